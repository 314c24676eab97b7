package io.pipeguard.scan;

import java.time.Duration;
import java.util.List;

/**
 * Result of one {@link StuckDocumentScanner#scanOnce()} pass.
 *
 * @param collections per-collection outcome, in scan order
 * @param duration    wall time of the pass
 */
public record ScanReport(List<CollectionReport> collections, Duration duration) {

    public ScanReport {
        collections = List.copyOf(collections);
    }

    /**
     * Outcome for one collection.
     *
     * @param collection     collection name
     * @param stuck          stuck candidates found
     * @param requeued       trigger events republished
     * @param skippedBackoff candidates still inside their backoff window
     * @param lostRace       candidates whose attempt increment was won by someone else
     * @param markedFailed   entities moved to failed_max_retries in this pass
     * @param publishErrors  republish attempts that failed
     * @param failedTotal    entities in failed_max_retries after the pass
     * @param error          collection-level error message, or {@code null}
     */
    public record CollectionReport(String collection, int stuck, int requeued, int skippedBackoff, int lostRace,
                                   int markedFailed, int publishErrors, long failedTotal, String error) {

        static CollectionReport failed(String collection, Throwable error) {
            return new CollectionReport(collection, 0, 0, 0, 0, 0, 0, 0,
                    error.getClass().getSimpleName() + ": " + error.getMessage());
        }

        public boolean succeeded() {
            return error == null;
        }
    }

    public boolean succeeded() {
        return collections.stream().allMatch(CollectionReport::succeeded);
    }

    public int totalRequeued() {
        return collections.stream().mapToInt(CollectionReport::requeued).sum();
    }

    public int totalMarkedFailed() {
        return collections.stream().mapToInt(CollectionReport::markedFailed).sum();
    }

    public CollectionReport collection(String name) {
        return collections.stream().filter(c -> c.collection().equals(name)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Collection not scanned: " + name));
    }
}
