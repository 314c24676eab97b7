package io.pipeguard;

/**
 * The document an event refers to cannot be read yet.
 *
 * <p>An event may arrive before the write that produced it is visible to this reader (replica
 * lag, eventually consistent stores). Classifiers built with
 * {@link io.pipeguard.ack.FailureClassifier.Builder#transientOnDocumentNotFound()} retry it.
 */
public class DocumentNotFoundException extends RuntimeException {
    private final String collection;
    private final String documentId;

    public DocumentNotFoundException(String collection, String documentId) {
        super("Document not found: " + collection + "/" + documentId);
        this.collection = collection;
        this.documentId = documentId;
    }

    public String collection() {
        return collection;
    }

    public String documentId() {
        return documentId;
    }
}
