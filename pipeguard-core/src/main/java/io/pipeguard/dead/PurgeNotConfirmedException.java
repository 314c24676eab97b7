package io.pipeguard.dead;

public class PurgeNotConfirmedException extends RuntimeException {

    public PurgeNotConfirmedException(String queue) {
        super("Refusing to purge " + queue + " without confirmation (use a dry run to preview)");
    }
}
