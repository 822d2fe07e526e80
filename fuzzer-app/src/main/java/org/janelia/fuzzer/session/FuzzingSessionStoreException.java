package org.janelia.fuzzer.session;

/**
 * Thrown when a fuzzing session or its results cannot be persisted or read.
 */
public class FuzzingSessionStoreException
        extends RuntimeException {

    public FuzzingSessionStoreException(final String message,
                                        final Throwable cause) {
        super(message, cause);
    }
}
