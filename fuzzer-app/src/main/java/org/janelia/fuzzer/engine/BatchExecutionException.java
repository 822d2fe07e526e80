package org.janelia.fuzzer.engine;

/**
 * Thrown from a result stream when a detection in the current batch fails
 * and the stream uses {@link FailurePolicy#FAIL_FAST}.
 */
public class BatchExecutionException
        extends RuntimeException {

    private final DetectionFailure failure;
    private final int batchIndex;

    public BatchExecutionException(final int batchIndex,
                                   final DetectionFailure failure) {
        super("batch " + batchIndex + " aborted because " + failure, failure.getCause());
        this.batchIndex = batchIndex;
        this.failure = failure;
    }

    public DetectionFailure getFailure() {
        return failure;
    }

    public int getBatchIndex() {
        return batchIndex;
    }
}
