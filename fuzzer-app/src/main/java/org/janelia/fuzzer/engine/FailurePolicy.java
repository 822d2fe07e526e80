package org.janelia.fuzzer.engine;

/**
 * What happens to a batch when one of its detections fails.
 */
public enum FailurePolicy {

    /** Cancel the rest of the batch and end the result stream with a {@link BatchExecutionException}. */
    FAIL_FAST,

    /** Record the failure, keep the other results of the batch, and continue with the next batch. */
    SKIP_AND_RECORD
}
