package org.janelia.fuzzer.engine;

import org.janelia.fuzzer.detection.DetectionResult;

/**
 * Receives each result on the worker thread that produced it, before the batch is drained.
 * Implementations are called concurrently and must guard any shared sink.
 *
 * Results of abandoned detections (timed out, or cut off by a fail-fast failure or
 * cancellation before they finished) are never delivered.  Every delivered result is
 * also yielded by the {@link DetectionResultStream} unless the stream is cancelled.
 */
@FunctionalInterface
public interface DetectionResultListener {

    /**
     * @param  iteration  position of the result's parameter set in the swept sequence.
     * @param  result     detection result.
     */
    void resultReady(int iteration,
                     DetectionResult result);

    DetectionResultListener NONE = (iteration, result) -> {};
}
