package org.janelia.fuzzer.engine;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.janelia.fuzzer.detection.FeatureDetectorRunner;
import org.janelia.fuzzer.detection.parameters.DetectionParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs detections for an ordered parameter sequence in fixed size batches.
 *
 * All detections of a batch run concurrently (the batch size is the concurrency bound)
 * and the whole batch is drained by the consumer before the next batch starts.
 * This keeps the number of live detector instances bounded no matter how large the
 * parameter grid is.
 *
 * One executor can serve many sequential {@link #execute} calls.  Close it when done.
 */
public class BatchedDetectionExecutor
        implements AutoCloseable {

    public static final int DEFAULT_BATCH_SIZE = 10;

    private final int batchSize;
    private final FailurePolicy failurePolicy;
    private final Long batchTimeoutMilliseconds;
    private final CancellationToken cancellationToken;
    private final ExecutorService executorService;

    public BatchedDetectionExecutor() {
        this(DEFAULT_BATCH_SIZE, FailurePolicy.FAIL_FAST, null, new CancellationToken());
    }

    /**
     * @param  batchSize                number of detections run concurrently per batch.
     * @param  failurePolicy            how failed detections are handled.
     * @param  batchTimeoutMilliseconds maximum time to wait for the results of one batch (null for no limit).
     *                                  Detections still running at the deadline are abandoned and
     *                                  treated as failures, but the batch still ends only after their
     *                                  threads return.
     * @param  cancellationToken        token checked before and during each batch.
     *
     * @throws IllegalArgumentException
     *   if the batch size or timeout is not positive.
     */
    public BatchedDetectionExecutor(final int batchSize,
                                    final FailurePolicy failurePolicy,
                                    final Long batchTimeoutMilliseconds,
                                    final CancellationToken cancellationToken)
            throws IllegalArgumentException {

        if (batchSize < 1) {
            throw new IllegalArgumentException("batch size must be at least 1");
        }
        if ((batchTimeoutMilliseconds != null) && (batchTimeoutMilliseconds < 1)) {
            throw new IllegalArgumentException("batch timeout must be positive");
        }

        this.batchSize = batchSize;
        this.failurePolicy = failurePolicy;
        this.batchTimeoutMilliseconds = batchTimeoutMilliseconds;
        this.cancellationToken = cancellationToken;
        this.executorService = Executors.newFixedThreadPool(batchSize, new DetectionThreadFactory());
    }

    /**
     * @return lazy stream of results for the specified parameters.  No detection starts
     *         until the stream is first queried.  The stream is finite and cannot be restarted.
     */
    public <P extends DetectionParameters> DetectionResultStream<P> execute(final Iterable<P> parameters,
                                                                            final FeatureDetectorRunner<P> runner,
                                                                            final DetectionResultListener listener) {
        LOG.debug("execute: entry, runner={}, batchSize={}, failurePolicy={}",
                  runner, batchSize, failurePolicy);
        return new DetectionResultStream<>(parameters.iterator(),
                                           runner,
                                           listener,
                                           executorService,
                                           batchSize,
                                           failurePolicy,
                                           batchTimeoutMilliseconds,
                                           cancellationToken);
    }

    public <P extends DetectionParameters> DetectionResultStream<P> execute(final Iterable<P> parameters,
                                                                            final FeatureDetectorRunner<P> runner) {
        return execute(parameters, runner, DetectionResultListener.NONE);
    }

    @Override
    public void close() {
        executorService.shutdownNow();
        try {
            if (! executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("close: detection threads did not terminate within 30 seconds");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("close: interrupted while waiting for detection threads to terminate");
        }
    }

    private static class DetectionThreadFactory
            implements ThreadFactory {

        private final AtomicInteger threadCount = new AtomicInteger(0);

        @Override
        public Thread newThread(final Runnable runnable) {
            final Thread thread = new Thread(runnable, "detection-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(BatchedDetectionExecutor.class);
}
