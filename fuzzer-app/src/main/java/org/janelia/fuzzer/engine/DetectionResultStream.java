package org.janelia.fuzzer.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.janelia.fuzzer.detection.DetectionResult;
import org.janelia.fuzzer.detection.FeatureDetectorRunner;
import org.janelia.fuzzer.detection.parameters.DetectionParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy, finite, single pass sequence of detection results.
 *
 * A batch is submitted only when the consumer asks for a result and the buffer
 * of the previous batch has been fully drained.  Results are yielded in parameter
 * order within each batch and batches are yielded in order.
 *
 * A batch is never left behind with detections still running: once a batch fails, times out,
 * or is cancelled, the stream abandons every detection that has not started delivering its
 * result and then waits for all of the batch's worker threads to return.  Abandoned
 * detections never reach the listener.  Every result that did reach the listener is also
 * yielded by the stream (unless the stream is cancelled).
 *
 * {@link #hasNext()} throws {@link BatchExecutionException} for fail-fast failures (after the
 * failed batch's delivered results have been yielded) and {@link CancellationException} when
 * the cancellation token is set.  Either ends the stream.
 *
 * @param  <P>  parameter type for the swept family.
 */
public class DetectionResultStream<P extends DetectionParameters>
        implements Iterator<DetectionResult> {

    private static final long CANCELLATION_POLL_MILLISECONDS = 100;
    private static final long STRAY_DETECTION_LOG_SECONDS = 10;

    private final Iterator<P> parameterIterator;
    private final FeatureDetectorRunner<P> runner;
    private final DetectionResultListener listener;
    private final ExecutorService executorService;
    private final int batchSize;
    private final FailurePolicy failurePolicy;
    private final Long batchTimeoutMilliseconds;
    private final CancellationToken cancellationToken;

    private final Deque<DetectionResult> buffer;
    private final List<DetectionFailure> failures;
    private int nextIteration;
    private int batchCount;
    private boolean terminated;
    private BatchExecutionException batchFailure;

    DetectionResultStream(final Iterator<P> parameterIterator,
                          final FeatureDetectorRunner<P> runner,
                          final DetectionResultListener listener,
                          final ExecutorService executorService,
                          final int batchSize,
                          final FailurePolicy failurePolicy,
                          final Long batchTimeoutMilliseconds,
                          final CancellationToken cancellationToken) {
        this.parameterIterator = parameterIterator;
        this.runner = runner;
        this.listener = listener;
        this.executorService = executorService;
        this.batchSize = batchSize;
        this.failurePolicy = failurePolicy;
        this.batchTimeoutMilliseconds = batchTimeoutMilliseconds;
        this.cancellationToken = cancellationToken;
        this.buffer = new ArrayDeque<>(batchSize);
        this.failures = new ArrayList<>();
        this.nextIteration = 0;
        this.batchCount = 0;
        this.terminated = false;
        this.batchFailure = null;
    }

    @Override
    public boolean hasNext()
            throws BatchExecutionException, CancellationException {
        while (buffer.isEmpty() && (! terminated) && parameterIterator.hasNext()) {
            runNextBatch();
        }
        if (buffer.isEmpty() && (batchFailure != null)) {
            final BatchExecutionException failure = batchFailure;
            batchFailure = null;
            throw failure;
        }
        return ! buffer.isEmpty();
    }

    @Override
    public DetectionResult next()
            throws BatchExecutionException, CancellationException, NoSuchElementException {
        if (! hasNext()) {
            throw new NoSuchElementException("no more detection results");
        }
        return buffer.removeFirst();
    }

    /**
     * @return failures recorded so far (only populated with {@link FailurePolicy#SKIP_AND_RECORD}).
     */
    public List<DetectionFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    /**
     * @return number of batches submitted so far.
     */
    public int getBatchCount() {
        return batchCount;
    }

    /**
     * @return number of parameter sets handed to the executor so far.
     */
    public int getSubmittedCount() {
        return nextIteration;
    }

    private void runNextBatch()
            throws CancellationException {

        checkCancellation();

        final int batchIndex = batchCount;
        batchCount++;

        final List<DetectionTask> taskList = new ArrayList<>(batchSize);
        while ((taskList.size() < batchSize) && parameterIterator.hasNext()) {
            final DetectionTask task = new DetectionTask(parameterIterator.next(), nextIteration);
            nextIteration++;
            task.future = executorService.submit(task);
            taskList.add(task);
        }

        LOG.debug("runNextBatch: submitted batch {} with {} detections for {}",
                  batchIndex, taskList.size(), runner);

        final Long deadline = batchTimeoutMilliseconds == null ?
                              null : System.currentTimeMillis() + batchTimeoutMilliseconds;

        int failedIndex = -1;
        try {

            for (int i = 0; (i < taskList.size()) && (failedIndex < 0); i++) {

                final DetectionTask task = taskList.get(i);

                Throwable timeout = null;
                try {
                    waitFor(task, deadline);
                } catch (final TimeoutException e) {
                    // later detections in the batch share the expired deadline
                    if (task.abandon()) {
                        timeout = new TimeoutException("batch " + batchIndex + " did not complete within " +
                                                       batchTimeoutMilliseconds + "ms");
                    }
                    awaitReturn(task);
                }

                if ((timeout == null) && (task.result != null)) {
                    buffer.addLast(task.result);
                } else {
                    final DetectionFailure failure = toFailure(task, timeout == null ? task.failure : timeout);
                    if (failurePolicy == FailurePolicy.FAIL_FAST) {
                        failedIndex = i;
                        batchFailure = new BatchExecutionException(batchIndex, failure);
                        abandonFrom(taskList, i + 1);
                    } else {
                        LOG.warn("runNextBatch: skipping {}", failure);
                        failures.add(failure);
                    }
                }
            }

        } catch (final CancellationException e) {
            abandonFrom(taskList, 0);
            terminated = true;
            throw e;
        } finally {
            for (final DetectionTask task : taskList) {
                awaitReturn(task);
            }
        }

        if (failedIndex >= 0) {
            // results delivered before the remaining detections could be abandoned are kept
            for (int i = failedIndex + 1; i < taskList.size(); i++) {
                final DetectionResult result = taskList.get(i).result;
                if (result != null) {
                    buffer.addLast(result);
                }
            }
            terminated = true;
        }
    }

    private void waitFor(final DetectionTask task,
                         final Long deadline)
            throws TimeoutException, CancellationException {

        while (true) {
            checkCancellation();

            long waitMilliseconds = CANCELLATION_POLL_MILLISECONDS;
            if (deadline != null) {
                waitMilliseconds = Math.min(waitMilliseconds,
                                            Math.max(0, deadline - System.currentTimeMillis()));
            }

            try {
                if (task.returned.await(waitMilliseconds, TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellationToken.cancel();
                throw new CancellationException("interrupted while waiting for detection to complete");
            }

            if ((deadline != null) && (System.currentTimeMillis() >= deadline)) {
                throw new TimeoutException();
            }
        }
    }

    /**
     * Waits (without a limit and regardless of interrupts) until the task's worker thread has
     * returned, so nothing from the batch still uses the shared image after the batch ends.
     */
    private void awaitReturn(final DetectionTask task) {
        boolean interrupted = false;
        try {
            while (task.returned.getCount() > 0) {
                try {
                    if (! task.returned.await(STRAY_DETECTION_LOG_SECONDS, TimeUnit.SECONDS)) {
                        LOG.warn("awaitReturn: still waiting for abandoned detection {} ({}) to return",
                                 task.iteration, task.parameters.toParameterString());
                    }
                } catch (final InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private DetectionFailure toFailure(final DetectionTask task,
                                       final Throwable cause) {
        return new DetectionFailure(runner.getAlgorithm(),
                                    task.parameters.getFileName(),
                                    task.iteration,
                                    task.parameters.toParameterString(),
                                    cause);
    }

    private void checkCancellation()
            throws CancellationException {
        if (cancellationToken.isCancelled()) {
            terminated = true;
            throw new CancellationException(runner + " detection was cancelled");
        }
    }

    private void abandonFrom(final List<DetectionTask> taskList,
                             final int fromIndex) {
        for (int i = fromIndex; i < taskList.size(); i++) {
            taskList.get(i).abandon();
        }
    }

    /**
     * One detection of a batch.  The state only moves forward:
     * QUEUED to RUNNING to DELIVERING, or QUEUED/RUNNING to ABANDONED.
     * Only a task that reaches DELIVERING hands its result to the listener.
     */
    private class DetectionTask
            implements Runnable {

        private static final int QUEUED = 0;
        private static final int RUNNING = 1;
        private static final int DELIVERING = 2;
        private static final int ABANDONED = 3;

        private final P parameters;
        private final int iteration;
        private final AtomicInteger state;
        private final CountDownLatch returned;
        private Future<?> future;
        private volatile DetectionResult result;
        private volatile Throwable failure;

        DetectionTask(final P parameters,
                      final int iteration) {
            this.parameters = parameters;
            this.iteration = iteration;
            this.state = new AtomicInteger(QUEUED);
            this.returned = new CountDownLatch(1);
        }

        @Override
        public void run() {
            try {
                if (state.compareAndSet(QUEUED, RUNNING)) {
                    final DetectionResult detected = runner.performDetection(parameters);
                    if (state.compareAndSet(RUNNING, DELIVERING)) {
                        listener.resultReady(iteration, detected);
                        result = detected;
                    }
                }
            } catch (final Throwable t) {
                failure = t;
            } finally {
                returned.countDown();
            }
        }

        /**
         * @return true if the task will never deliver a result;
         *         false if delivery had already started.
         */
        boolean abandon() {
            if (state.compareAndSet(QUEUED, ABANDONED)) {
                future.cancel(false);
                returned.countDown();
                return true;
            }
            if (state.compareAndSet(RUNNING, ABANDONED)) {
                // interruptible detections stop early, native ones are waited for
                future.cancel(true);
                return true;
            }
            return state.get() == ABANDONED;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(DetectionResultStream.class);
}
