package org.janelia.fuzzer;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.janelia.fuzzer.detection.DetectionResult;
import org.janelia.fuzzer.detection.DetectionRuntime;
import org.janelia.fuzzer.detection.FeatureDetectorAlgorithm;
import org.janelia.fuzzer.detection.FeatureDetectorRunner;
import org.janelia.fuzzer.detection.ImageContext;
import org.janelia.fuzzer.detection.ImageLoader;
import org.janelia.fuzzer.detection.ImageToProcess;
import org.janelia.fuzzer.detection.SourceImage;
import org.janelia.fuzzer.detection.parameters.DetectionParameters;
import org.janelia.fuzzer.detection.parameters.ParameterGrid;
import org.janelia.fuzzer.engine.BatchExecutionException;
import org.janelia.fuzzer.engine.BatchedDetectionExecutor;
import org.janelia.fuzzer.engine.CancellationToken;
import org.janelia.fuzzer.engine.DetectionResultListener;
import org.janelia.fuzzer.engine.DetectionResultStream;
import org.janelia.fuzzer.parameters.FuzzingParameters;
import org.janelia.fuzzer.report.DetectionReportWriter;
import org.janelia.fuzzer.report.ImageAnnotator;
import org.janelia.fuzzer.session.FuzzingSession;
import org.janelia.fuzzer.session.FuzzingSessionStore;
import org.janelia.fuzzer.session.FuzzingSessionStoreException;
import org.janelia.fuzzer.session.SessionRecorder;
import org.janelia.fuzzer.util.FileUtil;
import org.janelia.fuzzer.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sweeps every enabled detector family's parameter grid for every input image.
 *
 * Images and families are processed sequentially; detections within a family run in
 * parallel batches.  Each result is written to the CSV report (and optionally an annotated
 * image) as soon as it is produced, and the session's records are committed to the store
 * once per image and family.
 *
 * A fuzzer instance runs one session.
 */
public class FeatureDetectorFuzzer {

    public static final String OUTPUT_FILE_NAME = "fuzzer-output.csv";

    public enum State {
        NOT_STARTED, RUNNING, COMPLETED
    }

    private final FuzzingParameters parameters;
    private final Map<FeatureDetectorAlgorithm, FeatureDetectorRunner<?>> runners;
    private final ImageLoader imageLoader;
    private final ImageAnnotator imageAnnotator;
    private final FuzzingSessionStore sessionStore;
    private final DetectionRuntime detectionRuntime;
    private final CancellationToken cancellationToken;
    private final SessionRecorder sessionRecorder;

    private volatile State state;
    private FuzzingSession session;
    private FuzzingSessionStoreException firstStoreFailure;

    /**
     * @throws IllegalArgumentException
     *   if the parameters are invalid or an enabled algorithm has no runner.
     */
    public FeatureDetectorFuzzer(final FuzzingParameters parameters,
                                 final List<FeatureDetectorRunner<?>> runnerList,
                                 final ImageLoader imageLoader,
                                 final ImageAnnotator imageAnnotator,
                                 final FuzzingSessionStore sessionStore,
                                 final DetectionRuntime detectionRuntime)
            throws IllegalArgumentException {

        parameters.validate();

        this.parameters = parameters;
        this.runners = new EnumMap<>(FeatureDetectorAlgorithm.class);
        for (final FeatureDetectorRunner<?> runner : runnerList) {
            this.runners.put(runner.getAlgorithm(), runner);
        }
        for (final FeatureDetectorAlgorithm algorithm : parameters.getEnabledAlgorithms()) {
            if (! this.runners.containsKey(algorithm)) {
                throw new IllegalArgumentException("no runner is available for " + algorithm);
            }
        }

        this.imageLoader = imageLoader;
        this.imageAnnotator = imageAnnotator;
        this.sessionStore = sessionStore;
        this.detectionRuntime = detectionRuntime;
        this.cancellationToken = new CancellationToken();
        this.sessionRecorder = new SessionRecorder(sessionStore);
        this.state = State.NOT_STARTED;
    }

    public State getState() {
        return state;
    }

    /**
     * @return the current session or null if fuzzing has not started.
     */
    public FuzzingSession getSession() {
        return session;
    }

    /**
     * Asks a running session to stop.  The session keeps a null end time.
     */
    public void cancel() {
        cancellationToken.cancel();
    }

    /**
     * Runs the session.  Batch failures are logged and counted rather than thrown.
     *
     * @return summary of the session.
     *
     * @throws FuzzerInputNotFoundException
     *   if the input file does not exist (nothing is started in this case).
     *
     * @throws java.util.concurrent.CancellationException
     *   if the session is cancelled.
     *
     * @throws FuzzingSessionStoreException
     *   if any store operation failed (thrown after all images have been attempted).
     *
     * @throws IOException
     *   if the input or report files cannot be read or written.
     */
    public FuzzingSummary fuzz()
            throws FuzzerInputNotFoundException, FuzzingSessionStoreException, IOException {

        if (state != State.NOT_STARTED) {
            throw new IllegalStateException("fuzzer has already been run, state is " + state);
        }

        final File inputDirectory = parameters.getInputDirectory();
        final File outputDirectory = parameters.getOutputDirectory();
        final Set<FeatureDetectorAlgorithm> enabledAlgorithms = parameters.getEnabledAlgorithms();

        final List<ImageToProcess> imageList = FuzzerInput.load(inputDirectory);

        FileUtil.ensureWritableDirectory(outputDirectory);

        session = new FuzzingSession();
        sessionStore.startSession(session);
        state = State.RUNNING;

        final FuzzingSummary summary = new FuzzingSummary(session.getId());
        final ProcessTimer timer = new ProcessTimer();

        LOG.info("fuzz: started {} for {} images with algorithms {}", session, imageList.size(), enabledAlgorithms);

        detectionRuntime.initialize();

        try (final BatchedDetectionExecutor executor =
                     new BatchedDetectionExecutor(parameters.batchSize,
                                                  parameters.failurePolicy,
                                                  parameters.getBatchTimeoutMilliseconds(),
                                                  cancellationToken);
             final DetectionReportWriter reportWriter =
                     new DetectionReportWriter(new File(outputDirectory, OUTPUT_FILE_NAME))) {

            for (final ImageToProcess image : imageList) {

                cancellationToken.throwIfCancelled("fuzzing " + session);

                final File imageFile = new File(inputDirectory, image.getFileName());
                if (! imageFile.isFile()) {
                    LOG.warn("fuzz: skipping {} because {} does not exist", image, imageFile.getAbsolutePath());
                    summary.addSkippedImage();
                    continue;
                }

                final SourceImage sourceImage;
                try {
                    sourceImage = imageLoader.load(imageFile);
                } catch (final IOException e) {
                    LOG.warn("fuzz: skipping " + image + " because it could not be loaded", e);
                    summary.addSkippedImage();
                    continue;
                }

                LOG.info("fuzz: processing {}", image);

                try (final SourceImage closeableImage = sourceImage) {
                    final ImageContext imageContext = new ImageContext(image, closeableImage);
                    for (final FeatureDetectorAlgorithm algorithm : enabledAlgorithms) {
                        fuzzFamily(runners.get(algorithm), imageContext, executor, reportWriter, summary);
                    }
                }

                summary.addProcessedImage();
            }

            LOG.info("fuzz: wrote {} report rows", reportWriter.getRowCount());

        } finally {
            detectionRuntime.close();
        }

        session.markComplete();
        try {
            sessionStore.completeSession(session);
        } catch (final FuzzingSessionStoreException e) {
            handleStoreFailure("complete " + session, e);
        }
        state = State.COMPLETED;

        LOG.info("fuzz: completed {} with {} stored records in {}", summary, session.getRecordedCount(), timer);

        if (firstStoreFailure != null) {
            throw firstStoreFailure;
        }

        return summary;
    }

    private <P extends DetectionParameters> void fuzzFamily(final FeatureDetectorRunner<P> runner,
                                                            final ImageContext imageContext,
                                                            final BatchedDetectionExecutor executor,
                                                            final DetectionReportWriter reportWriter,
                                                            final FuzzingSummary summary) {

        final FeatureDetectorAlgorithm algorithm = runner.getAlgorithm();
        final ParameterGrid<P> grid = runner.generateParameters(imageContext);
        final File outputDirectory = parameters.getOutputDirectory();

        LOG.info("fuzzFamily: running {} with {} parameter sets for {}",
                 algorithm, grid.size(), imageContext.getFileName());

        final DetectionResultListener listener = (iteration, result) -> {
            String outputFileName = null;
            if (imageAnnotator.isEnabled()) {
                outputFileName = ImageAnnotator.getOutputFileName(result.getFileName(), algorithm, iteration);
                try {
                    imageAnnotator.annotate(imageContext.getImage(),
                                            imageContext.getRegionOfInterest(),
                                            result,
                                            new File(outputDirectory, outputFileName));
                } catch (final IOException e) {
                    throw new UncheckedIOException("failed to write " + outputFileName, e);
                }
            }
            reportWriter.write(result, iteration, outputFileName);
            sessionRecorder.record(session, result, iteration);
        };

        final ProcessTimer timer = new ProcessTimer();
        final DetectionResultStream<P> resultStream = executor.execute(grid, runner, listener);

        DetectionResult bestResult = null;
        long resultCount = 0;
        try {

            while (resultStream.hasNext()) {
                final DetectionResult result = resultStream.next();
                resultCount++;
                if (FuzzingSummary.isBetter(result, bestResult)) {
                    bestResult = result;
                }
                if (timer.hasIntervalPassed()) {
                    LOG.info("fuzzFamily: {} of {} {} results received for {}",
                             resultCount, grid.size(), algorithm, imageContext.getFileName());
                }
            }

        } catch (final BatchExecutionException e) {
            LOG.error("fuzzFamily: stopped " + algorithm + " for " + imageContext.getFileName() +
                      " after " + resultCount + " results", e);
            summary.addAbortedFamily();
        } finally {
            summary.addResults(resultCount);
            summary.addFailedDetections(resultStream.getFailures().size());
            commitRecords(algorithm, imageContext);
        }

        if (bestResult != null) {
            summary.addBestResult(bestResult);
            LOG.info("fuzzFamily: best {} result for {} has {} of {} keypoints inside region (ratio {}) with {}",
                     algorithm, imageContext.getFileName(), bestResult.getInlierFeatureCount(),
                     bestResult.getTotalFeatureCount(), bestResult.getInlierOutlierRatio(),
                     bestResult.getFeatureDetectorConfiguration());
        }

        LOG.info("fuzzFamily: finished {} for {}, {} results and {} skipped detections in {}",
                 algorithm, imageContext.getFileName(), resultCount, resultStream.getFailures().size(), timer);
    }

    private void commitRecords(final FeatureDetectorAlgorithm algorithm,
                               final ImageContext imageContext) {
        try {
            sessionRecorder.commit(session);
        } catch (final FuzzingSessionStoreException e) {
            handleStoreFailure("commit " + algorithm + " records for " + imageContext.getFileName(), e);
        }
    }

    private void handleStoreFailure(final String context,
                                    final FuzzingSessionStoreException e) {
        LOG.error("handleStoreFailure: failed to " + context + ", results remain in the CSV report", e);
        if (firstStoreFailure == null) {
            firstStoreFailure = e;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FeatureDetectorFuzzer.class);
}
