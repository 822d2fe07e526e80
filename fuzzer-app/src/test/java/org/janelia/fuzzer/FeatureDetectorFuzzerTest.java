package org.janelia.fuzzer;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.janelia.fuzzer.detection.AgastRunner;
import org.janelia.fuzzer.detection.DetectionResult;
import org.janelia.fuzzer.detection.DetectionRuntime;
import org.janelia.fuzzer.detection.FeatureDetectorAlgorithm;
import org.janelia.fuzzer.detection.FeatureDetectorRunner;
import org.janelia.fuzzer.detection.ImageContext;
import org.janelia.fuzzer.detection.Keypoint;
import org.janelia.fuzzer.detection.KeypointDetector;
import org.janelia.fuzzer.detection.RegionOfInterest;
import org.janelia.fuzzer.detection.SourceImage;
import org.janelia.fuzzer.detection.TestSourceImage;
import org.janelia.fuzzer.detection.parameters.AgastParameters;
import org.janelia.fuzzer.detection.parameters.AgastParameters.AgastType;
import org.janelia.fuzzer.detection.parameters.ParameterAxis;
import org.janelia.fuzzer.detection.parameters.ParameterGrid;
import org.janelia.fuzzer.parameters.FuzzingParameters;
import org.janelia.fuzzer.report.DetectionReportWriter;
import org.janelia.fuzzer.report.ImageAnnotator;
import org.janelia.fuzzer.session.DbConfig;
import org.janelia.fuzzer.session.FeatureDetectionRecord;
import org.janelia.fuzzer.session.FuzzingSession;
import org.janelia.fuzzer.session.FuzzingSessionStoreException;
import org.janelia.fuzzer.session.JdbcFuzzingSessionStore;
import org.janelia.fuzzer.util.FileUtil;
import org.janelia.fuzzer.util.LogbackTestTools;
import org.janelia.fuzzer.util.TestDirectory;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link FeatureDetectorFuzzer} class with stubbed detection, image loading, and annotation.
 */
public class FeatureDetectorFuzzerTest {

    private static final List<Keypoint> SIX_IN_FOUR_OUT = Arrays.asList(
            new Keypoint(10, 10), new Keypoint(60, 60), new Keypoint(35, 35),
            new Keypoint(20, 50), new Keypoint(59, 11), new Keypoint(30, 45),
            new Keypoint(9, 10), new Keypoint(61, 30), new Keypoint(30, 61), new Keypoint(0, 0));

    private File testDirectory;
    private File inputDirectory;
    private File outputDirectory;
    private JdbcFuzzingSessionStore store;
    private List<TestSourceImage> loadedImages;
    private List<File> annotatedFiles;

    @Before
    public void setup() throws IOException {

        testDirectory = TestDirectory.create("test-fuzzer");
        inputDirectory = new File(testDirectory, "input");
        outputDirectory = new File(testDirectory, "output");
        if (! inputDirectory.mkdirs()) {
            throw new IllegalStateException("failed to create " + inputDirectory);
        }

        Files.write(new File(inputDirectory, "present.png").toPath(), new byte[] { 1 });
        Files.write(new File(inputDirectory, FuzzerInput.INPUT_FILE_NAME).toPath(),
                    Collections.singletonList(
                            "[ { \"FileName\": \"missing.png\", " +
                            "\"RegionOfInterest\": { \"X\": 10, \"Y\": 10, \"Width\": 50, \"Height\": 50 } }, " +
                            "{ \"FileName\": \"present.png\", " +
                            "\"RegionOfInterest\": { \"X\": 10, \"Y\": 10, \"Width\": 50, \"Height\": 50 } } ]"),
                    StandardCharsets.UTF_8);

        store = new JdbcFuzzingSessionStore(
                new DbConfig("jdbc:h2:mem:fuzzer-test-" + System.nanoTime() + ";DB_CLOSE_DELAY=-1", "sa", ""));
        loadedImages = new ArrayList<>();
        annotatedFiles = Collections.synchronizedList(new ArrayList<>());
    }

    @After
    public void tearDown() {
        LogbackTestTools.resetLogLevel(FeatureDetectorFuzzer.class);
        store.close();
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testSingleDetection() throws Exception {

        final FeatureDetectorFuzzer fuzzer = buildFuzzer(p -> SIX_IN_FOUR_OUT);

        Assert.assertEquals("invalid initial state", FeatureDetectorFuzzer.State.NOT_STARTED, fuzzer.getState());

        final FuzzingSummary summary = fuzzer.fuzz();

        Assert.assertEquals("invalid final state", FeatureDetectorFuzzer.State.COMPLETED, fuzzer.getState());
        Assert.assertEquals("invalid processed count", 1, summary.getProcessedImageCount());
        Assert.assertEquals("missing image should be skipped", 1, summary.getSkippedImageCount());
        Assert.assertEquals("invalid result count", 1, summary.getResultCount());
        Assert.assertEquals("invalid best result count", 1, summary.getBestResults().size());
        Assert.assertEquals("invalid best inlier count", 6, summary.getBestResults().get(0).getInlierFeatureCount());

        final List<String> lines = readReport();
        Assert.assertEquals("report should have header and one row", 2, lines.size());
        Assert.assertEquals("invalid header", DetectionReportWriter.HEADER, lines.get(0));

        final String[] cells = lines.get(1).split(",", 9);
        Assert.assertEquals("invalid file name", "\"present.png\"", cells[0]);
        Assert.assertEquals("invalid algorithm", "AGAST", cells[1]);
        Assert.assertEquals("invalid iteration", "0", cells[2]);
        Assert.assertEquals("invalid inlier count", "6", cells[3]);
        Assert.assertEquals("invalid total count", "10", cells[4]);
        Assert.assertEquals("invalid ratio", "0.6", cells[5]);
        Assert.assertTrue("execution time should not be negative", Long.parseLong(cells[6]) >= 0);
        Assert.assertEquals("invalid output file name", "\"present-AGAST-0.jpg\"", cells[7]);
        Assert.assertEquals("invalid parameters",
                            "\"agastType: OAST_9_16, threshold: 10, useNonMaxSuppression: true\"", cells[8]);

        Assert.assertEquals("one image should be annotated",
                            Collections.singletonList(new File(outputDirectory, "present-AGAST-0.jpg")),
                            annotatedFiles);

        final FuzzingSession session = store.getSession(summary.getSessionId());
        Assert.assertNotNull("session should be stored", session);
        Assert.assertNotNull("completed session should have an end time", session.getEndTime());

        final List<FeatureDetectionRecord> records = store.getRecords(summary.getSessionId());
        Assert.assertEquals("invalid number of stored records", 1, records.size());
        Assert.assertEquals("invalid stored inlier count", 6, records.get(0).getInlierCount());
        Assert.assertEquals("invalid stored total count", 10, records.get(0).getTotalCount());

        Assert.assertEquals("only the present image should be loaded", 1, loadedImages.size());
        Assert.assertTrue("loaded image should be closed", loadedImages.get(0).isClosed());

        try {
            fuzzer.fuzz();
            Assert.fail("a fuzzer should only run once");
        } catch (final IllegalStateException e) {
            Assert.assertTrue("message should include state", e.getMessage().contains("COMPLETED"));
        }
    }

    @Test
    public void testNoEnabledAlgorithms() throws Exception {

        final FuzzingParameters parameters = buildParameters(Collections.emptyList());
        final FeatureDetectorFuzzer fuzzer = new FeatureDetectorFuzzer(parameters,
                                                                       Collections.emptyList(),
                                                                       this::loadImage,
                                                                       ImageAnnotator.DISABLED,
                                                                       store,
                                                                       DetectionRuntime.NONE);
        final FuzzingSummary summary = fuzzer.fuzz();

        Assert.assertEquals("invalid final state", FeatureDetectorFuzzer.State.COMPLETED, fuzzer.getState());
        Assert.assertEquals("invalid result count", 0, summary.getResultCount());

        final FuzzingSession session = store.getSession(summary.getSessionId());
        Assert.assertNotNull("session should have a start time", session.getStartTime());
        Assert.assertNotNull("session should have an end time", session.getEndTime());
        Assert.assertFalse("end should not precede start", session.getEndTime().before(session.getStartTime()));
        Assert.assertEquals("no records should be stored", 0, store.getRecords(summary.getSessionId()).size());
        Assert.assertEquals("report should only have a header", 1, readReport().size());
    }

    @Test
    public void testMissingInputFile() {

        final File emptyDirectory = new File(testDirectory, "empty");
        final FuzzingParameters parameters = new FuzzingParameters(emptyDirectory.getAbsolutePath(),
                                                                   outputDirectory.getAbsolutePath(),
                                                                   null);
        final FeatureDetectorFuzzer fuzzer = new FeatureDetectorFuzzer(parameters,
                                                                       Collections.emptyList(),
                                                                       this::loadImage,
                                                                       ImageAnnotator.DISABLED,
                                                                       store,
                                                                       DetectionRuntime.NONE);
        try {
            fuzzer.fuzz();
            Assert.fail("missing input file should fail");
        } catch (final FuzzerInputNotFoundException e) {
            Assert.assertTrue("message should name the file", e.getMessage().contains(FuzzerInput.INPUT_FILE_NAME));
        } catch (final IOException e) {
            Assert.fail("unexpected exception " + e);
        }

        Assert.assertEquals("fuzzer should not start", FeatureDetectorFuzzer.State.NOT_STARTED, fuzzer.getState());
        Assert.assertNull("no session should be created", fuzzer.getSession());
    }

    @Test
    public void testMissingRunnerIsRejected() {
        try {
            new FeatureDetectorFuzzer(buildParameters(null),
                                      agastOnly(),
                                      this::loadImage,
                                      ImageAnnotator.DISABLED,
                                      store,
                                      DetectionRuntime.NONE);
            Assert.fail("enabled algorithms without runners should be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should name a missing algorithm", e.getMessage().contains("AKAZE"));
        }
    }

    @Test
    public void testFailedFamilyDoesNotStopSession() throws Exception {

        LogbackTestTools.setLogLevelToOff(FeatureDetectorFuzzer.class);

        final FeatureDetectorFuzzer fuzzer = buildFuzzer(p -> {
            throw new IllegalStateException("detector exploded");
        });

        final FuzzingSummary summary = fuzzer.fuzz();

        Assert.assertEquals("invalid final state", FeatureDetectorFuzzer.State.COMPLETED, fuzzer.getState());
        Assert.assertEquals("family should be counted as aborted", 1, summary.getAbortedFamilyCount());
        Assert.assertEquals("no results should be produced", 0, summary.getResultCount());
        Assert.assertNotNull("session should still complete",
                             store.getSession(summary.getSessionId()).getEndTime());
    }

    @Test
    public void testCancelledSessionHasNoEndTime() throws Exception {

        final FeatureDetectorFuzzer fuzzer = buildFuzzer(p -> SIX_IN_FOUR_OUT);
        fuzzer.cancel();

        try {
            fuzzer.fuzz();
            Assert.fail("cancelled fuzzer should stop");
        } catch (final CancellationException e) {
            Assert.assertNotNull("exception should have a message", e.getMessage());
        }

        Assert.assertEquals("cancelled fuzzer should not complete", FeatureDetectorFuzzer.State.RUNNING, fuzzer.getState());
        final FuzzingSession storedSession = store.getSession(fuzzer.getSession().getId());
        Assert.assertNotNull("session should be stored", storedSession);
        Assert.assertNull("cancelled session should have no end time", storedSession.getEndTime());
    }

    @Test
    public void testStoreFailureKeepsReport() throws Exception {

        LogbackTestTools.setLogLevelToOff(FeatureDetectorFuzzer.class);

        final JdbcFuzzingSessionStore failingStore = new JdbcFuzzingSessionStore(
                new DbConfig("jdbc:h2:mem:fuzzer-failing-" + System.nanoTime() + ";DB_CLOSE_DELAY=-1", "sa", "")) {
            @Override
            public synchronized void saveRecords(final FuzzingSession session,
                                                 final List<FeatureDetectionRecord> records) {
                throw new FuzzingSessionStoreException("database is read only", null);
            }
        };

        final FeatureDetectorFuzzer fuzzer = new FeatureDetectorFuzzer(buildParameters(agastList()),
                                                                       agastOnly(p -> SIX_IN_FOUR_OUT),
                                                                       this::loadImage,
                                                                       ImageAnnotator.DISABLED,
                                                                       failingStore,
                                                                       DetectionRuntime.NONE);
        try {
            fuzzer.fuzz();
            Assert.fail("store failure should be reported");
        } catch (final FuzzingSessionStoreException e) {
            Assert.assertEquals("invalid failure", "database is read only", e.getMessage());
        } finally {
            failingStore.close();
        }

        Assert.assertEquals("session bookkeeping should still finish",
                            FeatureDetectorFuzzer.State.COMPLETED, fuzzer.getState());
        Assert.assertEquals("report row should survive the store failure", 2, readReport().size());
    }

    @Test
    public void testAbortedBatchKeepsImageOpenForRunningDetections() throws Exception {

        LogbackTestTools.setLogLevelToOff(FeatureDetectorFuzzer.class);

        final CountDownLatch slowDetectionStarted = new CountDownLatch(1);
        final AtomicBoolean slowDetectionReturned = new AtomicBoolean(false);
        final AtomicBoolean slowDetectionSawClosedImage = new AtomicBoolean(false);

        final KeypointDetector<AgastParameters> detector = p -> {
            if (p.getThreshold() == 10) {
                awaitQuietly(slowDetectionStarted);
                throw new IllegalStateException("threshold 10 always fails");
            }
            slowDetectionStarted.countDown();
            spin(800);
            final TestSourceImage image = (TestSourceImage) p.getImageContext().getImage();
            slowDetectionSawClosedImage.set(image.isClosed());
            slowDetectionReturned.set(true);
            return SIX_IN_FOUR_OUT;
        };

        final FuzzingParameters parameters = buildParameters(agastList());
        parameters.batchSize = 2;

        final FeatureDetectorFuzzer fuzzer =
                new FeatureDetectorFuzzer(parameters,
                                          Collections.singletonList(new ThresholdAgastRunner(detector, 10, 12)),
                                          this::loadImage,
                                          ImageAnnotator.DISABLED,
                                          store,
                                          DetectionRuntime.NONE);
        final FuzzingSummary summary = fuzzer.fuzz();

        Assert.assertEquals("family should be counted as aborted", 1, summary.getAbortedFamilyCount());
        Assert.assertTrue("abandoned detection should return before the fuzzer finishes",
                          slowDetectionReturned.get());
        Assert.assertFalse("image should stay open until every detection of the batch has returned",
                           slowDetectionSawClosedImage.get());
        Assert.assertTrue("image should be closed after the families finish", loadedImages.get(0).isClosed());
        assertReportMatchesSummaryAndStore(summary);
    }

    @Test
    public void testFailFastReportMatchesSummary() throws Exception {

        LogbackTestTools.setLogLevelToOff(FeatureDetectorFuzzer.class);

        final KeypointDetector<AgastParameters> detector = p -> {
            if (p.getThreshold() == 12) {
                throw new IllegalStateException("threshold 12 always fails");
            }
            return SIX_IN_FOUR_OUT;
        };

        final FuzzingParameters parameters = buildParameters(agastList());
        parameters.batchSize = 3;

        final FeatureDetectorFuzzer fuzzer =
                new FeatureDetectorFuzzer(parameters,
                                          Collections.singletonList(new ThresholdAgastRunner(detector, 10, 12, 14)),
                                          this::loadImage,
                                          ImageAnnotator.DISABLED,
                                          store,
                                          DetectionRuntime.NONE);
        final FuzzingSummary summary = fuzzer.fuzz();

        Assert.assertEquals("family should be counted as aborted", 1, summary.getAbortedFamilyCount());
        Assert.assertTrue("result before the failure should be counted", summary.getResultCount() >= 1);
        assertReportMatchesSummaryAndStore(summary);
    }

    private void assertReportMatchesSummaryAndStore(final FuzzingSummary summary) throws IOException {
        final int reportRowCount = readReport().size() - 1;
        Assert.assertEquals("report rows should match summary result count",
                            summary.getResultCount(), reportRowCount);
        Assert.assertEquals("stored records should match summary result count",
                            summary.getResultCount(), store.getRecords(summary.getSessionId()).size());
    }

    private FeatureDetectorFuzzer buildFuzzer(final KeypointDetector<AgastParameters> detector) {
        return new FeatureDetectorFuzzer(buildParameters(agastList()),
                                         agastOnly(detector),
                                         this::loadImage,
                                         new RecordingAnnotator(),
                                         store,
                                         DetectionRuntime.NONE);
    }

    private FuzzingParameters buildParameters(final List<FeatureDetectorAlgorithm> algorithms) {
        return new FuzzingParameters(inputDirectory.getAbsolutePath(),
                                     outputDirectory.getAbsolutePath(),
                                     algorithms);
    }

    private TestSourceImage loadImage(final File imageFile) {
        final TestSourceImage image = new TestSourceImage(imageFile.getName());
        loadedImages.add(image);
        return image;
    }

    private List<String> readReport() throws IOException {
        return Files.readAllLines(new File(outputDirectory, FeatureDetectorFuzzer.OUTPUT_FILE_NAME).toPath(),
                                  StandardCharsets.UTF_8);
    }

    /**
     * Busy waits without checking for interrupts, like a native detection call.
     */
    private static void spin(final long milliseconds) {
        final long stopTime = System.currentTimeMillis() + milliseconds;
        while (System.currentTimeMillis() < stopTime) {
            Thread.onSpinWait();
        }
    }

    private static void awaitQuietly(final CountDownLatch latch) {
        try {
            if (! latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch was not released");
            }
        } catch (final InterruptedException e) {
            throw new IllegalStateException("interrupted", e);
        }
    }

    private static List<FeatureDetectorAlgorithm> agastList() {
        return Collections.singletonList(FeatureDetectorAlgorithm.AGAST);
    }

    private static List<FeatureDetectorRunner<?>> agastOnly() {
        return agastOnly(p -> SIX_IN_FOUR_OUT);
    }

    private static List<FeatureDetectorRunner<?>> agastOnly(final KeypointDetector<AgastParameters> detector) {
        return Collections.singletonList(new ThresholdAgastRunner(detector, 10));
    }

    /** AGAST runner that only sweeps the specified thresholds. */
    private static class ThresholdAgastRunner
            extends AgastRunner {

        private final Integer[] thresholds;

        ThresholdAgastRunner(final KeypointDetector<AgastParameters> keypointDetector,
                             final Integer... thresholds) {
            super(keypointDetector);
            this.thresholds = thresholds;
        }

        @Override
        public ParameterGrid<AgastParameters> generateParameters(final ImageContext imageContext) {
            final ParameterAxis<Integer> threshold = ParameterAxis.ofValues("threshold", thresholds);
            return new ParameterGrid<>(Collections.singletonList(threshold),
                                       i -> new AgastParameters(imageContext,
                                                                AgastType.OAST_9_16,
                                                                threshold.get(i[0]),
                                                                true));
        }
    }

    private class RecordingAnnotator
            implements ImageAnnotator {

        @Override
        public void annotate(final SourceImage sourceImage,
                             final RegionOfInterest regionOfInterest,
                             final DetectionResult result,
                             final File outputFile) {
            annotatedFiles.add(outputFile);
        }
    }
}
