package org.janelia.fuzzer.report;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.janelia.fuzzer.detection.DetectionResult;
import org.janelia.fuzzer.detection.FeatureDetectorAlgorithm;
import org.janelia.fuzzer.detection.Keypoint;
import org.janelia.fuzzer.util.FileUtil;
import org.janelia.fuzzer.util.TestDirectory;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link DetectionReportWriter} class.
 */
public class DetectionReportWriterTest {

    private File testDirectory;

    @Before
    public void setup() throws IOException {
        testDirectory = TestDirectory.create("test-report");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testRowsAreFlushedImmediately() throws IOException {

        final File reportFile = new File(testDirectory, "fuzzer-output.csv");
        final DetectionResult result =
                new DetectionResult("scan.png",
                                    Arrays.asList(new Keypoint(1, 1), new Keypoint(2, 2),
                                                  new Keypoint(3, 3), new Keypoint(90, 90)),
                                    3, 17, FeatureDetectorAlgorithm.STAR,
                                    "\"maxSize: 25, responseThreshold: 10\"");

        try (final DetectionReportWriter writer = new DetectionReportWriter(reportFile)) {

            writer.write(result, 4, "scan-STAR-4.jpg");
            writer.write(result, 5, null);

            // read before close to verify auto flush
            final List<String> lines = Files.readAllLines(reportFile.toPath(), StandardCharsets.UTF_8);
            Assert.assertEquals("invalid number of lines", 3, lines.size());
            Assert.assertEquals("invalid header", DetectionReportWriter.HEADER, lines.get(0));
            Assert.assertEquals("invalid first row",
                                "\"scan.png\",STAR,4,3,4,0.75,17,\"scan-STAR-4.jpg\",\"maxSize: 25, responseThreshold: 10\"",
                                lines.get(1));
            Assert.assertEquals("invalid row without image",
                                "\"scan.png\",STAR,5,3,4,0.75,17,,\"maxSize: 25, responseThreshold: 10\"",
                                lines.get(2));
            Assert.assertEquals("invalid row count", 2, writer.getRowCount());
        }
    }

    @Test
    public void testFileNamesWithSeparatorsKeepColumnsAligned() {

        final DetectionResult result =
                new DetectionResult("left, \"top\".png",
                                    Arrays.asList(new Keypoint(1, 1), new Keypoint(90, 90)),
                                    1, 5, FeatureDetectorAlgorithm.ORB,
                                    "\"nFeatures: 250\"");

        final String row = DetectionReportWriter.formatRow(result, 2, "left, top-ORB-2.jpg");

        Assert.assertEquals("invalid row",
                            "\"left, \"\"top\"\".png\",ORB,2,1,2,0.5,5,\"left, top-ORB-2.jpg\",\"nFeatures: 250\"",
                            row);
    }

    @Test
    public void testExistingReportIsReplaced() throws IOException {

        final File reportFile = new File(testDirectory, "fuzzer-output.csv");
        Files.write(reportFile.toPath(), Arrays.asList("stale", "rows"), StandardCharsets.UTF_8);

        try (final DetectionReportWriter ignored = new DetectionReportWriter(reportFile)) {
            final List<String> lines = Files.readAllLines(reportFile.toPath(), StandardCharsets.UTF_8);
            Assert.assertEquals("only the header should remain", 1, lines.size());
        }
    }

    @Test
    public void testOutputFileName() {
        Assert.assertEquals("invalid annotated image name",
                            "scan-AGAST-12.jpg",
                            ImageAnnotator.getOutputFileName("scan.png", FeatureDetectorAlgorithm.AGAST, 12));
        Assert.assertEquals("invalid name for nested file",
                            "tile.01-ORB-0.jpg",
                            ImageAnnotator.getOutputFileName("raw/tile.01.tif", FeatureDetectorAlgorithm.ORB, 0));
    }
}
