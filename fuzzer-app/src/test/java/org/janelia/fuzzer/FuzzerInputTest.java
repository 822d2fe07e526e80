package org.janelia.fuzzer;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.List;

import org.janelia.fuzzer.detection.ImageToProcess;
import org.janelia.fuzzer.detection.RegionOfInterest;
import org.janelia.fuzzer.util.FileUtil;
import org.janelia.fuzzer.util.TestDirectory;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link FuzzerInput} class.
 */
public class FuzzerInputTest {

    private File inputDirectory;

    @Before
    public void setup() throws IOException {
        inputDirectory = TestDirectory.create("test-fuzzer-input");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(inputDirectory);
    }

    @Test
    public void testLoad() throws Exception {

        writeInput("[ { \"fileName\": \"a.png\", \"regionOfInterest\": { \"x\": 1, \"y\": 2, \"width\": 3, \"height\": 4 } },\n" +
                   "  { \"FILENAME\": \"b.tif\", \"RegionOfInterest\": { \"X\": 0, \"Y\": 0, \"Width\": 9, \"Height\": 9 } } ]");

        final List<ImageToProcess> imageList = FuzzerInput.load(inputDirectory);

        Assert.assertEquals("invalid number of images", 2, imageList.size());
        Assert.assertEquals("invalid first file name", "a.png", imageList.get(0).getFileName());
        Assert.assertEquals("invalid first region",
                            new RegionOfInterest(1, 2, 3, 4), imageList.get(0).getRegionOfInterest());
        Assert.assertEquals("invalid second file name", "b.tif", imageList.get(1).getFileName());
        Assert.assertEquals("invalid second region width", 9, imageList.get(1).getRegionOfInterest().getWidth());
    }

    @Test
    public void testEmptyList() throws Exception {
        writeInput("[]");
        Assert.assertTrue("empty input should load", FuzzerInput.load(inputDirectory).isEmpty());
    }

    @Test(expected = FuzzerInputNotFoundException.class)
    public void testMissingFile() throws Exception {
        FuzzerInput.load(inputDirectory);
    }

    @Test
    public void testMissingRegion() throws Exception {

        writeInput("[ { \"FileName\": \"a.png\" } ]");

        try {
            FuzzerInput.load(inputDirectory);
            Assert.fail("image without a region should be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should name the missing field",
                              e.getMessage().contains("RegionOfInterest"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() throws Exception {
        writeInput("{ \"FileName\": ");
        FuzzerInput.load(inputDirectory);
    }

    private void writeInput(final String json) throws IOException {
        Files.write(new File(inputDirectory, FuzzerInput.INPUT_FILE_NAME).toPath(),
                    Collections.singletonList(json),
                    StandardCharsets.UTF_8);
    }
}
