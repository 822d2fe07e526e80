package org.janelia.fuzzer;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.List;

import org.janelia.fuzzer.detection.ImageToProcess;
import org.janelia.fuzzer.json.JsonUtils;
import org.janelia.fuzzer.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the list of images to fuzz from an input directory.
 *
 * The input file is a JSON array like:
 * <pre>
 *   [ { "FileName": "scan.png", "RegionOfInterest": { "X": 10, "Y": 10, "Width": 50, "Height": 50 } } ]
 * </pre>
 */
public class FuzzerInput {

    public static final String INPUT_FILE_NAME = "fuzzer-input.json";

    private static final JsonUtils.Helper<ImageToProcess> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.CASE_INSENSITIVE_MAPPER, ImageToProcess.class);

    /**
     * @throws FuzzerInputNotFoundException
     *   if the input file does not exist.
     *
     * @throws IllegalArgumentException
     *   if the input file cannot be parsed or lists an image without a region of interest.
     *
     * @throws IOException
     *   if the input file cannot be read.
     */
    public static List<ImageToProcess> load(final File inputDirectory)
            throws FuzzerInputNotFoundException, IllegalArgumentException, IOException {

        final File inputFile = new File(inputDirectory, INPUT_FILE_NAME);
        if (! inputFile.isFile()) {
            throw new FuzzerInputNotFoundException(inputFile);
        }

        final List<ImageToProcess> imageList;
        try (final Reader reader = FileUtil.getUtf8Reader(inputFile)) {
            imageList = JSON_HELPER.fromJsonArray(reader);
        }

        for (final ImageToProcess image : imageList) {
            if ((image.getFileName() == null) || (image.getRegionOfInterest() == null)) {
                throw new IllegalArgumentException("every image in " + inputFile.getAbsolutePath() +
                                                   " must have a FileName and RegionOfInterest, " +
                                                   "invalid entry is " + image);
            }
        }

        LOG.info("load: loaded {} images from {}", imageList.size(), inputFile.getAbsolutePath());

        return imageList;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FuzzerInput.class);
}
