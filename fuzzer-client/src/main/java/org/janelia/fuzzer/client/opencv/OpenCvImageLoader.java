package org.janelia.fuzzer.client.opencv;

import java.io.File;
import java.io.IOException;

import org.bytedeco.opencv.opencv_core.Mat;
import org.janelia.fuzzer.detection.ImageLoader;
import org.janelia.fuzzer.detection.SourceImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_COLOR;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imread;

/**
 * Decodes image files with OpenCV.
 */
public class OpenCvImageLoader
        implements ImageLoader {

    @Override
    public SourceImage load(final File imageFile)
            throws IOException {

        final String path = imageFile.getAbsolutePath();
        final Mat mat = imread(path, IMREAD_COLOR);

        if (mat.empty()) {
            mat.close();
            throw new IOException("failed to decode " + path);
        }

        LOG.debug("load: loaded {} ({}x{})", path, mat.cols(), mat.rows());

        return new OpenCvSourceImage(imageFile.getName(), mat);
    }

    private static final Logger LOG = LoggerFactory.getLogger(OpenCvImageLoader.class);
}
