package org.janelia.fuzzer.client.opencv;

import org.bytedeco.opencv.opencv_core.Mat;
import org.janelia.fuzzer.detection.SourceImage;

/**
 * Decoded image held in an OpenCV matrix.
 */
public class OpenCvSourceImage
        implements SourceImage {

    private final String name;
    private final Mat mat;

    public OpenCvSourceImage(final String name,
                             final Mat mat) {
        this.name = name;
        this.mat = mat;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getWidth() {
        return mat.cols();
    }

    @Override
    public int getHeight() {
        return mat.rows();
    }

    /**
     * @return the shared matrix.  Callers must not modify it.
     */
    public Mat getMat() {
        return mat;
    }

    @Override
    public void close() {
        mat.close();
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * @throws IllegalArgumentException
     *   if the image was not loaded by {@link OpenCvImageLoader}.
     */
    public static Mat getMat(final SourceImage sourceImage)
            throws IllegalArgumentException {
        if (! (sourceImage instanceof OpenCvSourceImage)) {
            throw new IllegalArgumentException("image " + sourceImage + " was not loaded by OpenCV");
        }
        return ((OpenCvSourceImage) sourceImage).getMat();
    }
}
