package org.janelia.fuzzer.client.opencv;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.janelia.fuzzer.detection.DetectionResult;
import org.janelia.fuzzer.detection.Keypoint;
import org.janelia.fuzzer.detection.RegionOfInterest;
import org.janelia.fuzzer.detection.SourceImage;
import org.janelia.fuzzer.report.ImageAnnotator;

import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;
import static org.bytedeco.opencv.global.opencv_imgproc.circle;
import static org.bytedeco.opencv.global.opencv_imgproc.rectangle;

/**
 * Draws the region of interest (green) and keypoints (red inliers, blue outliers)
 * onto a clone of the source matrix and writes it as a JPEG.
 */
public class OpenCvImageAnnotator
        implements ImageAnnotator {

    // OpenCV scalars are BGR
    private static final double[] REGION_COLOR = { 0, 255, 0 };
    private static final double[] INLIER_COLOR = { 0, 0, 255 };
    private static final double[] OUTLIER_COLOR = { 255, 0, 0 };

    @Override
    public void annotate(final SourceImage sourceImage,
                         final RegionOfInterest regionOfInterest,
                         final DetectionResult result,
                         final File outputFile)
            throws IOException {

        try (final Mat annotated = OpenCvSourceImage.getMat(sourceImage).clone()) {

            drawRectangleOn(annotated, regionOfInterest);
            drawKeypointsOn(annotated, result.getKeypoints(), regionOfInterest);

            if (! imwrite(outputFile.getAbsolutePath(), annotated)) {
                throw new IOException("failed to write " + outputFile.getAbsolutePath());
            }
        }
    }

    static void drawRectangleOn(final Mat image,
                                final RegionOfInterest regionOfInterest) {
        // edges are inside the region, so the drawn box covers width + 1 pixels
        try (final Rect rect = new Rect(regionOfInterest.getX(),
                                        regionOfInterest.getY(),
                                        regionOfInterest.getWidth() + 1,
                                        regionOfInterest.getHeight() + 1);
             final Scalar color = toScalar(REGION_COLOR)) {
            rectangle(image, rect, color);
        }
    }

    static void drawKeypointsOn(final Mat image,
                                final List<Keypoint> keypoints,
                                final RegionOfInterest regionOfInterest) {
        try (final Scalar inlierColor = toScalar(INLIER_COLOR);
             final Scalar outlierColor = toScalar(OUTLIER_COLOR)) {
            for (final Keypoint keypoint : keypoints) {
                final int radius = Math.max(1, Math.round(keypoint.getSize() / 2));
                try (final Point center = new Point(Math.round(keypoint.getX()), Math.round(keypoint.getY()))) {
                    circle(image,
                           center,
                           radius,
                           regionOfInterest.contains(keypoint) ? inlierColor : outlierColor);
                }
            }
        }
    }

    private static Scalar toScalar(final double[] bgr) {
        return new Scalar(bgr[0], bgr[1], bgr[2], 0);
    }
}
