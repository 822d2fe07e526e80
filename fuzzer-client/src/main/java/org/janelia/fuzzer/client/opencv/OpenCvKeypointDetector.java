package org.janelia.fuzzer.client.opencv;

import java.util.List;

import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.Feature2D;
import org.janelia.fuzzer.detection.DetectionExecutionException;
import org.janelia.fuzzer.detection.DetectorConstructionException;
import org.janelia.fuzzer.detection.Keypoint;
import org.janelia.fuzzer.detection.KeypointDetector;
import org.janelia.fuzzer.detection.parameters.DetectionParameters;

/**
 * Builds one OpenCV detector per call, runs it, and releases it (and the keypoint vector)
 * before returning or throwing.
 *
 * @param  <P>  parameter type for the family.
 * @param  <D>  OpenCV detector type.
 */
public abstract class OpenCvKeypointDetector<P extends DetectionParameters, D extends Feature2D>
        implements KeypointDetector<P> {

    /**
     * @return new native detector instance for the parameters.
     */
    protected abstract D createDetector(final P parameters);

    /**
     * Applies any parameters that are not passed to {@link #createDetector}.
     */
    protected void configureDetector(final D detector,
                                     final P parameters) {
    }

    @Override
    public List<Keypoint> detect(final P parameters)
            throws DetectorConstructionException, DetectionExecutionException {

        final Mat image = OpenCvSourceImage.getMat(parameters.getImage());
        final D detector = buildDetector(parameters);

        try (final D closeableDetector = detector;
             final KeyPointVector keyPointVector = new KeyPointVector()) {
            closeableDetector.detect(image, keyPointVector);
            return OpenCvKeypoints.toKeypoints(keyPointVector);
        } catch (final RuntimeException e) {
            throw new DetectionExecutionException(parameters.toParameterString(), e);
        }
    }

    private D buildDetector(final P parameters)
            throws DetectorConstructionException {

        final D detector;
        try {
            detector = createDetector(parameters);
        } catch (final RuntimeException e) {
            throw new DetectorConstructionException(parameters.toParameterString(), e);
        }

        try {
            configureDetector(detector, parameters);
        } catch (final RuntimeException e) {
            detector.close();
            throw new DetectorConstructionException(parameters.toParameterString(), e);
        }

        return detector;
    }
}
