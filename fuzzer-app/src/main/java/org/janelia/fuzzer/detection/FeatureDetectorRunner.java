package org.janelia.fuzzer.detection;

import java.util.List;

import org.janelia.fuzzer.detection.parameters.DetectionParameters;
import org.janelia.fuzzer.detection.parameters.ParameterGrid;
import org.janelia.fuzzer.util.ProcessTimer;

/**
 * Generates the parameter grid for one detector family and scores a single
 * detection run against the image's region of interest.
 *
 * Subclasses only define the grid.  Detection itself is delegated to a
 * {@link KeypointDetector} so that the same runner works with any detection
 * capability (native or stubbed).
 *
 * @param  <P>  parameter type for the family.
 */
public abstract class FeatureDetectorRunner<P extends DetectionParameters> {

    private final FeatureDetectorAlgorithm algorithm;
    private final KeypointDetector<P> keypointDetector;

    protected FeatureDetectorRunner(final FeatureDetectorAlgorithm algorithm,
                                    final KeypointDetector<P> keypointDetector) {
        this.algorithm = algorithm;
        this.keypointDetector = keypointDetector;
    }

    public FeatureDetectorAlgorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * @return every parameter combination for the specified image in deterministic order.
     */
    public abstract ParameterGrid<P> generateParameters(final ImageContext imageContext);

    /**
     * Runs one detection and classifies each keypoint as inside or outside the region of interest.
     *
     * @throws DetectorConstructionException
     *   if the detection capability rejects the parameters.
     *
     * @throws DetectionExecutionException
     *   if detection fails for any other reason.
     */
    public DetectionResult performDetection(final P parameters)
            throws DetectorConstructionException, DetectionExecutionException {

        final ProcessTimer timer = new ProcessTimer();

        final List<Keypoint> keypoints;
        try {
            keypoints = keypointDetector.detect(parameters);
        } catch (final DetectionException e) {
            throw e;
        } catch (final RuntimeException e) {
            throw new DetectionExecutionException(parameters.toParameterString(), e);
        }

        final long executionTimeMs = timer.getElapsedMilliseconds();

        if (keypoints == null) {
            throw new DetectionExecutionException("detector returned no keypoint list",
                                                  parameters.toParameterString(),
                                                  null);
        }

        final RegionOfInterest regionOfInterest = parameters.getRegionOfInterest();
        int inlierCount = 0;
        for (final Keypoint keypoint : keypoints) {
            if (regionOfInterest.contains(keypoint)) {
                inlierCount++;
            }
        }

        return new DetectionResult(parameters.getFileName(),
                                   keypoints,
                                   inlierCount,
                                   executionTimeMs,
                                   algorithm,
                                   parameters.toParameterString());
    }

    @Override
    public String toString() {
        return algorithm + " runner";
    }
}
