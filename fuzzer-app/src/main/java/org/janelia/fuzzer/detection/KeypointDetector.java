package org.janelia.fuzzer.detection;

import java.util.List;

import org.janelia.fuzzer.detection.parameters.DetectionParameters;

/**
 * External detection capability for one algorithm family.
 *
 * Implementations build a detector for the specified parameters, run it against
 * the parameters' image, and release every native resource they acquired before
 * returning or throwing.
 *
 * @param  <P>  parameter type for the family.
 */
@FunctionalInterface
public interface KeypointDetector<P extends DetectionParameters> {

    /**
     * @return all keypoints the configured detector found in the parameters' image.
     *
     * @throws DetectorConstructionException
     *   if the parameter combination is rejected.
     *
     * @throws DetectionExecutionException
     *   if detection itself fails.
     */
    List<Keypoint> detect(P parameters)
            throws DetectorConstructionException, DetectionExecutionException;
}
