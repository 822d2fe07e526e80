package org.janelia.fuzzer.client.opencv;

import java.util.Arrays;
import java.util.List;

import org.janelia.fuzzer.detection.AgastRunner;
import org.janelia.fuzzer.detection.AkazeRunner;
import org.janelia.fuzzer.detection.FeatureDetectorRunner;
import org.janelia.fuzzer.detection.OrbRunner;
import org.janelia.fuzzer.detection.SiftRunner;
import org.janelia.fuzzer.detection.StarRunner;

/**
 * Runners for every detector family backed by OpenCV.
 */
public class OpenCvRunners {

    public static List<FeatureDetectorRunner<?>> all() {
        return Arrays.asList(new AkazeRunner(new OpenCvAkazeDetector()),
                             new AgastRunner(new OpenCvAgastDetector()),
                             new OrbRunner(new OpenCvOrbDetector()),
                             new StarRunner(new OpenCvStarDetector()),
                             new SiftRunner(new OpenCvSiftDetector()));
    }
}
