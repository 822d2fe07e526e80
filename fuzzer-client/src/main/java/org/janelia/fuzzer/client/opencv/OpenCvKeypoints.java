package org.janelia.fuzzer.client.opencv;

import java.util.ArrayList;
import java.util.List;

import org.bytedeco.opencv.opencv_core.KeyPoint;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.janelia.fuzzer.detection.Keypoint;

/**
 * Converts OpenCV keypoints into {@link Keypoint} instances.
 */
public class OpenCvKeypoints {

    public static List<Keypoint> toKeypoints(final KeyPointVector keyPointVector) {
        final long count = keyPointVector.size();
        final List<Keypoint> keypoints = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            final KeyPoint keyPoint = keyPointVector.get(i);
            keypoints.add(new Keypoint(keyPoint.pt().x(),
                                       keyPoint.pt().y(),
                                       keyPoint.size(),
                                       keyPoint.angle(),
                                       keyPoint.response(),
                                       keyPoint.octave()));
        }
        return keypoints;
    }
}
