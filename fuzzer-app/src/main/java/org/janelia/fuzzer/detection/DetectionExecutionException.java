package org.janelia.fuzzer.detection;

/**
 * Thrown when a constructed detector fails while detecting keypoints.
 */
public class DetectionExecutionException
        extends DetectionException {

    public DetectionExecutionException(final String message,
                                       final String parameterDescription,
                                       final Throwable cause) {
        super(message, parameterDescription, cause);
    }

    public DetectionExecutionException(final String parameterDescription,
                                       final Throwable cause) {
        this("failed to detect keypoints", parameterDescription, cause);
    }
}
