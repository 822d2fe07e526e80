package org.janelia.fuzzer.detection;

/**
 * Thrown when the detection capability rejects a parameter combination
 * while building a detector instance.
 */
public class DetectorConstructionException
        extends DetectionException {

    public DetectorConstructionException(final String parameterDescription,
                                         final Throwable cause) {
        super("failed to construct detector", parameterDescription, cause);
    }
}
