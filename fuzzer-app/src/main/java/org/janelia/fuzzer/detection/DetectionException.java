package org.janelia.fuzzer.detection;

/**
 * Base class for failures of a single detector invocation.
 */
public abstract class DetectionException
        extends RuntimeException {

    private final String parameterDescription;

    protected DetectionException(final String message,
                                 final String parameterDescription,
                                 final Throwable cause) {
        super(message + " for parameters " + parameterDescription, cause);
        this.parameterDescription = parameterDescription;
    }

    public String getParameterDescription() {
        return parameterDescription;
    }
}
