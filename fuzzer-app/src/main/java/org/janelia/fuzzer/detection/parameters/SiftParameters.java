package org.janelia.fuzzer.detection.parameters;

import org.janelia.fuzzer.detection.ImageContext;

/**
 * Parameters describing a SIFT feature detector.
 */
public class SiftParameters
        extends DetectionParameters {

    /** A feature count of zero means unlimited. */
    private final int features;
    private final int octaveLayers;
    private final double contrastThreshold;
    private final double edgeThreshold;
    private final double sigma;

    public SiftParameters(final ImageContext imageContext,
                          final int features,
                          final int octaveLayers,
                          final double contrastThreshold,
                          final double edgeThreshold,
                          final double sigma) {
        super(imageContext);
        this.features = features;
        this.octaveLayers = octaveLayers;
        this.contrastThreshold = contrastThreshold;
        this.edgeThreshold = edgeThreshold;
        this.sigma = sigma;
    }

    public int getFeatures() {
        return features;
    }

    public int getOctaveLayers() {
        return octaveLayers;
    }

    public double getContrastThreshold() {
        return contrastThreshold;
    }

    public double getEdgeThreshold() {
        return edgeThreshold;
    }

    public double getSigma() {
        return sigma;
    }

    @Override
    public String toParameterString() {
        return quote("features: " + features +
                     ", octaveLayers: " + octaveLayers +
                     ", contrastThreshold: " + contrastThreshold +
                     ", edgeThreshold: " + edgeThreshold +
                     ", sigma: " + sigma);
    }
}
