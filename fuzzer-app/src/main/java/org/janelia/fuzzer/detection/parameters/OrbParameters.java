package org.janelia.fuzzer.detection.parameters;

import org.janelia.fuzzer.detection.ImageContext;

/**
 * Parameters describing an ORB feature detector.
 */
public class OrbParameters
        extends DetectionParameters {

    /** Keypoint ranking scores with their OpenCV constant values. */
    public enum ScoreType {
        FAST(1),
        HARRIS(0);

        private final int code;

        ScoreType(final int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    private final int numberOfFeatures;
    private final float scaleFactor;
    private final int levels;
    private final int edgeThreshold;
    private final ScoreType scoreType;
    private final int patchSize;
    private final int fastThreshold;

    public OrbParameters(final ImageContext imageContext,
                         final int numberOfFeatures,
                         final float scaleFactor,
                         final int levels,
                         final int edgeThreshold,
                         final ScoreType scoreType,
                         final int patchSize,
                         final int fastThreshold) {
        super(imageContext);
        this.numberOfFeatures = numberOfFeatures;
        this.scaleFactor = scaleFactor;
        this.levels = levels;
        this.edgeThreshold = edgeThreshold;
        this.scoreType = scoreType;
        this.patchSize = patchSize;
        this.fastThreshold = fastThreshold;
    }

    public int getNumberOfFeatures() {
        return numberOfFeatures;
    }

    public float getScaleFactor() {
        return scaleFactor;
    }

    public int getLevels() {
        return levels;
    }

    public int getEdgeThreshold() {
        return edgeThreshold;
    }

    public ScoreType getScoreType() {
        return scoreType;
    }

    public int getPatchSize() {
        return patchSize;
    }

    public int getFastThreshold() {
        return fastThreshold;
    }

    @Override
    public String toParameterString() {
        return quote("numberOfFeatures: " + numberOfFeatures +
                     ", scaleFactor: " + scaleFactor +
                     ", levels: " + levels +
                     ", edgeThreshold: " + edgeThreshold +
                     ", scoreType: " + scoreType +
                     ", patchSize: " + patchSize +
                     ", fastThreshold: " + fastThreshold);
    }
}
