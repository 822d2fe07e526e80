package org.janelia.fuzzer.detection;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Feature detector families that can be fuzzed.
 * Declaration order is the order families are run for each image.
 */
public enum FeatureDetectorAlgorithm {

    AKAZE,
    AGAST,
    ORB,
    STAR,
    SIFT;

    /**
     * @return algorithm with the specified name (case and surrounding whitespace ignored).
     *
     * @throws IllegalArgumentException
     *   if the name is not recognized.
     */
    public static FeatureDetectorAlgorithm fromName(final String name)
            throws IllegalArgumentException {

        final String cleanedName = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        for (final FeatureDetectorAlgorithm algorithm : values()) {
            if (algorithm.name().equals(cleanedName)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Specified algorithm '" + name + "' was not recognized.  " +
                                           "Valid values are " + EnumSet.allOf(FeatureDetectorAlgorithm.class));
    }

    public static Set<FeatureDetectorAlgorithm> all() {
        return EnumSet.allOf(FeatureDetectorAlgorithm.class);
    }
}
