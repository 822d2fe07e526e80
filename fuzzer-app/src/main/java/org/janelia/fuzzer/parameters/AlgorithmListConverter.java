package org.janelia.fuzzer.parameters;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import java.util.ArrayList;
import java.util.List;

import org.janelia.fuzzer.detection.FeatureDetectorAlgorithm;

/**
 * Converts a comma separated list of algorithm names (e.g. "agast, ORB") into algorithms.
 * Blank values are ignored so an empty list enables no algorithms.
 */
public class AlgorithmListConverter
        implements IStringConverter<List<FeatureDetectorAlgorithm>> {

    @Override
    public List<FeatureDetectorAlgorithm> convert(final String value)
            throws ParameterException {

        final List<FeatureDetectorAlgorithm> algorithms = new ArrayList<>();
        for (final String name : value.split(",")) {
            if (name.trim().length() > 0) {
                try {
                    algorithms.add(FeatureDetectorAlgorithm.fromName(name));
                } catch (final IllegalArgumentException e) {
                    throw new ParameterException(e.getMessage());
                }
            }
        }
        return algorithms;
    }
}
