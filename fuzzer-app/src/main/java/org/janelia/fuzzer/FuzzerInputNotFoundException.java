package org.janelia.fuzzer;

import java.io.File;

/**
 * Thrown when the fuzzer input file does not exist.
 */
public class FuzzerInputNotFoundException
        extends IllegalStateException {

    public FuzzerInputNotFoundException(final File inputFile) {
        super("fuzzer input file " + inputFile.getAbsolutePath() + " does not exist");
    }
}
