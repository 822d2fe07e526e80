package org.janelia.fuzzer.detection;

import java.io.File;
import java.io.IOException;

/**
 * Decodes image files into {@link SourceImage} instances.
 */
@FunctionalInterface
public interface ImageLoader {

    /**
     * @throws IOException
     *   if the file cannot be decoded.
     */
    SourceImage load(File imageFile)
            throws IOException;
}
