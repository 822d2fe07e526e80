package org.janelia.fuzzer.util;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 *
 * @author Eric Trautman
 */
public class FileUtil {

    public static Reader getUtf8Reader(final File file)
            throws IOException {
        return Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
    }

    public static void ensureWritableDirectory(final File directory) {
        // try twice to work around concurrent access issues
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    throw new IllegalArgumentException("failed to create " + directory);
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    /**
     * Removes the specified file if it exists so that it can be recreated by a new run.
     *
     * @return true if an existing file was removed.
     *
     * @throws IOException
     *   if the existing file cannot be removed.
     */
    public static boolean deleteExistingFile(final File file)
            throws IOException {
        final boolean deleted = Files.deleteIfExists(file.toPath());
        if (deleted) {
            LOG.info("deleteExistingFile: removed previous version of {}", file.getAbsolutePath());
        }
        return deleted;
    }

    /**
     * @return the specified file name without its extension (e.g. "scan.png" becomes "scan").
     */
    public static String getBaseName(final String fileName) {
        final String name = new File(fileName).getName();
        final int extensionStart = name.lastIndexOf('.');
        return extensionStart > 0 ? name.substring(0, extensionStart) : name;
    }

    public static boolean deleteRecursive(final File file) {

        boolean deleteSuccessful = true;

        if (file.isDirectory()){
            final File[] files = file.listFiles();
            if (files != null) {
                for (final File f : files) {
                    deleteSuccessful = deleteSuccessful && deleteRecursive(f);
                }
            }
        }

        if (file.delete()) {
            LOG.info("deleted " + file.getAbsolutePath());
        } else {
            LOG.warn("failed to delete " + file.getAbsolutePath());
            deleteSuccessful = false;
        }

        return deleteSuccessful;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);

}
