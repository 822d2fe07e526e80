package org.janelia.fuzzer.session;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Database connection configuration properties.
 *
 * @author Eric Trautman
 */
public class DbConfig {

    public static final String DEFAULT_H2_DATABASE_NAME = "fuzzer-results";

    private final String url;
    private final String userName;
    private final String password;

    public DbConfig(final String url,
                    final String userName,
                    final String password) {
        this.url = url;
        this.userName = userName;
        this.password = password;
    }

    public String getUrl() {
        return url;
    }

    public boolean hasCredentials() {
        return (userName != null) && (password != null);
    }

    public String getUserName() {
        return userName;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        return url;
    }

    /**
     * @return configuration for an embedded H2 database file in the specified directory.
     */
    public static DbConfig forH2File(final File directory) {
        final File databaseFile = new File(directory, DEFAULT_H2_DATABASE_NAME).getAbsoluteFile();
        return new DbConfig("jdbc:h2:file:" + databaseFile.getPath(), "sa", "");
    }

    public static DbConfig fromFile(final File file)
            throws IllegalArgumentException {

        final Properties properties = new Properties();
        final String path = file.getAbsolutePath();

        try (final FileInputStream in = new FileInputStream(file)) {
            properties.load(in);
        } catch (final IOException e) {
            throw new IllegalArgumentException("failed to load properties from " + path, e);
        }

        final String url = getRequiredProperty("url", properties, path);

        final String userName = properties.getProperty("userName");
        String password = null;
        if (userName == null) {
            LOG.info("fromFile: skipping load of database credentials because no userName is defined in {}", path);
        } else {
            password = getRequiredProperty("password", properties, path);
        }

        return new DbConfig(url, userName, password);
    }

    private static String getRequiredProperty(final String propertyName,
                                              final Properties properties,
                                              final String path)
            throws IllegalArgumentException {

        final String value = properties.getProperty(propertyName);
        if (value == null) {
            throw new IllegalArgumentException(propertyName + " value is missing from " + path);
        }
        return value;
    }

    private static final Logger LOG = LoggerFactory.getLogger(DbConfig.class);

}
