package org.janelia.fuzzer.client;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.janelia.fuzzer.FeatureDetectorFuzzer;
import org.janelia.fuzzer.FuzzingSummary;
import org.janelia.fuzzer.client.opencv.OpenCvImageAnnotator;
import org.janelia.fuzzer.client.opencv.OpenCvImageLoader;
import org.janelia.fuzzer.client.opencv.OpenCvRunners;
import org.janelia.fuzzer.client.opencv.OpenCvRuntime;
import org.janelia.fuzzer.client.parameter.CommandLineParameters;
import org.janelia.fuzzer.parameters.FuzzingParameters;
import org.janelia.fuzzer.report.ImageAnnotator;
import org.janelia.fuzzer.session.DbConfig;
import org.janelia.fuzzer.session.FuzzingSessionStore;
import org.janelia.fuzzer.session.JdbcFuzzingSessionStore;
import org.janelia.fuzzer.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for sweeping OpenCV feature detector parameters across a set of images
 * and recording how many keypoints land inside each image's region of interest.
 */
public class FuzzFeatureDetectorsClient {

    public static final String OPERATION_NAME = "FuzzFeatureDetectors";

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "-Operation",
                description = "Operation to perform (only " + OPERATION_NAME + " is supported)",
                required = true,
                validateWith = OperationValidator.class)
        public String operation;

        @ParametersDelegate
        public FuzzingParameters fuzzing = new FuzzingParameters();

        @Parameter(
                names = "--dbConfig",
                description = "Properties file with url, userName, and password for the result database " +
                              "(default is an H2 database file in the output directory)")
        public String dbConfigPath;

        @Parameter(
                names = "--skipDatabase",
                description = "Only write the CSV report and annotated images",
                arity = 0)
        public boolean skipDatabase = false;

        @Parameter(
                names = "--skipAnnotatedImages",
                description = "Do not write an annotated image for each detection",
                arity = 0)
        public boolean skipAnnotatedImages = false;

        @Parameter(
                names = "--useOpenCL",
                description = "Let OpenCV use OpenCL acceleration when it is available",
                arity = 1)
        public boolean useOpenCL = true;

        public DbConfig getDbConfig() {
            return dbConfigPath == null ?
                   DbConfig.forH2File(fuzzing.getOutputDirectory()) :
                   DbConfig.fromFile(new File(dbConfigPath));
        }
    }

    public static class OperationValidator
            implements IParameterValidator {

        @Override
        public void validate(final String name,
                             final String value)
                throws ParameterException {
            if (! OPERATION_NAME.equals(value)) {
                throw new ParameterException("Unknown operation '" + value + "' specified for " + name +
                                             ", only " + OPERATION_NAME + " is supported");
            }
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final FuzzFeatureDetectorsClient client = new FuzzFeatureDetectorsClient(parameters);
                client.fuzz();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    /**
     * @throws IllegalArgumentException
     *   if the fuzzing parameters are invalid (checked before any output is created).
     */
    FuzzFeatureDetectorsClient(final Parameters parameters)
            throws IllegalArgumentException {
        parameters.fuzzing.validate();
        this.parameters = parameters;
    }

    public FuzzingSummary fuzz()
            throws IOException {

        final ImageAnnotator imageAnnotator = parameters.skipAnnotatedImages ?
                                              ImageAnnotator.DISABLED : new OpenCvImageAnnotator();

        try (final FuzzingSessionStore sessionStore = buildSessionStore()) {

            final FeatureDetectorFuzzer fuzzer = new FeatureDetectorFuzzer(parameters.fuzzing,
                                                                           OpenCvRunners.all(),
                                                                           new OpenCvImageLoader(),
                                                                           imageAnnotator,
                                                                           sessionStore,
                                                                           new OpenCvRuntime(parameters.useOpenCL));

            final CountDownLatch fuzzingDone = new CountDownLatch(1);
            final Thread shutdownHook = new Thread(() -> {
                LOG.warn("shutdownHook: cancelling {}", fuzzer.getSession());
                fuzzer.cancel();
                try {
                    // give the current family a chance to commit its records
                    if (! fuzzingDone.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                        LOG.warn("shutdownHook: fuzzing did not stop within {} seconds", SHUTDOWN_WAIT_SECONDS);
                    }
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "fuzzer-shutdown");

            Runtime.getRuntime().addShutdownHook(shutdownHook);
            try {
                final FuzzingSummary summary = fuzzer.fuzz();
                LOG.info("fuzz: {}", summary);
                return summary;
            } finally {
                fuzzingDone.countDown();
                removeShutdownHook(shutdownHook);
            }
        }
    }

    private FuzzingSessionStore buildSessionStore() {
        final FuzzingSessionStore sessionStore;
        if (parameters.skipDatabase) {
            LOG.info("buildSessionStore: skipping database persistence");
            sessionStore = FuzzingSessionStore.DISABLED;
        } else {
            FileUtil.ensureWritableDirectory(parameters.fuzzing.getOutputDirectory());
            sessionStore = new JdbcFuzzingSessionStore(parameters.getDbConfig());
        }
        return sessionStore;
    }

    private static void removeShutdownHook(final Thread shutdownHook) {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (final IllegalStateException e) {
            LOG.debug("removeShutdownHook: JVM is already shutting down");
        }
    }

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private static final Logger LOG = LoggerFactory.getLogger(FuzzFeatureDetectorsClient.class);
}
