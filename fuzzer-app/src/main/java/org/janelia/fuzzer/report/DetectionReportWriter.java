package org.janelia.fuzzer.report;

import java.io.Closeable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.janelia.fuzzer.detection.DetectionResult;
import org.janelia.fuzzer.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one CSV row per detection result.
 *
 * Any existing report is replaced when the writer is opened.  Every row is flushed
 * as soon as it is written so an interrupted sweep still leaves a usable report.
 */
public class DetectionReportWriter
        implements Closeable {

    public static final String HEADER =
            "InputFileName,Algorithm,Iteration,Inlier Count,Total Count,Inlier/Outlier Ratio," +
            "Execution (ms),OutputFileName,Parameters";

    private final PrintWriter writer;
    private long rowCount;

    public DetectionReportWriter(final File reportFile)
            throws IOException {

        FileUtil.deleteExistingFile(reportFile);

        this.writer = new PrintWriter(new OutputStreamWriter(new FileOutputStream(reportFile),
                                                             StandardCharsets.UTF_8),
                                      true);
        this.writer.println(HEADER);
        this.rowCount = 0;

        LOG.info("DetectionReportWriter: writing results to {}", reportFile.getAbsolutePath());
    }

    /**
     * Appends a row for the result.  Safe to call from concurrent detection threads.
     *
     * @param  result          detection result.
     * @param  iteration       index of the result's parameter set.
     * @param  outputFileName  name of the annotated image for the result (null if none was written).
     */
    public synchronized void write(final DetectionResult result,
                                   final int iteration,
                                   final String outputFileName) {
        writer.println(formatRow(result, iteration, outputFileName));
        rowCount++;
    }

    public synchronized long getRowCount() {
        return rowCount;
    }

    @Override
    public synchronized void close() {
        writer.close();
    }

    static String formatRow(final DetectionResult result,
                            final int iteration,
                            final String outputFileName) {
        return quoteField(result.getFileName()) + ',' +
               result.getFeatureDetector() + ',' +
               iteration + ',' +
               result.getInlierFeatureCount() + ',' +
               result.getTotalFeatureCount() + ',' +
               result.getInlierOutlierRatio() + ',' +
               result.getExecutionTimeMs() + ',' +
               (outputFileName == null ? "" : quoteField(outputFileName)) + ',' +
               result.getFeatureDetectorConfiguration();
    }

    /**
     * @return the value in double quotes with any embedded double quotes doubled.
     */
    static String quoteField(final String value) {
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static final Logger LOG = LoggerFactory.getLogger(DetectionReportWriter.class);
}
