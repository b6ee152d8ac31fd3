package com.ttennebkram.videofft.output;

import java.util.Arrays;
import java.util.List;

/**
 * CSV report in three blocks separated by blank lines: a summary header row and value row,
 * the per-frame scores, and the mean radial profile.
 */
public class CsvReportEncoder implements ReportEncoder {

    static final List<String> SUMMARY_COLUMNS = Arrays.asList(
        "input_file", "frame_count", "mean_high_frequency_score", "max_high_frequency_score",
        "min_high_frequency_score", "median_high_frequency_score", "pct_05", "pct_95");

    private static final String NEWLINE = "\r\n";

    @Override
    public String encode(AnalysisReport report) {
        StringBuilder sb = new StringBuilder();
        row(sb, SUMMARY_COLUMNS);
        row(sb, Arrays.asList(
            report.getInputFile() == null ? "" : report.getInputFile(),
            String.valueOf(report.getFrameCount()),
            String.valueOf(report.getMeanHighFrequencyScore()),
            String.valueOf(report.getMaxHighFrequencyScore()),
            String.valueOf(report.getMinHighFrequencyScore()),
            String.valueOf(report.getMedianHighFrequencyScore()),
            String.valueOf(report.getPct05()),
            String.valueOf(report.getPct95())));

        sb.append(NEWLINE);
        row(sb, Arrays.asList("frame_index", "high_frequency_score"));
        for (AnalysisReport.FrameScore fs : report.getPerFrame()) {
            row(sb, Arrays.asList(String.valueOf(fs.frameIndex), String.valueOf(fs.highFrequencyScore)));
        }

        sb.append(NEWLINE);
        row(sb, Arrays.asList("radius", "mean_radial_profile"));
        double[] profile = report.getMeanRadialProfile();
        for (int r = 0; r < profile.length; r++) {
            row(sb, Arrays.asList(String.valueOf(r), String.valueOf(profile[r])));
        }
        return sb.toString();
    }

    private static void row(StringBuilder sb, List<String> fields) {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(escape(fields.get(i)));
        }
        sb.append(NEWLINE);
    }

    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
            && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
