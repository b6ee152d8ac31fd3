package com.ttennebkram.videofft.output;

/**
 * Turns a report into text in one output format.
 */
public interface ReportEncoder {

    String encode(AnalysisReport report);
}
