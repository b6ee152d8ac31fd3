package com.ttennebkram.videofft.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Pretty-printed JSON report.
 */
public class JsonReportEncoder implements ReportEncoder {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .serializeSpecialFloatingPointValues()
        .create();

    @Override
    public String encode(AnalysisReport report) {
        return GSON.toJson(toJson(report));
    }

    public JsonObject toJson(AnalysisReport report) {
        JsonObject root = new JsonObject();
        root.addProperty("input_file", report.getInputFile());
        root.addProperty("frame_count", report.getFrameCount());
        root.addProperty("mean_high_frequency_score", report.getMeanHighFrequencyScore());
        root.addProperty("max_high_frequency_score", report.getMaxHighFrequencyScore());
        root.addProperty("min_high_frequency_score", report.getMinHighFrequencyScore());
        root.addProperty("median_high_frequency_score", report.getMedianHighFrequencyScore());
        root.addProperty("pct_05", report.getPct05());
        root.addProperty("pct_95", report.getPct95());

        JsonArray perFrame = new JsonArray();
        for (AnalysisReport.FrameScore fs : report.getPerFrame()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("frame_index", fs.frameIndex);
            entry.addProperty("high_frequency_score", fs.highFrequencyScore);
            perFrame.add(entry);
        }
        root.add("per_frame", perFrame);

        JsonArray profile = new JsonArray();
        for (double v : report.getMeanRadialProfile()) {
            profile.add(v);
        }
        root.add("mean_radial_profile", profile);
        return root;
    }
}
