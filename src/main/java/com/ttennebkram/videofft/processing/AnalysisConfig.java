package com.ttennebkram.videofft.processing;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.videofft.output.OutputFormat;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Settings for one analysis run. Immutable; use {@link #builder()} or {@link #load(Path)}.
 *
 * JSON configuration keys (all optional):
 * <pre>
 * {
 *   "numFrames": 100,
 *   "visualization": ["first", "mean"],
 *   "progress": true,
 *   "radiusBounds": "inscribed",
 *   "workerThreads": 4,
 *   "scale": 1.0,
 *   "outputFormat": "json",
 *   "output": "/tmp/spectra"
 * }
 * </pre>
 */
public class AnalysisConfig {

    private final Integer numFramesLimit;
    private final Set<VisualizationPolicy> visualization;
    private final boolean progressEnabled;
    private final RadiusBounds radiusBounds;
    private final int workerThreads;
    private final double imageScale;
    private final OutputFormat outputFormat;
    private final String outputDirectory;

    private AnalysisConfig(Builder b) {
        this.numFramesLimit = b.numFramesLimit;
        EnumSet<VisualizationPolicy> policies = b.visualization.isEmpty()
            ? EnumSet.of(VisualizationPolicy.NONE)
            : EnumSet.copyOf(b.visualization);
        if (policies.size() > 1) {
            policies.remove(VisualizationPolicy.NONE);
        }
        this.visualization = Collections.unmodifiableSet(policies);
        this.progressEnabled = b.progressEnabled;
        this.radiusBounds = b.radiusBounds;
        this.workerThreads = b.workerThreads;
        this.imageScale = b.imageScale;
        this.outputFormat = b.outputFormat;
        this.outputDirectory = b.outputDirectory;
    }

    public static AnalysisConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.numFramesLimit = numFramesLimit;
        b.visualization = EnumSet.copyOf(visualization);
        b.visualization.remove(VisualizationPolicy.NONE);
        b.progressEnabled = progressEnabled;
        b.radiusBounds = radiusBounds;
        b.workerThreads = workerThreads;
        b.imageScale = imageScale;
        b.outputFormat = outputFormat;
        b.outputDirectory = outputDirectory;
        return b;
    }

    /**
     * Read a JSON configuration file; keys that are absent keep their defaults.
     */
    public static AnalysisConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                throw new IllegalArgumentException("Configuration " + path + " must be a JSON object");
            }
            return fromJson(root.getAsJsonObject());
        } catch (JsonParseException e) {
            throw new IOException("Malformed configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Build a configuration from parsed JSON. A null value keeps the default.
     *
     * @throws IllegalArgumentException if a value has the wrong type or is out of range
     */
    public static AnalysisConfig fromJson(JsonObject json) {
        Builder b = builder();
        JsonElement numFrames = value(json, "numFrames");
        if (numFrames != null) {
            b.numFramesLimit(intValue(numFrames, "numFrames"));
        }
        JsonElement vis = value(json, "visualization");
        if (vis != null) {
            if (vis.isJsonArray()) {
                JsonArray arr = vis.getAsJsonArray();
                for (JsonElement e : arr) {
                    b.visualize(VisualizationPolicy.fromName(stringValue(e, "visualization")));
                }
            } else {
                b.visualize(VisualizationPolicy.fromName(stringValue(vis, "visualization")));
            }
        }
        JsonElement progress = value(json, "progress");
        if (progress != null) {
            if (!progress.isJsonPrimitive() || !progress.getAsJsonPrimitive().isBoolean()) {
                throw wrongType("progress", "a boolean", progress);
            }
            b.progressEnabled(progress.getAsBoolean());
        }
        JsonElement bounds = value(json, "radiusBounds");
        if (bounds != null) b.radiusBounds(RadiusBounds.fromName(stringValue(bounds, "radiusBounds")));
        JsonElement threads = value(json, "workerThreads");
        if (threads != null) b.workerThreads(intValue(threads, "workerThreads"));
        JsonElement scale = value(json, "scale");
        if (scale != null) b.imageScale(numberValue(scale, "scale").doubleValue());
        JsonElement format = value(json, "outputFormat");
        if (format != null) b.outputFormat(OutputFormat.fromName(stringValue(format, "outputFormat")));
        JsonElement output = value(json, "output");
        if (output != null) b.outputDirectory(stringValue(output, "output"));
        return b.build();
    }

    private static JsonElement value(JsonObject json, String key) {
        JsonElement e = json.get(key);
        return e == null || e.isJsonNull() ? null : e;
    }

    private static String stringValue(JsonElement e, String key) {
        if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            throw wrongType(key, "a string", e);
        }
        return e.getAsString();
    }

    private static Number numberValue(JsonElement e, String key) {
        if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            throw wrongType(key, "a number", e);
        }
        return e.getAsNumber();
    }

    private static int intValue(JsonElement e, String key) {
        double d = numberValue(e, key).doubleValue();
        if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
            throw wrongType(key, "an integer", e);
        }
        return (int) d;
    }

    private static IllegalArgumentException wrongType(String key, String expected, JsonElement actual) {
        return new IllegalArgumentException("Configuration key '" + key + "' must be " + expected + ", got " + actual);
    }

    /** Maximum number of frames to analyze, or null for all of them. */
    public Integer getNumFramesLimit() { return numFramesLimit; }
    public Set<VisualizationPolicy> getVisualization() { return visualization; }
    public boolean isProgressEnabled() { return progressEnabled; }
    public RadiusBounds getRadiusBounds() { return radiusBounds; }
    public int getWorkerThreads() { return workerThreads; }
    public double getImageScale() { return imageScale; }
    public OutputFormat getOutputFormat() { return outputFormat; }
    public String getOutputDirectory() { return outputDirectory; }

    public boolean visualizes(VisualizationPolicy policy) {
        return visualization.contains(policy);
    }

    /**
     * True if any per-frame or mean rendering was requested.
     */
    public boolean needsRenderer() {
        return !visualization.contains(VisualizationPolicy.NONE);
    }

    public static class Builder {
        private Integer numFramesLimit = null;
        private EnumSet<VisualizationPolicy> visualization = EnumSet.noneOf(VisualizationPolicy.class);
        private boolean progressEnabled = true;
        private RadiusBounds radiusBounds = RadiusBounds.INSCRIBED;
        private int workerThreads = 1;
        private double imageScale = 1.0;
        private OutputFormat outputFormat = OutputFormat.JSON;
        private String outputDirectory = null;

        public Builder numFramesLimit(Integer limit) {
            if (limit != null && limit < 0) {
                throw new IllegalArgumentException("Frame limit must not be negative: " + limit);
            }
            this.numFramesLimit = limit;
            return this;
        }

        public Builder visualize(VisualizationPolicy policy) {
            if (policy == VisualizationPolicy.NONE) {
                visualization.clear();
            } else {
                visualization.add(policy);
            }
            return this;
        }

        public Builder progressEnabled(boolean enabled) {
            this.progressEnabled = enabled;
            return this;
        }

        public Builder radiusBounds(RadiusBounds bounds) {
            if (bounds == null) {
                throw new IllegalArgumentException("Radius bounds must be set");
            }
            this.radiusBounds = bounds;
            return this;
        }

        public Builder workerThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("Worker threads must be at least 1: " + threads);
            }
            this.workerThreads = threads;
            return this;
        }

        public Builder imageScale(double scale) {
            if (!(scale > 0) || Double.isInfinite(scale)) {
                throw new IllegalArgumentException("Image scale must be positive: " + scale);
            }
            this.imageScale = scale;
            return this;
        }

        public Builder outputFormat(OutputFormat format) {
            if (format == null) {
                throw new IllegalArgumentException("Output format must be set");
            }
            this.outputFormat = format;
            return this;
        }

        public Builder outputDirectory(String dir) {
            this.outputDirectory = dir;
            return this;
        }

        public AnalysisConfig build() {
            return new AnalysisConfig(this);
        }
    }
}
