package com.ttennebkram.videofft.output;

/**
 * Supported report encodings.
 */
public enum OutputFormat {
    JSON {
        @Override
        public ReportEncoder encoder() {
            return new JsonReportEncoder();
        }
    },
    CSV {
        @Override
        public ReportEncoder encoder() {
            return new CsvReportEncoder();
        }
    };

    public abstract ReportEncoder encoder();

    public static OutputFormat fromName(String name) {
        for (OutputFormat f : values()) {
            if (f.name().equalsIgnoreCase(name)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Wrong output format '" + name + "', must be 'json' or 'csv'");
    }
}
