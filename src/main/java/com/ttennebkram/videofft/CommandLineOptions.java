package com.ttennebkram.videofft;

import com.ttennebkram.videofft.output.OutputFormat;
import com.ttennebkram.videofft.processing.AnalysisConfig;
import com.ttennebkram.videofft.processing.RadiusBounds;
import com.ttennebkram.videofft.processing.VisualizationPolicy;

/**
 * Parsed command line. Flags that were not given stay null so they do not override
 * values from a configuration file.
 */
public class CommandLineOptions {

    public static final String USAGE =
        "usage: video-fft [-h] [-V] [-o OUTPUT] [-n NUM_FRAMES] [-of {json,csv}] [-r] [-a] [-m]\n" +
        "                 [-s SCALE] [-q] [-t THREADS] [--radius-bounds {inscribed,full}]\n" +
        "                 [-c CONFIG] input\n" +
        "\n" +
        "positional arguments:\n" +
        "  input                  Input video file\n" +
        "\n" +
        "options:\n" +
        "  -h, --help             show this help message and exit\n" +
        "  -V, --version          show the version and exit\n" +
        "  -o, --output OUTPUT    Output path for the images (default: same as input video file)\n" +
        "  -n, --num-frames N     Number of frames to calculate (default: all)\n" +
        "  -of, --output-format F Select output format, json or csv (default: json)\n" +
        "  -r, --first-frame      Render image for radial profile of the first frame\n" +
        "  -a, --all-frames       Render image for radial profile of all frames\n" +
        "  -m, --mean             Render image for mean/average radial profile of the entire sequence\n" +
        "  -s, --scale SCALE      Image scaling, adjust to increase/decrease rendered image size (default: 1)\n" +
        "  -q, --quiet            Do not show progress bar\n" +
        "  -t, --threads N        Worker threads for spectrum computation (default: 1)\n" +
        "  --radius-bounds B      Radial profile extent, inscribed or full (default: inscribed)\n" +
        "  -c, --config CONFIG    JSON configuration file; command line flags take precedence\n";

    /**
     * Bad command line; the message is meant for the user.
     */
    public static class UsageException extends Exception {
        public UsageException(String message) {
            super(message);
        }
    }

    String input;
    String output;
    Integer numFrames;
    OutputFormat outputFormat;
    boolean firstFrame;
    boolean allFrames;
    boolean mean;
    Double scale;
    boolean quiet;
    Integer threads;
    RadiusBounds radiusBounds;
    String configFile;
    boolean help;
    boolean version;

    public static CommandLineOptions parse(String[] args) throws UsageException {
        CommandLineOptions opts = new CommandLineOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h":
                case "--help":
                    opts.help = true;
                    break;
                case "-V":
                case "--version":
                    opts.version = true;
                    break;
                case "-o":
                case "--output":
                    opts.output = value(args, ++i, arg);
                    break;
                case "-n":
                case "--num-frames":
                    opts.numFrames = intValue(args, ++i, arg);
                    if (opts.numFrames < 0) {
                        throw new UsageException(arg + " must not be negative");
                    }
                    break;
                case "-of":
                case "--output-format":
                    try {
                        opts.outputFormat = OutputFormat.fromName(value(args, ++i, arg));
                    } catch (IllegalArgumentException e) {
                        throw new UsageException(e.getMessage());
                    }
                    break;
                case "-r":
                case "--first-frame":
                    opts.firstFrame = true;
                    break;
                case "-a":
                case "--all-frames":
                    opts.allFrames = true;
                    break;
                case "-m":
                case "--mean":
                    opts.mean = true;
                    break;
                case "-s":
                case "--scale":
                    String raw = value(args, ++i, arg);
                    try {
                        opts.scale = Double.parseDouble(raw);
                    } catch (NumberFormatException e) {
                        throw new UsageException(arg + " expects a number, got '" + raw + "'");
                    }
                    if (!(opts.scale > 0)) {
                        throw new UsageException(arg + " must be positive");
                    }
                    break;
                case "-q":
                case "--quiet":
                    opts.quiet = true;
                    break;
                case "-t":
                case "--threads":
                    opts.threads = intValue(args, ++i, arg);
                    if (opts.threads < 1) {
                        throw new UsageException(arg + " must be at least 1");
                    }
                    break;
                case "--radius-bounds":
                    try {
                        opts.radiusBounds = RadiusBounds.fromName(value(args, ++i, arg));
                    } catch (IllegalArgumentException e) {
                        throw new UsageException(e.getMessage());
                    }
                    break;
                case "-c":
                case "--config":
                    opts.configFile = value(args, ++i, arg);
                    break;
                default:
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new UsageException("unrecognized argument: " + arg);
                    }
                    if (opts.input != null) {
                        throw new UsageException("unexpected extra argument: " + arg);
                    }
                    opts.input = arg;
            }
        }
        if (opts.input == null && !opts.help && !opts.version) {
            throw new UsageException("the following arguments are required: input");
        }
        return opts;
    }

    private static String value(String[] args, int i, String flag) throws UsageException {
        if (i >= args.length) {
            throw new UsageException(flag + " expects a value");
        }
        return args[i];
    }

    private static int intValue(String[] args, int i, String flag) throws UsageException {
        String raw = value(args, i, flag);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects an integer, got '" + raw + "'");
        }
    }

    /**
     * Overlay the flags that were given on top of {@code base}.
     */
    public AnalysisConfig applyTo(AnalysisConfig base) {
        AnalysisConfig.Builder b = base.toBuilder();
        if (output != null) b.outputDirectory(output);
        if (numFrames != null) b.numFramesLimit(numFrames);
        if (outputFormat != null) b.outputFormat(outputFormat);
        if (firstFrame) b.visualize(VisualizationPolicy.FIRST);
        if (allFrames) b.visualize(VisualizationPolicy.ALL);
        if (mean) b.visualize(VisualizationPolicy.MEAN);
        if (scale != null) b.imageScale(scale);
        if (quiet) b.progressEnabled(false);
        if (threads != null) b.workerThreads(threads);
        if (radiusBounds != null) b.radiusBounds(radiusBounds);
        return b.build();
    }

    public String getInput() { return input; }
    public String getConfigFile() { return configFile; }
    public boolean isHelp() { return help; }
    public boolean isVersion() { return version; }
}
