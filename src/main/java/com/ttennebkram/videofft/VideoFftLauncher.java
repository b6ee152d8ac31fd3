package com.ttennebkram.videofft;

import com.ttennebkram.videofft.model.SequenceResult;
import com.ttennebkram.videofft.output.AnalysisReport;
import com.ttennebkram.videofft.output.ResultFormatter;
import com.ttennebkram.videofft.processing.AnalysisConfig;
import com.ttennebkram.videofft.processing.ProgressObserver;
import com.ttennebkram.videofft.processing.SequenceAggregator;
import com.ttennebkram.videofft.processing.SpectralAnalysisException;
import com.ttennebkram.videofft.render.SpectrumImageWriter;
import com.ttennebkram.videofft.source.FrameSource;
import com.ttennebkram.videofft.source.FrameSources;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Paths;

/**
 * Command line entry point: analyze a video and print the report on stdout.
 * Diagnostics and the progress bar go to stderr.
 */
public class VideoFftLauncher {

    public static final String VERSION = "1.0.0";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineOptions opts;
        try {
            opts = CommandLineOptions.parse(args);
        } catch (CommandLineOptions.UsageException e) {
            err.print(CommandLineOptions.USAGE);
            err.println("video-fft: error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (opts.isHelp()) {
            out.println("video-fft v" + VERSION);
            out.print(CommandLineOptions.USAGE);
            return EXIT_OK;
        }
        if (opts.isVersion()) {
            out.println("video-fft v" + VERSION);
            return EXIT_OK;
        }

        AnalysisConfig config;
        try {
            AnalysisConfig base = opts.getConfigFile() != null
                ? AnalysisConfig.load(Paths.get(opts.getConfigFile()))
                : AnalysisConfig.defaults();
            config = opts.applyTo(base);
        } catch (IOException | IllegalArgumentException e) {
            err.println("[VideoFft] Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();

        try (FrameSource source = FrameSources.open(opts.getInput())) {
            SpectrumImageWriter renderer = config.needsRenderer()
                ? SpectrumImageWriter.create(config.getOutputDirectory(), opts.getInput(), config.getImageScale())
                : null;
            ProgressObserver progress = config.isProgressEnabled() ? new ConsoleProgressBar(err) : null;

            SequenceAggregator aggregator = new SequenceAggregator(config, progress, renderer);
            SequenceResult result = aggregator.run(source);

            AnalysisReport report = ResultFormatter.format(result, source.describe());
            out.println(config.getOutputFormat().encoder().encode(report));
            return EXIT_OK;
        } catch (SpectralAnalysisException e) {
            err.println("[VideoFft] Analysis failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("[VideoFft] " + e.getMessage());
            return EXIT_FAILURE;
        } catch (UncheckedIOException e) {
            err.println("[VideoFft] " + e.getCause().getMessage());
            return EXIT_FAILURE;
        }
    }
}
