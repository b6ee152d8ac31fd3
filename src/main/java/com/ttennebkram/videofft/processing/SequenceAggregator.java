package com.ttennebkram.videofft.processing;

import com.ttennebkram.videofft.model.FrameResult;
import com.ttennebkram.videofft.model.LuminanceFrame;
import com.ttennebkram.videofft.model.MagnitudeSpectrum;
import com.ttennebkram.videofft.model.RadialProfile;
import com.ttennebkram.videofft.model.SequenceResult;
import com.ttennebkram.videofft.source.FrameSource;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives FrameSpectrum and RadialProfiler over a frame stream and aggregates the results.
 *
 * Frames are pulled, indexed, appended, rendered and reported strictly in stream order.
 * With more than one worker thread the spectra are computed concurrently, but results
 * are still consumed in frame order on the calling thread, so the outcome is identical
 * to the sequential run.
 *
 * Any per-frame failure aborts the run; no partial result is returned.
 */
public class SequenceAggregator {

    private final AnalysisConfig config;
    private final FrameSpectrum frameSpectrum;
    private final RadialProfiler radialProfiler;
    private final ProgressObserver progressObserver;
    private final SpectrumRenderer renderer;

    public SequenceAggregator(AnalysisConfig config) {
        this(config, null, null);
    }

    public SequenceAggregator(AnalysisConfig config, ProgressObserver progressObserver, SpectrumRenderer renderer) {
        this(config, new FrameSpectrum(), new RadialProfiler(config.getRadiusBounds()), progressObserver, renderer);
    }

    public SequenceAggregator(AnalysisConfig config, FrameSpectrum frameSpectrum, RadialProfiler radialProfiler,
                              ProgressObserver progressObserver, SpectrumRenderer renderer) {
        this.config = config;
        this.frameSpectrum = frameSpectrum;
        this.radialProfiler = radialProfiler;
        this.progressObserver = config.isProgressEnabled() ? progressObserver : null;
        this.renderer = config.needsRenderer() ? renderer : null;
    }

    /**
     * Analyze frames up to the configured limit.
     */
    public SequenceResult run(FrameSource frames) {
        return run(frames, config.getNumFramesLimit());
    }

    /**
     * Analyze at most {@code limit} frames, or all of them when {@code limit} is null.
     *
     * @throws EmptySequenceException if no frame was consumed
     * @throws InvalidFrameException if a frame is malformed, tagged with its index
     * @throws DegenerateSpectrumException if frames are too small, tagged with the frame index
     */
    public SequenceResult run(FrameSource frames, Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Frame limit must not be negative: " + limit);
        }
        if (limit != null && limit == 0) {
            throw new EmptySequenceException("Frame limit is 0, nothing to analyze");
        }

        RunState state = new RunState(expectedTotal(frames, limit));
        long start = System.currentTimeMillis();
        try {
            if (config.getWorkerThreads() > 1) {
                runParallel(frames, limit, state);
            } else {
                runSequential(frames, limit, state);
            }
        } finally {
            if (progressObserver != null) {
                progressObserver.finished();
            }
        }

        if (state.results.isEmpty()) {
            throw new EmptySequenceException("Frame source produced no frames");
        }

        if (state.meanSpectrum != null) {
            MagnitudeSpectrum mean = state.meanSpectrum.mean();
            RadialProfile meanProfile = radialProfiler.radialProfile(mean);
            renderer.renderMean(mean, meanProfile);
        }

        SequenceResult result = SequenceResult.of(state.results);
        if (config.isProgressEnabled()) {
            System.err.println("[SequenceAggregator] Analyzed " + result.getFrameCount() + " frames in "
                + (System.currentTimeMillis() - start) + " ms, mean high-frequency score "
                + String.format("%.3f", result.getMeanHighFrequencyScore()));
        }
        return result;
    }

    private void runSequential(FrameSource frames, Integer limit, RunState state) {
        int index = 0;
        while (limit == null || index < limit) {
            LuminanceFrame frame = frames.nextFrame();
            if (frame == null) {
                break;
            }
            state.checkDimensions(frame, index);
            accept(analyze(frame, index), state);
            index++;
        }
    }

    private void runParallel(FrameSource frames, Integer limit, RunState state) {
        int threads = config.getWorkerThreads();
        int window = threads * 2;
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "SpectrumWorker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        Deque<Future<FrameAnalysis>> pending = new ArrayDeque<>();

        try {
            int index = 0;
            while (limit == null || index < limit) {
                LuminanceFrame frame = frames.nextFrame();
                if (frame == null) {
                    break;
                }
                try {
                    state.checkDimensions(frame, index);
                } catch (InvalidFrameException e) {
                    // earlier frames fail first, as they would in a sequential run
                    while (!pending.isEmpty()) {
                        accept(await(pending.removeFirst()), state);
                    }
                    throw e;
                }
                final int frameIndex = index;
                pending.addLast(pool.submit(() -> analyze(frame, frameIndex)));
                index++;

                if (pending.size() >= window) {
                    accept(await(pending.removeFirst()), state);
                }
            }
            while (!pending.isEmpty()) {
                accept(await(pending.removeFirst()), state);
            }
        } finally {
            for (Future<FrameAnalysis> f : pending) {
                f.cancel(true);
            }
            pool.shutdownNow();
        }
    }

    private FrameAnalysis await(Future<FrameAnalysis> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Spectrum worker failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for spectrum worker", e);
        }
    }

    /**
     * Spectrum and profile of one frame. Pure, may run on any thread.
     */
    private FrameAnalysis analyze(LuminanceFrame frame, int frameIndex) {
        try {
            MagnitudeSpectrum spectrum = frameSpectrum.compute(frame);
            RadialProfiler.Result profiled = radialProfiler.profile(spectrum);
            FrameResult result = new FrameResult(frameIndex, profiled.profile, profiled.highFrequencyScore);
            return new FrameAnalysis(result, keepsSpectrum(frameIndex) ? spectrum : null);
        } catch (SpectralAnalysisException e) {
            throw e.atFrame(frameIndex);
        }
    }

    private boolean keepsSpectrum(int frameIndex) {
        if (renderer == null) {
            return false;
        }
        return config.visualizes(VisualizationPolicy.ALL)
            || config.visualizes(VisualizationPolicy.MEAN)
            || (config.visualizes(VisualizationPolicy.FIRST) && frameIndex == 0);
    }

    /**
     * Consume one analyzed frame; always called on the run's thread, in frame order.
     */
    private void accept(FrameAnalysis analysis, RunState state) {
        FrameResult result = analysis.result;
        int frameIndex = result.getFrameIndex();
        state.results.add(result);

        if (analysis.spectrum != null) {
            boolean renderThis = config.visualizes(VisualizationPolicy.ALL)
                || (config.visualizes(VisualizationPolicy.FIRST) && frameIndex == 0);
            if (renderThis) {
                renderer.renderFrame(frameIndex, analysis.spectrum, result.getRadialProfile());
            }
            if (config.visualizes(VisualizationPolicy.MEAN)) {
                if (state.meanSpectrum == null) {
                    state.meanSpectrum = new MeanSpectrum(analysis.spectrum.getHeight(), analysis.spectrum.getWidth());
                }
                state.meanSpectrum.add(analysis.spectrum);
            }
        }

        if (progressObserver != null) {
            progressObserver.frameCompleted(frameIndex, state.expectedTotal);
        }
    }

    private static int expectedTotal(FrameSource frames, Integer limit) {
        int hint = frames.frameCountHint();
        if (hint < 0) {
            return ProgressObserver.UNKNOWN_TOTAL;
        }
        return limit != null ? Math.min(hint, limit) : hint;
    }

    private static class FrameAnalysis {
        final FrameResult result;
        final MagnitudeSpectrum spectrum;

        FrameAnalysis(FrameResult result, MagnitudeSpectrum spectrum) {
            this.result = result;
            this.spectrum = spectrum;
        }
    }

    private static class RunState {
        final List<FrameResult> results = new ArrayList<>();
        final int expectedTotal;
        MeanSpectrum meanSpectrum;
        int height = -1;
        int width = -1;

        RunState(int expectedTotal) {
            this.expectedTotal = expectedTotal;
        }

        void checkDimensions(LuminanceFrame frame, int frameIndex) {
            if (height < 0) {
                height = frame.getHeight();
                width = frame.getWidth();
                return;
            }
            if (frame.getHeight() != height || frame.getWidth() != width) {
                throw new InvalidFrameException("Frame is " + frame.getHeight() + "x" + frame.getWidth()
                    + " but the sequence is " + height + "x" + width, frameIndex, null);
            }
        }
    }

    /**
     * Running element-wise sum of log spectra.
     */
    private static class MeanSpectrum {
        private final int height;
        private final int width;
        private final double[] sums;
        private int count;

        MeanSpectrum(int height, int width) {
            this.height = height;
            this.width = width;
            this.sums = new double[height * width];
        }

        void add(MagnitudeSpectrum spectrum) {
            double[] values = spectrum.getValues();
            for (int i = 0; i < sums.length; i++) {
                sums[i] += values[i];
            }
            count++;
        }

        MagnitudeSpectrum mean() {
            double[] mean = new double[sums.length];
            for (int i = 0; i < sums.length; i++) {
                mean[i] = sums[i] / count;
            }
            return new MagnitudeSpectrum(height, width, mean, true);
        }
    }
}
