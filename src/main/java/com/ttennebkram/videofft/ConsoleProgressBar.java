package com.ttennebkram.videofft;

import com.ttennebkram.videofft.processing.ProgressObserver;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Single-line text progress bar, redrawn in place with carriage returns.
 */
public class ConsoleProgressBar implements ProgressObserver {

    private static final int BAR_WIDTH = 30;

    private final PrintStream out;
    private final long startTime = System.currentTimeMillis();
    private boolean drawn = false;

    public ConsoleProgressBar(PrintStream out) {
        this.out = out;
    }

    @Override
    public void frameCompleted(int frameIndex, int total) {
        out.print('\r');
        out.print(render(frameIndex + 1, total, System.currentTimeMillis() - startTime));
        out.flush();
        drawn = true;
    }

    @Override
    public void finished() {
        if (drawn) {
            out.println();
            out.flush();
        }
    }

    static String render(int done, int total, long elapsedMs) {
        double seconds = elapsedMs / 1000.0;
        double rate = seconds > 0 ? done / seconds : 0;
        if (total <= 0) {
            return String.format(Locale.ROOT, "%d frames [%.1fs, %.2f frames/s]", done, seconds, rate);
        }
        int shown = Math.min(done, total);
        int filled = (int) ((long) shown * BAR_WIDTH / total);
        StringBuilder bar = new StringBuilder(BAR_WIDTH);
        for (int i = 0; i < BAR_WIDTH; i++) {
            bar.append(i < filled ? '#' : ' ');
        }
        int percent = (int) ((long) shown * 100 / total);
        return String.format(Locale.ROOT, "%3d%%|%s| %d/%d [%.1fs, %.2f frames/s]", percent, bar, shown, total, seconds, rate);
    }
}
