package com.ttennebkram.videofft.processing;

/**
 * Notified after each frame has been processed, in frame order.
 */
@FunctionalInterface
public interface ProgressObserver {

    int UNKNOWN_TOTAL = -1;

    /**
     * @param frameIndex index of the frame just completed
     * @param total expected number of frames, or {@link #UNKNOWN_TOTAL}
     */
    void frameCompleted(int frameIndex, int total);

    /**
     * Called once when the run ends, successfully or not.
     */
    default void finished() {
    }
}
