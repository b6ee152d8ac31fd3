package com.ttennebkram.videofft.source;

import com.ttennebkram.videofft.model.LuminanceFrame;

import java.util.Iterator;
import java.util.List;

/**
 * Forward-only, finite stream of luminance frames. Frames are pulled one at a time
 * and the stream cannot be restarted.
 */
public interface FrameSource extends AutoCloseable {

    int UNKNOWN_COUNT = -1;

    /**
     * Next frame in decode order, or null once the stream is exhausted.
     */
    LuminanceFrame nextFrame();

    /**
     * Number of frames the stream expects to produce, or {@link #UNKNOWN_COUNT}.
     * Only used for progress reporting.
     */
    default int frameCountHint() {
        return UNKNOWN_COUNT;
    }

    /**
     * Human readable origin of the frames (file path or similar), may be null.
     */
    default String describe() {
        return null;
    }

    @Override
    default void close() {
    }

    static FrameSource of(List<LuminanceFrame> frames) {
        Iterator<LuminanceFrame> it = frames.iterator();
        int count = frames.size();
        return new FrameSource() {
            @Override
            public LuminanceFrame nextFrame() {
                return it.hasNext() ? it.next() : null;
            }

            @Override
            public int frameCountHint() {
                return count;
            }
        };
    }

    static FrameSource of(Iterator<LuminanceFrame> frames) {
        return () -> frames.hasNext() ? frames.next() : null;
    }
}
