package com.ttennebkram.videofft.source;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Opens a media file as a frame source, picking the decoder by file extension.
 */
public final class FrameSources {

    private static final List<String> IMAGE_EXTENSIONS = Arrays.asList(
        ".png", ".jpg", ".jpeg", ".bmp", ".tif", ".tiff");

    private FrameSources() {
    }

    public static FrameSource open(String path) throws IOException {
        if (isImage(path)) {
            return ImageFrameSource.open(path);
        }
        return VideoCaptureFrameSource.open(path);
    }

    static boolean isImage(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (String ext : IMAGE_EXTENSIONS) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
