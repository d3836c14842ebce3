package com.video.annotator.video;

import com.video.annotator.util.ImageUtils;
import lombok.Getter;
import org.opencv.core.Mat;

/**
 * 解码后的单帧：pts（tick）+ BGR像素
 */
@Getter
public class DecodedFrame implements AutoCloseable {

    public static final long NO_PTS = Long.MIN_VALUE;

    private final long pts;
    private final Mat image;

    public DecodedFrame(long pts, Mat image) {
        this.pts = pts;
        this.image = image;
    }

    public boolean hasPts() {
        return pts != NO_PTS;
    }

    @Override
    public void close() {
        ImageUtils.safeRelease(image);
    }
}
