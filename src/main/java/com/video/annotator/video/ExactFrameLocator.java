package com.video.annotator.video;

import com.video.annotator.config.AnnotatorConfig;
import com.video.annotator.exception.AnnotatorException;
import com.video.annotator.exception.FrameCaptureTimeoutException;
import com.video.annotator.exception.SeekOutOfRangeException;
import com.video.annotator.util.ImageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * 精确帧定位器
 * 流程：
 * 1. 将目标时间（秒）换算为视频流时间基的 tick
 * 2. 向后定位到不晚于目标 tick 的关键帧
 * 3. 从关键帧开始顺序解码，丢弃 pts 早于目标的帧
 * 4. 返回第一个 pts ≥ 目标 tick 的帧
 * <p>
 * 压缩视频只能从关键帧开始解码，"精确"依赖第3步的逐帧比较而不是定位本身。
 * 没有 pts 的帧跳过。
 * <p>
 * 超时和最大解码帧数在每解码一帧后检查，单次阻塞的 open/seek/next 调用不会被打断。
 */
public class ExactFrameLocator {

    private static final Logger LOG = LoggerFactory.getLogger(ExactFrameLocator.class);

    private final VideoDecoderFactory decoderFactory;
    private final long timeoutMs;
    private final long maxDecodedFrames;

    public ExactFrameLocator(VideoDecoderFactory decoderFactory, AnnotatorConfig config) {
        this(decoderFactory, config.getCaptureTimeoutMs(), config.getCaptureMaxDecodedFrames());
    }

    public ExactFrameLocator(VideoDecoderFactory decoderFactory, long timeoutMs, long maxDecodedFrames) {
        this.decoderFactory = decoderFactory;
        this.timeoutMs = timeoutMs;
        this.maxDecodedFrames = maxDecodedFrames;
    }

    /**
     * 定位 t 秒时可见的帧，调用方负责关闭返回的帧
     */
    public DecodedFrame locate(Path video, double t) {
        if (Double.isNaN(t) || Double.isInfinite(t) || t < 0) {
            throw new SeekOutOfRangeException("Invalid timestamp: " + t);
        }

        VideoDecoder decoder = decoderFactory.create();
        try {
            VideoStreamInfo info = decoder.open(video);
            TimeBase timeBase = info.getTimeBase();
            long target = timeBase.secondsToTicks(t);

            if (info.hasDuration() && target >= info.getDurationTicks()) {
                throw new SeekOutOfRangeException(String.format(
                        "Timestamp %.3fs is beyond video duration %.3fs",
                        t, timeBase.ticksToSeconds(info.getDurationTicks())));
            }

            decoder.seek(target);

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            long decoded = 0;
            DecodedFrame frame;
            while ((frame = decoder.next()) != null) {
                decoded++;
                if (frame.hasPts() && frame.getPts() >= target) {
                    LOG.debug("Located frame pts={} for target tick {} after {} decoded frames",
                            frame.getPts(), target, decoded);
                    return frame;
                }
                frame.close();

                if (decoded >= maxDecodedFrames || System.nanoTime() > deadline) {
                    throw new FrameCaptureTimeoutException(String.format(
                            "Gave up locating %.3fs in %s after %d decoded frames", t, video, decoded));
                }
            }

            throw new SeekOutOfRangeException(String.format(
                    "No frame at or after %.3fs in %s", t, video));
        } finally {
            decoder.close();
        }
    }

    /**
     * 定位帧并写为PNG文件，自动创建父目录
     */
    public void extractTo(Path video, double t, Path outPath) {
        try (DecodedFrame frame = locate(video, t)) {
            Path parent = outPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(outPath, ImageUtils.encodePng(frame.getImage()));
            LOG.info("Frame at {}s extracted from {} to {}", String.format("%.3f", t), video, outPath);
        } catch (IOException e) {
            throw new AnnotatorException("Failed to write frame image: " + outPath, e);
        }
    }
}
