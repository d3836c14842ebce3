package com.video.annotator.store;

import com.video.annotator.exception.NotFoundException;
import com.video.annotator.model.VideoSession;
import com.video.annotator.video.VideoDecoder;
import com.video.annotator.video.VideoDecoderFactory;
import com.video.annotator.video.VideoStreamInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

/**
 * 视频会话登记：同一时间只有一个活动会话，新视频替换旧会话
 */
public class VideoSessionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(VideoSessionRegistry.class);

    private final VideoDecoderFactory decoderFactory;
    private final double defaultFps;

    private VideoSession active;

    public VideoSessionRegistry(VideoDecoderFactory decoderFactory, double defaultFps) {
        this.decoderFactory = decoderFactory;
        this.defaultFps = defaultFps;
    }

    /**
     * 登记新视频并设为活动会话，返回新会话
     */
    public synchronized VideoSession register(Path videoFile, String originalName) {
        VideoSession session = VideoSession.builder()
                .id(UUID.randomUUID().toString().replace("-", ""))
                .sourcePath(videoFile.toString())
                .originalName(originalName)
                .frameRate(probeFrameRate(videoFile))
                .build();
        if (active != null) {
            LOG.info("Video session {} replaced by {}", active.getId(), session.getId());
        }
        active = session;
        LOG.info("Video registered: id={}, file={}, fps={}", session.getId(), videoFile, session.getFrameRate());
        return session;
    }

    public synchronized Optional<VideoSession> active() {
        return Optional.ofNullable(active);
    }

    public synchronized VideoSession get(String videoId) {
        if (active == null || !active.getId().equals(videoId)) {
            throw new NotFoundException("Video not found: " + videoId);
        }
        return active;
    }

    /**
     * 读取视频帧率，失败时使用默认帧率
     */
    double probeFrameRate(Path videoFile) {
        try (VideoDecoder decoder = decoderFactory.create()) {
            VideoStreamInfo info = decoder.open(videoFile);
            if (info.getFrameRate() > 0) {
                return info.getFrameRate();
            }
        } catch (RuntimeException e) {
            LOG.error("Could not determine FPS for {}", videoFile, e);
        }
        return defaultFps;
    }
}
