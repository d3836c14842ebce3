package com.video.annotator.video;

import java.nio.file.Path;

/**
 * 视频解码协作者：打开容器、定位关键帧、顺序解码、关闭
 */
public interface VideoDecoder extends AutoCloseable {

    /**
     * 打开容器并选择第一个视频流
     *
     * @throws com.video.annotator.exception.StreamUnavailableException 无法打开或没有视频流
     */
    VideoStreamInfo open(Path video);

    /**
     * 定位到不晚于 tick 的最近关键帧，之后的 {@link #next()} 从该关键帧开始解码
     */
    void seek(long tick);

    /**
     * 解码下一帧，流结束时返回 null
     */
    DecodedFrame next();

    /**
     * 释放解码会话，可重复调用
     */
    @Override
    void close();
}
