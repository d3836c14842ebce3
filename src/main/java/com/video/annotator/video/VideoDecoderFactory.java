package com.video.annotator.video;

/**
 * 每次捕获创建独立的解码会话
 */
@FunctionalInterface
public interface VideoDecoderFactory {

    VideoDecoder create();
}
