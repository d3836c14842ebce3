package com.video.annotator.exception;

/**
 * 容器无法打开或没有可解码的视频流
 */
public class StreamUnavailableException extends AnnotatorException {

    private static final long serialVersionUID = 1L;

    public StreamUnavailableException(String message) {
        super(message);
    }

    public StreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
