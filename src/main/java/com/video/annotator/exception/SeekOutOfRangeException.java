package com.video.annotator.exception;

/**
 * 请求的时间戳超出视频范围
 */
public class SeekOutOfRangeException extends AnnotatorException {

    private static final long serialVersionUID = 1L;

    public SeekOutOfRangeException(String message) {
        super(message);
    }

    public SeekOutOfRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
