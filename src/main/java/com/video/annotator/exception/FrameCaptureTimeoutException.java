package com.video.annotator.exception;

/**
 * 精确帧定位超过解码期限
 */
public class FrameCaptureTimeoutException extends AnnotatorException {

    private static final long serialVersionUID = 1L;

    public FrameCaptureTimeoutException(String message) {
        super(message);
    }

    public FrameCaptureTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
