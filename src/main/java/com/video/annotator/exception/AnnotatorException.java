package com.video.annotator.exception;

/**
 * 视频帧标注异常基类
 */
public class AnnotatorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AnnotatorException(String message) {
        super(message);
    }

    public AnnotatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
