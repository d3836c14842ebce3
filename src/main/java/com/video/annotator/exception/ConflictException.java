package com.video.annotator.exception;

/**
 * 分类名称重复
 */
public class ConflictException extends AnnotatorException {

    private static final long serialVersionUID = 1L;

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
