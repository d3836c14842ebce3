package com.video.annotator.exception;

/**
 * 默认分类不允许修改或删除
 */
public class ForbiddenOperationException extends AnnotatorException {

    private static final long serialVersionUID = 1L;

    public ForbiddenOperationException(String message) {
        super(message);
    }

    public ForbiddenOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
