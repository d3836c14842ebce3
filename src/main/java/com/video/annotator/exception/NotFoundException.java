package com.video.annotator.exception;

/**
 * 视频、帧或分类不存在
 */
public class NotFoundException extends AnnotatorException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
