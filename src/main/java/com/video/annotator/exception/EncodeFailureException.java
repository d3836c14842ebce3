package com.video.annotator.exception;

/**
 * PNG编码失败
 */
public class EncodeFailureException extends AnnotatorException {

    private static final long serialVersionUID = 1L;

    public EncodeFailureException(String message) {
        super(message);
    }

    public EncodeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
