package com.video.annotator.exception;

/**
 * 图像字节无法解码
 */
public class DecodeFailureException extends AnnotatorException {

    private static final long serialVersionUID = 1L;

    public DecodeFailureException(String message) {
        super(message);
    }

    public DecodeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
