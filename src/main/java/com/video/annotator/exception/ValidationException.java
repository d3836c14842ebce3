package com.video.annotator.exception;

import java.util.Collections;
import java.util.List;

/**
 * 输入校验失败，整批拒绝
 */
public class ValidationException extends AnnotatorException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public ValidationException(String message) {
        super(message);
        this.violations = Collections.singletonList(message);
    }

    public ValidationException(List<String> violations) {
        super("Validation failed: " + String.join("; ", violations));
        this.violations = Collections.unmodifiableList(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
