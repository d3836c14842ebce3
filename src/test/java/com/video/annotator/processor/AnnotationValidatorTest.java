package com.video.annotator.processor;

import com.video.annotator.exception.ValidationException;
import com.video.annotator.model.AnnotationSpec;
import com.video.annotator.model.FramePoint;
import com.video.annotator.model.LineAnnotation;
import com.video.annotator.model.RectangleAnnotation;
import com.video.annotator.model.TextAnnotation;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnnotationValidatorTest {

    private final AnnotationValidator validator = new AnnotationValidator();

    @Test
    void validAnnotations_shouldPass() {
        List<AnnotationSpec> annotations = Arrays.asList(
                LineAnnotation.of(FramePoint.of(0, 0), FramePoint.of(10, 10), "#ff0000", 2),
                RectangleAnnotation.of(FramePoint.of(-5, -5), FramePoint.of(1000, 1000), "#00f", 1),
                TextAnnotation.of(FramePoint.of(3, 4), "ok", "#ffffff", 12));

        assertDoesNotThrow(() -> validator.validate(annotations));
        assertDoesNotThrow(() -> validator.validate(null));
    }

    @Test
    void invalidEntries_shouldBeReportedTogether() {
        List<AnnotationSpec> annotations = Arrays.asList(
                LineAnnotation.of(FramePoint.of(0, 0), FramePoint.of(10, 10), "red", 2),
                RectangleAnnotation.of(FramePoint.of(0, 0), null, "#ff0000", 0.5),
                TextAnnotation.of(FramePoint.of(0, 0), "", "#ffffff", 0));

        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(annotations));

        assertTrue(e.getViolations().size() >= 5, e.getViolations().toString());
        assertTrue(e.getViolations().stream().anyMatch(v -> v.startsWith("annotations[0].color")));
        assertTrue(e.getViolations().stream().anyMatch(v -> v.startsWith("annotations[1].end")));
        assertTrue(e.getViolations().stream().anyMatch(v -> v.startsWith("annotations[2].fontSize")));
    }

    @Test
    void nonFiniteCoordinates_shouldBeRejected() {
        List<AnnotationSpec> annotations = Collections.singletonList(
                LineAnnotation.of(FramePoint.of(Double.NaN, 0), FramePoint.of(1, Double.POSITIVE_INFINITY), "#000000", 1));

        assertThrows(ValidationException.class, () -> validator.validate(annotations));
    }
}
