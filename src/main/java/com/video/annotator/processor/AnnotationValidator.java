package com.video.annotator.processor;

import com.video.annotator.exception.ValidationException;
import com.video.annotator.model.AnnotationSpec;
import com.video.annotator.model.FramePoint;
import com.video.annotator.model.ShapeAnnotation;
import com.video.annotator.model.TextAnnotation;
import com.video.annotator.util.ImageUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 标注批量校验：任何一条不合法则整批拒绝，渲染阶段不会出现部分绘制
 */
public class AnnotationValidator {

    public void validate(List<AnnotationSpec> annotations) {
        if (annotations == null) {
            return;
        }
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < annotations.size(); i++) {
            check(i, annotations.get(i), violations);
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private void check(int index, AnnotationSpec annotation, List<String> violations) {
        String prefix = "annotations[" + index + "]";
        if (annotation == null) {
            violations.add(prefix + " is null");
            return;
        }
        if (!ImageUtils.isHexColor(annotation.getColor())) {
            violations.add(prefix + ".color is not a hex color: " + annotation.getColor());
        }

        if (annotation instanceof ShapeAnnotation) {
            ShapeAnnotation shape = (ShapeAnnotation) annotation;
            checkPoint(prefix + ".start", shape.getStart(), violations);
            checkPoint(prefix + ".end", shape.getEnd(), violations);
            if (!(shape.getThickness() >= 1) || Double.isInfinite(shape.getThickness())) {
                violations.add(prefix + ".thickness must be >= 1 but was " + shape.getThickness());
            }
        } else if (annotation instanceof TextAnnotation) {
            TextAnnotation text = (TextAnnotation) annotation;
            checkPoint(prefix + ".pos", text.getPos(), violations);
            if (text.getText() == null || text.getText().isEmpty()) {
                violations.add(prefix + ".text is empty");
            }
            if (!(text.getFontSize() > 0) || Double.isInfinite(text.getFontSize())) {
                violations.add(prefix + ".fontSize must be > 0 but was " + text.getFontSize());
            }
        } else {
            violations.add(prefix + " has unsupported type " + annotation.getType());
        }
    }

    private void checkPoint(String field, FramePoint point, List<String> violations) {
        if (point == null) {
            violations.add(field + " is missing");
        } else if (!Double.isFinite(point.getX()) || !Double.isFinite(point.getY())) {
            violations.add(field + " is not finite");
        }
    }
}
