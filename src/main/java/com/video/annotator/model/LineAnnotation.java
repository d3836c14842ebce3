package com.video.annotator.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 线段标注
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class LineAnnotation extends ShapeAnnotation {

    private static final long serialVersionUID = 1L;

    public static final String TYPE = "line";

    public static LineAnnotation of(FramePoint start, FramePoint end, String color, double thickness) {
        LineAnnotation annotation = new LineAnnotation();
        annotation.setStart(start);
        annotation.setEnd(end);
        annotation.setColor(color);
        annotation.setThickness(thickness);
        return annotation;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public LineAnnotation copy() {
        return copyInto(new LineAnnotation());
    }
}
