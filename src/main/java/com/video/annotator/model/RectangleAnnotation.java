package com.video.annotator.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 矩形框（仅描边）标注
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RectangleAnnotation extends ShapeAnnotation {

    private static final long serialVersionUID = 1L;

    public static final String TYPE = "rectangle";

    public static RectangleAnnotation of(FramePoint start, FramePoint end, String color, double thickness) {
        RectangleAnnotation annotation = new RectangleAnnotation();
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
    public RectangleAnnotation copy() {
        return copyInto(new RectangleAnnotation());
    }
}
