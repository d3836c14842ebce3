package com.video.annotator.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 由两个端点定义的图形标注
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract class ShapeAnnotation extends AnnotationSpec {

    private static final long serialVersionUID = 1L;

    private FramePoint start;
    private FramePoint end;

    /**
     * 线宽（基准帧像素，≥1）
     */
    private double thickness = 1;

    protected <T extends ShapeAnnotation> T copyInto(T copy) {
        copy.setColor(getColor());
        copy.setStart(start != null ? FramePoint.of(start.getX(), start.getY()) : null);
        copy.setEnd(end != null ? FramePoint.of(end.getX(), end.getY()) : null);
        copy.setThickness(thickness);
        return copy;
    }
}
