package com.video.annotator.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 文字标注，pos 为文字基线左端点
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TextAnnotation extends AnnotationSpec {

    private static final long serialVersionUID = 1L;

    public static final String TYPE = "text";

    private FramePoint pos;
    private String text;

    /**
     * 字号（基准帧像素）
     */
    private double fontSize;

    public static TextAnnotation of(FramePoint pos, String text, String color, double fontSize) {
        TextAnnotation annotation = new TextAnnotation();
        annotation.setPos(pos);
        annotation.setText(text);
        annotation.setColor(color);
        annotation.setFontSize(fontSize);
        return annotation;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public TextAnnotation copy() {
        TextAnnotation copy = new TextAnnotation();
        copy.setColor(getColor());
        copy.setPos(pos != null ? FramePoint.of(pos.getX(), pos.getY()) : null);
        copy.setText(text);
        copy.setFontSize(fontSize);
        return copy;
    }
}
