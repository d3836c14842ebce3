package com.video.annotator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;

import java.io.Serializable;

/**
 * 矢量标注（按 type 区分：line / rectangle / text）
 * <p>
 * 所有坐标和尺寸都以基准帧（scale=1）像素为单位存储，与帧的 scale
 * 以及查看器的临时缩放无关；渲染时再乘以 scale。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LineAnnotation.class, name = LineAnnotation.TYPE),
        @JsonSubTypes.Type(value = RectangleAnnotation.class, name = RectangleAnnotation.TYPE),
        @JsonSubTypes.Type(value = TextAnnotation.class, name = TextAnnotation.TYPE)
})
public abstract class AnnotationSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 颜色，#rrggbb
     */
    private String color;

    public abstract String getType();

    public abstract AnnotationSpec copy();
}
