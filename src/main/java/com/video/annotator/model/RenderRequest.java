package com.video.annotator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 渲染请求：原始帧字节 + 滤镜栈 + 标注 + 放大倍数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderRequest implements Serializable {

    private static final long serialVersionUID = 1L;

    private byte[] imageBytes;

    @Builder.Default
    private List<FilterSpec> filters = new ArrayList<>();

    @Builder.Default
    private List<AnnotationSpec> annotations = new ArrayList<>();

    @Builder.Default
    private int scale = Frame.DEFAULT_SCALE;
}
