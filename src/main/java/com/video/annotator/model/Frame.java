package com.video.annotator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 已捕获帧记录
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Frame implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_SCALE = 1;

    private String id;

    /**
     * 所属视频会话ID
     */
    private String videoId;

    /**
     * 源视频时间戳（秒）
     */
    private double timestampSeconds;

    /**
     * 帧图片文件名（相对 frames 目录）
     */
    private String fileName;

    /**
     * 帧图片完整路径（PNG）
     */
    private String imagePath;

    private String categoryId;

    private String note;

    @Builder.Default
    private List<FilterSpec> filters = new ArrayList<>();

    @Builder.Default
    private List<AnnotationSpec> annotations = new ArrayList<>();

    /**
     * 放大倍数 {1, 2, 3}
     */
    @Builder.Default
    private int scale = DEFAULT_SCALE;

    /**
     * 深拷贝
     */
    public Frame copy() {
        return toBuilder()
                .filters(copyFilters(filters))
                .annotations(copyAnnotations(annotations))
                .build();
    }

    public static List<FilterSpec> copyFilters(List<FilterSpec> filters) {
        if (filters == null) {
            return new ArrayList<>();
        }
        return filters.stream().map(FilterSpec::copy).collect(Collectors.toCollection(ArrayList::new));
    }

    public static List<AnnotationSpec> copyAnnotations(List<AnnotationSpec> annotations) {
        if (annotations == null) {
            return new ArrayList<>();
        }
        return annotations.stream().map(AnnotationSpec::copy).collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * 新捕获帧的默认滤镜栈：全部关闭
     */
    public static List<FilterSpec> defaultFilters() {
        List<FilterSpec> filters = new ArrayList<>();
        filters.add(BrightnessContrastFilter.of(false, 0, 0));
        filters.add(ClaheFilter.of(false, ClaheFilter.DEFAULT_CLIP_LIMIT, ClaheFilter.DEFAULT_GRID_SIZE));
        filters.add(WhiteBalanceFilter.of(false));
        return filters;
    }
}
