package com.video.annotator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * 图库导出/导入条目
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GalleryEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("ts")
    private Double timestampSeconds;

    @JsonProperty("cat_name")
    private String categoryName;

    private String note;

    private List<FilterSpec> filters;

    private List<AnnotationSpec> annotations;

    private Integer scale;
}
