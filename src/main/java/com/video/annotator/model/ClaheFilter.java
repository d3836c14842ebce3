package com.video.annotator.model;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * CLAHE（仅作用于亮度通道）
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ClaheFilter extends FilterSpec {

    private static final long serialVersionUID = 1L;

    public static final String NAME = "clahe";
    public static final String DEFAULT_LABEL = "CLAHE";

    public static final double DEFAULT_CLIP_LIMIT = 2.0;
    public static final int DEFAULT_GRID_SIZE = 8;

    /**
     * 对比度限制 [1, 40]
     */
    private Double clipLimit;

    /**
     * 网格边长 [2, 16]，即 gridSize x gridSize 个分块
     */
    private Integer gridSize;

    public static ClaheFilter of(boolean enabled, double clipLimit, int gridSize) {
        ClaheFilter filter = new ClaheFilter();
        filter.setLabel(DEFAULT_LABEL);
        filter.setEnabled(enabled);
        filter.setClipLimit(clipLimit);
        filter.setGridSize(gridSize);
        return filter;
    }

    @JsonSetter("clipLimit")
    void readClipLimit(JsonNode value) {
        this.clipLimit = lenientNumber("clipLimit", value);
    }

    @JsonSetter("gridSize")
    void readGridSize(JsonNode value) {
        this.gridSize = lenientInteger("gridSize", value);
    }

    public double clipLimitOrDefault() {
        return clipLimit != null ? clipLimit : DEFAULT_CLIP_LIMIT;
    }

    public int gridSizeOrDefault() {
        return gridSize != null ? gridSize : DEFAULT_GRID_SIZE;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ClaheFilter copy() {
        ClaheFilter copy = copyCommonTo(new ClaheFilter());
        copy.setClipLimit(clipLimit);
        copy.setGridSize(gridSize);
        return copy;
    }
}
