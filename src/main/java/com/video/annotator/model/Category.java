package com.video.annotator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 帧分类
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Category implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_ID = "default";
    public static final String DEFAULT_NAME = "Não categorizado";
    public static final String DEFAULT_COLOR = "#6b7280";
    public static final String NEW_CATEGORY_COLOR = "#4f46e5";

    private String id;
    private String name;
    private String color;

    public static Category defaultCategory() {
        return new Category(DEFAULT_ID, DEFAULT_NAME, DEFAULT_COLOR);
    }

    @JsonIgnore
    public boolean isDefault() {
        return DEFAULT_NAME.equals(name);
    }
}
