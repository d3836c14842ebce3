package com.video.annotator.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 帧捕获请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaptureRequest implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonAlias("video_id")
    private String videoId;

    @JsonAlias("ts")
    private double timestampSeconds;

    @JsonAlias("cat_id")
    private String categoryId;
}
