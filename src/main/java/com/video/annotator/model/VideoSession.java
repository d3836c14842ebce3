package com.video.annotator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 视频会话（上传后创建，生命周期内不可变）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoSession implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;

    /**
     * 服务端保存的视频文件路径
     */
    private String sourcePath;

    /**
     * 用户上传时的文件名
     */
    private String originalName;

    /**
     * 帧率，无法确定时为默认值 30
     */
    private double frameRate;

    /**
     * 文件名去掉扩展名，用于导出文件和帧文件命名
     */
    public String baseName() {
        String name = originalName != null ? originalName : "video";
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
