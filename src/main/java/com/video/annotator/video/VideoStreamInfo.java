package com.video.annotator.video;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 视频流信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoStreamInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final long UNKNOWN_DURATION = -1;

    private int streamIndex;

    private TimeBase timeBase;

    /**
     * 时长（tick），未知时为 -1
     */
    private long durationTicks;

    /**
     * 帧率，未知时为 0
     */
    private double frameRate;

    private int width;
    private int height;

    public boolean hasDuration() {
        return durationTicks > 0;
    }
}
