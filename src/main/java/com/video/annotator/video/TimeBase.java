package com.video.annotator.video;

import lombok.Value;

import java.io.Serializable;

/**
 * 视频流时间基（num/den 秒为一个tick）
 */
@Value
public class TimeBase implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final TimeBase MICROSECONDS = new TimeBase(1, 1_000_000);

    long num;
    long den;

    public TimeBase(long num, long den) {
        if (num <= 0 || den <= 0) {
            throw new IllegalArgumentException("Invalid time base " + num + "/" + den);
        }
        this.num = num;
        this.den = den;
    }

    /**
     * 秒 -> tick，向下取整
     */
    public long secondsToTicks(double seconds) {
        return (long) Math.floor(seconds * den / num);
    }

    public double ticksToSeconds(long ticks) {
        return (double) ticks * num / den;
    }

    /**
     * 微秒 -> tick，四舍五入（FFmpeg 的微秒时间戳由 tick 截断得到，误差小于1微秒）
     */
    public long microsToTicks(long micros) {
        return Math.round((double) micros * den / (num * 1_000_000.0));
    }

    public long ticksToMicros(long ticks) {
        return Math.round((double) ticks * num * 1_000_000.0 / den);
    }
}
