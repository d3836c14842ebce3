package com.video.annotator.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 基准帧坐标系（scale=1）下的点，JSON 形式为 [x, y]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x", "y"})
public class FramePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private double x;
    private double y;

    public static FramePoint of(double x, double y) {
        return new FramePoint(x, y);
    }
}
