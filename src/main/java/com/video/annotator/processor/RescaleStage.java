package com.video.annotator.processor;

import com.video.annotator.exception.ValidationException;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * 整数倍放大（Lanczos），必须在滤镜之后、标注之前执行
 */
public class RescaleStage {

    public static final int MIN_SCALE = 1;
    public static final int MAX_SCALE = 3;

    public static void validateScale(int scale) {
        if (scale < MIN_SCALE || scale > MAX_SCALE) {
            throw new ValidationException("scale must be one of 1, 2, 3 but was " + scale);
        }
    }

    /**
     * scale=1 时返回副本，不做重采样
     */
    public Mat rescale(Mat image, int scale) {
        validateScale(scale);
        if (scale == 1) {
            return image.clone();
        }
        Mat output = new Mat();
        Imgproc.resize(image, output, new Size(image.cols() * scale, image.rows() * scale),
                0, 0, Imgproc.INTER_LANCZOS4);
        return output;
    }
}
