package com.video.annotator.processor;

import com.video.annotator.model.BrightnessContrastFilter;
import com.video.annotator.model.ClaheFilter;
import com.video.annotator.model.FilterSpec;
import com.video.annotator.model.WhiteBalanceFilter;
import com.video.annotator.util.ImageUtils;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 滤镜阶段
 * 按列表顺序依次处理，每个滤镜的输入是上一个滤镜的输出；enabled=false 的滤镜直接跳过
 */
public class FilterStage {

    private static final Logger LOG = LoggerFactory.getLogger(FilterStage.class);

    /**
     * 白平衡色度修正强度
     */
    private static final double WHITE_BALANCE_GAIN = 1.1;

    /**
     * Lab 8位表示中 a/b 通道的中性值
     */
    private static final double LAB_NEUTRAL = 128.0;

    static {
        ImageUtils.loadOpenCV();
    }

    /**
     * 对字节形式的图像应用滤镜栈，返回PNG字节；无法解码时返回null
     */
    public byte[] applyFilters(byte[] imageBytes, List<FilterSpec> filters) {
        Mat image = ImageUtils.decodeImage(imageBytes);
        if (image == null) {
            LOG.warn("Failed to decode image ({} bytes)", imageBytes != null ? imageBytes.length : 0);
            return null;
        }
        Mat result = null;
        try {
            result = applyFilters(image, filters);
            return ImageUtils.encodePng(result);
        } finally {
            ImageUtils.safeRelease(result);
            ImageUtils.safeRelease(image);
        }
    }

    /**
     * 对BGR图像应用滤镜栈，返回新的Mat，输入不变
     */
    public Mat applyFilters(Mat image, List<FilterSpec> filters) {
        Mat current = image.clone();
        if (filters == null) {
            return current;
        }
        for (FilterSpec filter : filters) {
            if (filter == null || !filter.isEnabled()) {
                continue;
            }
            Mat next = apply(current, filter);
            current.release();
            current = next;
            LOG.debug("Applied filter {}", filter.getName());
        }
        return current;
    }

    private Mat apply(Mat input, FilterSpec filter) {
        if (filter instanceof BrightnessContrastFilter) {
            return brightnessContrast(input, (BrightnessContrastFilter) filter);
        } else if (filter instanceof WhiteBalanceFilter) {
            return whiteBalance(input);
        } else if (filter instanceof ClaheFilter) {
            return clahe(input, (ClaheFilter) filter);
        }
        throw new IllegalArgumentException("Unsupported filter: " + filter.getName());
    }

    /**
     * v' = clamp(alpha * v + beta, 0, 255)，alpha = 1 + contrast/100，beta = brightness
     */
    Mat brightnessContrast(Mat input, BrightnessContrastFilter filter) {
        double alpha = 1.0 + filter.contrastOrDefault() / 100.0;
        double beta = filter.brightnessOrDefault();
        Mat output = new Mat();
        input.convertTo(output, -1, alpha, beta);
        return output;
    }

    /**
     * 灰度世界白平衡（Lab空间，按亮度加权）：
     * a' = a - (avgA - 128) * (L / 255) * 1.1，b 同理
     */
    Mat whiteBalance(Mat input) {
        Mat lab = new Mat();
        List<Mat> channels = new ArrayList<>();
        Mat weight = new Mat();
        Mat chroma = new Mat();
        Mat output = new Mat();
        try {
            Imgproc.cvtColor(input, lab, Imgproc.COLOR_BGR2Lab);
            Core.split(lab, channels);

            channels.get(0).convertTo(weight, CvType.CV_32F, WHITE_BALANCE_GAIN / 255.0);
            for (int c = 1; c <= 2; c++) {
                Mat channel = channels.get(c);
                double shift = Core.mean(channel).val[0] - LAB_NEUTRAL;
                channel.convertTo(chroma, CvType.CV_32F);
                Core.scaleAdd(weight, -shift, chroma, chroma);
                chroma.convertTo(channel, CvType.CV_8U);
            }

            Core.merge(channels, lab);
            Imgproc.cvtColor(lab, output, Imgproc.COLOR_Lab2BGR);
            return output;
        } finally {
            lab.release();
            weight.release();
            chroma.release();
            for (Mat m : channels) {
                m.release();
            }
        }
    }

    /**
     * 仅对 Lab 的 L 通道做 CLAHE
     */
    Mat clahe(Mat input, ClaheFilter filter) {
        int grid = filter.gridSizeOrDefault();
        CLAHE clahe = Imgproc.createCLAHE(filter.clipLimitOrDefault(), new Size(grid, grid));
        Mat lab = new Mat();
        List<Mat> channels = new ArrayList<>();
        Mat lChannel = new Mat();
        Mat output = new Mat();
        try {
            Imgproc.cvtColor(input, lab, Imgproc.COLOR_BGR2Lab);
            Core.split(lab, channels);
            clahe.apply(channels.get(0), lChannel);
            channels.get(0).release();
            channels.set(0, lChannel);
            Core.merge(channels, lab);
            Imgproc.cvtColor(lab, output, Imgproc.COLOR_Lab2BGR);
            return output;
        } finally {
            lab.release();
            for (Mat m : channels) {
                m.release();
            }
        }
    }
}
