package com.video.annotator.util;

import com.video.annotator.exception.EncodeFailureException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.regex.Pattern;

/**
 * 图像处理工具类
 */
public final class ImageUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ImageUtils.class);

    private static final Pattern HEX_COLOR = Pattern.compile("^#?([0-9a-fA-F]{6}|[0-9a-fA-F]{3})$");

    /**
     * PNG 压缩级别固定，保证相同输入得到相同字节
     */
    private static final int PNG_COMPRESSION = 3;

    private static volatile boolean loaded;

    static {
        loadOpenCV();
    }

    private ImageUtils() {
    }

    /**
     * 加载OpenCV本地库
     */
    public static void loadOpenCV() {
        if (loaded) {
            return;
        }
        synchronized (ImageUtils.class) {
            if (!loaded) {
                nu.pattern.OpenCV.loadLocally();
                loaded = true;
                LOG.info("OpenCV loaded successfully");
            }
        }
    }

    /**
     * 解码图像字节数组为BGR Mat，无法解码时返回null
     */
    public static Mat decodeImage(byte[] imageData) {
        if (imageData == null || imageData.length == 0) {
            return null;
        }
        MatOfByte matOfByte = new MatOfByte(imageData);
        try {
            Mat mat = Imgcodecs.imdecode(matOfByte, Imgcodecs.IMREAD_COLOR);
            if (mat == null || mat.empty()) {
                safeRelease(mat);
                return null;
            }
            return mat;
        } finally {
            matOfByte.release();
        }
    }

    /**
     * 无损编码为PNG字节
     */
    public static byte[] encodePng(Mat image) {
        if (image == null || image.empty()) {
            throw new EncodeFailureException("Cannot encode an empty image");
        }
        MatOfByte buffer = new MatOfByte();
        MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_PNG_COMPRESSION, PNG_COMPRESSION);
        try {
            if (!Imgcodecs.imencode(".png", image, buffer, params)) {
                throw new EncodeFailureException("OpenCV refused to encode image as PNG");
            }
            return buffer.toArray();
        } catch (EncodeFailureException e) {
            throw e;
        } catch (Exception e) {
            LOG.error("Error encoding image {}x{}", image.cols(), image.rows(), e);
            throw new EncodeFailureException("PNG encoding failed", e);
        } finally {
            buffer.release();
            params.release();
        }
    }

    /**
     * 将按行存储（可能带行填充）的BGR24像素复制为Mat
     *
     * @param stride 每行字节数
     */
    public static Mat bgrToMat(ByteBuffer pixels, int width, int height, int stride) {
        Mat mat = new Mat(height, width, CvType.CV_8UC3);
        byte[] row = new byte[width * 3];
        ByteBuffer source = pixels.duplicate();
        for (int y = 0; y < height; y++) {
            source.position(y * stride);
            source.get(row, 0, row.length);
            mat.put(y, 0, row);
        }
        return mat;
    }

    /**
     * 判断是否为合法的 #rrggbb / #rgb 颜色
     */
    public static boolean isHexColor(String color) {
        return color != null && HEX_COLOR.matcher(color.trim()).matches();
    }

    /**
     * #rrggbb 转为OpenCV的BGR颜色
     */
    public static Scalar hexToBgr(String color) {
        if (!isHexColor(color)) {
            throw new IllegalArgumentException("Invalid color: " + color);
        }
        String hex = color.trim();
        if (hex.startsWith("#")) {
            hex = hex.substring(1);
        }
        if (hex.length() == 3) {
            hex = new StringBuilder()
                    .append(hex.charAt(0)).append(hex.charAt(0))
                    .append(hex.charAt(1)).append(hex.charAt(1))
                    .append(hex.charAt(2)).append(hex.charAt(2))
                    .toString();
        }
        int r = Integer.parseInt(hex.substring(0, 2), 16);
        int g = Integer.parseInt(hex.substring(2, 4), 16);
        int b = Integer.parseInt(hex.substring(4, 6), 16);
        return new Scalar(b, g, r);
    }

    /**
     * 安全释放Mat
     */
    public static void safeRelease(Mat mat) {
        if (mat != null) {
            try {
                mat.release();
            } catch (Exception e) {
                LOG.error("Error releasing Mat", e);
            }
        }
    }
}
