package com.video.annotator.processor;

import com.video.annotator.model.AnnotationSpec;
import com.video.annotator.model.FramePoint;
import com.video.annotator.model.LineAnnotation;
import com.video.annotator.model.RectangleAnnotation;
import com.video.annotator.model.ShapeAnnotation;
import com.video.annotator.model.TextAnnotation;
import com.video.annotator.util.ImageUtils;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * 标注渲染器
 * <p>
 * 标注按基准帧坐标存储，绘制时所有坐标和尺寸乘以 scale 映射到当前画布，
 * 后面的标注覆盖前面的标注。
 * <p>
 * 取整规则：坐标 round(v * scale)；线宽 w = max(1, round(thickness * scale))，半数向上取整。
 * <p>
 * 线宽即设备像素宽度，不使用 OpenCV 的粗线（以坐标为中心、偶数线宽会多画 1 像素）：
 * <ul>
 * <li>矩形：四条边各为 w 像素宽的实心带，画在起止点围成的框内侧，不超出框</li>
 * <li>水平/垂直线：宽 w 的实心带，覆盖 [c - w/2, c - w/2 + w)，c 为线所在行/列</li>
 * <li>斜线：像素中心到线段距离不超过 w/2 的像素，端点处为圆头</li>
 * </ul>
 * <p>
 * 字号映射（存储的 fontSize 依赖此映射，不可修改）：
 * Hershey Simplex 字体，fontScale = fontSize * scale / 30，
 * 笔画宽度 max(1, round(fontSize * scale / 15))，pos 为基线左端点。
 */
public class AnnotationRenderer {

    /**
     * Hershey Simplex 在 fontScale=1 时约占 30 像素行高
     */
    public static final double HERSHEY_PIXELS_PER_SCALE = 30.0;

    /**
     * 每 15 像素字号对应 1 像素笔画
     */
    public static final double FONT_PIXELS_PER_STROKE = 15.0;

    public static final int FONT_FACE = Imgproc.FONT_HERSHEY_SIMPLEX;

    static {
        ImageUtils.loadOpenCV();
    }

    /**
     * 在画布副本上按顺序绘制全部标注
     */
    public Mat render(Mat canvas, List<AnnotationSpec> annotations, int scale) {
        RescaleStage.validateScale(scale);
        Mat output = canvas.clone();
        if (annotations == null) {
            return output;
        }
        for (AnnotationSpec annotation : annotations) {
            draw(output, annotation, scale);
        }
        return output;
    }

    private void draw(Mat canvas, AnnotationSpec annotation, int scale) {
        Scalar color = ImageUtils.hexToBgr(annotation.getColor());

        if (annotation instanceof ShapeAnnotation) {
            ShapeAnnotation shape = (ShapeAnnotation) annotation;
            Point start = toDevice(shape.getStart(), scale);
            Point end = toDevice(shape.getEnd(), scale);
            int width = strokeWidth(shape.getThickness(), scale);

            if (shape instanceof RectangleAnnotation) {
                drawRectangle(canvas, start, end, width, color);
            } else if (shape instanceof LineAnnotation) {
                drawLine(canvas, start, end, width, color);
            }
        } else if (annotation instanceof TextAnnotation) {
            TextAnnotation text = (TextAnnotation) annotation;
            Imgproc.putText(canvas, text.getText(), toDevice(text.getPos(), scale), FONT_FACE,
                    fontScale(text.getFontSize(), scale), color,
                    textStrokeWidth(text.getFontSize(), scale), Imgproc.LINE_AA);
        }
    }

    /**
     * 四条边画在框内侧，框小于两倍线宽时整体填充
     */
    private void drawRectangle(Mat canvas, Point start, Point end, int width, Scalar color) {
        int minX = (int) Math.min(start.x, end.x);
        int maxX = (int) Math.max(start.x, end.x);
        int minY = (int) Math.min(start.y, end.y);
        int maxY = (int) Math.max(start.y, end.y);

        fillBand(canvas, minX, minY, maxX, Math.min(maxY, minY + width - 1), color);
        fillBand(canvas, minX, Math.max(minY, maxY - width + 1), maxX, maxY, color);
        fillBand(canvas, minX, minY, Math.min(maxX, minX + width - 1), maxY, color);
        fillBand(canvas, Math.max(minX, maxX - width + 1), minY, maxX, maxY, color);
    }

    private void drawLine(Mat canvas, Point start, Point end, int width, Scalar color) {
        int x0 = (int) start.x;
        int y0 = (int) start.y;
        int x1 = (int) end.x;
        int y1 = (int) end.y;
        int offset = width / 2;

        if (y0 == y1) {
            fillBand(canvas, Math.min(x0, x1), y0 - offset, Math.max(x0, x1), y0 - offset + width - 1, color);
        } else if (x0 == x1) {
            fillBand(canvas, x0 - offset, Math.min(y0, y1), x0 - offset + width - 1, Math.max(y0, y1), color);
        } else {
            drawDiagonal(canvas, x0, y0, x1, y1, width / 2.0, color);
        }
    }

    /**
     * 斜线：逐行填充像素中心到线段距离不超过 halfWidth 的像素（每行为连续区间）
     */
    private void drawDiagonal(Mat canvas, int x0, int y0, int x1, int y1, double halfWidth, Scalar color) {
        int reach = (int) Math.ceil(halfWidth);
        int left = Math.max(0, Math.min(x0, x1) - reach);
        int right = Math.min(canvas.cols() - 1, Math.max(x0, x1) + reach);
        int top = Math.max(0, Math.min(y0, y1) - reach);
        int bottom = Math.min(canvas.rows() - 1, Math.max(y0, y1) + reach);

        for (int y = top; y <= bottom; y++) {
            int first = -1;
            int last = -1;
            for (int x = left; x <= right; x++) {
                if (distanceToSegment(x, y, x0, y0, x1, y1) <= halfWidth) {
                    if (first < 0) {
                        first = x;
                    }
                    last = x;
                } else if (first >= 0) {
                    break;
                }
            }
            if (first >= 0) {
                fillBand(canvas, first, y, last, y, color);
            }
        }
    }

    static double distanceToSegment(double px, double py, double x0, double y0, double x1, double y1) {
        double dx = x1 - x0;
        double dy = y1 - y0;
        double t = ((px - x0) * dx + (py - y0) * dy) / (dx * dx + dy * dy);
        t = Math.max(0, Math.min(1, t));
        return Math.hypot(px - (x0 + t * dx), py - (y0 + t * dy));
    }

    /**
     * 填充闭区间 [x0, x1] x [y0, y1]，画布外部分由 OpenCV 裁剪
     */
    private static void fillBand(Mat canvas, int x0, int y0, int x1, int y1, Scalar color) {
        Imgproc.rectangle(canvas, new Point(x0, y0), new Point(x1, y1), color, Imgproc.FILLED, Imgproc.LINE_8);
    }

    static Point toDevice(FramePoint point, int scale) {
        return new Point(Math.round(point.getX() * scale), Math.round(point.getY() * scale));
    }

    public static int strokeWidth(double thickness, int scale) {
        return Math.max(1, (int) Math.round(thickness * scale));
    }

    public static double fontScale(double fontSize, int scale) {
        return fontSize * scale / HERSHEY_PIXELS_PER_SCALE;
    }

    public static int textStrokeWidth(double fontSize, int scale) {
        return Math.max(1, (int) Math.round(fontSize * scale / FONT_PIXELS_PER_STROKE));
    }
}
