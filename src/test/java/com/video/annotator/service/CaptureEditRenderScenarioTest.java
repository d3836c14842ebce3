package com.video.annotator.service;

import com.video.annotator.config.AnnotatorConfig;
import com.video.annotator.model.BrightnessContrastFilter;
import com.video.annotator.model.CaptureRequest;
import com.video.annotator.model.FilterSpec;
import com.video.annotator.model.Frame;
import com.video.annotator.model.FramePoint;
import com.video.annotator.model.RectangleAnnotation;
import com.video.annotator.model.VideoSession;
import com.video.annotator.util.ImageUtils;
import com.video.annotator.util.TestImages;
import com.video.annotator.util.TestVideos;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 捕获 -> 调亮度 -> 加矩形 -> 放大，全流程走真实 FFmpeg 解码和合成管线
 */
class CaptureEditRenderScenarioTest {

    private static final int[] RED = {0, 0, 255};

    @TempDir
    Path tempDir;

    @Test
    void captureEditAndRescale_shouldRenderExpectedPixels() throws Exception {
        // Given
        AnnotatorConfig config = AnnotatorConfig.forDataDir(tempDir);
        FrameAnnotatorService service = FrameAnnotatorService.create(config);
        Path clip = TestVideos.recordCountingClip(tempDir.resolve("counting.mkv"));
        VideoSession session = service.registerVideo(clip, "counting.mkv");
        assertEquals(TestVideos.FPS, session.getFrameRate(), 0.01);

        // When: 捕获 2.5s
        Frame frame = service.captureFrame(new CaptureRequest(session.getId(), 2.5, null));

        // Then
        assertEquals(2.5, frame.getTimestampSeconds(), 0.0);
        assertEquals(1, frame.getScale());
        assertEquals(3, frame.getFilters().size());
        assertTrue(frame.getFilters().stream().noneMatch(FilterSpec::isEnabled));
        assertTrue(frame.getAnnotations().isEmpty());
        Mat source = ImageUtils.decodeImage(Files.readAllBytes(Paths.get(frame.getImagePath())));
        assertEquals(TestVideos.WIDTH, source.cols());
        assertEquals(TestVideos.HEIGHT, source.rows());

        // When: 启用亮度 +50
        List<FilterSpec> filters = Frame.defaultFilters();
        filters.set(0, BrightnessContrastFilter.of(true, 50, 0));
        service.updateFilters(frame.getId(), filters);
        Mat brightened = ImageUtils.decodeImage(service.renderFrame(frame.getId()));

        // Then: 每个通道 = clamp(src + 50)
        assertEquals(source.size(), brightened.size());
        for (int y = 0; y < source.rows(); y++) {
            for (int x = 0; x < source.cols(); x++) {
                int[] src = TestImages.bgrAt(source, x, y);
                int[] out = TestImages.bgrAt(brightened, x, y);
                for (int c = 0; c < 3; c++) {
                    assertEquals(Math.min(255, src[c] + 50), out[c], "pixel (" + x + "," + y + ")");
                }
            }
        }

        // When: 加 2px 红色矩形，scale 仍为 1
        service.addAnnotation(frame.getId(),
                RectangleAnnotation.of(FramePoint.of(0, 0), FramePoint.of(10, 10), "#ff0000", 2));
        Mat annotated = ImageUtils.decodeImage(service.renderFrame(frame.getId()));

        // Then: 左边 x=0..1，右边 x=9..10，框外无红色
        assertEquals("RR.......RR.", redRow(annotated, 5, 12));
        assertEquals("RR.......RR.", redColumn(annotated, 5, 12));

        // When: scale 改为 2
        service.updateScale(frame.getId(), 2);
        Mat scaled = ImageUtils.decodeImage(service.renderFrame(frame.getId()));

        // Then: 画布翻倍，矩形覆盖 [0,0]-[20,20]，线宽 4
        assertEquals(TestVideos.WIDTH * 2, scaled.cols());
        assertEquals(TestVideos.HEIGHT * 2, scaled.rows());
        assertEquals("RRRR.............RRRR..", redRow(scaled, 10, 23));
        assertEquals("RRRR.............RRRR..", redColumn(scaled, 10, 23));
    }

    private static String redRow(Mat image, int y, int width) {
        StringBuilder row = new StringBuilder();
        for (int x = 0; x < width; x++) {
            row.append(Arrays.equals(RED, TestImages.bgrAt(image, x, y)) ? 'R' : '.');
        }
        return row.toString();
    }

    private static String redColumn(Mat image, int x, int height) {
        StringBuilder column = new StringBuilder();
        for (int y = 0; y < height; y++) {
            column.append(Arrays.equals(RED, TestImages.bgrAt(image, x, y)) ? 'R' : '.');
        }
        return column.toString();
    }
}
