package com.video.annotator.processor;

import com.video.annotator.model.BrightnessContrastFilter;
import com.video.annotator.model.ClaheFilter;
import com.video.annotator.model.FilterSpec;
import com.video.annotator.model.WhiteBalanceFilter;
import com.video.annotator.util.ImageUtils;
import com.video.annotator.util.TestImages;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterStageTest {

    private final FilterStage stage = new FilterStage();

    @Test
    void brightness_shouldSaturateAt255() {
        Mat input = TestImages.gray(4, 4, 250);
        Mat output = stage.applyFilters(input, Collections.singletonList(BrightnessContrastFilter.of(true, 20, 0)));

        assertArrayEquals(new int[]{255, 255, 255}, TestImages.bgrAt(output, 1, 1));
        // 输入不变
        assertArrayEquals(new int[]{250, 250, 250}, TestImages.bgrAt(input, 1, 1));
    }

    @Test
    void negativeBrightness_shouldClampAtZero() {
        Mat input = TestImages.gray(4, 4, 30);
        Mat output = stage.applyFilters(input, Collections.singletonList(BrightnessContrastFilter.of(true, -100, 0)));

        assertArrayEquals(new int[]{0, 0, 0}, TestImages.bgrAt(output, 0, 0));
    }

    @Test
    void contrast_shouldScaleAroundZero() {
        Mat input = TestImages.gray(4, 4, 100);
        Mat output = stage.applyFilters(input, Collections.singletonList(BrightnessContrastFilter.of(true, 0, 50)));

        assertArrayEquals(new int[]{150, 150, 150}, TestImages.bgrAt(output, 2, 2));
    }

    @Test
    void filters_shouldApplyInListOrder() {
        Mat input = TestImages.gray(4, 4, 100);
        FilterSpec brighten = BrightnessContrastFilter.of(true, 50, 0);
        FilterSpec stretch = BrightnessContrastFilter.of(true, 0, 100);

        Mat brightenFirst = stage.applyFilters(input, Arrays.asList(brighten, stretch));
        Mat stretchFirst = stage.applyFilters(input, Arrays.asList(stretch, brighten));

        // (100 + 50) * 2 饱和为 255；100 * 2 + 50 = 250
        assertEquals(255, TestImages.bgrAt(brightenFirst, 0, 0)[0]);
        assertEquals(250, TestImages.bgrAt(stretchFirst, 0, 0)[0]);
    }

    @Test
    void brightnessAndClahe_shouldNotCommute() {
        Mat input = TestImages.horizontalGradient(64, 64);
        FilterSpec brighten = BrightnessContrastFilter.of(true, 50, 0);
        FilterSpec clahe = ClaheFilter.of(true, 2.0, 8);

        Mat brightenFirst = stage.applyFilters(input, Arrays.asList(brighten, clahe));
        Mat claheFirst = stage.applyFilters(input, Arrays.asList(clahe, brighten));

        Mat diff = new Mat();
        Core.absdiff(brightenFirst, claheFirst, diff);
        assertTrue(Core.sumElems(diff).val[0] > 0, "CLAHE 应作用于上一级输出");
        // 后做亮度 +50 时所有通道至少为 50
        assertTrue(Core.minMaxLoc(claheFirst.reshape(1)).minVal >= 50);
    }

    @Test
    void disabledFilters_shouldBeSkippedEvenWithOutOfRangeParameters() {
        Mat input = TestImages.solid(4, 4, 10, 20, 30);
        BrightnessContrastFilter bc = BrightnessContrastFilter.of(false, 500, -900);
        ClaheFilter clahe = ClaheFilter.of(false, 999.0, 0);
        List<FilterSpec> filters = Arrays.asList(bc, clahe, WhiteBalanceFilter.of(false));

        Mat output = stage.applyFilters(input, filters);

        assertArrayEquals(new int[]{10, 20, 30}, TestImages.bgrAt(output, 3, 3));
    }

    @Test
    void whiteBalance_shouldReduceColorCast() {
        Mat input = TestImages.solid(16, 16, 100, 100, 170);
        Mat output = stage.applyFilters(input, Collections.singletonList(WhiteBalanceFilter.of(true)));

        int[] before = TestImages.bgrAt(input, 8, 8);
        int[] after = TestImages.bgrAt(output, 8, 8);
        assertTrue(after[2] - after[0] < before[2] - before[0],
                "白平衡后红蓝差应减小: " + Arrays.toString(after));
    }

    @Test
    void whiteBalance_onNeutralGray_shouldStayNeutral() {
        Mat input = TestImages.gray(8, 8, 128);
        Mat output = stage.applyFilters(input, Collections.singletonList(WhiteBalanceFilter.of(true)));

        int[] pixel = TestImages.bgrAt(output, 4, 4);
        assertTrue(Math.abs(pixel[0] - pixel[2]) <= 2, Arrays.toString(pixel));
        assertTrue(Math.abs(pixel[1] - 128) <= 2, Arrays.toString(pixel));
    }

    @Test
    void clahe_shouldKeepSizeAndType() {
        Mat input = TestImages.solid(32, 24, 40, 80, 120);
        Mat output = stage.applyFilters(input, Collections.singletonList(ClaheFilter.of(true, 2.0, 8)));

        assertEquals(input.size(), output.size());
        assertEquals(input.type(), output.type());
    }

    @Test
    void applyFilters_onBytes_withUndecodableInput_shouldReturnNull() {
        assertNull(stage.applyFilters(new byte[]{9, 9, 9}, Collections.emptyList()));
    }

    @Test
    void applyFilters_onBytes_shouldReturnPng() {
        byte[] png = TestImages.grayPng(4, 4, 100);
        byte[] output = stage.applyFilters(png, Collections.singletonList(BrightnessContrastFilter.of(true, 10, 0)));

        Mat decoded = ImageUtils.decodeImage(output);
        assertNotNull(decoded);
        assertArrayEquals(new int[]{110, 110, 110}, TestImages.bgrAt(decoded, 0, 0));
    }
}
