package com.video.annotator.processor;

import com.video.annotator.exception.ValidationException;
import com.video.annotator.util.TestImages;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

class RescaleStageTest {

    private final RescaleStage stage = new RescaleStage();

    @Test
    void scaleOne_shouldReturnEqualCopy() {
        Mat input = TestImages.solid(10, 8, 1, 2, 3);
        Mat output = stage.rescale(input, 1);

        assertNotSame(input, output);
        assertEquals(10, output.cols());
        assertEquals(8, output.rows());
        assertArrayEquals(new int[]{1, 2, 3}, TestImages.bgrAt(output, 9, 7));
    }

    @Test
    void scaleTwoAndThree_shouldMultiplyDimensions() {
        Mat input = TestImages.gray(10, 8, 77);

        Mat doubled = stage.rescale(input, 2);
        Mat tripled = stage.rescale(input, 3);

        assertEquals(20, doubled.cols());
        assertEquals(16, doubled.rows());
        assertEquals(30, tripled.cols());
        assertEquals(24, tripled.rows());
        // 均匀图像放大后像素不变
        assertArrayEquals(new int[]{77, 77, 77}, TestImages.bgrAt(tripled, 15, 12));
    }

    @Test
    void unsupportedScale_shouldBeRejected() {
        Mat input = TestImages.gray(4, 4, 0);
        assertThrows(ValidationException.class, () -> stage.rescale(input, 0));
        assertThrows(ValidationException.class, () -> stage.rescale(input, 4));
    }
}
