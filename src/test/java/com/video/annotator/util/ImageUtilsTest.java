package com.video.annotator.util;

import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

class ImageUtilsTest {

    @Test
    void hexToBgr_shouldSwapChannelOrder() {
        Scalar color = ImageUtils.hexToBgr("#ff8000");
        assertEquals(0, color.val[0], 0.0);
        assertEquals(128, color.val[1], 0.0);
        assertEquals(255, color.val[2], 0.0);
    }

    @Test
    void hexToBgr_shouldExpandShortForm() {
        Scalar color = ImageUtils.hexToBgr("#0f0");
        assertEquals(0, color.val[0], 0.0);
        assertEquals(255, color.val[1], 0.0);
        assertEquals(0, color.val[2], 0.0);
    }

    @Test
    void isHexColor_shouldRejectNamesAndBadLengths() {
        assertTrue(ImageUtils.isHexColor("#6b7280"));
        assertFalse(ImageUtils.isHexColor("red"));
        assertFalse(ImageUtils.isHexColor("#12345"));
        assertFalse(ImageUtils.isHexColor(null));
    }

    @Test
    void decodeImage_withGarbage_shouldReturnNull() {
        assertNull(ImageUtils.decodeImage(new byte[]{1, 2, 3, 4}));
        assertNull(ImageUtils.decodeImage(new byte[0]));
    }

    @Test
    void encodePng_shouldBeLosslessAndDeterministic() {
        Mat image = TestImages.solid(8, 6, 10, 20, 30);
        byte[] first = ImageUtils.encodePng(image);
        byte[] second = ImageUtils.encodePng(image);
        assertArrayEquals(first, second);

        Mat decoded = ImageUtils.decodeImage(first);
        assertNotNull(decoded);
        assertArrayEquals(new int[]{10, 20, 30}, TestImages.bgrAt(decoded, 7, 5));
        decoded.release();
        image.release();
    }

    @Test
    void bgrToMat_shouldSkipRowPadding() {
        int width = 2;
        int height = 2;
        int stride = 8;
        ByteBuffer pixels = ByteBuffer.allocate(stride * height);
        // 第0行
        pixels.put(0, (byte) 1).put(1, (byte) 2).put(2, (byte) 3);
        pixels.put(3, (byte) 4).put(4, (byte) 5).put(5, (byte) 6);
        // 第1行（前一行有2字节填充）
        pixels.put(8, (byte) 7).put(9, (byte) 8).put(10, (byte) 9);
        pixels.put(11, (byte) 10).put(12, (byte) 11).put(13, (byte) 12);

        Mat mat = ImageUtils.bgrToMat(pixels, width, height, stride);

        assertArrayEquals(new int[]{4, 5, 6}, TestImages.bgrAt(mat, 1, 0));
        assertArrayEquals(new int[]{7, 8, 9}, TestImages.bgrAt(mat, 0, 1));
        assertArrayEquals(new int[]{10, 11, 12}, TestImages.bgrAt(mat, 1, 1));
        mat.release();
    }
}
