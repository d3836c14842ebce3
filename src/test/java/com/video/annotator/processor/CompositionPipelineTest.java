package com.video.annotator.processor;

import com.video.annotator.exception.DecodeFailureException;
import com.video.annotator.exception.ValidationException;
import com.video.annotator.model.AnnotationSpec;
import com.video.annotator.model.BrightnessContrastFilter;
import com.video.annotator.model.FilterSpec;
import com.video.annotator.model.Frame;
import com.video.annotator.model.FramePoint;
import com.video.annotator.model.RectangleAnnotation;
import com.video.annotator.model.RenderRequest;
import com.video.annotator.util.ImageUtils;
import com.video.annotator.util.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opencv.core.Mat;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CompositionPipelineTest {

    @Mock
    private FilterStage mockFilterStage;
    @Mock
    private RescaleStage mockRescaleStage;
    @Mock
    private AnnotationRenderer mockRenderer;

    private final CompositionPipeline pipeline = new CompositionPipeline();

    @Test
    void identityRequest_shouldReturnSourceBytesWithoutDecoding() {
        // Given
        CompositionPipeline isolated = new CompositionPipeline(mockFilterStage, mockRescaleStage, mockRenderer,
                new FilterValidator(), new AnnotationValidator());
        byte[] source = TestImages.grayPng(8, 8, 42);

        // When
        byte[] output = isolated.compose(source, Frame.defaultFilters(), Collections.emptyList(), 1);

        // Then
        assertSame(source, output);
        verifyNoInteractions(mockFilterStage, mockRescaleStage, mockRenderer);
    }

    @Test
    void identityRequest_withUndecodableBytes_shouldStillPassThrough() {
        byte[] garbage = {1, 2, 3};
        assertSame(garbage, pipeline.compose(garbage, null, null, 1));
    }

    @Test
    void rectangleAtScaleTwo_shouldMatchExpectedPixels() {
        // Given
        byte[] source = TestImages.grayPng(100, 100, 0);
        List<AnnotationSpec> annotations = Collections.singletonList(
                RectangleAnnotation.of(FramePoint.of(10, 10), FramePoint.of(30, 30), "#ff0000", 1));

        // When
        byte[] output = pipeline.compose(source, Collections.emptyList(), annotations, 2);

        // Then
        Mat image = ImageUtils.decodeImage(output);
        assertNotNull(image);
        assertEquals(200, image.cols());
        assertEquals(200, image.rows());
        assertArrayEquals(new int[]{0, 0, 255}, TestImages.bgrAt(image, 40, 20));
        assertArrayEquals(new int[]{0, 0, 0}, TestImages.bgrAt(image, 40, 40));
    }

    @Test
    void filtersRunBeforeAnnotations() {
        byte[] source = TestImages.grayPng(50, 50, 100);
        List<FilterSpec> filters = Collections.singletonList(BrightnessContrastFilter.of(true, 100, 0));
        List<AnnotationSpec> annotations = Collections.singletonList(
                RectangleAnnotation.of(FramePoint.of(5, 5), FramePoint.of(20, 20), "#000000", 1));

        Mat image = ImageUtils.decodeImage(pipeline.compose(source, filters, annotations, 1));

        // 标注颜色不受滤镜影响
        assertArrayEquals(new int[]{0, 0, 0}, TestImages.bgrAt(image, 5, 5));
        assertArrayEquals(new int[]{200, 200, 200}, TestImages.bgrAt(image, 40, 40));
    }

    @Test
    void compose_shouldBeDeterministic() {
        RenderRequest request = RenderRequest.builder()
                .imageBytes(TestImages.grayPng(64, 48, 90))
                .filters(Collections.singletonList(BrightnessContrastFilter.of(true, 10, 20)))
                .annotations(Collections.singletonList(
                        RectangleAnnotation.of(FramePoint.of(1, 1), FramePoint.of(30, 20), "#22cc88", 2)))
                .scale(3)
                .build();

        assertArrayEquals(pipeline.compose(request), pipeline.compose(request));
    }

    @Test
    void undecodableBytes_withWork_shouldFailWithDecodeFailure() {
        List<FilterSpec> filters = Collections.singletonList(BrightnessContrastFilter.of(true, 10, 0));
        assertThrows(DecodeFailureException.class, () -> pipeline.compose(new byte[]{7, 7}, filters, null, 1));
    }

    @Test
    void invalidScale_shouldBeRejectedBeforeAnyWork() {
        byte[] source = TestImages.grayPng(4, 4, 0);
        assertThrows(ValidationException.class, () -> pipeline.compose(source, null, null, 5));
    }

    @Test
    void invalidAnnotation_shouldRejectWholeRequest() {
        byte[] source = TestImages.grayPng(4, 4, 0);
        List<AnnotationSpec> annotations = Collections.singletonList(
                RectangleAnnotation.of(FramePoint.of(0, 0), FramePoint.of(1, 1), "not-a-color", 1));
        assertThrows(ValidationException.class, () -> pipeline.compose(source, null, annotations, 2));
    }
}
