package com.video.annotator.processor;

import com.video.annotator.exception.DecodeFailureException;
import com.video.annotator.model.AnnotationSpec;
import com.video.annotator.model.FilterSpec;
import com.video.annotator.model.RenderRequest;
import com.video.annotator.util.ImageUtils;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 帧合成流水线：滤镜 -> 放大 -> 标注 -> PNG编码
 * <p>
 * 纯函数：相同输入得到逐字节相同的输出，不持有可变状态，可并发调用。
 * 没有启用的滤镜、没有标注且 scale=1 时直接返回源字节。
 */
public class CompositionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(CompositionPipeline.class);

    private final FilterStage filterStage;
    private final RescaleStage rescaleStage;
    private final AnnotationRenderer annotationRenderer;
    private final FilterValidator filterValidator;
    private final AnnotationValidator annotationValidator;

    public CompositionPipeline() {
        this(new FilterStage(), new RescaleStage(), new AnnotationRenderer(),
                new FilterValidator(), new AnnotationValidator());
    }

    public CompositionPipeline(FilterStage filterStage,
                               RescaleStage rescaleStage,
                               AnnotationRenderer annotationRenderer,
                               FilterValidator filterValidator,
                               AnnotationValidator annotationValidator) {
        this.filterStage = filterStage;
        this.rescaleStage = rescaleStage;
        this.annotationRenderer = annotationRenderer;
        this.filterValidator = filterValidator;
        this.annotationValidator = annotationValidator;
    }

    public byte[] compose(RenderRequest request) {
        return compose(request.getImageBytes(), request.getFilters(), request.getAnnotations(), request.getScale());
    }

    public byte[] compose(byte[] frameBytes, List<FilterSpec> filters, List<AnnotationSpec> annotations, int scale) {
        RescaleStage.validateScale(scale);
        filterValidator.validate(filters);
        annotationValidator.validate(annotations);

        if (isIdentity(filters, annotations, scale)) {
            return frameBytes;
        }

        Mat source = ImageUtils.decodeImage(frameBytes);
        if (source == null) {
            throw new DecodeFailureException("Frame bytes are not a decodable image");
        }

        Mat filtered = null;
        Mat scaled = null;
        Mat annotated = null;
        try {
            filtered = filterStage.applyFilters(source, filters);
            scaled = rescaleStage.rescale(filtered, scale);
            annotated = annotationRenderer.render(scaled, annotations, scale);
            byte[] png = ImageUtils.encodePng(annotated);
            LOG.debug("Composed {}x{} frame: scale={}, annotations={}, output={} bytes",
                    annotated.cols(), annotated.rows(), scale,
                    annotations != null ? annotations.size() : 0, png.length);
            return png;
        } finally {
            ImageUtils.safeRelease(annotated);
            ImageUtils.safeRelease(scaled);
            ImageUtils.safeRelease(filtered);
            ImageUtils.safeRelease(source);
        }
    }

    /**
     * 是否可以跳过解码/编码，原样返回源字节
     */
    public static boolean isIdentity(List<FilterSpec> filters, List<AnnotationSpec> annotations, int scale) {
        return scale == 1 && !hasEnabledFilter(filters) && (annotations == null || annotations.isEmpty());
    }

    public static boolean hasEnabledFilter(List<FilterSpec> filters) {
        if (filters == null) {
            return false;
        }
        for (FilterSpec filter : filters) {
            if (filter != null && filter.isEnabled()) {
                return true;
            }
        }
        return false;
    }
}
