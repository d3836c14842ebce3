package com.video.annotator.processor;

import com.video.annotator.exception.ValidationException;
import com.video.annotator.model.BrightnessContrastFilter;
import com.video.annotator.model.ClaheFilter;
import com.video.annotator.model.FilterSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * 滤镜参数校验，只检查已启用的滤镜；关闭的滤镜参数任意
 */
public class FilterValidator {

    public void validate(List<FilterSpec> filters) {
        if (filters == null) {
            return;
        }
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < filters.size(); i++) {
            FilterSpec filter = filters.get(i);
            String prefix = "filters[" + i + "]";
            if (filter == null) {
                violations.add(prefix + " is null");
                continue;
            }
            if (!filter.isEnabled()) {
                continue;
            }
            filter.getMalformedParameters().forEach((field, raw) ->
                    violations.add(String.format("%s.%s must be a number but was %s", prefix, field, raw)));
            if (filter instanceof BrightnessContrastFilter) {
                BrightnessContrastFilter bc = (BrightnessContrastFilter) filter;
                checkRange(prefix + ".brightness", bc.brightnessOrDefault(), -100, 100, violations);
                checkRange(prefix + ".contrast", bc.contrastOrDefault(), -100, 100, violations);
            } else if (filter instanceof ClaheFilter) {
                ClaheFilter clahe = (ClaheFilter) filter;
                checkRange(prefix + ".clipLimit", clahe.clipLimitOrDefault(), 1, 40, violations);
                checkRange(prefix + ".gridSize", clahe.gridSizeOrDefault(), 2, 16, violations);
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private void checkRange(String field, double value, double min, double max, List<String> violations) {
        if (!(value >= min && value <= max)) {
            violations.add(String.format("%s must be in [%s, %s] but was %s",
                    field, format(min), format(max), format(value)));
        }
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
