package com.video.annotator.model;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 亮度/对比度：v' = clamp((1 + contrast/100) * v + brightness, 0, 255)
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class BrightnessContrastFilter extends FilterSpec {

    private static final long serialVersionUID = 1L;

    public static final String NAME = "brightness_contrast";
    public static final String DEFAULT_LABEL = "Brilho/Contraste";

    /**
     * 亮度 [-100, 100]
     */
    private Integer brightness;

    /**
     * 对比度 [-100, 100]
     */
    private Integer contrast;

    public static BrightnessContrastFilter of(boolean enabled, int brightness, int contrast) {
        BrightnessContrastFilter filter = new BrightnessContrastFilter();
        filter.setLabel(DEFAULT_LABEL);
        filter.setEnabled(enabled);
        filter.setBrightness(brightness);
        filter.setContrast(contrast);
        return filter;
    }

    @JsonSetter("brightness")
    void readBrightness(JsonNode value) {
        this.brightness = lenientInteger("brightness", value);
    }

    @JsonSetter("contrast")
    void readContrast(JsonNode value) {
        this.contrast = lenientInteger("contrast", value);
    }

    public int brightnessOrDefault() {
        return brightness != null ? brightness : 0;
    }

    public int contrastOrDefault() {
        return contrast != null ? contrast : 0;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BrightnessContrastFilter copy() {
        BrightnessContrastFilter copy = copyCommonTo(new BrightnessContrastFilter());
        copy.setBrightness(brightness);
        copy.setContrast(contrast);
        return copy;
    }
}
