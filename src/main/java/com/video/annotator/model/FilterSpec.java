package com.video.annotator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 滤镜描述（按 name 区分的标签变体）
 * 列表顺序即应用顺序，enabled=false 的滤镜不参与处理
 * <p>
 * 数值参数宽松解析：无法解析或超出类型范围的值置为 null 并记入 malformedParameters，
 * 只有滤镜启用时才由校验器报错
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "name")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BrightnessContrastFilter.class, name = BrightnessContrastFilter.NAME),
        @JsonSubTypes.Type(value = WhiteBalanceFilter.class, name = WhiteBalanceFilter.NAME),
        @JsonSubTypes.Type(value = ClaheFilter.class, name = ClaheFilter.NAME)
})
public abstract class FilterSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 界面显示名称（仅展示用）
     */
    private String label;

    private boolean enabled;

    /**
     * 无法解析的参数：字段名 -> 原始 JSON 文本
     */
    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private Map<String, String> malformedParameters = new LinkedHashMap<>();

    /**
     * 滤镜类型名，如 brightness_contrast
     */
    public abstract String getName();

    /**
     * 深拷贝，记录存储对外只暴露快照
     */
    public abstract FilterSpec copy();

    protected <T extends FilterSpec> T copyCommonTo(T target) {
        target.setLabel(label);
        target.setEnabled(enabled);
        target.setMalformedParameters(new LinkedHashMap<>(malformedParameters));
        return target;
    }

    protected Integer lenientInteger(String field, JsonNode value) {
        Double number = lenientNumber(field, value);
        if (number == null) {
            return null;
        }
        if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            malformedParameters.put(field, value.toString());
            return null;
        }
        // 小数按向零截断
        return (int) number.doubleValue();
    }

    protected Double lenientNumber(String field, JsonNode value) {
        malformedParameters.remove(field);
        if (value == null || value.isNull()) {
            return null;
        }
        double number;
        if (value.isNumber()) {
            number = value.asDouble();
        } else if (value.isTextual()) {
            try {
                number = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                malformedParameters.put(field, value.toString());
                return null;
            }
        } else {
            malformedParameters.put(field, value.toString());
            return null;
        }
        if (!Double.isFinite(number)) {
            malformedParameters.put(field, value.toString());
            return null;
        }
        return number;
    }
}
