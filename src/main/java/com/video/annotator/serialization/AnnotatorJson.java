package com.video.annotator.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.video.annotator.exception.AnnotatorException;
import com.video.annotator.exception.ValidationException;
import com.video.annotator.model.AnnotationSpec;
import com.video.annotator.model.FilterSpec;
import com.video.annotator.model.RenderRequest;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * JSON 序列化（滤镜栈、标注、渲染请求、分类、图库）
 */
public final class AnnotatorJson {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    private static final TypeReference<List<FilterSpec>> FILTER_LIST = new TypeReference<List<FilterSpec>>() {
    };
    private static final TypeReference<List<AnnotationSpec>> ANNOTATION_LIST = new TypeReference<List<AnnotationSpec>>() {
    };

    private AnnotatorJson() {
    }

    public static ObjectMapper mapper() {
        return objectMapper;
    }

    public static List<FilterSpec> readFilters(String json) {
        return read(json, FILTER_LIST, "filters");
    }

    public static List<AnnotationSpec> readAnnotations(String json) {
        return read(json, ANNOTATION_LIST, "annotations");
    }

    /**
     * 渲染请求，imageBytes 为 base64
     */
    public static RenderRequest readRenderRequest(byte[] json) {
        try {
            return objectMapper.readValue(json, RenderRequest.class);
        } catch (IOException e) {
            throw new ValidationException("Malformed render request: " + describe(e));
        }
    }

    public static <T> T read(InputStream input, TypeReference<T> type, String what) {
        try {
            return objectMapper.readValue(input, type);
        } catch (IOException e) {
            throw new ValidationException("Malformed " + what + ": " + describe(e));
        }
    }

    public static <T> T read(String json, TypeReference<T> type, String what) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed " + what + ": " + describe(e));
        }
    }

    private static String describe(IOException e) {
        if (e instanceof JsonProcessingException) {
            return ((JsonProcessingException) e).getOriginalMessage();
        }
        return e.getMessage();
    }

    public static byte[] writeBytes(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new AnnotatorException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static String writeString(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AnnotatorException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
