package com.video.annotator.export;

import com.fasterxml.jackson.core.type.TypeReference;
import com.video.annotator.model.Category;
import com.video.annotator.model.Frame;
import com.video.annotator.model.GalleryEntry;
import com.video.annotator.serialization.AnnotatorJson;
import com.video.annotator.exception.ValidationException;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 图库JSON导出与解析
 * <p>
 * 条目只记录时间戳、分类名称、备注和编辑参数，帧图片在导入时重新从视频捕获。
 */
public class GalleryExporter {

    private static final TypeReference<List<GalleryEntry>> ENTRY_LIST = new TypeReference<List<GalleryEntry>>() {
    };

    public List<GalleryEntry> toEntries(List<Frame> frames, Function<String, Category> categoryLookup) {
        List<GalleryEntry> entries = new ArrayList<>();
        for (Frame frame : frames) {
            Category category = categoryLookup.apply(frame.getCategoryId());
            entries.add(GalleryEntry.builder()
                    .timestampSeconds(frame.getTimestampSeconds())
                    .categoryName(category != null ? category.getName() : null)
                    .note(frame.getNote())
                    .filters(Frame.copyFilters(frame.getFilters()))
                    .annotations(Frame.copyAnnotations(frame.getAnnotations()))
                    .scale(frame.getScale())
                    .build());
        }
        return entries;
    }

    public byte[] export(List<Frame> frames, Function<String, Category> categoryLookup) {
        return AnnotatorJson.writeBytes(toEntries(frames, categoryLookup));
    }

    /**
     * 解析图库文件，顶层必须是列表
     */
    public List<GalleryEntry> parse(InputStream input) {
        List<GalleryEntry> entries = AnnotatorJson.read(input, ENTRY_LIST, "gallery");
        if (entries == null) {
            throw new ValidationException("Gallery file must contain a JSON list");
        }
        return entries;
    }
}
