package com.video.annotator.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.video.annotator.exception.AnnotatorException;
import com.video.annotator.model.Category;
import com.video.annotator.model.Frame;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * CSV报告：category,timestamp,file,note，按捕获顺序每帧一行
 * 只有含分隔符、引号或换行的值才加引号
 */
public class CsvReportExporter {

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private final CsvSchema schema = csvMapper.schemaFor(ReportRow.class).withHeader();

    public byte[] export(List<Frame> frames, Function<String, Category> categoryLookup) {
        List<ReportRow> rows = new ArrayList<>();
        for (Frame frame : frames) {
            Category category = categoryLookup.apply(frame.getCategoryId());
            rows.add(new ReportRow(
                    category != null ? category.getName() : ExportNames.UNCATEGORIZED_FOLDER,
                    frame.getTimestampSeconds(),
                    frame.getFileName(),
                    frame.getNote()));
        }
        try {
            return csvMapper.writer(schema).writeValueAsString(rows).getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AnnotatorException("Failed to write CSV report", e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"category", "timestamp", "file", "note"})
    public static class ReportRow {
        private String category;
        private double timestamp;
        private String file;
        private String note;
    }
}
