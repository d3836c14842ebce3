package com.video.annotator.export;

import com.video.annotator.model.Category;
import com.video.annotator.model.Frame;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CsvReportExporterTest {

    private final CsvReportExporter exporter = new CsvReportExporter();

    private static Frame frame(double ts, String fileName, String note) {
        return Frame.builder()
                .id(fileName)
                .videoId("v")
                .timestampSeconds(ts)
                .fileName(fileName)
                .categoryId(Category.DEFAULT_ID)
                .note(note)
                .build();
    }

    @Test
    void export_shouldQuoteOnlyValuesThatNeedIt() {
        // Given: 分类名含空格，备注含逗号和引号
        Frame plain = frame(1.5, "a.png", "sem virgula");
        Frame quoted = frame(2.0, "b.png", "diz \"oi\", tchau");

        // When
        String csv = new String(exporter.export(Arrays.asList(plain, quoted), id -> Category.defaultCategory()),
                StandardCharsets.UTF_8);
        String[] lines = csv.split("\n");

        // Then
        assertEquals("category,timestamp,file,note", lines[0]);
        assertEquals("Não categorizado,1.5,a.png,sem virgula", lines[1]);
        assertEquals("Não categorizado,2.0,b.png,\"diz \"\"oi\"\", tchau\"", lines[2]);
    }

    @Test
    void export_withUnknownCategory_shouldUseFallbackName() {
        String csv = new String(exporter.export(Arrays.asList(frame(0.5, "c.png", "n")), id -> null),
                StandardCharsets.UTF_8);

        assertEquals(ExportNames.UNCATEGORIZED_FOLDER + ",0.5,c.png,n", csv.split("\n")[1]);
    }
}
