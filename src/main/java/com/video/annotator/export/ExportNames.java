package com.video.annotator.export;

import com.video.annotator.model.VideoSession;

/**
 * 导出文件命名
 */
public final class ExportNames {

    public static final String UNCATEGORIZED_FOLDER = "sem_categoria";

    private ExportNames() {
    }

    public static String galleryFile(VideoSession session) {
        return "galeria_" + session.baseName() + ".json";
    }

    public static String categoriesFile(VideoSession session) {
        return "categorias_" + session.baseName() + ".json";
    }

    public static String zipFile(VideoSession session) {
        return "imagens_" + session.baseName() + ".zip";
    }

    public static String csvFile(VideoSession session) {
        return "relatorio_" + session.baseName() + ".csv";
    }
}
