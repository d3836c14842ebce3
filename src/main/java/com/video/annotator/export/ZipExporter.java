package com.video.annotator.export;

import com.video.annotator.exception.AnnotatorException;
import com.video.annotator.model.Category;
import com.video.annotator.model.Frame;
import com.video.annotator.processor.CompositionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * ZIP导出：每帧一个条目，路径为 分类名/文件名
 * <p>
 * 各帧渲染在有界线程池中并行执行，条目按帧顺序写入。
 * 图片文件缺失的帧跳过；渲染失败的帧记录日志后跳过，其余帧照常导出。
 */
public class ZipExporter {

    private static final Logger LOG = LoggerFactory.getLogger(ZipExporter.class);

    private final CompositionPipeline pipeline;
    private final int parallelism;

    public ZipExporter(CompositionPipeline pipeline, int parallelism) {
        this.pipeline = pipeline;
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * @return 写入的条目数
     */
    public int export(List<Frame> frames, Function<String, Category> categoryLookup, OutputStream out) {
        List<Frame> present = new ArrayList<>();
        for (Frame frame : frames) {
            if (frame.getImagePath() == null || !Files.isRegularFile(Paths.get(frame.getImagePath()))) {
                LOG.warn("Frame image missing, skipped from archive: {}", frame.getImagePath());
                continue;
            }
            present.add(frame);
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, present.size())));
        try {
            List<Future<byte[]>> renders = new ArrayList<>();
            for (Frame frame : present) {
                renders.add(executor.submit(() -> render(frame)));
            }

            int written = 0;
            ZipOutputStream zip = new ZipOutputStream(out);
            for (int i = 0; i < present.size(); i++) {
                Frame frame = present.get(i);
                byte[] bytes;
                try {
                    bytes = renders.get(i).get();
                } catch (ExecutionException e) {
                    LOG.error("Failed to render frame {} for archive", frame.getFileName(), e.getCause());
                    continue;
                }
                zip.putNextEntry(new ZipEntry(entryName(frame, categoryLookup)));
                zip.write(bytes);
                zip.closeEntry();
                written++;
            }
            zip.finish();
            LOG.info("Archive written: {} of {} frames", written, frames.size());
            return written;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnnotatorException("Archive export interrupted", e);
        } catch (IOException e) {
            throw new AnnotatorException("Failed to write archive", e);
        } finally {
            executor.shutdownNow();
        }
    }

    static String entryName(Frame frame, Function<String, Category> categoryLookup) {
        Category category = categoryLookup.apply(frame.getCategoryId());
        String folder = category != null ? category.getName() : ExportNames.UNCATEGORIZED_FOLDER;
        return folder + "/" + frame.getFileName();
    }

    private byte[] render(Frame frame) throws IOException {
        byte[] original = Files.readAllBytes(Paths.get(frame.getImagePath()));
        return pipeline.compose(original, frame.getFilters(), frame.getAnnotations(), frame.getScale());
    }
}
