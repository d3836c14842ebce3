package com.video.annotator.service;

import com.video.annotator.config.AnnotatorConfig;
import com.video.annotator.exception.AnnotatorException;
import com.video.annotator.exception.NotFoundException;
import com.video.annotator.exception.ValidationException;
import com.video.annotator.export.CsvReportExporter;
import com.video.annotator.export.GalleryExporter;
import com.video.annotator.export.ZipExporter;
import com.video.annotator.model.AnnotationSpec;
import com.video.annotator.model.CaptureRequest;
import com.video.annotator.model.Category;
import com.video.annotator.model.FilterSpec;
import com.video.annotator.model.Frame;
import com.video.annotator.model.GalleryEntry;
import com.video.annotator.model.VideoSession;
import com.video.annotator.processor.AnnotationValidator;
import com.video.annotator.processor.CompositionPipeline;
import com.video.annotator.processor.FilterValidator;
import com.video.annotator.processor.RescaleStage;
import com.video.annotator.serialization.AnnotatorJson;
import com.video.annotator.store.CategoryStore;
import com.video.annotator.store.FrameRecordStore;
import com.video.annotator.store.ImportSummary;
import com.video.annotator.store.VideoSessionRegistry;
import com.video.annotator.video.ExactFrameLocator;
import com.video.annotator.video.FFmpegVideoDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Function;

/**
 * 帧标注服务
 * <p>
 * 组合视频会话、帧记录、分类存储、精确帧定位和合成管线，提供捕获、编辑、渲染和导入导出操作。
 */
public class FrameAnnotatorService {

    private static final Logger LOG = LoggerFactory.getLogger(FrameAnnotatorService.class);

    private final AnnotatorConfig config;
    private final VideoSessionRegistry sessions;
    private final FrameRecordStore frames;
    private final CategoryStore categories;
    private final ExactFrameLocator locator;
    private final CompositionPipeline pipeline;

    private final FilterValidator filterValidator = new FilterValidator();
    private final AnnotationValidator annotationValidator = new AnnotationValidator();
    private final GalleryExporter galleryExporter = new GalleryExporter();
    private final CsvReportExporter csvExporter = new CsvReportExporter();
    private final ZipExporter zipExporter;

    public FrameAnnotatorService(AnnotatorConfig config,
                                 VideoSessionRegistry sessions,
                                 FrameRecordStore frames,
                                 CategoryStore categories,
                                 ExactFrameLocator locator,
                                 CompositionPipeline pipeline) {
        this.config = config;
        this.sessions = sessions;
        this.frames = frames;
        this.categories = categories;
        this.locator = locator;
        this.pipeline = pipeline;
        this.zipExporter = new ZipExporter(pipeline, config.getExportParallelism());
    }

    /**
     * 使用 FFmpeg 解码器和配置中的存储路径创建服务
     */
    public static FrameAnnotatorService create(AnnotatorConfig config) {
        return new FrameAnnotatorService(config,
                new VideoSessionRegistry(FFmpegVideoDecoder::new, config.getDefaultFps()),
                new FrameRecordStore(),
                new CategoryStore(config.categoriesPath()),
                new ExactFrameLocator(FFmpegVideoDecoder::new, config),
                new CompositionPipeline());
    }

    // ---------------------------------------------------------------- 视频

    /**
     * 保存上传的视频到 videos 目录并登记为活动会话
     */
    public VideoSession uploadVideo(InputStream data, String fileName) {
        if (fileName == null || fileName.trim().isEmpty()) {
            throw new ValidationException("No file");
        }
        String safeName = Paths.get(fileName.trim()).getFileName().toString();
        Path target = config.videosPath().resolve(newId() + "_" + safeName);
        try {
            Files.createDirectories(config.videosPath());
            Files.copy(data, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new AnnotatorException("Failed to store uploaded video " + safeName, e);
        }
        return registerVideo(target, safeName);
    }

    /**
     * 登记视频，旧会话的帧及图片被丢弃
     */
    public VideoSession registerVideo(Path videoFile, String originalName) {
        VideoSession previous = sessions.active().orElse(null);
        VideoSession session = sessions.register(videoFile, originalName);
        if (previous != null) {
            int dropped = frames.removeVideo(previous.getId());
            LOG.info("Dropped {} frames of previous video {}", dropped, previous.getId());
        }
        return session;
    }

    public VideoSession getVideo(String videoId) {
        return sessions.get(videoId);
    }

    // ---------------------------------------------------------------- 帧

    public List<Frame> listFrames(String videoId) {
        sessions.get(videoId);
        return frames.listByVideo(videoId);
    }

    public Frame getFrame(String frameId) {
        return frames.get(frameId);
    }

    /**
     * 捕获 t 秒处的精确帧，保存PNG并新建帧记录
     */
    public Frame captureFrame(CaptureRequest request) {
        VideoSession session = sessions.get(request.getVideoId());
        Category category = categories.findOrDefault(request.getCategoryId());
        double ts = request.getTimestampSeconds();

        int frameNumber = frames.countByVideo(session.getId()) + 1;
        String fileName = frameFileName(session, frameNumber, ts);
        Path imagePath = config.framesPath().resolve(fileName);
        locator.extractTo(Paths.get(session.getSourcePath()), ts, imagePath);

        Frame frame = Frame.builder()
                .id(newId())
                .videoId(session.getId())
                .timestampSeconds(ts)
                .fileName(fileName)
                .imagePath(imagePath.toString())
                .categoryId(category.getId())
                .note(String.format(Locale.ROOT, "Frame: %d, Tempo: %.3fs", frameNumber, ts))
                .filters(Frame.defaultFilters())
                .build();
        LOG.info("Frame captured: video={}, ts={}, file={}, category={}",
                session.getId(), ts, fileName, category.getName());
        return frames.add(frame);
    }

    public Frame updateNote(String frameId, String note) {
        return frames.updateNote(frameId, note);
    }

    public Frame changeCategory(String frameId, String categoryId) {
        Category category = categories.find(categoryId)
                .orElseThrow(() -> new NotFoundException("Category not found: " + categoryId));
        return frames.updateCategory(frameId, category.getId());
    }

    public Frame updateFilters(String frameId, List<FilterSpec> filters) {
        if (filters == null) {
            throw new ValidationException("Filter stack must be a list");
        }
        filterValidator.validate(filters);
        return frames.updateFilters(frameId, filters);
    }

    public Frame updateAnnotations(String frameId, List<AnnotationSpec> annotations) {
        if (annotations == null) {
            throw new ValidationException("Annotations must be a list");
        }
        annotationValidator.validate(annotations);
        return frames.updateAnnotations(frameId, annotations);
    }

    public Frame addAnnotation(String frameId, AnnotationSpec annotation) {
        List<AnnotationSpec> single = new ArrayList<>();
        single.add(annotation);
        annotationValidator.validate(single);
        AnnotationSpec snapshot = annotation.copy();
        return frames.update(frameId, frame -> frame.getAnnotations().add(snapshot));
    }

    /**
     * 撤销最后一条标注，没有标注时不变
     */
    public Frame undoAnnotation(String frameId) {
        return frames.update(frameId, frame -> {
            List<AnnotationSpec> annotations = frame.getAnnotations();
            if (!annotations.isEmpty()) {
                annotations.remove(annotations.size() - 1);
            }
        });
    }

    public Frame updateScale(String frameId, int scale) {
        return frames.updateScale(frameId, scale);
    }

    public void deleteFrame(String frameId) {
        frames.delete(frameId);
    }

    // ---------------------------------------------------------------- 渲染

    /**
     * 按帧记录的当前快照渲染
     */
    public byte[] renderFrame(String frameId) {
        Frame frame = frames.get(frameId);
        return pipeline.compose(readImage(frame), frame.getFilters(), frame.getAnnotations(), frame.getScale());
    }

    /**
     * 使用临时滤镜栈预览（不保存），标注和放大倍数取自帧记录
     */
    public byte[] renderPreview(String frameId, List<FilterSpec> filters) {
        Frame frame = frames.get(frameId);
        return pipeline.compose(readImage(frame), filters, frame.getAnnotations(), frame.getScale());
    }

    private byte[] readImage(Frame frame) {
        Path path = Paths.get(frame.getImagePath());
        if (!Files.isRegularFile(path)) {
            throw new NotFoundException("Frame image not found: " + frame.getFileName());
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new AnnotatorException("Failed to read frame image " + path, e);
        }
    }

    // ---------------------------------------------------------------- 分类

    public List<Category> listCategories() {
        return categories.list();
    }

    public Category createCategory(String name) {
        return categories.create(name);
    }

    public Category renameCategory(String categoryId, String name) {
        return categories.rename(categoryId, name);
    }

    /**
     * 删除分类，其下的帧归入默认分类
     */
    public void deleteCategory(String categoryId) {
        String fallback = categories.delete(categoryId);
        int moved = frames.reassignCategory(categoryId, fallback);
        LOG.info("{} frames moved to the default category", moved);
    }

    public byte[] exportCategories() {
        return AnnotatorJson.writeBytes(categories.exportCategories());
    }

    public ImportSummary importCategories(InputStream input) {
        return categories.importCategories(input);
    }

    public List<Category> resetCategories() {
        return categories.reset();
    }

    // ---------------------------------------------------------------- 导入导出

    public byte[] exportGallery(String videoId) {
        sessions.get(videoId);
        return galleryExporter.export(frames.listByVideo(videoId), categoryLookup());
    }

    /**
     * 导入图库：替换视频的全部帧，逐条重新捕获
     * 缺少时间戳的条目跳过，未知分类归入默认分类。
     * 帧先提取到临时目录，全部成功后才替换原有帧；任何一条失败时原有帧保持不变。
     */
    public ImportSummary importGallery(String videoId, InputStream input) {
        VideoSession session = sessions.get(videoId);
        List<GalleryEntry> entries = galleryExporter.parse(input);
        for (GalleryEntry entry : entries) {
            if (entry.getFilters() != null) {
                filterValidator.validate(entry.getFilters());
            }
            if (entry.getAnnotations() != null) {
                annotationValidator.validate(entry.getAnnotations());
            }
            if (entry.getScale() != null) {
                RescaleStage.validateScale(entry.getScale());
            }
        }

        Path video = Paths.get(session.getSourcePath());
        Path staging = config.framesPath().resolve(".import-" + newId());
        List<Frame> imported = new ArrayList<>();
        int skipped = 0;
        try {
            for (int idx = 0; idx < entries.size(); idx++) {
                GalleryEntry entry = entries.get(idx);
                if (entry.getTimestampSeconds() == null) {
                    skipped++;
                    continue;
                }
                double ts = entry.getTimestampSeconds();
                Category category = categories.findByName(entry.getCategoryName())
                        .orElseGet(Category::defaultCategory);
                String fileName = frameFileName(session, idx + 1, ts);
                locator.extractTo(video, ts, staging.resolve(fileName));

                imported.add(Frame.builder()
                        .id(newId())
                        .videoId(videoId)
                        .timestampSeconds(ts)
                        .fileName(fileName)
                        .imagePath(config.framesPath().resolve(fileName).toString())
                        .categoryId(category.getId())
                        .note(entry.getNote() != null ? entry.getNote() : "")
                        .filters(entry.getFilters() != null ? Frame.copyFilters(entry.getFilters()) : new ArrayList<>())
                        .annotations(Frame.copyAnnotations(entry.getAnnotations()))
                        .scale(entry.getScale() != null ? entry.getScale() : Frame.DEFAULT_SCALE)
                        .build());
            }

            // 旧帧图片与新帧可能同名，先删旧记录再移入新文件
            frames.replaceAll(videoId, imported);
            for (Frame frame : imported) {
                Files.move(staging.resolve(frame.getFileName()), Paths.get(frame.getImagePath()),
                        StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new AnnotatorException("Failed to move imported frames into " + config.framesPath(), e);
        } finally {
            deleteStaging(staging);
        }
        LOG.info("Gallery imported for video {}: {} frames, {} skipped", videoId, imported.size(), skipped);
        return new ImportSummary(imported.size(), skipped);
    }

    private void deleteStaging(Path staging) {
        if (!Files.isDirectory(staging)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(staging)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            LOG.warn("Could not clean up import staging directory {}", staging, e);
        }
    }

    public int exportZip(String videoId, OutputStream out) {
        sessions.get(videoId);
        return zipExporter.export(frames.listByVideo(videoId), categoryLookup(), out);
    }

    public byte[] exportCsv(String videoId) {
        sessions.get(videoId);
        return csvExporter.export(frames.listByVideo(videoId), categoryLookup());
    }

    private Function<String, Category> categoryLookup() {
        List<Category> snapshot = categories.list();
        return id -> {
            for (Category category : snapshot) {
                if (category.getId().equals(id)) {
                    return category;
                }
            }
            return null;
        };
    }

    static String frameFileName(VideoSession session, int frameNumber, double ts) {
        String stamp = String.format(Locale.ROOT, "%.3f", ts).replace('.', '_');
        return session.baseName() + "_frame" + frameNumber + "_ts" + stamp + ".png";
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
