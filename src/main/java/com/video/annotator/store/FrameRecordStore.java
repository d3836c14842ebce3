package com.video.annotator.store;

import com.video.annotator.exception.NotFoundException;
import com.video.annotator.model.AnnotationSpec;
import com.video.annotator.model.FilterSpec;
import com.video.annotator.model.Frame;
import com.video.annotator.processor.RescaleStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 帧记录存储（内存）
 * <p>
 * 读取返回深拷贝快照；同一帧的并发修改为后写覆盖。删除记录时同时删除帧图片。
 */
public class FrameRecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(FrameRecordStore.class);

    // 按捕获顺序保存
    private final Map<String, Frame> frames = new LinkedHashMap<>();

    public synchronized Frame add(Frame frame) {
        frames.put(frame.getId(), frame.copy());
        return frame.copy();
    }

    public synchronized Frame get(String frameId) {
        return require(frameId).copy();
    }

    public synchronized List<Frame> listByVideo(String videoId) {
        List<Frame> result = new ArrayList<>();
        for (Frame frame : frames.values()) {
            if (frame.getVideoId().equals(videoId)) {
                result.add(frame.copy());
            }
        }
        return result;
    }

    public synchronized int countByVideo(String videoId) {
        int count = 0;
        for (Frame frame : frames.values()) {
            if (frame.getVideoId().equals(videoId)) {
                count++;
            }
        }
        return count;
    }

    public Frame updateNote(String frameId, String note) {
        return update(frameId, frame -> frame.setNote(note != null ? note : ""));
    }

    public Frame updateCategory(String frameId, String categoryId) {
        return update(frameId, frame -> frame.setCategoryId(categoryId));
    }

    public Frame updateFilters(String frameId, List<FilterSpec> filters) {
        List<FilterSpec> snapshot = Frame.copyFilters(filters);
        return update(frameId, frame -> frame.setFilters(snapshot));
    }

    public Frame updateAnnotations(String frameId, List<AnnotationSpec> annotations) {
        List<AnnotationSpec> snapshot = Frame.copyAnnotations(annotations);
        return update(frameId, frame -> frame.setAnnotations(snapshot));
    }

    public Frame updateScale(String frameId, int scale) {
        RescaleStage.validateScale(scale);
        return update(frameId, frame -> frame.setScale(scale));
    }

    public synchronized Frame update(String frameId, Consumer<Frame> mutation) {
        Frame frame = require(frameId);
        mutation.accept(frame);
        return frame.copy();
    }

    /**
     * 删除帧记录及其图片文件
     */
    public synchronized void delete(String frameId) {
        Frame frame = require(frameId);
        frames.remove(frameId);
        deleteImage(frame);
        LOG.info("Frame {} deleted", frameId);
    }

    /**
     * 删除某视频的全部帧（含图片）
     */
    public synchronized int removeVideo(String videoId) {
        int removed = 0;
        Iterator<Frame> it = frames.values().iterator();
        while (it.hasNext()) {
            Frame frame = it.next();
            if (frame.getVideoId().equals(videoId)) {
                it.remove();
                deleteImage(frame);
                removed++;
            }
        }
        return removed;
    }

    /**
     * 用新的帧列表替换某视频的全部帧（图库导入）
     */
    public synchronized void replaceAll(String videoId, List<Frame> replacement) {
        removeVideo(videoId);
        for (Frame frame : replacement) {
            frames.put(frame.getId(), frame.copy());
        }
    }

    /**
     * 分类删除后，将其下的帧移到目标分类
     */
    public synchronized int reassignCategory(String fromCategoryId, String toCategoryId) {
        int moved = 0;
        for (Frame frame : frames.values()) {
            if (fromCategoryId.equals(frame.getCategoryId())) {
                frame.setCategoryId(toCategoryId);
                moved++;
            }
        }
        return moved;
    }

    private Frame require(String frameId) {
        Frame frame = frames.get(frameId);
        if (frame == null) {
            throw new NotFoundException("Frame not found: " + frameId);
        }
        return frame;
    }

    private void deleteImage(Frame frame) {
        if (frame.getImagePath() == null) {
            return;
        }
        try {
            Files.deleteIfExists(Paths.get(frame.getImagePath()));
        } catch (IOException e) {
            LOG.warn("Could not delete frame image {}", frame.getImagePath(), e);
        }
    }
}
