package com.video.annotator.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.video.annotator.exception.AnnotatorException;
import com.video.annotator.exception.ConflictException;
import com.video.annotator.exception.ForbiddenOperationException;
import com.video.annotator.exception.NotFoundException;
import com.video.annotator.exception.ValidationException;
import com.video.annotator.model.Category;
import com.video.annotator.serialization.AnnotatorJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 分类存储（JSON文件）
 * 默认分类"Não categorizado"始终存在，不能改名或删除
 */
public class CategoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(CategoryStore.class);

    private static final TypeReference<List<Category>> CATEGORY_LIST = new TypeReference<List<Category>>() {
    };

    private final Path file;

    public CategoryStore(Path file) {
        this.file = file;
    }

    public synchronized List<Category> list() {
        return load();
    }

    public synchronized Optional<Category> find(String categoryId) {
        if (categoryId == null) {
            return Optional.empty();
        }
        return load().stream().filter(c -> categoryId.equals(c.getId())).findFirst();
    }

    /**
     * 按ID查找，不存在时返回默认分类
     */
    public synchronized Category findOrDefault(String categoryId) {
        return find(categoryId).orElseGet(Category::defaultCategory);
    }

    public synchronized Optional<Category> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return load().stream().filter(c -> name.equals(c.getName())).findFirst();
    }

    public synchronized Category create(String name) {
        String trimmed = requireName(name);
        List<Category> categories = load();
        if (categories.stream().anyMatch(c -> c.getName().equals(trimmed))) {
            throw new ConflictException("Category '" + trimmed + "' already exists");
        }
        Category category = new Category(newId(), trimmed, Category.NEW_CATEGORY_COLOR);
        categories.add(category);
        save(categories);
        LOG.info("Category created: {} ({})", trimmed, category.getId());
        return category;
    }

    public synchronized Category rename(String categoryId, String name) {
        String trimmed = requireName(name);
        List<Category> categories = load();
        Category target = categories.stream()
                .filter(c -> c.getId().equals(categoryId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Category not found: " + categoryId));
        if (target.isDefault()) {
            throw new ForbiddenOperationException("The default category cannot be edited");
        }
        if (categories.stream().anyMatch(c -> c.getName().equals(trimmed) && !c.getId().equals(categoryId))) {
            throw new ConflictException("Category '" + trimmed + "' already exists");
        }
        target.setName(trimmed);
        save(categories);
        return target;
    }

    /**
     * 删除分类，返回接收其帧的默认分类ID
     */
    public synchronized String delete(String categoryId) {
        List<Category> categories = load();
        Category target = categories.stream()
                .filter(c -> c.getId().equals(categoryId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Category not found: " + categoryId));
        if (target.isDefault()) {
            throw new ForbiddenOperationException("The default category cannot be deleted");
        }
        categories.remove(target);
        save(categories);
        LOG.info("Category deleted: {} ({})", target.getName(), categoryId);
        return Category.DEFAULT_ID;
    }

    /**
     * 导出除默认分类以外的全部分类
     */
    public synchronized List<Category> exportCategories() {
        List<Category> result = new ArrayList<>();
        for (Category category : load()) {
            if (!category.isDefault()) {
                result.add(category);
            }
        }
        return result;
    }

    /**
     * 导入分类列表，跳过空名称和已存在的名称
     */
    public synchronized ImportSummary importCategories(InputStream input) {
        JsonNode root;
        try {
            root = AnnotatorJson.mapper().readTree(input);
        } catch (IOException e) {
            throw new ValidationException("Category file is not valid JSON");
        }
        if (root == null || !root.isArray()) {
            throw new ValidationException("Category file must contain a JSON list");
        }

        List<Category> categories = load();
        Set<String> names = new HashSet<>();
        categories.forEach(c -> names.add(c.getName()));

        int imported = 0;
        int skipped = 0;
        for (JsonNode node : root) {
            String name = node.path("name").asText("").trim();
            if (name.isEmpty() || names.contains(name)) {
                skipped++;
                continue;
            }
            String color = node.path("color").asText(Category.NEW_CATEGORY_COLOR);
            categories.add(new Category(newId(), name, color));
            names.add(name);
            imported++;
        }
        save(categories);
        LOG.info("Categories imported: {}, skipped: {}", imported, skipped);
        return new ImportSummary(imported, skipped);
    }

    /**
     * 重置为只含默认分类
     */
    public synchronized List<Category> reset() {
        List<Category> categories = new ArrayList<>();
        categories.add(Category.defaultCategory());
        save(categories);
        return categories;
    }

    private List<Category> load() {
        if (Files.isRegularFile(file)) {
            try (InputStream input = Files.newInputStream(file)) {
                List<Category> categories = AnnotatorJson.read(input, CATEGORY_LIST, "categories");
                if (categories != null) {
                    return new ArrayList<>(categories);
                }
            } catch (IOException | ValidationException e) {
                LOG.warn("Category file {} is unreadable, re-initializing", file, e);
            }
        }
        return reset();
    }

    private void save(List<Category> categories) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, AnnotatorJson.writeBytes(categories));
        } catch (IOException e) {
            LOG.error("Error saving categories to {}", file, e);
            throw new AnnotatorException("Failed to save categories", e);
        }
    }

    private static String requireName(String name) {
        String trimmed = name != null ? name.trim() : "";
        if (trimmed.isEmpty()) {
            throw new ValidationException("Category name must not be empty");
        }
        return trimmed;
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
