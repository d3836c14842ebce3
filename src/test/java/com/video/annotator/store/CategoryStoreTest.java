package com.video.annotator.store;

import com.video.annotator.exception.ConflictException;
import com.video.annotator.exception.ForbiddenOperationException;
import com.video.annotator.exception.NotFoundException;
import com.video.annotator.exception.ValidationException;
import com.video.annotator.model.Category;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategoryStoreTest {

    @TempDir
    Path tempDir;

    private Path file;
    private CategoryStore store;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("data/categories.json");
        store = new CategoryStore(file);
    }

    private static ByteArrayInputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void missingFile_shouldBeInitializedWithDefaultCategory() {
        List<Category> categories = store.list();

        assertEquals(1, categories.size());
        assertEquals(Category.defaultCategory(), categories.get(0));
        assertTrue(Files.exists(file));
    }

    @Test
    void corruptFile_shouldBeReinitialized() throws Exception {
        Files.createDirectories(file.getParent());
        Files.write(file, "{broken".getBytes(StandardCharsets.UTF_8));

        assertEquals(1, store.list().size());
    }

    @Test
    void create_shouldTrimNameAndAssignColor() {
        Category created = store.create("  Gol  ");

        assertEquals("Gol", created.getName());
        assertEquals(Category.NEW_CATEGORY_COLOR, created.getColor());
        assertEquals(32, created.getId().length());
        assertEquals(2, new CategoryStore(file).list().size(), "应持久化到文件");
    }

    @Test
    void create_withBlankOrDuplicateName_shouldFail() {
        store.create("Falta");

        assertThrows(ValidationException.class, () -> store.create("   "));
        assertThrows(ConflictException.class, () -> store.create("Falta"));
        assertThrows(ConflictException.class, () -> store.create(Category.DEFAULT_NAME));
    }

    @Test
    void rename_shouldProtectDefaultCategory() {
        Category created = store.create("Falta");

        assertEquals("Pênalti", store.rename(created.getId(), " Pênalti ").getName());
        assertThrows(ForbiddenOperationException.class, () -> store.rename(Category.DEFAULT_ID, "x"));
        assertThrows(NotFoundException.class, () -> store.rename("missing", "x"));
    }

    @Test
    void delete_shouldProtectDefaultAndReturnFallback() {
        Category created = store.create("Falta");

        assertEquals(Category.DEFAULT_ID, store.delete(created.getId()));
        assertFalse(store.find(created.getId()).isPresent());
        assertThrows(ForbiddenOperationException.class, () -> store.delete(Category.DEFAULT_ID));
    }

    @Test
    void exportCategories_shouldExcludeDefault() {
        store.create("A");
        store.create("B");

        List<Category> exported = store.exportCategories();

        assertEquals(2, exported.size());
        assertTrue(exported.stream().noneMatch(Category::isDefault));
    }

    @Test
    void importCategories_shouldSkipBlankAndExistingNames() {
        store.create("A");

        ImportSummary summary = store.importCategories(json(
                "[{\"name\":\"A\"},{\"name\":\"  \"},{\"name\":\"B\",\"color\":\"#123456\"},{\"color\":\"#000\"},{\"name\":\"C\"}]"));

        assertEquals(2, summary.getImported());
        assertEquals(3, summary.getSkipped());
        assertEquals("#123456", store.findByName("B").get().getColor());
        assertEquals(Category.NEW_CATEGORY_COLOR, store.findByName("C").get().getColor());
    }

    @Test
    void importCategories_withNonList_shouldFail() {
        assertThrows(ValidationException.class, () -> store.importCategories(json("{\"name\":\"A\"}")));
        assertThrows(ValidationException.class, () -> store.importCategories(json("not json")));
    }

    @Test
    void reset_shouldLeaveOnlyDefault() {
        store.create("A");

        store.reset();

        assertEquals(1, store.list().size());
        assertEquals(Category.DEFAULT_NAME, store.findOrDefault("anything").getName());
    }
}
