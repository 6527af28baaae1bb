package me.golemcore.gateway.adapter.outbound.storage;

import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "test-dir";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void init_createsWorkspaceDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("models")));
        assertTrue(Files.isDirectory(tempDir.resolve("usage")));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "file.txt", "Hello").get();

        assertEquals("Hello", storageAdapter.getText(TEST_DIR, "file.txt").get());
    }

    @Test
    void putText_overwritesExistingContent() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "file.txt", "first version").get();
        storageAdapter.putText(TEST_DIR, "file.txt", "second").get();

        assertEquals("second", storageAdapter.getText(TEST_DIR, "file.txt").get());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.txt").get());
    }

    @Test
    void exists_reflectsFilePresence() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "existing.txt", "x").get();

        assertTrue(storageAdapter.exists(TEST_DIR, "existing.txt").get());
        assertFalse(storageAdapter.exists(TEST_DIR, "other.txt").get());
    }

    @Test
    void appendText_appendsToExistingFile() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(TEST_DIR, "log.jsonl", "a\n").get();
        storageAdapter.appendText(TEST_DIR, "log.jsonl", "b\n").get();

        assertEquals("a\nb\n", storageAdapter.getText(TEST_DIR, "log.jsonl").get());
    }

    @Test
    void listObjects_returnsSortedRelativePaths() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "b.txt", "b").get();
        storageAdapter.putText(TEST_DIR, "a.txt", "a").get();

        assertEquals(List.of("a.txt", "b.txt"), storageAdapter.listObjects(TEST_DIR, "").get());
    }

    @Test
    void listObjects_returnsEmptyForMissingDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("nowhere", "").get().isEmpty());
    }

    @Test
    void resolvePath_blocksTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../etc/passwd").join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
