package fr.lapetina.configstore.domain.provider;

import fr.lapetina.configstore.domain.model.Item;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FileProviderTest {

    @TempDir
    Path tempDir;

    private Path file;
    private AtomicInteger changes;
    private FileProvider provider;
    private Instant loadedAt;

    @BeforeEach
    void setUp() throws IOException {
        file = tempDir.resolve("app.yaml");
        loadedAt = Instant.now();
        Files.writeString(file, "- key: x\n  value: \"1\"\n  priority: 10\n");
        Files.setLastModifiedTime(file, FileTime.from(loadedAt.minusSeconds(5)));

        changes = new AtomicInteger();
        provider = new FileProvider(
                file,
                new YamlItemDecoder(),
                FileProvider.readItems(file, new YamlItemDecoder()),
                loadedAt,
                changes::incrementAndGet
        );
    }

    private void rewrite(String content, int secondsAhead) throws IOException {
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, FileTime.from(loadedAt.plusSeconds(secondsAhead)));
    }

    private String currentValue() {
        return provider.load().items().get(0).value();
    }

    @Test
    @DisplayName("should be named after its path")
    void shouldBeNamedAfterPath() {
        assertThat(provider.name()).isEqualTo("file:" + file);
        assertThat(provider.load().items()).containsExactly(Item.of("x", "1", 10));
    }

    @Test
    @DisplayName("should skip when the file is not newer than last seen")
    void shouldSkipUnmodifiedFile() {
        assertThat(provider.reloadIfModified()).isEqualTo(FileProvider.RefreshOutcome.UNCHANGED);
        assertThat(changes).hasValue(0);
    }

    @Test
    @DisplayName("should swap items and notify when the file changes")
    void shouldReloadModifiedFile() throws IOException {
        rewrite("- key: x\n  value: \"2\"\n  priority: 10\n", 60);

        assertThat(provider.reloadIfModified()).isEqualTo(FileProvider.RefreshOutcome.RELOADED);
        assertThat(currentValue()).isEqualTo("2");
        assertThat(changes).hasValue(1);

        // Same modification time again: nothing to do
        assertThat(provider.reloadIfModified()).isEqualTo(FileProvider.RefreshOutcome.UNCHANGED);
        assertThat(changes).hasValue(1);
    }

    @Test
    @DisplayName("should keep previous items when new content does not decode")
    void shouldKeepItemsOnDecodeFailure() throws IOException {
        rewrite("- key: [broken", 60);

        assertThat(provider.reloadIfModified()).isEqualTo(FileProvider.RefreshOutcome.FAILED);
        assertThat(currentValue()).isEqualTo("1");
        assertThat(changes).hasValue(0);
    }

    @Test
    @DisplayName("should not retry a bad write until the file changes again")
    void shouldNotRetryBadWrite() throws IOException {
        rewrite("- key: [broken", 60);
        provider.reloadIfModified();

        assertThat(provider.reloadIfModified()).isEqualTo(FileProvider.RefreshOutcome.UNCHANGED);

        rewrite("- key: x\n  value: \"3\"\n  priority: 10\n", 120);
        assertThat(provider.reloadIfModified()).isEqualTo(FileProvider.RefreshOutcome.RELOADED);
        assertThat(currentValue()).isEqualTo("3");
    }

    @Test
    @DisplayName("should keep previous items when the file disappears")
    void shouldKeepItemsWhenFileDeleted() throws IOException {
        Files.delete(file);

        assertThat(provider.reloadIfModified()).isEqualTo(FileProvider.RefreshOutcome.FAILED);
        assertThat(currentValue()).isEqualTo("1");
    }

    @Test
    @DisplayName("should stop its attached refresh task on close")
    void shouldCloseAttachedTask() {
        AtomicInteger closed = new AtomicInteger();
        provider.attachRefreshTask(closed::incrementAndGet);
        assertThat(provider.isRefreshing()).isTrue();

        provider.close();
        provider.close();

        assertThat(closed).hasValue(1);
        assertThat(provider.isRefreshing()).isFalse();
    }

    @Test
    @DisplayName("should read items with a custom decoder")
    void shouldUseCustomDecoder() throws IOException {
        Files.writeString(file, "a=1\nb=2\n");
        ItemDecoder properties = content -> new String(content).lines()
                .map(line -> line.split("=", 2))
                .map(parts -> Item.of(parts[0], parts[1], 1))
                .toList();

        List<Item> items = FileProvider.readItems(file, properties);

        assertThat(items).containsExactly(Item.of("a", "1", 1), Item.of("b", "2", 1));
    }
}
