package com.notionexport.core.output.impl;

import com.notionexport.core.output.ExportOutput;
import com.notionexport.core.output.OutputContext;
import com.notionexport.core.output.OutputFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withMultipleFiles_writesAllFilesAsUtf8() throws IOException {
        // Given
        ExportOutput output = new ExportOutput(List.of(
            OutputFile.markdown("cafe--0123abcdef.md", "# Café ☕\n"),
            OutputFile.markdown("_INDEX.md", "# Notion Export Index\n\n")));
        OutputContext context = new OutputContext(tempDir.toString(), Map.of());

        // When
        renderer.render(output, context);

        // Then
        assertThat(Files.readString(tempDir.resolve("cafe--0123abcdef.md"))).isEqualTo("# Café ☕\n");
        assertThat(Files.readString(tempDir.resolve("_INDEX.md"))).isEqualTo("# Notion Export Index\n\n");
    }

    @Test
    void render_withExistingFile_overwritesFile() throws IOException {
        // Given
        Path existingFile = tempDir.resolve("page.md");
        Files.writeString(existingFile, "Old content");
        ExportOutput output = new ExportOutput(List.of(OutputFile.markdown("page.md", "New content")));

        // When
        renderer.render(output, new OutputContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(existingFile)).isEqualTo("New content");
    }

    @Test
    void render_withNonExistentOutputDirectory_createsDirectory() {
        // Given
        Path newDir = tempDir.resolve("notion_export/nested");
        ExportOutput output = new ExportOutput(List.of(OutputFile.markdown("page.md", "Content")));

        // When
        renderer.render(output, new OutputContext(newDir.toString(), Map.of()));

        // Then
        assertThat(newDir.resolve("page.md")).exists();
    }

    @Test
    void render_outputDirectoryIsAFile_throwsIllegalState() throws IOException {
        // Given
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        ExportOutput output = new ExportOutput(List.of(OutputFile.markdown("page.md", "Content")));

        // When / Then
        assertThatThrownBy(() -> renderer.render(output, new OutputContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class);
    }
}
