package com.notionexport.core.output.impl;

import com.notionexport.core.output.ExportOutput;
import com.notionexport.core.output.OutputContext;
import com.notionexport.core.output.OutputFile;
import com.notionexport.core.output.OutputRenderer;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ConsoleRenderer renderer = new ConsoleRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    private final ExportOutput output = new ExportOutput(List.of(
        OutputFile.markdown("a.md", "Alpha\n"),
        OutputFile.markdown("b.md", "Beta\n")));

    @Test
    void render_withHeaders_printsEveryFile() {
        renderer.render(output, new OutputContext("unused", Map.of()));

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("File 1/2: a.md", "Alpha", "File 2/2: b.md", "Beta");
        assertThat(printed).contains("-".repeat(78));
    }

    @Test
    void render_withoutHeaders_customSeparator() {
        renderer.render(output, new OutputContext("unused", Map.of(
            "console.showHeaders", "false",
            "console.separator", "=")));

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertThat(printed).doesNotContain("File 1/2");
        assertThat(printed).startsWith("Alpha\n" + "=".repeat(80));
    }

    @Test
    void find_registeredRenderers() {
        assertThat(OutputRenderer.find("console")).containsInstanceOf(ConsoleRenderer.class);
        assertThat(OutputRenderer.find("FILESYSTEM")).containsInstanceOf(FileSystemRenderer.class);
        assertThat(OutputRenderer.find("pdf")).isEmpty();
    }

    @Test
    void writesToDisk_onlyForFilesystem() {
        assertThat(renderer.writesToDisk()).isFalse();
        assertThat(new FileSystemRenderer().writesToDisk()).isTrue();
    }
}
