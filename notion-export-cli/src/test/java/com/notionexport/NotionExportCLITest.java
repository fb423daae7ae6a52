package com.notionexport;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NotionExportCLI} and the {@code list} command.
 */
class NotionExportCLITest {

    private final ch.qos.logback.classic.Logger root =
        (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    private final Level originalLevel = root.getLevel();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @AfterEach
    void restoreLevel() {
        root.setLevel(originalLevel);
    }

    private int run(String... args) {
        CommandLine commandLine = NotionExportCLI.commandLine(new NotionExportCLI());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void listBlocks_printsSupportedTypes() {
        int exitCode = run("list", "blocks");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("Supported Block Types:", "• paragraph", "• table_row", "• link_to_page");
    }

    @Test
    void listRenderers_discoversBothRenderers() {
        int exitCode = run("list", "renderers");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("(ID: filesystem)", "(ID: console)");
    }

    @Test
    void listUnknownType_usageError() {
        assertThat(run("list", "widgets")).isEqualTo(2);
        assertThat(err.toString()).contains("Unknown type: widgets");
    }

    @Test
    void verboseFlag_setsDebugBeforeSubcommandRuns() {
        run("-v", "list", "blocks");

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void quietFlag_setsError() {
        run("-q", "list", "blocks");

        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void exportWithoutRoot_picocliUsageError() {
        assertThat(run("export")).isEqualTo(2);
        assertThat(err.toString()).contains("Missing required parameter");
    }
}
