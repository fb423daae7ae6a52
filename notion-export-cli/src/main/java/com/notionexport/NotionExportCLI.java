package com.notionexport;

import ch.qos.logback.classic.Level;
import com.notionexport.cli.ExportCommand;
import com.notionexport.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point.
 *
 * <p>Exports a Notion page, or every page of a database, together with everything it links
 * to, as cross-linked Markdown files.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code export} - Export a page or database and every page reachable from it</li>
 *   <li>{@code list} - List output renderers or supported block types</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * export NOTION_TOKEN=secret_...
 * notion-export export https://www.notion.so/My-Page-0123456789abcdef0123456789abcdef
 *
 * notion-export -v export 01234567-89ab-cdef-0123-456789abcdef -o ./docs
 * }</pre>
 */
@Command(
    name = "notion-export",
    mixinStandardHelpOptions = true,
    version = "notion-export 1.0.0-SNAPSHOT",
    description = "Export a Notion page graph as cross-linked Markdown files",
    subcommands = {
        ExportCommand.class,
        ListCommand.class
    }
)
public class NotionExportCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("notion-export - Notion to Markdown exporter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'notion-export --help' to see available commands");
        System.out.println("Use 'notion-export <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @param cli root command instance
     * @return configured command line
     */
    static CommandLine commandLine(NotionExportCLI cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine(new NotionExportCLI()).execute(args);
        System.exit(exitCode);
    }
}
