package com.notionexport.cli;

import com.notionexport.core.output.OutputRenderer;
import com.notionexport.core.remote.http.BlockJsonParser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list output renderers or supported block types.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * notion-export list renderers
 * notion-export list blocks
 * }</pre>
 */
@Command(
    name = "list",
    description = "List output renderers or supported block types",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: renderers or blocks"
    )
    String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "renderers", "renderer" -> listRenderers(out);
            case "blocks", "block" -> listBlocks(out);
            default -> {
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: renderers or blocks");
                yield 2;
            }
        };
    }

    private int listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            out.printf("  • %s (ID: %s)%n", renderer.getDescription(), renderer.getId());
        }

        if (!found) {
            out.println("  No renderers found.");
        }
        return 0;
    }

    private int listBlocks(PrintWriter out) {
        out.println("Supported Block Types:");
        out.println();
        for (String blockType : BlockJsonParser.SUPPORTED_TYPES) {
            out.println("  • " + blockType);
        }
        out.println();
        out.println("Other block types are exported as their plain text, if any.");
        return 0;
    }
}
