package com.notionexport.core.output.impl;

import com.notionexport.core.output.ExportOutput;
import com.notionexport.core.output.OutputContext;
import com.notionexport.core.output.OutputFile;
import com.notionexport.core.output.OutputRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints export files to standard output instead of writing them.
 *
 * <p>Useful for previewing an export. Settings:
 * <ul>
 *   <li>{@code console.separator} - separator repeated between files (default: "---")</li>
 *   <li>{@code console.showHeaders} - print a header per file ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public String getDescription() {
        return "Prints Markdown files to standard output";
    }

    @Override
    public boolean writesToDisk() {
        return false;
    }

    @Override
    public void render(ExportOutput output, OutputContext context) {
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));
        String line = separator.repeat(Math.max(1, LINE_WIDTH / Math.max(1, separator.length())));

        logger.info("Printing {} files to console", output.files().size());

        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            OutputFile file = output.files().get(i);
            if (showHeaders) {
                out.println("File " + (i + 1) + "/" + total + ": " + file.relativePath());
                out.println();
            }
            out.print(file.content());
            out.println(line);
        }
    }
}
