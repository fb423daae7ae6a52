package com.notionexport.core.output.impl;

import com.notionexport.core.output.ExportOutput;
import com.notionexport.core.output.OutputContext;
import com.notionexport.core.output.OutputFile;
import com.notionexport.core.output.OutputRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes export files as UTF-8 under the output directory.
 *
 * <p>Creates missing directories and overwrites existing files.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public String getDescription() {
        return "Writes Markdown files to the output directory";
    }

    @Override
    public void render(ExportOutput output, OutputContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.info("Writing {} files to: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (OutputFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, OutputFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.debug("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
