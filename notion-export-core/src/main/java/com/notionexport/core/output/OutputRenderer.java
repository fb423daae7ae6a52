package com.notionexport.core.output;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Writes the files of an export to a destination.
 *
 * <p>Implementations are discovered via Java Service Provider Interface (SPI). Register them in
 * {@code META-INF/services/com.notionexport.core.output.OutputRenderer}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public void render(ExportOutput output, OutputContext context) {
 *         Path outputDir = Paths.get(context.outputDirectory());
 *         for (OutputFile file : output.files()) {
 *             Files.writeString(outputDir.resolve(file.relativePath()), file.content());
 *         }
 *     }
 * }
 * }</pre>
 */
public interface OutputRenderer {

    /**
     * Returns the unique, lower-case identifier used on the command line (e.g. "filesystem").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Returns a one-line description for {@code list renderers}.
     *
     * @return description
     */
    String getDescription();

    /**
     * Whether rendered files end up in the output directory.
     *
     * @return true unless the renderer only previews the export
     */
    default boolean writesToDisk() {
        return true;
    }

    /**
     * Writes every file of the output.
     *
     * @param output files to write
     * @param context destination settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(ExportOutput output, OutputContext context);

    /**
     * Finds a registered renderer by id.
     *
     * @param id renderer id
     * @return renderer, or empty if none is registered under that id
     */
    static Optional<OutputRenderer> find(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equalsIgnoreCase(id)) {
                return Optional.of(renderer);
            }
        }
        return Optional.empty();
    }
}
