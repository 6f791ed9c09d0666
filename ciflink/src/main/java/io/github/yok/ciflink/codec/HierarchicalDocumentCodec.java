package io.github.yok.ciflink.codec;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.File;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Reads and writes nested trees as JSON or YAML files. The format follows the file extension.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class HierarchicalDocumentCodec {

    /**
     * Reads a tree.
     *
     * @param file {@code .json}, {@code .yaml} or {@code .yml} file
     * @return tree
     * @throws IOException if the file cannot be read or parsed
     */
    public JsonNode read(File file) throws IOException {
        return DocumentMappers.forFormat(formatOf(file)).readTree(file);
    }

    /**
     * Writes a tree.
     *
     * @param tree tree to write
     * @param file target file; its extension selects JSON or YAML
     * @throws IOException if writing fails
     */
    public void write(JsonNode tree, File file) throws IOException {
        DocumentMappers.forFormat(formatOf(file)).writeValue(file, tree);
        log.info("Wrote document: {}", file.getAbsolutePath());
    }

    /**
     * Renders a tree as text.
     *
     * @param tree tree
     * @param format JSON or YAML
     * @return text
     * @throws IOException if serialization fails
     */
    public String writeString(JsonNode tree, DataFormat format) throws IOException {
        return DocumentMappers.forFormat(format).writeValueAsString(tree);
    }

    private static DataFormat formatOf(File file) {
        DataFormat format = DataFormat.fromExtension(FilenameUtils.getExtension(file.getName()));
        if (format != DataFormat.JSON && format != DataFormat.YAML) {
            throw new IllegalArgumentException("Not a JSON or YAML file: " + file);
        }
        return format;
    }
}
