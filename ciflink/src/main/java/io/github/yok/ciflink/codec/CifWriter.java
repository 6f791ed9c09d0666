package io.github.yok.ciflink.codec;

import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Writes a {@link DataContainer} as CIF text.
 *
 * <p>
 * Single-row categories are written as aligned {@code _category.item value} pairs; all others as
 * {@code loop_} tables. Values are quoted only when the bare form would not read back unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CifWriter {

    private static final String NL = "\n";

    /**
     * Writes the container to a file (UTF-8).
     *
     * @param container data to write
     * @param file target file
     * @throws IOException if writing fails
     */
    public void write(DataContainer container, File file) throws IOException {
        FileUtils.writeStringToFile(file, write(container), StandardCharsets.UTF_8);
        log.info("Wrote CIF file: {}", file.getAbsolutePath());
    }

    /**
     * Renders the container as CIF text.
     *
     * @param container data to render
     * @return CIF text
     */
    public String write(DataContainer container) {
        StringBuilder sb = new StringBuilder();
        for (DataBlock block : container.getBlocks()) {
            sb.append("data_").append(block.getName()).append(NL);
            writeCategories(sb, block);
            for (DataBlock frame : block.getSaveFrames()) {
                sb.append(NL).append("save_").append(frame.getName()).append(NL);
                writeCategories(sb, frame);
                sb.append("save_").append(NL);
            }
            sb.append(NL);
        }
        return sb.toString();
    }

    private void writeCategories(StringBuilder sb, DataBlock block) {
        for (Category category : block.getCategories()) {
            sb.append('#').append(NL);
            if (category.getRowCount() == 1) {
                writePairs(sb, category);
            } else {
                writeLoop(sb, category);
            }
        }
    }

    private void writePairs(StringBuilder sb, Category category) {
        int width = 0;
        for (String item : category.getItemNames()) {
            width = Math.max(width, tag(category, item).length());
        }
        for (String item : category.getItemNames()) {
            String value = format(category.getValue(0, item));
            sb.append(StringUtils.rightPad(tag(category, item), width + 1));
            if (value.startsWith(";")) {
                sb.append(NL);
            }
            sb.append(value).append(NL);
        }
    }

    private void writeLoop(StringBuilder sb, Category category) {
        sb.append("loop_").append(NL);
        List<String> items = category.getItemNames();
        for (String item : items) {
            sb.append(tag(category, item)).append(NL);
        }
        for (int r = 0; r < category.getRowCount(); r++) {
            StringBuilder line = new StringBuilder();
            for (String item : items) {
                String value = format(category.getValue(r, item));
                if (value.startsWith(";")) {
                    if (line.length() > 0) {
                        sb.append(line.toString().trim()).append(NL);
                        line.setLength(0);
                    }
                    sb.append(value).append(NL);
                } else {
                    line.append(value).append(' ');
                }
            }
            if (line.length() > 0) {
                sb.append(line.toString().trim()).append(NL);
            }
        }
    }

    private static String tag(Category category, String item) {
        return "_" + category.getName() + "." + item;
    }

    /**
     * Quotes a value for CIF output.
     *
     * @param value raw value; {@code null} is written as {@code ?}
     * @return CIF token
     */
    static String format(String value) {
        if (value == null) {
            return "?";
        }
        if (value.indexOf('\n') >= 0) {
            return ";" + value + NL + ";";
        }
        if (value.isEmpty()) {
            return "''";
        }
        if (!needsQuotes(value)) {
            return value;
        }
        if (!value.contains("' ") && !value.endsWith("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\" ") && !value.endsWith("\"")) {
            return "\"" + value + "\"";
        }
        return ";" + value + NL + ";";
    }

    private static boolean needsQuotes(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return true;
            }
        }
        char first = value.charAt(0);
        if (first == '_' || first == '#' || first == '$' || first == '\'' || first == '"'
                || first == ';' || first == '[' || first == ']') {
            return true;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return lower.startsWith("data_") || lower.startsWith("save_") || lower.equals("loop_")
                || lower.equals("stop_") || lower.equals("global_");
    }
}
