package io.github.yok.ciflink.codec;

import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Reads CIF text into a {@link DataContainer}.
 *
 * <p>
 * Supported constructs:
 * </p>
 * <ul>
 * <li>{@code data_<name>} block headers</li>
 * <li>{@code save_<name>} / {@code save_} frames (dictionary sources)</li>
 * <li>{@code _category.item value} pairs</li>
 * <li>{@code loop_} tables</li>
 * <li>single- and double-quoted values, and {@code ;}-delimited text fields</li>
 * <li>{@code #} comments</li>
 * </ul>
 *
 * <p>
 * Consecutive or scattered pairs of one category form a single-row category. A category must not
 * be declared twice in the same block or frame.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CifReader {

    private enum TokenType {
        DATA, SAVE, SAVE_END, LOOP, TAG, VALUE
    }

    private static final class Token {
        private final TokenType type;
        private final String text;
        private final int line;

        private Token(TokenType type, String text, int line) {
            this.type = type;
            this.text = text;
            this.line = line;
        }
    }

    /**
     * Reads a CIF file.
     *
     * @param file source file (UTF-8)
     * @return parsed container
     * @throws IOException if the file cannot be read
     */
    public DataContainer read(File file) throws IOException {
        String text = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
        DataContainer container = read(text);
        log.info("Read CIF file: {} ({} block(s))", file.getAbsolutePath(),
                container.getBlocks().size());
        return container;
    }

    /**
     * Parses CIF text.
     *
     * @param text CIF text
     * @return parsed container
     * @throws CifSyntaxException if the text is malformed
     */
    public DataContainer read(String text) {
        List<Token> tokens = tokenize(text);
        DataContainer container = new DataContainer();
        BlockBuilder block = null;
        BlockBuilder frame = null;

        int i = 0;
        while (i < tokens.size()) {
            Token t = tokens.get(i);
            switch (t.type) {
                case DATA:
                    if (frame != null) {
                        throw new CifSyntaxException("Unterminated save frame '" + frame.name
                                + "' before data block", t.line);
                    }
                    if (block != null) {
                        container.addBlock(block.build());
                    }
                    block = new BlockBuilder(t.text);
                    i++;
                    break;
                case SAVE:
                    requireBlock(block, t);
                    if (frame != null) {
                        throw new CifSyntaxException("Nested save frame '" + t.text + "'", t.line);
                    }
                    frame = new BlockBuilder(t.text);
                    i++;
                    break;
                case SAVE_END:
                    if (frame == null) {
                        throw new CifSyntaxException("save_ without open frame", t.line);
                    }
                    block.frames.add(frame.build());
                    frame = null;
                    i++;
                    break;
                case LOOP:
                    requireBlock(block, t);
                    i = readLoop(tokens, i + 1, frame != null ? frame : block);
                    break;
                case TAG:
                    requireBlock(block, t);
                    if (i + 1 >= tokens.size() || tokens.get(i + 1).type != TokenType.VALUE) {
                        throw new CifSyntaxException("Missing value for tag " + t.text, t.line);
                    }
                    (frame != null ? frame : block).addPair(t.text, tokens.get(i + 1).text, t.line);
                    i += 2;
                    break;
                default:
                    throw new CifSyntaxException("Unexpected value '" + t.text + "'", t.line);
            }
        }
        if (frame != null) {
            throw new CifSyntaxException("Unterminated save frame '" + frame.name + "'",
                    tokens.get(tokens.size() - 1).line);
        }
        if (block != null) {
            container.addBlock(block.build());
        }
        return container;
    }

    private static void requireBlock(BlockBuilder block, Token t) {
        if (block == null) {
            throw new CifSyntaxException("Content before the first data_ block", t.line);
        }
    }

    private int readLoop(List<Token> tokens, int start, BlockBuilder target) {
        int i = start;
        List<String> tags = new ArrayList<>();
        int loopLine = i < tokens.size() ? tokens.get(i).line : 0;
        while (i < tokens.size() && tokens.get(i).type == TokenType.TAG) {
            tags.add(tokens.get(i).text);
            i++;
        }
        if (tags.isEmpty()) {
            throw new CifSyntaxException("loop_ without tags", loopLine);
        }
        String categoryName = categoryOf(tags.get(0), loopLine);
        List<String> items = new ArrayList<>();
        for (String tag : tags) {
            if (!categoryOf(tag, loopLine).equals(categoryName)) {
                throw new CifSyntaxException(
                        "loop_ mixes categories " + categoryName + " and " + tag, loopLine);
            }
            items.add(itemOf(tag, loopLine));
        }
        List<List<String>> columns = new ArrayList<>();
        for (int c = 0; c < items.size(); c++) {
            columns.add(new ArrayList<>());
        }
        int n = 0;
        while (i < tokens.size() && tokens.get(i).type == TokenType.VALUE) {
            columns.get(n % items.size()).add(tokens.get(i).text);
            n++;
            i++;
        }
        if (n % items.size() != 0) {
            throw new CifSyntaxException("loop_ of " + categoryName + " has " + n
                    + " values, not a multiple of " + items.size() + " items", loopLine);
        }
        Category category = new Category(categoryName);
        for (int c = 0; c < items.size(); c++) {
            category.addItem(items.get(c), columns.get(c));
        }
        target.addCategory(category, loopLine);
        return i;
    }

    static String categoryOf(String tag, int line) {
        int dot = tag.indexOf('.');
        if (dot <= 1) {
            throw new CifSyntaxException("Tag must have the form _category.item: " + tag, line);
        }
        return tag.substring(1, dot);
    }

    static String itemOf(String tag, int line) {
        int dot = tag.indexOf('.');
        if (dot < 0 || dot == tag.length() - 1) {
            throw new CifSyntaxException("Tag must have the form _category.item: " + tag, line);
        }
        return tag.substring(dot + 1);
    }

    private List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int line = 1;
        int len = text.length();
        while (pos < len) {
            char c = text.charAt(pos);
            boolean lineStart = pos == 0 || text.charAt(pos - 1) == '\n';
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < len && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (c == ';' && lineStart) {
                int startLine = line;
                int end = text.indexOf("\n;", pos);
                if (end < 0) {
                    throw new CifSyntaxException("Unterminated text field", startLine);
                }
                String body = text.substring(pos + 1, end);
                if (body.endsWith("\r")) {
                    body = body.substring(0, body.length() - 1);
                }
                if (body.startsWith("\r\n")) {
                    body = body.substring(2);
                } else if (body.startsWith("\n")) {
                    body = body.substring(1);
                }
                tokens.add(new Token(TokenType.VALUE, body, startLine));
                for (int k = pos; k < end + 2; k++) {
                    if (text.charAt(k) == '\n') {
                        line++;
                    }
                }
                pos = end + 2;
            } else if (c == '\'' || c == '"') {
                int close = pos + 1;
                while (true) {
                    close = text.indexOf(c, close);
                    int newline = text.indexOf('\n', pos);
                    if (close < 0 || (newline >= 0 && newline < close)) {
                        throw new CifSyntaxException("Unterminated quoted value", line);
                    }
                    if (close + 1 >= len || Character.isWhitespace(text.charAt(close + 1))) {
                        break;
                    }
                    close++;
                }
                tokens.add(new Token(TokenType.VALUE, text.substring(pos + 1, close), line));
                pos = close + 1;
            } else {
                int end = pos;
                while (end < len && !Character.isWhitespace(text.charAt(end))) {
                    end++;
                }
                tokens.add(classify(text.substring(pos, end), line));
                pos = end;
            }
        }
        return tokens;
    }

    private static Token classify(String word, int line) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.startsWith("data_")) {
            return new Token(TokenType.DATA, word.substring(5), line);
        }
        if (lower.equals("save_")) {
            return new Token(TokenType.SAVE_END, word, line);
        }
        if (lower.startsWith("save_")) {
            return new Token(TokenType.SAVE, word.substring(5), line);
        }
        if (lower.equals("loop_")) {
            return new Token(TokenType.LOOP, word, line);
        }
        if (word.startsWith("_")) {
            return new Token(TokenType.TAG, word, line);
        }
        return new Token(TokenType.VALUE, word, line);
    }

    /**
     * Collects categories of one block or frame in first-seen order.
     */
    private static final class BlockBuilder {
        private final String name;
        private final Map<String, Object> entries = new LinkedHashMap<>();
        private final List<DataBlock> frames = new ArrayList<>();

        private BlockBuilder(String name) {
            this.name = name;
        }

        @SuppressWarnings("unchecked")
        private void addPair(String tag, String value, int line) {
            String categoryName = categoryOf(tag, line);
            String item = itemOf(tag, line);
            Object existing = entries.get(categoryName);
            if (existing instanceof Category) {
                throw new CifSyntaxException("Category " + categoryName
                        + " already declared as loop_", line);
            }
            Map<String, String> pairs = (Map<String, String>) existing;
            if (pairs == null) {
                pairs = new LinkedHashMap<>();
                entries.put(categoryName, pairs);
            }
            if (pairs.containsKey(item)) {
                throw new CifSyntaxException("Duplicate tag " + tag, line);
            }
            pairs.put(item, value);
        }

        private void addCategory(Category category, int line) {
            if (entries.containsKey(category.getName())) {
                throw new CifSyntaxException(
                        "Category " + category.getName() + " declared twice", line);
            }
            entries.put(category.getName(), category);
        }

        @SuppressWarnings("unchecked")
        private DataBlock build() {
            DataBlock block = new DataBlock(name.isEmpty() ? "unnamed" : name);
            for (Map.Entry<String, Object> e : entries.entrySet()) {
                if (e.getValue() instanceof Category) {
                    block.addCategory((Category) e.getValue());
                } else {
                    block.addCategory(
                            new Category(e.getKey()).addRow((Map<String, String>) e.getValue()));
                }
            }
            for (DataBlock frame : frames) {
                block.addSaveFrame(frame);
            }
            return block;
        }
    }
}
