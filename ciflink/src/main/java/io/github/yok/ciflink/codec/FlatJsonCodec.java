package io.github.yok.ciflink.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import io.github.yok.ciflink.model.Row;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Flat record interchange as JSON: {@code {block: {category: record | [records]}}}.
 *
 * <p>
 * Values are written as CIF text, null tokens included, so the form is lossless. A category with
 * one row is written as an object, otherwise as a list. Both forms are accepted on reading.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FlatJsonCodec {

    private final ObjectMapper mapper = DocumentMappers.json();

    /**
     * Converts records to a flat tree.
     *
     * @param container records
     * @return flat tree
     */
    public ObjectNode toTree(DataContainer container) {
        ObjectNode root = mapper.createObjectNode();
        for (DataBlock block : container.getBlocks()) {
            ObjectNode blockNode = root.putObject(block.getName());
            for (Category category : block.getCategories()) {
                if (category.getRowCount() == 1) {
                    blockNode.set(category.getName(), toObject(category.getRow(0)));
                } else {
                    ArrayNode rows = blockNode.putArray(category.getName());
                    for (Row row : category.getRows()) {
                        rows.add(toObject(row));
                    }
                }
            }
        }
        return root;
    }

    /**
     * Reads records from a flat tree. Items missing from a record become {@code ?}.
     *
     * @param root flat tree
     * @return records
     * @throws IllegalArgumentException if a category holds anything but records
     */
    public DataContainer fromTree(JsonNode root) {
        DataContainer container = new DataContainer();
        Iterator<Map.Entry<String, JsonNode>> blocks = root.fields();
        while (blocks.hasNext()) {
            Map.Entry<String, JsonNode> b = blocks.next();
            DataBlock block = new DataBlock(b.getKey());
            Iterator<Map.Entry<String, JsonNode>> categories = b.getValue().fields();
            while (categories.hasNext()) {
                Map.Entry<String, JsonNode> c = categories.next();
                List<Map<String, String>> records = new ArrayList<>();
                if (c.getValue().isObject()) {
                    records.add(toRecord(c.getKey(), c.getValue()));
                } else if (c.getValue().isArray()) {
                    for (JsonNode element : c.getValue()) {
                        records.add(toRecord(c.getKey(), element));
                    }
                } else {
                    throw new IllegalArgumentException(
                            "Category " + c.getKey() + " must be an object or a list");
                }
                block.addCategory(
                        Category.fromRecords(StringUtils.removeStart(c.getKey(), "_"), records));
            }
            container.addBlock(block);
        }
        return container;
    }

    public void write(DataContainer container, File file) throws IOException {
        mapper.writeValue(file, toTree(container));
        log.info("Wrote flat JSON: {}", file.getAbsolutePath());
    }

    public DataContainer read(File file) throws IOException {
        return fromTree(mapper.readTree(file));
    }

    private ObjectNode toObject(Row row) {
        ObjectNode node = mapper.createObjectNode();
        for (Map.Entry<String, String> e : row.toMap().entrySet()) {
            node.put(e.getKey(), e.getValue());
        }
        return node;
    }

    private static Map<String, String> toRecord(String category, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Records of " + category + " must be objects");
        }
        Map<String, String> record = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            record.put(f.getKey(), JsonValues.toText(f.getValue()));
        }
        return record;
    }
}
