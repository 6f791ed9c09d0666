package io.github.yok.ciflink.model;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Ordered collection of data blocks. This is the flat side of every conversion.
 *
 * @author Yasuharu.Okawauchi
 */
public class DataContainer {

    private final Map<String, DataBlock> blocks = new LinkedHashMap<>();

    /**
     * Adds a block. Block names are unique.
     *
     * @param block block to add
     * @return this container
     */
    public DataContainer addBlock(DataBlock block) {
        Validate.isTrue(!blocks.containsKey(block.getName()), "Duplicate data block '%s'.",
                block.getName());
        blocks.put(block.getName(), block);
        return this;
    }

    public DataBlock getBlock(String name) {
        return blocks.get(name);
    }

    public List<DataBlock> getBlocks() {
        return ImmutableList.copyOf(blocks.values());
    }

    public List<String> getBlockNames() {
        return ImmutableList.copyOf(blocks.keySet());
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
