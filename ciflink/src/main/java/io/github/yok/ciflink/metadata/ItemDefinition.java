package io.github.yok.ciflink.metadata;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dictionary definition of one item.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemDefinition {

    // item name without category prefix, e.g. "id"
    private String name;

    private String category;

    // dictionary type code, e.g. "code", "int", "text"
    private String typeCode;

    private String description;

    private boolean mandatory;

    private List<String> enumerations = new ArrayList<>();
}
