package io.github.yok.ciflink.mapping;

import io.github.yok.ciflink.metadata.ItemLocation;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Mapping of one item: its XML placement and value type.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor
public class ItemMapping {

    private final String name;

    private final ItemLocation location;

    // dictionary type code, or the XSD type for schema-only items
    private final String typeCode;

    private final boolean numeric;

    private final List<String> enumerations;

    private final boolean mandatory;
}
