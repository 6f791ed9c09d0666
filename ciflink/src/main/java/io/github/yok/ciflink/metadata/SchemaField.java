package io.github.yok.ciflink.metadata;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One field of a schema category: an attribute, a child element or the element content.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchemaField {

    private String name;

    private ItemLocation location;

    // XSD type name, e.g. "xsd:string"
    private String type;

    private boolean required;
}
