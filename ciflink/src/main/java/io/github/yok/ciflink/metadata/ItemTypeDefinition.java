package io.github.yok.ciflink.metadata;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the dictionary's {@code item_type_list}.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemTypeDefinition {

    private String code;

    // "char", "uchar", "numb" or "null"
    private String primitiveCode;

    // regular expression the values must match
    private String construct;
}
