package io.github.yok.ciflink.metadata;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields the XML schema declares for one category's row element.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchemaCategory {

    private String name;

    private Map<String, SchemaField> fields = new LinkedHashMap<>();

    public SchemaCategory(String name) {
        this.name = name;
    }
}
