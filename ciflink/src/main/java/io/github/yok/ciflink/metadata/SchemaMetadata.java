package io.github.yok.ciflink.metadata;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata parsed from an XML schema.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
public class SchemaMetadata implements Metadata {

    private Map<String, SchemaCategory> categories = new LinkedHashMap<>();

    @Override
    public Set<String> categoryNames() {
        return categories.keySet();
    }
}
