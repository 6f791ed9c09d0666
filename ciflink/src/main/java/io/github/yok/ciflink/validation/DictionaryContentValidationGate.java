package io.github.yok.ciflink.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.ciflink.codec.JsonValues;
import io.github.yok.ciflink.mapping.CategoryMapping;
import io.github.yok.ciflink.mapping.ItemMapping;
import io.github.yok.ciflink.mapping.MappingRules;
import io.github.yok.ciflink.model.NullValues;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Checks the values of a nested tree against the dictionary.
 *
 * <ul>
 * <li>Items of dictionary-defined categories must be defined.</li>
 * <li>Values of enumerated items must be one of the enumeration values (case-insensitive).</li>
 * <li>Values of numeric items must be numbers.</li>
 * </ul>
 *
 * <p>
 * Null values are never violations.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DictionaryContentValidationGate implements ValidationGate<JsonNode, MappingRules> {

    @Override
    public ValidationResult validate(JsonNode document, MappingRules rules) {
        List<String> errors = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> blocks = document.fields();
        while (blocks.hasNext()) {
            Map.Entry<String, JsonNode> block = blocks.next();
            Iterator<Map.Entry<String, JsonNode>> categories = block.getValue().fields();
            while (categories.hasNext()) {
                Map.Entry<String, JsonNode> c = categories.next();
                checkCategory(c.getKey(), c.getValue(), rules, errors,
                        block.getKey() + "/" + c.getKey());
            }
        }
        return ValidationResult.of(errors);
    }

    private void checkCategory(String category, JsonNode value, MappingRules rules,
            List<String> errors, String path) {
        if (value.isObject()) {
            checkRecord(category, value, rules, errors, path);
        } else if (value.isArray()) {
            for (int i = 0; i < value.size(); i++) {
                if (value.get(i).isObject()) {
                    checkRecord(category, value.get(i), rules, errors, path + "[" + i + "]");
                }
            }
        }
    }

    private void checkRecord(String category, JsonNode record, MappingRules rules,
            List<String> errors, String path) {
        CategoryMapping mapping = rules.getCategory(category);
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if (f.getValue().isContainerNode()) {
                checkCategory(f.getKey(), f.getValue(), rules, errors, path + "/" + f.getKey());
                continue;
            }
            if (mapping == null) {
                continue;
            }
            ItemMapping item = mapping.getItem(f.getKey());
            if (item == null) {
                if (mapping.isDefined()) {
                    errors.add(path + ": unknown item _" + category + "." + f.getKey());
                }
                continue;
            }
            String text = JsonValues.toText(f.getValue());
            if (NullValues.isNull(text)) {
                continue;
            }
            if (item.isNumeric() && !JsonValues.isNumber(text)) {
                errors.add(path + ": _" + category + "." + f.getKey() + " = '" + text
                        + "' is not a number");
            }
            if (!item.getEnumerations().isEmpty() && item.getEnumerations().stream()
                    .noneMatch(e -> e.equalsIgnoreCase(text))) {
                errors.add(path + ": _" + category + "." + f.getKey() + " = '" + text
                        + "' is not one of " + item.getEnumerations());
            }
        }
    }
}
