package io.github.yok.ciflink.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Structural gate for nested JSON documents, backed by JSON Schema 2020-12.
 *
 * @author Yasuharu.Okawauchi
 */
public class JsonSchemaValidationGate implements ValidationGate<JsonNode, JsonNode> {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    @Override
    public ValidationResult validate(JsonNode document, JsonNode schema) {
        JsonSchema jsonSchema = SCHEMA_FACTORY.getSchema(schema);
        Set<ValidationMessage> messages = jsonSchema.validate(document);
        List<String> errors = new ArrayList<>();
        for (ValidationMessage m : messages) {
            errors.add(m.getMessage());
        }
        errors.sort(null);
        return ValidationResult.of(errors);
    }
}
