package io.github.yok.ciflink.validation;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JsonSchemaValidationGateTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonSchemaValidationGate gate = new JsonSchemaValidationGate();
    private JsonNode schema;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/schemas/nested-json-schema.json")) {
            schema = mapper.readTree(in);
        }
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    @Test
    void validate_正常ケース_入れ子形式の文書を指定する_妥当と判定されること() throws Exception {
        JsonNode doc = json("{'1ABC': {'entry': {'id': '1ABC'}, 'entity': [{'id': '1',"
                + " 'formula_weight': 14331.16, 'details': null,"
                + " 'struct_asym': [{'id': 'A'}]}]}}");

        ValidationResult result = gate.validate(doc, schema);

        assertTrue(result.isValid(), () -> result.getErrors().toString());
    }

    @Test
    void validate_異常ケース_カテゴリがスカラーの文書を指定する_違反が報告されること() throws Exception {
        ValidationResult result = gate.validate(json("{'1ABC': {'entry': '1ABC'}}"), schema);

        assertFalse(result.isValid());
        assertFalse(result.getErrors().isEmpty());
    }

    @Test
    void validate_異常ケース_ブロックが配列の文書を指定する_違反が報告されること() throws Exception {
        ValidationResult result = gate.validate(json("{'1ABC': [{'id': '1'}]}"), schema);

        assertFalse(result.isValid());
    }

    @Test
    void validate_異常ケース_レコード配列に文字列を含む_違反が報告されること() throws Exception {
        ValidationResult result =
                gate.validate(json("{'1ABC': {'chem_comp': ['LYS']}}"), schema);

        assertFalse(result.isValid());
    }
}
