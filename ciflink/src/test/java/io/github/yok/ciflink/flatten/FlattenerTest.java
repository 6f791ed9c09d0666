package io.github.yok.ciflink.flatten;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.ciflink.codec.CifReader;
import io.github.yok.ciflink.codec.DocumentMappers;
import io.github.yok.ciflink.config.ConversionMode;
import io.github.yok.ciflink.mapping.MappingGenerator;
import io.github.yok.ciflink.mapping.MappingRules;
import io.github.yok.ciflink.metadata.CacheManager;
import io.github.yok.ciflink.metadata.MetadataCache;
import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import io.github.yok.ciflink.model.Row;
import io.github.yok.ciflink.resolve.RelationshipResolver;
import io.github.yok.ciflink.validation.StructuralValidationException;
import java.io.File;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FlattenerTest {

    private final ObjectMapper mapper = DocumentMappers.json();
    private final Flattener flattener = new Flattener();
    private MappingRules rules;

    @BeforeEach
    void setUp() throws Exception {
        rules = new MappingGenerator(new MetadataCache(new CacheManager())).getMappingRules(
                Paths.get(getClass().getResource("/metadata/test_dict.dic").toURI()), null);
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    // 行の並びに依存しない比較用の表現
    private static Map<String, List<String>> records(DataBlock block) {
        Map<String, List<String>> result = new TreeMap<>();
        for (Category category : block.getCategories()) {
            List<String> rows = new ArrayList<>();
            for (Row row : category.getRows()) {
                rows.add(new TreeMap<>(row.toMap()).toString());
            }
            rows.sort(null);
            result.put(category.getName(), rows);
        }
        return result;
    }

    @Test
    void flatten_正常ケース_入れ子の子レコードに外部キーがない_親の値で補完されること() throws Exception {
        JsonNode tree = json("{'X': {'entity': {'id': '1', 'type': 'polymer',"
                + " 'struct_asym': [{'id': 'A'}, {'id': 'B'}]}}}");

        DataBlock block = flattener.flatten(tree, rules).getBlock("X");

        Category asym = block.getCategory("struct_asym");
        assertEquals(Arrays.asList("A", "B"), asym.getValues("id"));
        assertEquals(Arrays.asList("1", "1"), asym.getValues("entity_id"));
        assertEquals(Arrays.asList("id", "type"), block.getCategory("entity").getItemNames());
    }

    @Test
    void flatten_正常ケース_子レコードが外部キーを持つ_子の値が優先されること() throws Exception {
        JsonNode tree = json("{'X': {'entity': {'id': '1',"
                + " 'struct_asym': {'id': 'A', 'entity_id': '7'}}}}");

        Category asym = flattener.flatten(tree, rules).getBlock("X").getCategory("struct_asym");

        assertEquals("7", asym.getValue(0, "entity_id"));
    }

    @Test
    void flatten_正常ケース_多段の入れ子_各段で直近の親から補完されること() throws Exception {
        JsonNode tree = json("{'X': {'entity': [{'id': '1', 'entity_poly': {'type': 'x',"
                + " 'entity_poly_seq': [{'num': 1, 'mon_id': 'LYS'}]}}]}}");

        DataBlock block = flattener.flatten(tree, rules).getBlock("X");

        assertEquals("1", block.getCategory("entity_poly").getValue(0, "entity_id"));
        Category seq = block.getCategory("entity_poly_seq");
        assertEquals("1", seq.getValue(0, "entity_id"));
        assertEquals("1", seq.getValue(0, "num"));
    }

    @Test
    void flatten_正常ケース_レコードごとに項目が異なる_欠けた項目が疑問符で補完されること()
            throws Exception {
        JsonNode tree = json("{'X': {'chem_comp': [{'id': 'LYS', 'name': 'LYSINE'},"
                + " {'id': 'HOH'}, {'id': 'VAL', 'name': null}]}}");

        Category chem = flattener.flatten(tree, rules).getBlock("X").getCategory("chem_comp");

        assertEquals(Arrays.asList("LYSINE", "?", "?"), chem.getValues("name"));
    }

    @Test
    void flatten_正常ケース_先頭アンダースコア付きのキー_除去して扱われること() throws Exception {
        JsonNode tree = json("{'X': {'_entity': {'id': '1', '_struct_asym': [{'id': 'A'}]}}}");

        DataBlock block = flattener.flatten(tree, rules).getBlock("X");

        assertEquals(Arrays.asList("entity", "struct_asym"), block.getCategoryNames());
        assertEquals("1", block.getCategory("struct_asym").getValue(0, "entity_id"));
    }

    @Test
    void flatten_異常ケース_未知の入れ子キーを含む_StructuralValidationExceptionが送出されること()
            throws Exception {
        JsonNode tree = json("{'X': {'entity': {'id': '1', 'extras': {'a': 'b'}}}}");

        StructuralValidationException ex = assertThrows(StructuralValidationException.class,
                () -> flattener.flatten(tree, rules));

        assertTrue(ex.getViolations().get(0).contains("Unknown nested key 'extras'"));
    }

    @Test
    void flatten_異常ケース_カテゴリがスカラーの場合_全ての違反がまとめて報告されること()
            throws Exception {
        JsonNode tree = json("{'X': {'entry': '1ABC', 'entity': {'id': '1', 'struct_asym': 'A'},"
                + " 'chem_comp': ['LYS']}}");

        StructuralValidationException ex = assertThrows(StructuralValidationException.class,
                () -> flattener.flatten(tree, rules));

        assertEquals(3, ex.getViolations().size());
        assertTrue(ex.getViolations().get(0).contains("X/entry"));
        assertTrue(ex.getViolations().get(1).contains("'struct_asym'"));
        assertTrue(ex.getViolations().get(2).contains("X/chem_comp[0]"));
    }

    @Test
    void flatten_異常ケース_ルートがオブジェクトでない_StructuralValidationExceptionが送出されること()
            throws Exception {
        assertThrows(StructuralValidationException.class,
                () -> flattener.flatten(json("[1, 2]"), rules));
        assertThrows(StructuralValidationException.class,
                () -> flattener.flatten(json("{'X': []}"), rules));
    }

    @Test
    void flatten_正常ケース_入れ子化した結果を平坦化する_元のレコードと一致すること() throws Exception {
        DataContainer original = new CifReader()
                .read(new File(getClass().getResource("/data/1abc.cif").toURI()));
        JsonNode nested =
                new RelationshipResolver().resolve(original, rules, ConversionMode.STRICT);

        DataContainer restored = flattener.flatten(nested, rules);

        DataBlock before = original.getBlock("1ABC");
        DataBlock after = restored.getBlock("1ABC");
        assertEquals(new HashSet<>(before.getCategoryNames()),
                new HashSet<>(after.getCategoryNames()));
        assertEquals(records(before), records(after));
    }

    @Test
    void flatten_正常ケース_入れ子化を経由する_ヌル値は疑問符に正規化されること() throws Exception {
        DataContainer original = new CifReader().read(String.join("\n", "data_X",
                "_entity.id 1", "loop_", "_struct_asym.id", "_struct_asym.entity_id",
                "_struct_asym.details", "A 1 .", "B ? ?", ""));
        JsonNode nested =
                new RelationshipResolver().resolve(original, rules, ConversionMode.STRICT);

        Category asym = flattener.flatten(nested, rules).getBlock("X").getCategory("struct_asym");

        assertEquals(2, asym.getRowCount());
        assertEquals(new HashSet<>(Arrays.asList("1", "?")),
                new HashSet<>(asym.getValues("entity_id")));
        assertEquals(Arrays.asList("?", "?"), asym.getValues("details"));
    }

    @Test
    void flatten_正常ケース_指数表記の数値を含む_入れ子化と文書化を経由しても元の表記に戻ること()
            throws Exception {
        DataContainer original = new CifReader().read(String.join("\n", "data_X", "loop_",
                "_entity.id", "_entity.formula_weight", "1 1E+3", "2 1.5E+10", "3 18.015",
                "4 12", ""));
        JsonNode nested =
                new RelationshipResolver().resolve(original, rules, ConversionMode.STRICT);

        List<String> expected = Arrays.asList("1E+3", "1.5E+10", "18.015", "12");
        assertEquals(expected, flattener.flatten(nested, rules).getBlock("X")
                .getCategory("entity").getValues("formula_weight"));

        // JSON テキストへ書き出して読み直しても表記が変わらないこと
        JsonNode reread = mapper.readTree(mapper.writeValueAsString(nested));
        assertEquals(expected, flattener.flatten(reread, rules).getBlock("X")
                .getCategory("entity").getValues("formula_weight"));
    }

    @Test
    void flatten_異常ケース_アンダースコア有無で同名となるブロック_StructuralValidationExceptionが送出されること()
            throws Exception {
        StructuralValidationException ex = assertThrows(StructuralValidationException.class,
                () -> flattener.flatten(json("{'X': {}, '_X': {}}"), rules));

        assertEquals(Arrays.asList("Duplicate data block 'X'"), ex.getViolations());
    }
}
