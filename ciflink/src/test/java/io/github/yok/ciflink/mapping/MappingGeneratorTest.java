package io.github.yok.ciflink.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.ciflink.metadata.CacheManager;
import io.github.yok.ciflink.metadata.CategoryDefinition;
import io.github.yok.ciflink.metadata.DictionaryMetadata;
import io.github.yok.ciflink.metadata.ItemDefinition;
import io.github.yok.ciflink.metadata.ItemLocation;
import io.github.yok.ciflink.metadata.LinkDeclaration;
import io.github.yok.ciflink.metadata.LinkSource;
import io.github.yok.ciflink.metadata.MetadataCache;
import io.github.yok.ciflink.metadata.SchemaMetadata;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MappingGeneratorTest {

    private Path dictionary;
    private Path schema;
    private MetadataCache metadataCache;
    private MappingGenerator generator;

    @BeforeEach
    void setUp() throws Exception {
        dictionary = Paths.get(getClass().getResource("/metadata/test_dict.dic").toURI());
        schema = Paths.get(getClass().getResource("/metadata/test_schema.xsd").toURI());
        metadataCache = new MetadataCache(new CacheManager());
        generator = new MappingGenerator(metadataCache);
    }

    private static void define(DictionaryMetadata meta, String category, String... keys) {
        CategoryDefinition def = new CategoryDefinition(category);
        def.getKeyItems().addAll(Arrays.asList(keys));
        for (String key : keys) {
            ItemDefinition item = new ItemDefinition();
            item.setName(key);
            item.setCategory(category);
            item.setTypeCode("code");
            def.getItems().put(key, item);
        }
        meta.getCategories().put(category, def);
    }

    private static LinkDeclaration link(String child, String parent, LinkSource source) {
        String[] c = child.split("\\.");
        String[] p = parent.split("\\.");
        return new LinkDeclaration(c[0], c[1], p[0], p[1], source, null);
    }

    @Test
    void getMappingRules_正常ケース_辞書を指定する_グループリンクが一般リンクより優先されること() {
        MappingRules rules = generator.getMappingRules(dictionary, null);

        FkLink seq = rules.getFkMap().get("entity_poly_seq", "entity_id");
        assertEquals("entity_poly", seq.getParentCategory());
        assertEquals("entity_id", seq.getParentItem());
        assertEquals(LinkSource.GROUPED, seq.getSource());

        FkLink poly = rules.getFkMap().get("entity_poly", "entity_id");
        assertEquals("entity", poly.getParentCategory());
        assertEquals(LinkSource.GENERAL, poly.getSource());
    }

    @Test
    void getMappingRules_正常ケース_未定義カテゴリへのリンクを含む_除外されて警告に記録されること() {
        MappingRules rules = generator.getMappingRules(dictionary, null);

        assertNull(rules.getFkMap().get("ghost", "entity_id"));
        assertEquals(1, rules.getWarnings().size());
        assertTrue(rules.getWarnings().get(0).contains("_ghost.entity_id -> _entity.id"));
    }

    @Test
    void getMappingRules_正常ケース_辞書を指定する_キーの被覆から多重度が決まること() {
        MappingRules rules = generator.getMappingRules(dictionary, null);

        ParentRelation poly = rules.parentRelations("entity_poly").get(0);
        assertEquals("entity", poly.getParentCategory());
        assertEquals(Multiplicity.SINGLE, poly.getMultiplicity());
        assertEquals(1, poly.getKeyOverlap());

        ParentRelation asym = rules.parentRelations("struct_asym").get(0);
        assertEquals(Multiplicity.MULTIPLE, asym.getMultiplicity());
        assertEquals(0, asym.getKeyOverlap());

        List<ParentRelation> seq = rules.parentRelations("entity_poly_seq");
        assertEquals(2, seq.size());
        assertEquals("chem_comp", seq.get(0).getParentCategory());
        assertEquals("entity_poly", seq.get(1).getParentCategory());
        assertFalse(seq.get(1).isSingle());
        assertTrue(rules.parentRelations("entity").isEmpty());
    }

    @Test
    void getMappingRules_正常ケース_辞書を指定する_項目の配置と数値判定と分類方式が決まること() {
        MappingRules rules = generator.getMappingRules(dictionary, null);

        CategoryMapping entity = rules.getCategory("entity");
        assertEquals(Arrays.asList("formula_weight", "id", "pdbx_description", "type"),
                new ArrayList<>(entity.getItems().keySet()));
        assertEquals(ItemLocation.ATTRIBUTE, entity.getItem("id").getLocation());
        assertEquals(ItemLocation.ELEMENT, entity.getItem("pdbx_description").getLocation());
        assertEquals(ItemLocation.ATTRIBUTE, entity.getItem("type").getLocation());
        assertTrue(rules.isNumeric("entity", "formula_weight"));
        assertTrue(rules.isNumeric("entity_poly_seq", "num"));
        assertFalse(rules.isNumeric("entity", "id"));
        assertFalse(rules.isNumeric("unknown", "id"));
        assertEquals(GroupingStrategy.SINGLE_KEY, entity.getGrouping());
        assertEquals(GroupingStrategy.COMPOSITE_KEY,
                rules.getCategory("entity_poly_seq").getGrouping());
        assertEquals("entityCategory", entity.getContainerElementName());
        assertTrue(entity.isDefined());
    }

    @Test
    void getMappingRules_正常ケース_スキーマを併用する_スキーマの配置が優先されスキーマのみのカテゴリも含まれること() {
        MappingRules rules = generator.getMappingRules(dictionary, schema);

        CategoryMapping entity = rules.getCategory("entity");
        assertEquals(ItemLocation.ELEMENT, entity.getItem("type").getLocation());
        assertEquals(ItemLocation.ELEMENT, entity.getItem("formula_weight").getLocation());
        // 辞書の型コードが優先される
        assertEquals("float", entity.getItem("formula_weight").getTypeCode());

        CategoryMapping keywords = rules.getCategory("pdbx_keywords");
        assertFalse(keywords.isDefined());
        assertEquals(ItemLocation.ELEMENT_CONTENT, keywords.getItem("value").getLocation());
        assertTrue(keywords.getItem("entry_id").isMandatory());
    }

    @Test
    void getMappingRules_正常ケース_同じソースで二回取得する_同じルールが返却され解析は一回であること() {
        MappingRules first = generator.getMappingRules(dictionary, schema);
        MappingRules second = generator.getMappingRules(dictionary, schema);

        assertSame(first, second);
        assertEquals(2, metadataCache.getParseCount());
    }

    @Test
    void getMappingRules_正常ケース_ソース未指定_空のルールが返却されること() {
        MappingRules rules = generator.getMappingRules(null, null);

        assertTrue(rules.getCategories().isEmpty());
        assertTrue(rules.getFkMap().isEmpty());
    }

    @Test
    void generate_正常ケース_リンクの宣言順を入れ替える_同じ外部キーマップが生成されること() {
        List<LinkDeclaration> links = new ArrayList<>(Arrays.asList(
                link("c.pid", "p2.id", LinkSource.GENERAL),
                link("c.pid", "p1.id", LinkSource.GENERAL),
                link("c.qid", "p2.id", LinkSource.GENERAL),
                link("c.qid", "p1.id", LinkSource.GROUPED)));
        List<List<FkLink>> results = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            DictionaryMetadata meta = new DictionaryMetadata();
            define(meta, "p1", "id");
            define(meta, "p2", "id");
            define(meta, "c", "id");
            List<LinkDeclaration> shuffled = new ArrayList<>(links);
            Collections.rotate(shuffled, i);
            meta.getLinks().addAll(shuffled);
            results.add(generator.generate(meta, new SchemaMetadata()).getFkMap().all());
        }

        for (List<FkLink> r : results) {
            assertEquals(results.get(0), r);
        }
        // 同じ種類同士は親カテゴリ名の昇順で決まる
        assertEquals("p1", results.get(0).get(0).getParentCategory());
        assertEquals(LinkSource.GROUPED, results.get(0).get(1).getSource());
    }

    @Test
    void generate_正常ケース_自己参照リンクを含む_外部キーマップには残り関係からは除外されること() {
        DictionaryMetadata meta = new DictionaryMetadata();
        define(meta, "node", "id");
        meta.getLinks().add(link("node.parent_id", "node.id", LinkSource.GENERAL));

        MappingRules rules = generator.generate(meta, new SchemaMetadata());

        assertTrue(rules.getFkMap().get("node", "parent_id").isSelfLink());
        assertTrue(rules.parentRelations("node").isEmpty());
    }

    @Test
    void generate_正常ケース_複合キーを全て結合する_単一の多重度となること() {
        DictionaryMetadata meta = new DictionaryMetadata();
        define(meta, "p", "a", "b");
        define(meta, "c", "a", "b");
        meta.getLinks().add(link("c.a", "p.a", LinkSource.GENERAL));
        meta.getLinks().add(link("c.b", "p.b", LinkSource.GENERAL));

        ParentRelation relation =
                generator.generate(meta, new SchemaMetadata()).parentRelations("c").get(0);

        assertEquals(Arrays.asList("a", "b"), relation.getChildItems());
        assertEquals(Arrays.asList("a", "b"), relation.getParentItems());
        assertEquals(2, relation.getKeyOverlap());
        assertTrue(relation.isSingle());
    }
}
