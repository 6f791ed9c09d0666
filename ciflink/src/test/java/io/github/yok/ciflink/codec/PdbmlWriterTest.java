package io.github.yok.ciflink.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.ciflink.mapping.MappingGenerator;
import io.github.yok.ciflink.mapping.MappingRules;
import io.github.yok.ciflink.metadata.CacheManager;
import io.github.yok.ciflink.metadata.CategoryDefinition;
import io.github.yok.ciflink.metadata.DictionaryMetadata;
import io.github.yok.ciflink.metadata.ItemDefinition;
import io.github.yok.ciflink.metadata.MetadataCache;
import io.github.yok.ciflink.metadata.SchemaMetadata;
import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import io.github.yok.ciflink.validation.ValidationResult;
import io.github.yok.ciflink.validation.XmlSchemaValidationGate;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PdbmlWriterTest {

    private Path dictionary;
    private Path schema;
    private MappingRules rules;
    private DataBlock block;

    @BeforeEach
    void setUp() throws Exception {
        dictionary = Paths.get(getClass().getResource("/metadata/test_dict.dic").toURI());
        schema = Paths.get(getClass().getResource("/metadata/test_schema.xsd").toURI());
        rules = new MappingGenerator(new MetadataCache(new CacheManager()))
                .getMappingRules(dictionary, schema);
        block = new CifReader()
                .read(new File(getClass().getResource("/data/entities.cif").toURI()))
                .getBlock("2XYZ");
    }

    @Test
    void write_正常ケース_スキーマ付きのルールを指定する_キーが属性でその他が子要素となること() {
        String xml = new PdbmlWriter().write(block, rules);

        assertTrue(xml.contains("xmlns=\"" + PdbmlWriter.NAMESPACE + "\""));
        assertTrue(xml.contains("datablockName=\"2XYZ\""));
        assertTrue(xml.contains("<entityCategory>"));
        assertTrue(xml.contains("<entity id=\"1\">"));
        assertTrue(xml.contains("<formula_weight>1200.50</formula_weight>"));
        assertTrue(xml.contains("<pdbx_description>Protein A</pdbx_description>"));
        assertTrue(xml.contains("<struct_asym id=\"A\">"));
        assertTrue(xml.contains("<entity_id>1</entity_id>"));
    }

    @Test
    void write_正常ケース_出力をXMLスキーマで検証する_違反が報告されないこと() {
        String xml = new PdbmlWriter().write(block, rules);

        ValidationResult result = new XmlSchemaValidationGate().validate(xml, schema.toFile());

        assertTrue(result.isValid(), () -> result.getErrors().toString());
    }

    @Test
    void write_正常ケース_ヌル値を含むレコードを指定する_ヌル値の項目が出力されないこと() {
        DataBlock nulls = new DataBlock("N").addCategory(new Category("entity")
                .addItem("id", Arrays.asList("1")).addItem("formula_weight", Arrays.asList("?"))
                .addItem("type", Arrays.asList(".")));

        String xml = new PdbmlWriter().write(nulls, rules);

        assertTrue(xml.contains("<entity id=\"1\"/>"));
        assertFalse(xml.contains("formula_weight"));
    }

    @Test
    void write_正常ケース_単純内容のカテゴリを指定する_本文として出力され読み戻されること()
            throws Exception {
        DataBlock keywords = new DataBlock("K").addCategory(new Category("pdbx_keywords")
                .addItem("entry_id", Arrays.asList("1ABC"))
                .addItem("value", Arrays.asList("HYDROLASE")));

        String xml = new PdbmlWriter().write(keywords, rules);
        assertTrue(xml.contains("<pdbx_keywords entry_id=\"1ABC\">HYDROLASE</pdbx_keywords>"));

        Category read = new PdbmlReader().read(xml, rules).getBlock("K")
                .getCategory("pdbx_keywords");
        assertEquals("1ABC", read.getValue(0, "entry_id"));
        assertEquals("HYDROLASE", read.getValue(0, "value"));
    }

    @Test
    void read_正常ケース_書き出したXMLを読み直す_同じレコードが得られること() throws Exception {
        String xml = new PdbmlWriter().write(block, rules);

        DataContainer container = new PdbmlReader().read(xml, rules);

        DataBlock read = container.getBlock("2XYZ");
        assertEquals(Arrays.asList("entity", "entity_poly", "struct_asym"),
                read.getCategoryNames());
        Category entity = read.getCategory("entity");
        assertEquals(Arrays.asList("1", "2"), entity.getValues("id"));
        assertEquals(Arrays.asList("1200.50", "18.015"), entity.getValues("formula_weight"));
        assertEquals("polypeptide(L)", read.getCategory("entity_poly").getValue(0, "type"));
        assertEquals(Arrays.asList("1", "2"),
                read.getCategory("struct_asym").getValues("entity_id"));
    }

    @Test
    void read_正常ケース_nil指定の要素を含む_疑問符として読み込まれること() throws Exception {
        String xml = "<datablock xmlns=\"" + PdbmlWriter.NAMESPACE + "\""
                + " xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
                + "<entityCategory><entity id=\"1\"><formula_weight xsi:nil=\"true\"/>"
                + "</entity></entityCategory></datablock>";

        DataContainer container = new PdbmlReader().read(xml, rules);

        DataBlock read = container.getBlock(PdbmlReader.DEFAULT_BLOCK_NAME);
        assertEquals("?", read.getCategory("entity").getValue(0, "formula_weight"));
    }

    @Test
    void read_異常ケース_整形式でないXMLを指定する_IOExceptionが送出されること() {
        assertThrows(IOException.class,
                () -> new PdbmlReader().read("<datablock><entityCategory>", rules));
    }

    @Test
    void read_異常ケース_想定外のルート要素を指定する_IOExceptionが送出されること() {
        IOException ex = assertThrows(IOException.class,
                () -> new PdbmlReader().read("<document/>", rules));
        assertTrue(ex.getMessage().contains("document"));
    }

    @Test
    void write_正常ケース_XML名に使えない文字を含む項目名_置換して出力され元の項目名で読み戻されること()
            throws Exception {
        CategoryDefinition def = new CategoryDefinition("atom_site_anisotrop");
        def.getKeyItems().add("id");
        defineItem(def, "id", "code");
        defineItem(def, "U[1][1]", "float");
        defineItem(def, "pdbx_note[2]", "text");
        DictionaryMetadata meta = new DictionaryMetadata();
        meta.getCategories().put(def.getName(), def);
        MappingRules anisoRules = new MappingGenerator(new MetadataCache(new CacheManager()))
                .generate(meta, new SchemaMetadata());
        DataBlock aniso = new CifReader().read(String.join("\n", "data_A",
                "_atom_site_anisotrop.id 1", "_atom_site_anisotrop.U[1][1] 0.0123",
                "_atom_site_anisotrop.pdbx_note[2] 'first mode'", "")).getBlock("A");

        String xml = new PdbmlWriter().write(aniso, anisoRules);

        assertTrue(xml.contains("U_1__1_=\"0.0123\""));
        assertTrue(xml.contains("<pdbx_note_2_>first mode</pdbx_note_2_>"));
        Category read = new PdbmlReader().read(xml, anisoRules).getBlock("A")
                .getCategory("atom_site_anisotrop");
        assertEquals("0.0123", read.getValue(0, "U[1][1]"));
        assertEquals("first mode", read.getValue(0, "pdbx_note[2]"));
        assertEquals("1", read.getValue(0, "id"));
    }

    @Test
    void write_正常ケース_ルールにないカテゴリ名が数字で始まる_接頭辞付きの名前で出力されること() {
        DataBlock other = new DataBlock("B")
                .addCategory(new Category("3d_map").addItem("v(1)", Arrays.asList("a")));

        String xml = new PdbmlWriter().write(other, rules);

        assertTrue(xml.contains("<x_3d_mapCategory>"));
        assertTrue(xml.contains("<x_3d_map>"));
        assertTrue(xml.contains("<v_1_>a</v_1_>"));
    }

    private static void defineItem(CategoryDefinition def, String name, String typeCode) {
        ItemDefinition item = new ItemDefinition();
        item.setName(name);
        item.setCategory(def.getName());
        item.setTypeCode(typeCode);
        def.getItems().put(name, item);
    }
}
