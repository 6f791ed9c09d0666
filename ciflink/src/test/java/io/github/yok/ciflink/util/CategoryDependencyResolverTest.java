package io.github.yok.ciflink.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CategoryDependencyResolverTest {

    @Test
    void resolveOrder_正常ケース_親子関係を指定する_親が子より先に並ぶこと() {
        Map<String, List<String>> parents = new HashMap<>();
        parents.put("entity_poly_seq", Arrays.asList("entity_poly", "chem_comp"));
        parents.put("entity_poly", Collections.singletonList("entity"));
        parents.put("struct_asym", Collections.singletonList("entity"));

        List<String> order = CategoryDependencyResolver.resolveOrder(
                Arrays.asList("struct_asym", "entity_poly_seq", "entity_poly", "entity",
                        "chem_comp"),
                parents);

        assertEquals(Arrays.asList("chem_comp", "entity", "entity_poly", "entity_poly_seq",
                "struct_asym"), order);
    }

    @Test
    void resolveOrder_正常ケース_依存関係がない_アルファベット順に並ぶこと() {
        List<String> order = CategoryDependencyResolver
                .resolveOrder(Arrays.asList("exptl", "cell", "atom_site"), Collections.emptyMap());

        assertEquals(Arrays.asList("atom_site", "cell", "exptl"), order);
    }

    @Test
    void resolveOrder_正常ケース_循環と自己参照を含む_循環部分が末尾にアルファベット順で追加されること() {
        Map<String, List<String>> parents = new HashMap<>();
        parents.put("beta", Collections.singletonList("alpha"));
        parents.put("alpha", Collections.singletonList("beta"));
        parents.put("entity", Arrays.asList("entity", "unknown"));

        List<String> order = CategoryDependencyResolver
                .resolveOrder(Arrays.asList("beta", "alpha", "entity", "entity"), parents);

        assertEquals(Arrays.asList("entity", "alpha", "beta"), order);
    }

    @Test
    void resolveOrder_正常ケース_空の一覧を指定する_空リストが返却されること() {
        assertTrue(CategoryDependencyResolver.resolveOrder(Collections.emptyList(),
                Collections.emptyMap()).isEmpty());
        assertTrue(CategoryDependencyResolver.resolveOrder(null, Collections.emptyMap())
                .isEmpty());
    }

    @Test
    void resolveOrder_異常ケース_空白のカテゴリ名を含む_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> CategoryDependencyResolver
                .resolveOrder(Arrays.asList("entity", " "), Collections.emptyMap()));
    }

    @Test
    void constructor_異常ケース_リフレクションで生成する_AssertionErrorが送出されること()
            throws Exception {
        Constructor<CategoryDependencyResolver> ctor =
                CategoryDependencyResolver.class.getDeclaredConstructor();
        ctor.setAccessible(true);

        InvocationTargetException ex =
                assertThrows(InvocationTargetException.class, ctor::newInstance);
        assertTrue(ex.getCause() instanceof AssertionError);
    }
}
