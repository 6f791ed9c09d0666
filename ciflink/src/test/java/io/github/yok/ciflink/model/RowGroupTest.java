package io.github.yok.ciflink.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class RowGroupTest {

    private final Category category =
            new Category("struct_asym").addItem("id", Arrays.asList("A", "B"));

    @Test
    void of_正常ケース_単一指定で一行を指定する_Singleが返却されること() {
        RowGroup group = RowGroup.of(true, Arrays.asList(category.getRow(0)));
        assertTrue(group instanceof RowGroup.Single);
        assertFalse(group.isList());
        assertEquals("A", group.getRows().get(0).get("id"));
    }

    @Test
    void of_正常ケース_複数指定を指定する_Multipleが返却されること() {
        RowGroup group = RowGroup.of(false, category.getRows());
        assertTrue(group instanceof RowGroup.Multiple);
        assertTrue(group.isList());
        assertEquals(2, group.getRows().size());
    }

    @Test
    void of_異常ケース_単一指定で二行を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> RowGroup.of(true, category.getRows()));
    }
}
