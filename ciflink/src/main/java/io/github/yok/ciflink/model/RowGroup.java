package io.github.yok.ciflink.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * The children of one parent record within one child category.
 *
 * <p>
 * A {@link Single} group holds at most one row and renders as an object; a {@link Multiple} group
 * holds any number of rows and renders as a list.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class RowGroup {

    private final List<Row> rows;

    protected RowGroup(List<Row> rows) {
        this.rows = ImmutableList.copyOf(rows);
    }

    public List<Row> getRows() {
        return rows;
    }

    /**
     * Returns whether this group renders as a list.
     *
     * @return {@code true} for {@link Multiple}
     */
    public abstract boolean isList();

    /**
     * Builds the group variant for a multiplicity.
     *
     * @param single whether the relation allows one child per parent
     * @param rows rows of the group
     * @return group
     */
    public static RowGroup of(boolean single, List<Row> rows) {
        return single ? new Single(rows) : new Multiple(rows);
    }

    /**
     * At most one row per parent.
     */
    public static final class Single extends RowGroup {

        public Single(List<Row> rows) {
            super(rows);
            Validate.isTrue(rows.size() <= 1, "single group holds at most one row, got %s.",
                    rows.size());
        }

        @Override
        public boolean isList() {
            return false;
        }
    }

    /**
     * Any number of rows per parent.
     */
    public static final class Multiple extends RowGroup {

        public Multiple(List<Row> rows) {
            super(rows);
        }

        @Override
        public boolean isList() {
            return true;
        }
    }
}
