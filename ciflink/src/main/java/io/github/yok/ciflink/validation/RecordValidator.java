package io.github.yok.ciflink.validation;

import io.github.yok.ciflink.model.Category;
import java.util.List;

/**
 * Caller-supplied record checks, registered in a {@link ValidatorRegistry}.
 *
 * @author Yasuharu.Okawauchi
 */
public final class RecordValidator {

    private RecordValidator() {
        throw new AssertionError("RecordValidator must not be instantiated.");
    }

    /**
     * Checks the records of one category.
     */
    @FunctionalInterface
    public interface SingleCategory {

        /**
         * Validates a category.
         *
         * @param category records to check
         * @return violations, empty if valid
         */
        List<String> validate(Category category);
    }

    /**
     * Checks two categories against each other.
     */
    @FunctionalInterface
    public interface CrossCategory {

        /**
         * Validates a pair of categories.
         *
         * @param first first category of the registered pair
         * @param second second category of the registered pair
         * @return violations, empty if valid
         */
        List<String> validate(Category first, Category second);
    }
}
