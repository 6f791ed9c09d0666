package io.github.yok.ciflink.validation;

import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Registry of record validators, owned by the caller.
 *
 * <p>
 * Single-category validators run on every block that contains their category. Cross-category
 * validators run on every block that contains both categories of their pair.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ValidatorRegistry {

    private final Map<String, List<RecordValidator.SingleCategory>> single = new LinkedHashMap<>();

    private final Map<Pair<String, String>, List<RecordValidator.CrossCategory>> cross =
            new LinkedHashMap<>();

    /**
     * Registers a validator for one category.
     *
     * @param category category name
     * @param validator validator
     * @return this registry
     */
    public ValidatorRegistry register(String category, RecordValidator.SingleCategory validator) {
        Validate.notBlank(category, "category must not be blank.");
        Validate.notNull(validator, "validator must not be null.");
        single.computeIfAbsent(category, k -> new ArrayList<>()).add(validator);
        return this;
    }

    /**
     * Registers a validator for a pair of categories.
     *
     * @param first first category
     * @param second second category
     * @param validator validator
     * @return this registry
     */
    public ValidatorRegistry register(String first, String second,
            RecordValidator.CrossCategory validator) {
        Validate.notBlank(first, "first must not be blank.");
        Validate.notBlank(second, "second must not be blank.");
        Validate.notNull(validator, "validator must not be null.");
        cross.computeIfAbsent(Pair.of(first, second), k -> new ArrayList<>()).add(validator);
        return this;
    }

    public boolean isEmpty() {
        return single.isEmpty() && cross.isEmpty();
    }

    /**
     * Runs all registered validators.
     *
     * @param container records to check
     * @return combined outcome
     */
    public ValidationResult validate(DataContainer container) {
        List<String> errors = new ArrayList<>();
        for (DataBlock block : container.getBlocks()) {
            for (Map.Entry<String, List<RecordValidator.SingleCategory>> e : single.entrySet()) {
                Category category = block.getCategory(e.getKey());
                if (category == null) {
                    continue;
                }
                for (RecordValidator.SingleCategory v : e.getValue()) {
                    errors.addAll(v.validate(category));
                }
            }
            for (Map.Entry<Pair<String, String>, List<RecordValidator.CrossCategory>> e : cross
                    .entrySet()) {
                Category first = block.getCategory(e.getKey().getLeft());
                Category second = block.getCategory(e.getKey().getRight());
                if (first == null || second == null) {
                    continue;
                }
                for (RecordValidator.CrossCategory v : e.getValue()) {
                    errors.addAll(v.validate(first, second));
                }
            }
        }
        log.debug("Record validators reported {} violation(s)", errors.size());
        return ValidationResult.of(errors);
    }
}
