package io.github.yok.ciflink.validation;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Outcome of a validation: valid, or the list of violations found.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(ImmutableList.of());

    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = ImmutableList.copyOf(errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Combines two results.
     *
     * @param other other result
     * @return result holding the violations of both
     */
    public ValidationResult and(ValidationResult other) {
        if (other.isValid()) {
            return this;
        }
        List<String> all = new ArrayList<>(errors);
        all.addAll(other.errors);
        return new ValidationResult(all);
    }
}
