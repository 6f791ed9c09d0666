package io.github.yok.ciflink.validation;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Base class of errors that abort a conversion. Carries every violation found in the pass.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ConversionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public ConversionException(String message, List<String> violations) {
        super(message + ": " + summarize(violations));
        this.violations = ImmutableList.copyOf(violations);
    }

    public ConversionException(String message, List<String> violations, Throwable cause) {
        super(message + ": " + summarize(violations), cause);
        this.violations = ImmutableList.copyOf(violations);
    }

    private static String summarize(List<String> violations) {
        if (violations.size() <= 3) {
            return String.join("; ", violations);
        }
        return String.join("; ", violations.subList(0, 3)) + " (+" + (violations.size() - 3)
                + " more)";
    }
}
