package io.github.yok.ciflink.validation;

import java.util.List;

/**
 * A document does not have the structure the conversion requires.
 *
 * @author Yasuharu.Okawauchi
 */
public class StructuralValidationException extends ConversionException {

    private static final long serialVersionUID = 1L;

    public StructuralValidationException(List<String> violations) {
        super("Structural validation failed", violations);
    }

    public StructuralValidationException(List<String> violations, Throwable cause) {
        super("Structural validation failed", violations, cause);
    }
}
