package io.github.yok.ciflink.validation;

import java.util.List;

/**
 * Data violates dictionary or schema rules.
 *
 * @author Yasuharu.Okawauchi
 */
public class ContentValidationException extends ConversionException {

    private static final long serialVersionUID = 1L;

    public ContentValidationException(List<String> violations) {
        super("Content validation failed", violations);
    }
}
