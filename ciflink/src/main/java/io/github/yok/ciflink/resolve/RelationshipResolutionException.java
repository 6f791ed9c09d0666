package io.github.yok.ciflink.resolve;

import io.github.yok.ciflink.validation.ConversionException;
import java.util.List;

/**
 * Records cannot be nested consistently: orphans or duplicate children in strict mode, or a
 * reference cycle.
 *
 * @author Yasuharu.Okawauchi
 */
public class RelationshipResolutionException extends ConversionException {

    private static final long serialVersionUID = 1L;

    public RelationshipResolutionException(List<String> violations) {
        super("Relationship resolution failed", violations);
    }
}
