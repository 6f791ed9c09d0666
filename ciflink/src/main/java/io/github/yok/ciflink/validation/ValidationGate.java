package io.github.yok.ciflink.validation;

/**
 * Checks a document against a schema at a conversion boundary.
 *
 * <p>
 * Gates only report; the caller decides whether violations abort the conversion.
 * </p>
 *
 * @param <D> document type
 * @param <S> schema type
 * @author Yasuharu.Okawauchi
 */
public interface ValidationGate<D, S> {

    /**
     * Validates a document.
     *
     * @param document document to check
     * @param schema schema to check against
     * @return validation outcome
     */
    ValidationResult validate(D document, S schema);
}
