package io.github.yok.ciflink.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Factory of the Jackson mappers used for documents.
 *
 * <p>
 * Decimal numbers are read as exact {@link java.math.BigDecimal} values, trailing zeros included,
 * so numeric item text survives a write/read cycle.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class DocumentMappers {

    private DocumentMappers() {
        throw new AssertionError("DocumentMappers must not be instantiated.");
    }

    public static ObjectMapper json() {
        return configure(new ObjectMapper());
    }

    public static ObjectMapper yaml() {
        YAMLFactory factory =
                YAMLFactory.builder().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS).build();
        return configure(new ObjectMapper(factory));
    }

    /**
     * Returns the mapper for a document format.
     *
     * @param format {@link DataFormat#JSON} or {@link DataFormat#YAML}
     * @return mapper
     */
    public static ObjectMapper forFormat(DataFormat format) {
        if (format == DataFormat.YAML) {
            return yaml();
        }
        if (format == DataFormat.JSON) {
            return json();
        }
        throw new IllegalArgumentException("Not a tree document format: " + format);
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }
}
