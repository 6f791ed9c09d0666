package io.github.yok.ciflink.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.yok.ciflink.codec.DocumentMappers;
import io.github.yok.ciflink.codec.PdbmlReader;
import io.github.yok.ciflink.codec.PdbmlWriter;
import io.github.yok.ciflink.config.CifLinkConfig;
import io.github.yok.ciflink.config.ConversionMode;
import io.github.yok.ciflink.flatten.Flattener;
import io.github.yok.ciflink.mapping.MappingGenerator;
import io.github.yok.ciflink.mapping.MappingRules;
import io.github.yok.ciflink.metadata.CacheManager;
import io.github.yok.ciflink.metadata.MetadataCache;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import io.github.yok.ciflink.resolve.RelationshipResolver;
import io.github.yok.ciflink.validation.ContentValidationException;
import io.github.yok.ciflink.validation.DictionaryContentValidationGate;
import io.github.yok.ciflink.validation.JsonSchemaValidationGate;
import io.github.yok.ciflink.validation.StructuralValidationException;
import io.github.yok.ciflink.validation.ValidationResult;
import io.github.yok.ciflink.validation.ValidatorRegistry;
import io.github.yok.ciflink.validation.XmlSchemaValidationGate;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Entry point of every conversion between the flat and the hierarchical forms.
 *
 * <p>
 * Owns the {@link CacheManager} for its lifetime and releases it on {@link #close()}. Mapping
 * rules are derived once per dictionary/schema version.
 * </p>
 *
 * <p>
 * <strong>Modes:</strong>
 * </p>
 * <ul>
 * <li>{@link ConversionMode#STRICT}: record validators and validation gates run before and after
 * each conversion, and any violation aborts it.</li>
 * <li>{@link ConversionMode#PERMISSIVE}: gates are skipped entirely; inconsistent records are kept
 * with a warning.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConversionPipeline implements AutoCloseable {

    static final String BUNDLED_JSON_SCHEMA = "/schemas/nested-json-schema.json";

    private final CifLinkConfig config;

    @Getter
    private final CacheManager cacheManager;

    @Getter
    private final MetadataCache metadataCache;

    private final MappingGenerator mappingGenerator;

    @Getter
    private final ValidatorRegistry validatorRegistry;

    private final RelationshipResolver resolver = new RelationshipResolver();

    private final Flattener flattener = new Flattener();

    private final PdbmlWriter xmlWriter = new PdbmlWriter();

    private final PdbmlReader xmlReader = new PdbmlReader();

    private final JsonSchemaValidationGate jsonGate = new JsonSchemaValidationGate();

    private final XmlSchemaValidationGate xmlGate = new XmlSchemaValidationGate();

    private final DictionaryContentValidationGate contentGate =
            new DictionaryContentValidationGate();

    private final ObjectMapper mapper = DocumentMappers.json();

    private JsonNode jsonSchema;

    public ConversionPipeline(CifLinkConfig config) {
        this(config, new ValidatorRegistry());
    }

    /**
     * Creates a pipeline.
     *
     * @param config configuration
     * @param validatorRegistry record validators run in strict mode
     */
    public ConversionPipeline(CifLinkConfig config, ValidatorRegistry validatorRegistry) {
        Validate.notNull(config, "config must not be null.");
        Validate.notNull(validatorRegistry, "validatorRegistry must not be null.");
        this.config = config;
        this.validatorRegistry = validatorRegistry;
        this.cacheManager = new CacheManager(config.getCacheDirectory(), DocumentMappers.json());
        this.metadataCache = new MetadataCache(cacheManager);
        this.mappingGenerator = new MappingGenerator(metadataCache);
    }

    public ConversionMode getMode() {
        return config.getMode();
    }

    /**
     * Returns the mapping rules of the configured dictionary and schema.
     *
     * @return mapping rules
     */
    public MappingRules getMappingRules() {
        return mappingGenerator.getMappingRules(config.getDictionary(), config.getSchema());
    }

    /**
     * Nests flat records.
     *
     * @param container flat records
     * @return nested tree keyed by block name
     * @throws ContentValidationException in strict mode if records or the result violate rules
     * @throws io.github.yok.ciflink.resolve.RelationshipResolutionException if records cannot be
     *         nested
     */
    public ObjectNode nest(DataContainer container) {
        MappingRules rules = getMappingRules();
        boolean strict = getMode() == ConversionMode.STRICT;
        if (strict) {
            requireValid(validatorRegistry.validate(container), false);
        }
        progress("Nesting {} block(s)", container.getBlocks().size());
        ObjectNode tree = resolver.resolve(container, rules, getMode());
        if (strict) {
            ValidationResult result = contentGate.validate(tree, rules);
            if (hasSchema()) {
                File schema = config.getSchema().toFile();
                for (DataBlock block : container.getBlocks()) {
                    result = result.and(xmlGate.validate(xmlWriter.write(block, rules), schema));
                }
            }
            requireValid(result, false);
        }
        progress("Nested {} block(s)", tree.size());
        return tree;
    }

    /**
     * Flattens a nested tree.
     *
     * @param tree nested tree
     * @return flat records
     * @throws StructuralValidationException if the tree does not have the nested shape
     * @throws ContentValidationException in strict mode if record validators report violations
     */
    public DataContainer flatten(JsonNode tree) {
        MappingRules rules = getMappingRules();
        boolean strict = getMode() == ConversionMode.STRICT;
        if (strict) {
            requireValid(jsonGate.validate(tree, jsonSchema()), true);
        }
        progress("Flattening {} block(s)", tree.size());
        DataContainer container = flattener.flatten(tree, rules);
        if (strict) {
            requireValid(validatorRegistry.validate(container), false);
        }
        return container;
    }

    /**
     * Renders records as XML, one document per block.
     *
     * @param container records
     * @return block name to XML text, in block order
     * @throws ContentValidationException in strict mode if a document violates the XML schema
     */
    public Map<String, String> toXml(DataContainer container) {
        MappingRules rules = getMappingRules();
        Map<String, String> documents = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        for (DataBlock block : container.getBlocks()) {
            String xml = xmlWriter.write(block, rules);
            if (getMode() == ConversionMode.STRICT && hasSchema()) {
                errors.addAll(xmlGate.validate(xml, config.getSchema().toFile()).getErrors());
            }
            documents.put(block.getName(), xml);
        }
        requireValid(ValidationResult.of(errors), false);
        progress("Rendered {} XML document(s)", documents.size());
        return documents;
    }

    /**
     * Reads records from an XML document.
     *
     * @param xml XML text
     * @return records
     * @throws StructuralValidationException if the document is malformed, or in strict mode does
     *         not conform to the XML schema
     */
    public DataContainer fromXml(String xml) {
        if (getMode() == ConversionMode.STRICT && hasSchema()) {
            requireValid(xmlGate.validate(xml, config.getSchema().toFile()), true);
        }
        try {
            return xmlReader.read(xml, getMappingRules());
        } catch (IOException e) {
            List<String> violations = new ArrayList<>();
            violations.add(e.getMessage());
            throw new StructuralValidationException(violations, e);
        }
    }

    private boolean hasSchema() {
        Path schema = config.getSchema();
        return schema != null && schema.toFile().isFile();
    }

    private void requireValid(ValidationResult result, boolean structural) {
        if (result.isValid()) {
            return;
        }
        if (structural) {
            throw new StructuralValidationException(result.getErrors());
        }
        throw new ContentValidationException(result.getErrors());
    }

    private synchronized JsonNode jsonSchema() {
        if (jsonSchema != null) {
            return jsonSchema;
        }
        try {
            File configured = config.getJsonSchemaFile();
            if (configured != null) {
                jsonSchema = mapper.readTree(configured);
            } else {
                try (InputStream in = getClass().getResourceAsStream(BUNDLED_JSON_SCHEMA)) {
                    Validate.validState(in != null, "bundled schema %s is missing",
                            BUNDLED_JSON_SCHEMA);
                    jsonSchema = mapper.readTree(in);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read JSON Schema", e);
        }
        return jsonSchema;
    }

    private void progress(String format, Object... args) {
        if (config.isQuiet()) {
            log.debug(format, args);
        } else {
            log.info(format, args);
        }
    }

    @Override
    public void close() {
        cacheManager.close();
    }
}
