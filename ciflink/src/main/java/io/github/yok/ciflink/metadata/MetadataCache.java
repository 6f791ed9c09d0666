package io.github.yok.ciflink.metadata;

import io.github.yok.ciflink.codec.DataFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.Validate;

/**
 * Parses dictionary and schema sources at most once per content version.
 *
 * <p>
 * Parsed metadata is kept in the {@link CacheManager} under a key derived from the source path,
 * size and modification time, so an edited source is parsed again. Cache corruption is recovered
 * by re-parsing; it never reaches the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MetadataCache {

    static final String DICTIONARY_KIND = "dictionary";

    static final String SCHEMA_KIND = "schema";

    @Getter
    private final CacheManager cacheManager;

    private final DictionaryParser dictionaryParser;

    private final XsdSchemaParser schemaParser;

    private final AtomicInteger parseCount = new AtomicInteger();

    public MetadataCache(CacheManager cacheManager) {
        this(cacheManager, new DictionaryParser(), new XsdSchemaParser());
    }

    public MetadataCache(CacheManager cacheManager, DictionaryParser dictionaryParser,
            XsdSchemaParser schemaParser) {
        Validate.notNull(cacheManager, "cacheManager must not be null.");
        this.cacheManager = cacheManager;
        this.dictionaryParser = dictionaryParser;
        this.schemaParser = schemaParser;
    }

    /**
     * Returns the parsed dictionary, parsing it on the first request for its current version.
     *
     * @param source dictionary file
     * @return metadata; empty if the file does not exist
     * @throws MetadataException if the source cannot be parsed
     */
    public DictionaryMetadata loadDictionary(Path source) {
        if (!exists(source)) {
            return new DictionaryMetadata();
        }
        return cacheManager.get(key(DICTIONARY_KIND, source), DictionaryMetadata.class, () -> {
            parseCount.incrementAndGet();
            return dictionaryParser.parse(source.toFile());
        });
    }

    /**
     * Returns the parsed schema, parsing it on the first request for its current version.
     *
     * @param source XSD file
     * @return metadata; empty if the file does not exist
     * @throws MetadataException if the source cannot be parsed
     */
    public SchemaMetadata loadSchema(Path source) {
        if (!exists(source)) {
            return new SchemaMetadata();
        }
        return cacheManager.get(key(SCHEMA_KIND, source), SchemaMetadata.class, () -> {
            parseCount.incrementAndGet();
            return schemaParser.parse(source.toFile());
        });
    }

    /**
     * Loads either kind of metadata, chosen by file extension ({@code .xsd} is a schema).
     *
     * @param source metadata file
     * @return metadata
     */
    public Metadata load(Path source) {
        Validate.notNull(source, "source must not be null.");
        String ext = FilenameUtils.getExtension(source.getFileName().toString());
        if ("xsd".equalsIgnoreCase(ext)) {
            return loadSchema(source);
        }
        if (!ext.isEmpty() && !DataFormat.CIF.matches(ext)) {
            log.warn("Unrecognized metadata extension '{}', reading {} as a dictionary", ext,
                    source);
        }
        return loadDictionary(source);
    }

    /**
     * Returns how many times a source was actually parsed.
     *
     * @return parse count
     */
    public int getParseCount() {
        return parseCount.get();
    }

    private static boolean exists(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            log.warn("Metadata source not found: {}. Using empty metadata.", source);
            return false;
        }
        return true;
    }

    private static String key(String kind, Path source) {
        try {
            return CacheManager.keyOf(kind, source);
        } catch (IOException e) {
            throw new MetadataException("Cannot stat metadata source " + source, e);
        }
    }
}
