package io.github.yok.ciflink.config;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code ciflink.*} properties from {@code application.yml}.
 *
 * <p>
 * Holds the metadata sources (dictionary, XML schema, JSON Schema), the metadata cache location
 * and the conversion flags.
 * </p>
 *
 * <ul>
 * <li>{@code ciflink.dictionary-path}: CIF dictionary; optional</li>
 * <li>{@code ciflink.schema-path}: XSD of the XML form; optional</li>
 * <li>{@code ciflink.json-schema-path}: JSON Schema of the nested form; the bundled schema is used
 * when blank</li>
 * <li>{@code ciflink.cache-dir}: directory of persisted metadata; defaults to
 * {@code ~/.ciflink_cache}</li>
 * <li>{@code ciflink.disk-cache}: whether metadata is persisted (default {@code true})</li>
 * <li>{@code ciflink.permissive}: permissive instead of strict mode</li>
 * <li>{@code ciflink.quiet}: progress messages at debug level</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "ciflink")
@Data
public class CifLinkConfig {

    static final String DEFAULT_CACHE_DIR_NAME = ".ciflink_cache";

    private String dictionaryPath;

    private String schemaPath;

    private String jsonSchemaPath;

    private String cacheDir;

    private boolean diskCache = true;

    private boolean permissive;

    private boolean quiet;

    public ConversionMode getMode() {
        return ConversionMode.of(permissive);
    }

    /**
     * Returns the dictionary source.
     *
     * @return path, or {@code null} if not configured
     */
    public Path getDictionary() {
        return StringUtils.isBlank(dictionaryPath) ? null : Paths.get(dictionaryPath);
    }

    /**
     * Returns the XML schema source.
     *
     * @return path, or {@code null} if not configured
     */
    public Path getSchema() {
        return StringUtils.isBlank(schemaPath) ? null : Paths.get(schemaPath);
    }

    /**
     * Returns the configured JSON Schema file.
     *
     * @return file, or {@code null} to use the bundled schema
     * @throws IllegalStateException if a path is configured but the file does not exist
     */
    public File getJsonSchemaFile() {
        if (StringUtils.isBlank(jsonSchemaPath)) {
            return null;
        }
        File file = new File(jsonSchemaPath);
        if (!file.isFile()) {
            throw new IllegalStateException("json-schema-path does not exist: " + jsonSchemaPath
                    + ". Please fix 'ciflink.json-schema-path' in application.yml.");
        }
        return file;
    }

    /**
     * Returns the directory of persisted metadata.
     *
     * @return directory, or {@code null} when the disk cache is disabled
     */
    public File getCacheDirectory() {
        if (!diskCache) {
            return null;
        }
        if (StringUtils.isBlank(cacheDir)) {
            return new File(System.getProperty("user.home"), DEFAULT_CACHE_DIR_NAME);
        }
        return new File(cacheDir);
    }
}
