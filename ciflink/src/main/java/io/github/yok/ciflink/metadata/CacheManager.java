package io.github.yok.ciflink.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.Validate;

/**
 * Two-level cache for parsed metadata and derived mapping rules.
 *
 * <p>
 * <strong>Levels:</strong>
 * </p>
 * <ul>
 * <li>Memory: one entry per key for the lifetime of this instance.</li>
 * <li>Disk (optional): one JSON file per key under the cache directory. Only entries stored with a
 * concrete bean type are persisted.</li>
 * </ul>
 *
 * <p>
 * Population is exclusive per key: the first caller runs the loader and concurrent callers for the
 * same key wait for its result. A failed load is not cached. A corrupted disk entry is deleted and
 * the value is loaded again.
 * </p>
 *
 * <p>
 * The instance is owned by its caller and released with {@link #close()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CacheManager implements AutoCloseable {

    private final ConcurrentMap<String, FutureTask<Object>> memory = new ConcurrentHashMap<>();

    // null when the disk level is disabled
    @Getter
    private final File cacheDir;

    private final ObjectMapper mapper;

    /**
     * Creates a memory-only cache.
     */
    public CacheManager() {
        this(null, new ObjectMapper());
    }

    /**
     * Creates a cache.
     *
     * @param cacheDir directory for persisted entries, or {@code null} for memory only
     * @param mapper mapper used to persist entries
     */
    public CacheManager(File cacheDir, ObjectMapper mapper) {
        Validate.notNull(mapper, "mapper must not be null.");
        this.cacheDir = cacheDir;
        this.mapper = mapper;
    }

    /**
     * Builds a cache key for a source file from its absolute path, size and modification time.
     *
     * @param kind entry kind, e.g. {@code "dictionary"}
     * @param source source file
     * @return key of the form {@code <kind>_<sha256>}
     * @throws IOException if the file attributes cannot be read
     */
    public static String keyOf(String kind, Path source) throws IOException {
        Path abs = source.toAbsolutePath().normalize();
        String raw = abs + "|" + Files.size(abs) + "|" + Files.getLastModifiedTime(abs).toMillis();
        return kind + "_" + DigestUtils.sha256Hex(raw);
    }

    /**
     * Returns the cached value for a key, loading and persisting it when absent.
     *
     * @param <T> value type
     * @param key cache key
     * @param type concrete bean type used for the disk level
     * @param loader computes the value on a miss
     * @return cached or freshly loaded value
     */
    public <T> T get(String key, Class<T> type, Callable<T> loader) {
        return type.cast(getFromMemory(key, () -> loadThroughDisk(key, type, loader)));
    }

    /**
     * Returns a memory-only cached value.
     *
     * @param <T> value type
     * @param key cache key
     * @param type value type
     * @param loader computes the value on a miss
     * @return cached or freshly computed value
     */
    public <T> T getInMemory(String key, Class<T> type, Callable<T> loader) {
        return type.cast(getFromMemory(key, loader));
    }

    private Object getFromMemory(String key, Callable<?> loader) {
        FutureTask<Object> created = new FutureTask<>(loader::call);
        FutureTask<Object> task = memory.putIfAbsent(key, created);
        if (task == null) {
            task = created;
            task.run();
        }
        try {
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            memory.remove(key, task);
            throw new MetadataException("Interrupted while waiting for cache entry " + key, e);
        } catch (ExecutionException e) {
            memory.remove(key, task);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new MetadataException("Failed to load cache entry " + key, cause);
        }
    }

    private <T> T loadThroughDisk(String key, Class<T> type, Callable<T> loader) throws Exception {
        if (cacheDir != null) {
            File file = fileOf(key);
            if (file.isFile()) {
                try {
                    T value = readEntry(file, type);
                    log.info("Using cached metadata: {}", file.getAbsolutePath());
                    return value;
                } catch (CacheException e) {
                    log.warn("Discarding corrupted cache entry {}: {}", file.getAbsolutePath(),
                            e.getMessage());
                    FileUtils.deleteQuietly(file);
                }
            }
        }
        T value = loader.call();
        if (cacheDir != null) {
            try {
                writeEntry(fileOf(key), value);
            } catch (CacheException e) {
                log.warn("Could not persist cache entry {}: {}", key, e.getMessage());
            }
        }
        return value;
    }

    private <T> T readEntry(File file, Class<T> type) throws CacheException {
        try {
            T value = mapper.readValue(file, type);
            if (value == null) {
                throw new CacheException("empty cache entry", null);
            }
            return value;
        } catch (IOException e) {
            throw new CacheException(e.getMessage(), e);
        }
    }

    private void writeEntry(File file, Object value) throws CacheException {
        try {
            FileUtils.forceMkdir(cacheDir);
            File tmp = new File(cacheDir, file.getName() + ".tmp");
            mapper.writeValue(tmp, value);
            FileUtils.deleteQuietly(file);
            FileUtils.moveFile(tmp, file);
            log.debug("Persisted cache entry: {}", file.getAbsolutePath());
        } catch (JsonProcessingException e) {
            throw new CacheException("cannot serialize entry: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CacheException(e.getMessage(), e);
        }
    }

    /**
     * Returns the disk file of a key.
     *
     * @param key cache key
     * @return file under the cache directory
     */
    public File fileOf(String key) {
        Validate.validState(cacheDir != null, "disk cache is disabled.");
        return new File(cacheDir, key + ".json");
    }

    /**
     * Drops all memory entries. Disk entries are kept.
     */
    public void clear() {
        memory.clear();
    }

    @Override
    public void close() {
        clear();
    }
}
