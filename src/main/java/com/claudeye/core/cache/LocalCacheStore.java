package com.claudeye.core.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Disk-backed {@link CacheStore}: every key maps to {@code {root}/{key}.json}
 * holding {@code {"value": ..., "meta": ...}}.
 * <p>
 * Writes go to a temp file in the same directory and are moved into place,
 * so a reader never sees a half-written entry.
 */
public class LocalCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(LocalCacheStore.class);
    private static final String SUFFIX = ".json";

    private final Path root;
    private final ObjectMapper objectMapper;

    public LocalCacheStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Path root() {
        return root;
    }

    @Override
    public <T> Optional<CacheEntry<T>> get(String key, Class<T> valueType) {
        try {
            Path file = fileFor(key);
            if (!Files.isRegularFile(file)) {
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(file.toFile());
            JsonNode meta = node.get("meta");
            if (meta == null || meta.isNull()) {
                return Optional.empty();
            }
            T value = objectMapper.treeToValue(node.get("value"), valueType);
            return Optional.of(new CacheEntry<>(value, objectMapper.treeToValue(meta, CacheMeta.class)));
        } catch (IOException | RuntimeException e) {
            log.debug("Cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public <T> void set(String key, T value, CacheMeta meta) {
        Path tmp = null;
        try {
            Path file = fileFor(key);
            Files.createDirectories(file.getParent());
            ObjectNode node = objectMapper.createObjectNode();
            node.set("value", objectMapper.valueToTree(value));
            node.set("meta", objectMapper.valueToTree(meta));
            tmp = Files.createTempFile(file.getParent(), ".write-", ".tmp");
            objectMapper.writeValue(tmp.toFile(), node);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException | RuntimeException e) {
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
        } finally {
            deleteQuietly(tmp);
        }
    }

    @Override
    public void invalidate(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException | RuntimeException e) {
            log.debug("Cache invalidate failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void invalidateByPrefix(String prefix) {
        int slash = prefix.lastIndexOf('/');
        String dirPart = slash >= 0 ? prefix.substring(0, slash) : "";
        String namePrefix = slash >= 0 ? prefix.substring(slash + 1) : prefix;
        Path dir;
        try {
            dir = dirPart.isEmpty() ? root : resolveInside(dirPart);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring invalid cache prefix {}: {}", prefix, e.getMessage());
            return;
        }
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : children.toList()) {
                String name = child.getFileName().toString();
                if (!name.startsWith(namePrefix)) {
                    continue;
                }
                if (Files.isDirectory(child)) {
                    deleteRecursively(child);
                } else if (name.endsWith(SUFFIX)) {
                    Files.deleteIfExists(child);
                }
            }
        } catch (IOException e) {
            log.warn("Cache prefix invalidation failed for {}: {}", prefix, e.getMessage());
        }
    }

    @Override
    public void clearAll() {
        try {
            deleteRecursively(root);
            log.info("Cleared cache at {}", root);
        } catch (IOException e) {
            log.warn("Failed to clear cache at {}: {}", root, e.getMessage());
        }
    }

    @Override
    public void close() {
        // Nothing is held open between calls.
    }

    Path fileFor(String key) {
        return resolveInside(key + SUFFIX);
    }

    private Path resolveInside(String relative) {
        if (relative == null || relative.isBlank()) {
            throw new IllegalArgumentException("empty cache key");
        }
        for (String segment : relative.split("/")) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("invalid cache key segment in '" + relative + "'");
            }
        }
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("cache key escapes root: " + relative);
        }
        return resolved;
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null && !(exc instanceof NoSuchFileException)) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temp cache file {}: {}", tmp, e.getMessage());
        }
    }
}
