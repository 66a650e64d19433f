package com.example.wormhole.storage;

import com.example.wormhole.config.WormholeProperties.DeleteMode;
import com.example.wormhole.model.MappingIndex;
import com.example.wormhole.model.ShardConfig;
import com.example.wormhole.model.UserMapping;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;

/**
 * Git-style sharded store holding one mapping per JSON file:
 * {@code <root>/<level1>/<level2>/<hash>.json}, plus a derived {@code <root>/index.json}.
 * <p>
 * The directory fan-out is bounded by {@code 16^level1Length} at the first tier and
 * {@code 16^level2Length} at the second, whatever the number of records.
 * Each write replaces exactly one file through a rename, so writes to different ids never
 * interfere; two writes to the same id race and the last rename wins.
 * <p>
 * The index is rebuilt from the record files and must only be rebuilt once all writes of
 * a batch have completed.
 */
public class ShardStore {

    private static final Logger log = LoggerFactory.getLogger(ShardStore.class);

    public static final String INDEX_FILE = "index.json";
    private static final String RECORD_SUFFIX = ".json";

    private final Path root;
    private final ShardConfig config;
    private final DeleteMode deleteMode;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public ShardStore(Path root, ShardConfig config, DeleteMode deleteMode,
                      ObjectMapper objectMapper, ExecutorService executor) {
        this.root = root;
        this.config = config;
        this.deleteMode = deleteMode;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    public Path root() {
        return root;
    }

    /**
     * SHA-256 of the id, hex encoded and truncated to {@code hashLength} characters.
     */
    public String hash(String id) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(id.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, config.hashLength());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Store-relative path of an id, e.g. {@code ab/cd/abcdef12.json}.
     */
    public String shardPath(String id) {
        String hash = hash(id);
        String level1 = hash.substring(0, config.level1Length());
        String level2 = hash.substring(config.level1Length(), config.level1Length() + config.level2Length());
        return level1 + "/" + level2 + "/" + hash + RECORD_SUFFIX;
    }

    public Path fullPath(String id) {
        return root.resolve(shardPath(id));
    }

    /**
     * Writes (or overwrites) the record of an id.
     *
     * @throws StorageException on any file-system failure
     */
    public void write(String id, UserMapping mapping) {
        Path target = fullPath(id);
        try {
            Files.createDirectories(target.getParent());
            writeAtomically(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(mapping));
            log.debug("Wrote mapping {} -> {}", id, root.relativize(target));
        } catch (IOException e) {
            throw new StorageException("Failed to write mapping for " + id, e);
        }
    }

    /**
     * Reads the record of an id. Missing, empty (deleted) and unparsable files are absent.
     *
     * @throws StorageException on I/O failures other than a missing file
     */
    public Optional<UserMapping> read(String id) {
        return readRecord(fullPath(id), id);
    }

    /**
     * Reads a record by its index-relative path.
     */
    public Optional<UserMapping> resolve(String relativePath) {
        return readRecord(root.resolve(relativePath), relativePath);
    }

    /**
     * Deletes the record of an id: TRUNCATE leaves an empty tombstone file in place,
     * REMOVE deletes the file. Deleting an unknown id is a no-op.
     */
    public void delete(String id) {
        Path target = fullPath(id);
        try {
            if (deleteMode == DeleteMode.REMOVE) {
                Files.deleteIfExists(target);
            } else if (Files.exists(target)) {
                Files.write(target, new byte[0]);
            }
            log.debug("Deleted mapping {} ({})", id, deleteMode);
        } catch (IOException e) {
            throw new StorageException("Failed to delete mapping for " + id, e);
        }
    }

    /**
     * Existence check only; the content is not read. A TRUNCATE tombstone still counts as present.
     */
    public boolean has(String id) {
        return Files.exists(fullPath(id));
    }

    /**
     * Scans every record file and indexes it under both of its identifiers.
     * Cost is O(records). Any file that does not yield a record with both identifiers is
     * logged and skipped; only a failure to walk the directory tree raises.
     */
    public MappingIndex buildIndex() {
        MappingIndex index = MappingIndex.empty();
        if (!Files.isDirectory(root)) {
            return index;
        }
        Path indexFile = root.resolve(INDEX_FILE);
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(RECORD_SUFFIX))
                    .filter(p -> !p.equals(indexFile))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to scan " + root, e);
        }

        int skipped = 0;
        for (Path file : files) {
            String relativePath = toRelativePath(file);
            Optional<UserMapping> mapping;
            try {
                mapping = readRecord(file, relativePath);
            } catch (StorageException e) {
                log.warn("Skipping unreadable record {}: {}", relativePath, e.getMessage());
                skipped++;
                continue;
            }
            if (mapping.isEmpty()) {
                skipped++;
                continue;
            }
            UserMapping record = mapping.get();
            if (record.bilibiliUid() == null || record.youtubeChannelId() == null) {
                log.warn("Skipping record {} without both identifiers", relativePath);
                skipped++;
                continue;
            }
            index.put(record.bilibiliUid(), relativePath);
            index.put(record.youtubeChannelId(), relativePath);
        }
        log.info("Built index for {}: {} keys from {} files ({} skipped)",
                root, index.size(), files.size(), skipped);
        return index;
    }

    public void writeIndex(MappingIndex index) {
        try {
            Files.createDirectories(root);
            writeAtomically(root.resolve(INDEX_FILE),
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(index));
        } catch (IOException e) {
            throw new StorageException("Failed to write index in " + root, e);
        }
    }

    /**
     * Reads the persisted index; absent when missing or malformed.
     */
    public Optional<MappingIndex> readIndex() {
        Path indexFile = root.resolve(INDEX_FILE);
        try {
            byte[] content = Files.readAllBytes(indexFile);
            return Optional.ofNullable(objectMapper.readValue(content, MappingIndex.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed index {}: {}", indexFile, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read index in " + root, e);
        }
    }

    /**
     * Rebuilds and persists the index in one step.
     */
    public MappingIndex rebuildIndex() {
        MappingIndex index = buildIndex();
        writeIndex(index);
        return index;
    }

    /**
     * Issues all writes concurrently and waits for every one of them to settle.
     * There is no rollback: writes that succeeded stay written, and the first failure
     * (in list order) is rethrown.
     */
    public void batchWrite(List<ShardEntry> entries) {
        List<CompletableFuture<Void>> writes = new ArrayList<>(entries.size());
        for (ShardEntry entry : entries) {
            writes.add(CompletableFuture.runAsync(() -> write(entry.id(), entry.mapping()), executor));
        }

        CompletableFuture.allOf(writes.toArray(CompletableFuture[]::new))
                .exceptionally(ex -> null)
                .join();

        for (CompletableFuture<Void> write : writes) {
            if (write.isCompletedExceptionally()) {
                try {
                    write.get();
                } catch (ExecutionException e) {
                    throw rethrow(e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StorageException("Interrupted while waiting for batch write", e);
                }
            }
        }
    }

    private Optional<UserMapping> readRecord(Path file, String label) {
        try {
            byte[] content = Files.readAllBytes(file);
            if (isBlank(content)) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(content, UserMapping.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unparsable record {}: {}", label, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read mapping " + label, e);
        }
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private String toRelativePath(Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    private static boolean isBlank(byte[] content) {
        for (byte b : content) {
            if (!Character.isWhitespace(b)) return false;
        }
        return true;
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new StorageException("Batch write failed", cause);
    }
}
