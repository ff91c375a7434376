package io.xblive.broker.store;

import io.xblive.broker.TokenStorageException;
import io.xblive.broker.internal.Json;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * {@link TokenStore} persisting every record in a single owner-only JSON document.
 *
 * <p>
 * The file is read lazily on first access. A missing file is a cold start. Each write goes to a
 * temporary file in the same directory which is then renamed over the document, so a reader never
 * observes a partial write and a failed write leaves the previous document in place.
 * </p>
 *
 * <p>
 * Safe for concurrent use within one process. Two processes sharing the same file race with
 * last-writer-wins semantics.
 * </p>
 */
public final class FileTokenStore implements TokenStore {

    private static final Logger LOGGER = Logger.getLogger(FileTokenStore.class.getName());

    private static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-------");
    private static final Set<PosixFilePermission> DIRECTORY_PERMISSIONS = PosixFilePermissions.fromString("rwx------");

    private final Path file;
    private final Clock clock;

    private Map<TokenKey, TokenRecord> records;

    public FileTokenStore(Path file) {
        this(file, Clock.systemUTC());
    }

    public FileTokenStore(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized Optional<TokenRecord> get(TokenKey key) throws TokenStorageException {
        TokenRecord record = loaded().get(key);
        if (record == null || !record.isUsableAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public synchronized void setAll(Map<TokenKey, TokenRecord> updates) throws TokenStorageException {
        Map<TokenKey, TokenRecord> next = new LinkedHashMap<>(loaded());
        next.putAll(updates);
        write(next);
        records = next;
        LOGGER.fine(() -> "[xblive] persisted " + updates.keySet() + " to " + file);
    }

    @Override
    public synchronized void remove(TokenKey key) throws TokenStorageException {
        if (!loaded().containsKey(key)) {
            return;
        }
        Map<TokenKey, TokenRecord> next = new LinkedHashMap<>(loaded());
        next.remove(key);
        write(next);
        records = next;
        LOGGER.fine(() -> "[xblive] removed " + key + " from " + file);
    }

    @Override
    public synchronized void clear() throws TokenStorageException {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            throw new TokenStorageException("remove token cache " + file + ": " + ex.getMessage(), ex);
        }
        records = new LinkedHashMap<>();
        LOGGER.fine(() -> "[xblive] cleared token cache " + file);
    }

    private Map<TokenKey, TokenRecord> loaded() throws TokenStorageException {
        if (records == null) {
            records = read();
        }
        return records;
    }

    private Map<TokenKey, TokenRecord> read() throws TokenStorageException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException ex) {
            LOGGER.fine(() -> "[xblive] no token cache at " + file + ", starting cold");
            return new LinkedHashMap<>();
        } catch (IOException ex) {
            throw new TokenStorageException("read token cache " + file + ": " + ex.getMessage(), ex);
        }

        if (bytes.length == 0) {
            return new LinkedHashMap<>();
        }
        try {
            CacheDocument document = Json.mapper().readValue(bytes, CacheDocument.class);
            return document == null ? new LinkedHashMap<>() : document.toRecords();
        } catch (IOException | IllegalArgumentException ex) {
            throw new TokenStorageException("parse token cache " + file + ": " + ex.getMessage(), ex);
        }
    }

    private void write(Map<TokenKey, TokenRecord> snapshot) throws TokenStorageException {
        Path directory = file.getParent();
        boolean posix = file.getFileSystem().supportedFileAttributeViews().contains("posix");
        Path temp = null;
        try {
            byte[] json = Json.mapper().writerWithDefaultPrettyPrinter()
                .writeValueAsBytes(CacheDocument.from(Collections.unmodifiableMap(snapshot)));

            if (directory != null && !Files.isDirectory(directory)) {
                if (posix) {
                    Files.createDirectories(directory, PosixFilePermissions.asFileAttribute(DIRECTORY_PERMISSIONS));
                } else {
                    Files.createDirectories(directory);
                }
            }

            FileAttribute<?>[] attributes = posix
                ? new FileAttribute<?>[] {PosixFilePermissions.asFileAttribute(FILE_PERMISSIONS)}
                : new FileAttribute<?>[0];
            temp = Files.createTempFile(directory, ".tokens-", ".tmp", attributes);
            Files.write(temp, json);
            move(temp, file);
            temp = null;
        } catch (IOException ex) {
            throw new TokenStorageException("write token cache " + file + ": " + ex.getMessage(), ex);
        } finally {
            if (temp != null) {
                deleteTemp(temp);
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            LOGGER.warning(() -> "[xblive] could not remove temporary cache file " + temp + ": " + ex.getMessage());
        }
    }
}
