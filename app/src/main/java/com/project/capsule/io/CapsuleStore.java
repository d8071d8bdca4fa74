package com.project.capsule.io;

import com.project.capsule.core.Capsule;
import com.project.capsule.core.CapsuleException.IndexOutOfRangeException;
import com.project.capsule.core.CapsuleException.StorageException;
import com.project.capsule.crypto.ErrorLogger;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Append-only, ordered collection of capsules indexed 0..n-1 in creation order.
 *
 * <p>When backed by a directory, each capsule lives in its own {@code capsule-NNNNNN.json}
 * file named after its index, written to a temporary file first and then linked into place.
 * The store never rewrites, reorders or deletes a record.</p>
 *
 * <p>Not thread-safe; {@code TimeCapsuleService} serializes writers against readers.</p>
 */
public class CapsuleStore {

    private static final String FILE_PREFIX = "capsule-";
    private static final String FILE_SUFFIX = ".json";
    private static final Pattern FILE_PATTERN = Pattern.compile("^capsule-(\\d{6,})\\.json$");

    private final Optional<Path> directory;
    private final List<Capsule> capsules = new ArrayList<>();

    private CapsuleStore(Optional<Path> directory) {
        this.directory = directory;
    }

    /**
     * Store kept only in memory, for tests and throwaway sessions.
     */
    public static CapsuleStore inMemory() {
        return new CapsuleStore(Optional.empty());
    }

    /**
     * Open (creating if needed) a store persisted under {@code directory} and load every record
     * through {@link CapsuleCodec}.
     *
     * @throws StorageException if the directory cannot be read, a record cannot be decoded, or
     *                          the record files do not form a contiguous index sequence.
     */
    public static CapsuleStore open(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        CapsuleStore store = new CapsuleStore(Optional.of(directory));
        try {
            Files.createDirectories(directory);
            List<Path> files;
            try (Stream<Path> listing = Files.list(directory)) {
                files = listing
                        .filter(path -> FILE_PATTERN.matcher(path.getFileName().toString()).matches())
                        .sorted(Comparator.comparingInt(CapsuleStore::indexOf))
                        .toList();
            }
            for (int expected = 0; expected < files.size(); expected++) {
                Path file = files.get(expected);
                int actual = indexOf(file);
                if (actual != expected) {
                    throw new StorageException(String.format(
                            "Capsule store is not contiguous: expected index %d but found %s",
                            expected, file.getFileName()));
                }
                store.capsules.add(read(file));
            }
        } catch (IOException e) {
            ErrorLogger.logError("CapsuleStore.open", "Failed to open capsule store at " + directory, e);
            throw new StorageException("Failed to open capsule store at " + directory, e);
        }
        ErrorLogger.logInfo("CapsuleStore.open", "Loaded " + store.size() + " capsules from " + directory);
        return store;
    }

    /**
     * Append a capsule and return its index. The in-memory view is only extended after the
     * record is durably in place.
     */
    public int append(Capsule capsule) {
        Objects.requireNonNull(capsule, "capsule must not be null");
        int index = capsules.size();
        if (directory.isPresent()) {
            write(directory.get(), index, capsule);
        }
        capsules.add(capsule);
        return index;
    }

    public Capsule get(int index) {
        if (index < 0 || index >= capsules.size()) {
            throw new IndexOutOfRangeException(index, capsules.size());
        }
        return capsules.get(index);
    }

    public int size() {
        return capsules.size();
    }

    /**
     * Snapshot of all capsules in creation order.
     */
    public List<Capsule> list() {
        return List.copyOf(capsules);
    }

    public Optional<Path> directory() {
        return directory;
    }

    static String fileName(int index) {
        return String.format("%s%06d%s", FILE_PREFIX, index, FILE_SUFFIX);
    }

    static int indexOf(Path file) {
        Matcher matcher = FILE_PATTERN.matcher(file.getFileName().toString());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a capsule file: " + file);
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new StorageException("Capsule record index is out of range: " + file.getFileName(), e);
        }
    }

    private static Capsule read(Path file) throws IOException {
        try {
            return CapsuleCodec.decode(Files.readAllBytes(file));
        } catch (StorageException e) {
            ErrorLogger.logError("CapsuleStore.read", "Corrupted capsule record " + file.getFileName(), e);
            throw new StorageException("Corrupted capsule record " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static void write(Path directory, int index, Capsule capsule) {
        Path target = directory.resolve(fileName(index));
        byte[] encoded = CapsuleCodec.encode(capsule);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, FILE_PREFIX, ".tmp");
            Files.write(temp, encoded);
            publish(temp, target);
        } catch (FileAlreadyExistsException e) {
            ErrorLogger.logError("CapsuleStore.write", "Capsule record " + target.getFileName() + " already exists", e);
            throw new StorageException("Refusing to overwrite existing capsule record " + target.getFileName(), e);
        } catch (IOException e) {
            ErrorLogger.logError("CapsuleStore.write", "Failed to persist capsule " + index, e);
            throw new StorageException("Failed to persist capsule record " + target.getFileName(), e);
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * Link the finished record into place.
     *
     * @throws FileAlreadyExistsException if a record with this index was already published.
     */
    private static void publish(Path temp, Path target) throws IOException {
        try {
            Files.createLink(target, temp);
        } catch (UnsupportedOperationException e) {
            Files.move(temp, target);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            ErrorLogger.logWarning("CapsuleStore.write", "Could not remove temporary file " + temp);
        }
    }
}
