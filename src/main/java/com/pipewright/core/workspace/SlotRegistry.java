package com.pipewright.core.workspace;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipewright.core.persistence.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * JSON file listing the allocated workspace slots.
 * <p>
 * Every read-modify-write happens under an exclusive lock on a sibling
 * {@code .lock} file, so step processes running at the same time agree on
 * which slots are taken.
 */
public class SlotRegistry {

    private static final Logger log = LoggerFactory.getLogger(SlotRegistry.class);

    private static final TypeReference<List<WorkspaceSlot>> SLOT_LIST = new TypeReference<>() {};

    private final Path file;
    private final Path lockFile;
    private final ObjectMapper objectMapper = ObjectMappers.standard();

    public SlotRegistry(Path file) {
        this.file = file;
        this.lockFile = file.resolveSibling(file.getFileName() + ".lock");
    }

    /**
     * Reads the slot list under a shared lock. Nothing is created on disk:
     * without a lock file no writer has ever run, so the registry file is read as is.
     */
    public synchronized List<WorkspaceSlot> list() {
        try {
            if (!Files.isRegularFile(lockFile)) {
                return List.copyOf(read());
            }
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.READ);
                 FileLock ignored = channel.lock(0, Long.MAX_VALUE, true)) {
                return List.copyOf(read());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read workspace registry " + file, e);
        }
    }

    /**
     * Applies {@code change} to the current slot list under the file lock and
     * persists the list afterwards.
     */
    public synchronized <T> T update(Function<List<WorkspaceSlot>, T> change) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                List<WorkspaceSlot> slots = read();
                List<WorkspaceSlot> before = List.copyOf(slots);
                T result = change.apply(slots);
                if (!before.equals(slots)) {
                    write(slots);
                }
                return result;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to update workspace registry " + file, e);
        }
    }

    private List<WorkspaceSlot> read() throws IOException {
        if (!Files.isRegularFile(file)) {
            return new ArrayList<>();
        }
        try {
            List<WorkspaceSlot> slots = objectMapper.readValue(file.toFile(), SLOT_LIST);
            return slots != null ? new ArrayList<>(slots) : new ArrayList<>();
        } catch (IOException e) {
            log.error("Workspace registry {} is unreadable; refusing to overwrite it", file);
            throw e;
        }
    }

    private void write(List<WorkspaceSlot> slots) throws IOException {
        Path temp = Files.createTempFile(file.toAbsolutePath().getParent(), ".slots-", ".json");
        objectMapper.writeValue(temp.toFile(), slots);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Workspace registry now holds {} slot(s)", slots.size());
    }
}
