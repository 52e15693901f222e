package com.pipewright.core.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Resolves where the state file of a run lives, in lookup order:
 * the canonical location first, then the legacy location.
 */
public class StateLocator {

    private static final Logger log = LoggerFactory.getLogger(StateLocator.class);

    private final Path canonicalRoot;
    private final Path legacyRoot;
    private final String fileName;

    public StateLocator(Path canonicalRoot, Path legacyRoot, String fileName) {
        this.canonicalRoot = canonicalRoot;
        this.legacyRoot = legacyRoot;
        this.fileName = fileName;
    }

    public static StateLocator from(StateProperties properties) {
        return new StateLocator(Path.of(properties.getRoot()), Path.of(properties.getLegacyRoot()),
                properties.getFileName());
    }

    public record Candidate(StateLocation location, Path path) {}

    public Path canonicalPath(String runId) {
        return canonicalRoot.resolve(runId).resolve(fileName);
    }

    public Path legacyPath(String runId) {
        return legacyRoot.resolve(runId).resolve(fileName);
    }

    public List<Candidate> candidates(String runId) {
        return List.of(
                new Candidate(StateLocation.CANONICAL, canonicalPath(runId)),
                new Candidate(StateLocation.LEGACY, legacyPath(runId)));
    }

    /**
     * Lists the state files present under one location.
     */
    public List<Path> stateFiles(StateLocation location) {
        Path root = location == StateLocation.CANONICAL ? canonicalRoot : legacyRoot;
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        var files = new ArrayList<Path>();
        try (Stream<Path> dirs = Files.list(root)) {
            dirs.filter(Files::isDirectory)
                    .map(dir -> dir.resolve(fileName))
                    .filter(Files::isRegularFile)
                    .forEach(files::add);
        } catch (IOException e) {
            log.warn("Failed to list state files under {}: {}", root, e.getMessage());
        }
        return files;
    }

    public Path canonicalRoot() {
        return canonicalRoot;
    }
}
