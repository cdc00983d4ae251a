package com.caredirectory.providers.model;

import java.nio.file.Path;

/**
 * A fully written archive still at its temp path, waiting to be moved onto {@code target}.
 */
public record StagedSnapshot(Path stagedPath, Path target, String label) {
}
