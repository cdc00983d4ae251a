package com.caredirectory.providers.model;

import java.nio.file.Path;

/**
 * A fully written snapshot archive and the ledger label it was built for.
 */
public record PublishedSnapshot(Path path, String label) {
}
