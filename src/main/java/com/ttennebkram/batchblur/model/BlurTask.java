package com.ttennebkram.batchblur.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A single input image queued for blurring. Immutable.
 */
public final class BlurTask {

    private final Path path;

    public BlurTask(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path getPath() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlurTask)) return false;
        return path.equals(((BlurTask) o).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
