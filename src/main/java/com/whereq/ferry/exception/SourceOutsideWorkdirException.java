package com.whereq.ferry.exception;

import java.nio.file.Path;

/**
 * A source file lives outside the working directory, so it cannot be packaged
 * with a path relative to the archive root.
 */
public class SourceOutsideWorkdirException extends ConfigurationException {

    private final Path file;

    public SourceOutsideWorkdirException(Path workdir, Path file) {
        super(String.format(
            "All source files must be present in the working directory %s to be uploaded "
                + "to a source package that respects relative paths, but %s was found outside "
                + "of this directory. Please set your working directory accordingly.",
            workdir, file));
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
