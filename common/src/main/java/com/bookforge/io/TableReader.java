package com.bookforge.io;

import com.bookforge.config.PipelineConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads one kind of table fully into memory.
 *
 * @param <T> the row type
 */
public interface TableReader<T> {

    /**
     * Reads the whole table at {@code path}.
     *
     * @throws com.bookforge.error.IntegrityException if a row cannot be parsed into {@code T}
     */
    List<T> read(Path path, PipelineConfig config) throws IOException;
}
