package com.bookforge.io;

import com.bookforge.config.PipelineConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one kind of table, replacing any existing file in a single step.
 *
 * @param <T> the row type
 */
public interface TableWriter<T> {

    void write(Path path, List<T> table, PipelineConfig config) throws IOException;
}
