/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the NR-U BWP Manager.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.nru.metrics;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@link WindowMetrics} rows to a CSV file with a header line. Each row is flushed as it is written so a
 * partially completed run still leaves usable output.
 *
 * @author hal.hildebrand
 */
public class WindowMetricsWriter implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(WindowMetricsWriter.class);

    private final Path           path;
    private final SequenceWriter writer;
    private       long           rows;

    /**
     * Create or truncate the file, creating missing parent directories.
     *
     * @throws IOException if the file cannot be opened
     */
    public WindowMetricsWriter(Path path) throws IOException {
        this.path = path;
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        var mapper = new CsvMapper();
        var schema = mapper.schemaFor(WindowMetrics.class).withHeader();
        this.writer = mapper.writer(schema).writeValues(Files.newBufferedWriter(path));
        log.info("Writing window metrics to {}", path);
    }

    /**
     * @throws UncheckedIOException if the row cannot be written
     */
    public void write(WindowMetrics metrics) {
        try {
            writer.write(metrics);
            writer.flush();
            rows++;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write window metrics to " + path, e);
        }
    }

    public long getRows() {
        return rows;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        writer.close();
        log.debug("Closed window metrics {} after {} rows", path, rows);
    }
}
