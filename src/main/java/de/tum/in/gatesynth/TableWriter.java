/*
 * This file is part of GateSynth.
 * Copyright (c) 2024 The GateSynth authors.
 *
 * GateSynth is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * GateSynth is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with GateSynth. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.gatesynth;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * Writes truth tables in the format read by {@link TableReader#readTable}.
 */
public final class TableWriter {
    private TableWriter() {}

    public static void writeTable(Writer writer, Map<String, TruthTable> columns) throws IOException {
        if (columns.isEmpty()) {
            return;
        }
        int rows = columns.values().iterator().next().length();
        for (Map.Entry<String, TruthTable> column : columns.entrySet()) {
            if (column.getValue().length() != rows) {
                throw new IllegalArgumentException(String.format(
                        "Column %s has %d rows, expected %d", column.getKey(), column.getValue().length(), rows));
            }
        }

        writer.write(String.join(",", columns.keySet()));
        writer.write('\n');
        for (int row = 0; row < rows; row++) {
            boolean first = true;
            for (TruthTable column : columns.values()) {
                if (!first) {
                    writer.write(',');
                }
                first = false;
                writer.write(column.get(row) ? '1' : '0');
            }
            writer.write('\n');
        }
        writer.flush();
    }
}
