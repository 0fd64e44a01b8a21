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

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Reads the comma separated tables the command line tool works with: truth tables (a header of
 * column names followed by rows of {@code 0}/{@code 1} cells) and gate tables (rows of
 * {@code gate_name,num_inputs,complexity}). Blank lines and lines starting with {@code #} are
 * ignored.
 */
public final class TableReader {
    private static final Pattern SEPARATOR = Pattern.compile(",");

    private TableReader() {}

    @Nullable
    private static String nextLine(BufferedReader reader) throws IOException {
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.charAt(0) == '#') {
                continue;
            }
            return stripped;
        }
    }

    private static String[] cells(String line) {
        String[] cells = SEPARATOR.split(line, -1);
        for (int i = 0; i < cells.length; i++) {
            cells[i] = cells[i].strip();
        }
        return cells;
    }

    /**
     * Reads a truth table, returning the columns by name in header order.
     */
    public static Map<String, TruthTable> readTable(BufferedReader reader) throws IOException, InvalidFormatException {
        String header = nextLine(reader);
        if (header == null) {
            throw new InvalidFormatException("Stream is empty");
        }
        String[] names = cells(header);
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name.isEmpty()) {
                throw new InvalidFormatException("Empty column name in header " + header);
            }
            if (!seen.add(name)) {
                throw new InvalidFormatException("Duplicate column " + name);
            }
        }

        List<boolean[]> rows = new ArrayList<>();
        while (true) {
            String line = nextLine(reader);
            if (line == null) {
                break;
            }
            String[] cells = cells(line);
            if (cells.length != names.length) {
                throw new InvalidFormatException(String.format(
                        "Row %d has %d cells, expected %d: %s", rows.size() + 1, cells.length, names.length, line));
            }
            boolean[] row = new boolean[cells.length];
            for (int column = 0; column < cells.length; column++) {
                if ("1".equals(cells[column])) {
                    row[column] = true;
                } else if (!"0".equals(cells[column])) {
                    throw new InvalidFormatException(String.format(
                            "Non-binary value '%s' in row %d, column %s", cells[column], rows.size() + 1, names[column]));
                }
            }
            rows.add(row);
        }

        Map<String, TruthTable> columns = new LinkedHashMap<>();
        for (int column = 0; column < names.length; column++) {
            boolean[] bits = new boolean[rows.size()];
            for (int row = 0; row < bits.length; row++) {
                bits[row] = rows.get(row)[column];
            }
            columns.put(names[column], TruthTable.of(bits));
        }
        return columns;
    }

    /**
     * Reads a gate table. The names refer to the {@link StandardGates standard gates}, the declared
     * number of inputs has to match the gate. A leading header line is skipped.
     */
    public static GateLibrary readGateLibrary(BufferedReader reader) throws IOException, InvalidFormatException {
        List<Gate> gates = new ArrayList<>();
        boolean first = true;
        while (true) {
            String line = nextLine(reader);
            if (line == null) {
                break;
            }
            String[] cells = cells(line);
            if (cells.length != 3) {
                throw new InvalidFormatException("Expected name, inputs and complexity: " + line);
            }
            if (first && !isInteger(cells[1])) {
                first = false;
                continue;
            }
            first = false;

            StandardGates gate = StandardGates.byName(cells[0])
                    .orElseThrow(() -> new InvalidFormatException("Unknown gate " + cells[0]));
            int inputs;
            int cost;
            try {
                inputs = Integer.parseInt(cells[1]);
                cost = Integer.parseInt(cells[2]);
            } catch (NumberFormatException e) {
                throw new InvalidFormatException("Invalid gate definition " + line, e);
            }
            if (inputs != gate.arity()) {
                throw new InvalidFormatException(
                        String.format("Gate %s has %d inputs, declared %d", gate, gate.arity(), inputs));
            }
            try {
                gates.add(gate.gate(cost));
            } catch (ConfigurationException e) {
                throw new InvalidFormatException(e.getMessage(), e);
            }
        }
        try {
            return GateLibrary.of(gates);
        } catch (ConfigurationException e) {
            throw new InvalidFormatException(e.getMessage(), e);
        }
    }

    private static boolean isInteger(String cell) {
        if (cell.isEmpty()) {
            return false;
        }
        for (int i = 0; i < cell.length(); i++) {
            char c = cell.charAt(i);
            if (!Character.isDigit(c) && !(i == 0 && c == '-')) {
                return false;
            }
        }
        return true;
    }

    public static class InvalidFormatException extends Exception {
        private static final long serialVersionUID = 1L;

        public InvalidFormatException(String message) {
            super(message);
        }

        public InvalidFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
