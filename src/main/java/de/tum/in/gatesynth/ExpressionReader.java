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

import de.tum.in.gatesynth.TableReader.InvalidFormatException;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Turns circuit expressions such as {@code Sum : XOR2(A, B)} into a synthesis problem: the
 * variables of all expressions, sorted by name, span the canonical input table, and each
 * expression is evaluated into one target column.
 *
 * <p>Each non-blank line holds one expression, optionally prefixed by {@code Name :} and followed
 * by a {@code [complexity=N]} annotation, which is ignored wherever it appears. Unnamed outputs are called
 * {@code Output}, or {@code Output1}, {@code Output2}, ... if there are several lines. Gates are
 * the {@link StandardGates}, where {@code AND}, {@code OR}, {@code NAND}, {@code NOR}, {@code XOR}
 * and {@code XNOR} denote the two-input variants. Variables are an upper case letter followed by
 * digits.</p>
 *
 * <p>A file whose first line is {@code NO OUTPUTS} only lists variables, separated by whitespace, on
 * its second line. Such a file describes an input table without targets, see
 * {@link #parseInputsOnly(List)}.</p>
 */
public final class ExpressionReader {
    private static final Pattern ANNOTATION = Pattern.compile("\\s*\\[complexity=\\d+]");
    private static final String INPUTS_ONLY = "NO OUTPUTS";
    private static final Pattern VARIABLE = Pattern.compile("[A-Z][0-9]*");
    private static final Map<String, String> ALIASES = Map.of(
            "AND", "AND2", "OR", "OR2", "NAND", "NAND2", "NOR", "NOR2", "XOR", "XOR2", "XNOR", "XNOR2");

    private ExpressionReader() {}

    public static SynthesisProblem read(BufferedReader reader) throws IOException, InvalidFormatException {
        return parse(lines(reader));
    }

    /**
     * Returns the stripped, non-blank lines of the reader.
     */
    public static List<String> lines(BufferedReader reader) throws IOException {
        List<String> lines = new ArrayList<>();
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        return lines;
    }

    public static boolean isInputsOnly(List<String> lines) {
        return !lines.isEmpty() && INPUTS_ONLY.equals(lines.get(0).toUpperCase(Locale.ROOT));
    }

    /**
     * Builds the canonical input table for the variables listed after a {@code NO OUTPUTS} header,
     * sorted by name.
     */
    public static Map<String, TruthTable> parseInputsOnly(List<String> lines) throws InvalidFormatException {
        if (!isInputsOnly(lines)) {
            throw new InvalidFormatException("Expected " + INPUTS_ONLY + " header");
        }
        if (lines.size() != 2) {
            throw new InvalidFormatException(INPUTS_ONLY + " expects exactly one line of variable names");
        }
        List<String> variables = new ArrayList<>(Arrays.asList(lines.get(1).split("\\s+")));
        for (String variable : variables) {
            if (!VARIABLE.matcher(variable).matches()) {
                throw new InvalidFormatException("Invalid variable " + variable);
            }
        }
        Collections.sort(variables);
        try {
            return SynthesisProblem.inputsFor(variables);
        } catch (ConfigurationException e) {
            throw new InvalidFormatException(e.getMessage(), e);
        }
    }

    public static SynthesisProblem parse(List<String> lines) throws InvalidFormatException {
        if (lines.isEmpty()) {
            throw new InvalidFormatException("No expressions given");
        }
        Map<String, Expression> expressions = new LinkedHashMap<>();
        Set<String> variables = new TreeSet<>();
        if (isInputsOnly(lines)) {
            throw new InvalidFormatException(INPUTS_ONLY + " lists no expressions");
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = ANNOTATION.matcher(lines.get(i)).replaceAll("");
            String name;
            int colon = line.indexOf(':');
            if (colon >= 0) {
                name = line.substring(0, colon).strip();
                line = line.substring(colon + 1);
                if (name.isEmpty()) {
                    throw new InvalidFormatException("Empty output name in " + lines.get(i));
                }
            } else {
                name = lines.size() == 1 ? "Output" : "Output" + (i + 1);
            }
            Expression expression = parseExpression(line);
            expression.collectVariables(variables);
            if (expressions.put(name, expression) != null) {
                throw new InvalidFormatException("Output " + name + " defined twice");
            }
        }

        Map<String, TruthTable> inputs;
        try {
            inputs = SynthesisProblem.inputsFor(new ArrayList<>(variables));
        } catch (ConfigurationException e) {
            throw new InvalidFormatException(e.getMessage(), e);
        }
        Map<String, TruthTable> targets = new LinkedHashMap<>();
        expressions.forEach((name, expression) -> targets.put(name, expression.evaluate(inputs)));
        return SynthesisProblem.of(inputs, targets);
    }

    /**
     * Parses a single expression.
     */
    public static Expression parseExpression(String text) throws InvalidFormatException {
        Parser parser = new Parser(text);
        Expression expression = parser.expression();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error("Unexpected trailing input");
        }
        return expression;
    }

    /**
     * A parsed expression tree.
     */
    public abstract static class Expression {
        abstract void collectVariables(Set<String> variables);

        public abstract TruthTable evaluate(Map<String, TruthTable> inputs);
    }

    private static final class VariableExpression extends Expression {
        private final String name;

        VariableExpression(String name) {
            this.name = name;
        }

        @Override
        void collectVariables(Set<String> variables) {
            variables.add(name);
        }

        @Override
        public TruthTable evaluate(Map<String, TruthTable> inputs) {
            TruthTable value = inputs.get(name);
            if (value == null) {
                throw new IllegalArgumentException("No value for variable " + name);
            }
            return value;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class GateExpression extends Expression {
        private final Gate gate;
        private final List<Expression> arguments;

        GateExpression(Gate gate, List<Expression> arguments) {
            this.gate = gate;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        void collectVariables(Set<String> variables) {
            arguments.forEach(argument -> argument.collectVariables(variables));
        }

        @Override
        public TruthTable evaluate(Map<String, TruthTable> inputs) {
            TruthTable[] values = new TruthTable[arguments.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = arguments.get(i).evaluate(inputs);
            }
            return gate.apply(values);
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder(gate.name()).append('(');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) {
                    builder.append(", ");
                }
                builder.append(arguments.get(i));
            }
            return builder.append(')').toString();
        }
    }

    private static final class Parser {
        private final String text;
        private int position = 0;

        Parser(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return position >= text.length();
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(position))) {
                position += 1;
            }
        }

        InvalidFormatException error(String message) {
            return new InvalidFormatException(String.format("%s at position %d in '%s'", message, position, text));
        }

        Expression expression() throws InvalidFormatException {
            skipWhitespace();
            int start = position;
            while (!atEnd() && Character.isLetterOrDigit(text.charAt(position))) {
                position += 1;
            }
            if (start == position) {
                throw error("Expected identifier");
            }
            String identifier = text.substring(start, position);
            skipWhitespace();
            if (atEnd() || text.charAt(position) != '(') {
                if (!VARIABLE.matcher(identifier).matches()) {
                    throw error("Invalid variable " + identifier);
                }
                return new VariableExpression(identifier);
            }

            position += 1;
            List<Expression> arguments = new ArrayList<>();
            while (true) {
                arguments.add(expression());
                skipWhitespace();
                if (atEnd()) {
                    throw error("Unterminated argument list");
                }
                char next = text.charAt(position);
                position += 1;
                if (next == ')') {
                    break;
                }
                if (next != ',') {
                    throw error("Expected ',' or ')'");
                }
            }

            String gateName = ALIASES.getOrDefault(identifier.toUpperCase(Locale.ROOT), identifier);
            StandardGates gate = StandardGates.byName(gateName)
                    .orElseThrow(() -> error("Unknown gate " + identifier));
            if (gate.arity() != arguments.size()) {
                throw error(String.format("Gate %s expects %d arguments, got %d", gate, gate.arity(), arguments.size()));
            }
            return new GateExpression(gate.gate(0), arguments);
        }
    }
}
