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
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Command line entry point. Reads the truth tables (or circuit expressions) and the gate table,
 * runs the multi-output search and prints the found circuit. With {@code --generate}, it writes the
 * truth tables of a circuit expression file as {@code input.csv} and {@code output.csv} instead.
 *
 * <pre>
 * gatesynth &lt;inputs.csv&gt; &lt;outputs.csv&gt; &lt;gates.csv&gt; [maxComplexity]
 * gatesynth --expressions &lt;circuit.txt&gt; &lt;gates.csv&gt; [maxComplexity]
 * gatesynth --generate &lt;circuit.txt&gt; [outputDirectory]
 * </pre>
 */
public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_UNREACHABLE = 2;

    private static final Logger logger = Logger.getLogger(Main.class.getName());
    static final String INPUT_FILE = "input.csv";
    static final String OUTPUT_FILE = "output.csv";

    private static final String DEFAULT_OUTPUT_DIRECTORY = "I-O";
    private static final String USAGE = "Usage: gatesynth <inputs.csv> <outputs.csv> <gates.csv> [maxComplexity]\n"
            + "       gatesynth --expressions <circuit.txt> <gates.csv> [maxComplexity]\n"
            + "       gatesynth --generate <circuit.txt> [outputDirectory]";

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(Arrays.asList(args), System.out, System.err));
    }

    static int run(List<String> args, PrintStream out, PrintStream err) {
        if (!args.isEmpty() && "--generate".equals(args.get(0))) {
            return generate(args.subList(1, args.size()), out, err);
        }
        boolean expressions = !args.isEmpty() && "--expressions".equals(args.get(0));
        List<String> files = expressions ? args.subList(1, args.size()) : args;
        int required = expressions ? 2 : 3;
        if (files.size() != required && files.size() != required + 1) {
            err.println(USAGE);
            return EXIT_INVALID_INPUT;
        }

        SynthesisProblem problem;
        GateLibrary library;
        SynthesisConfiguration configuration;
        try {
            if (expressions) {
                try (BufferedReader reader = reader(files.get(0))) {
                    problem = ExpressionReader.read(reader);
                }
            } else {
                Map<String, TruthTable> inputs;
                Map<String, TruthTable> targets;
                try (BufferedReader reader = reader(files.get(0))) {
                    inputs = TableReader.readTable(reader);
                }
                try (BufferedReader reader = reader(files.get(1))) {
                    targets = TableReader.readTable(reader);
                }
                problem = SynthesisProblem.of(inputs, targets);
            }
            try (BufferedReader reader = reader(files.get(required - 1))) {
                library = TableReader.readGateLibrary(reader);
            }
            ImmutableSynthesisConfiguration.Builder builder = ImmutableSynthesisConfiguration.builder();
            if (files.size() > required) {
                builder.maxComplexity(Integer.parseInt(files.get(required)));
            }
            configuration = builder.build();
        } catch (IOException | InvalidFormatException | IllegalArgumentException e) {
            // Also covers ConfigurationException and malformed numbers
            logger.log(Level.FINE, "Invalid input", e);
            err.println("Invalid input: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        MultiOutputSynthesizer synthesizer = new MultiOutputSynthesizer(library, configuration);
        MultiOutputResult result = synthesizer.search(problem);
        result.solutions().forEach((name, signal) ->
                out.printf("%s = %s [level %d]%n", name, signal, signal.level()));
        out.println();
        out.print(result.toNetlist());
        out.printf("Total cost: %d%n", result.totalCost());
        if (!result.isComplete()) {
            err.println("Unreachable within the complexity bound: " + String.join(", ", result.unreachable()));
            return EXIT_UNREACHABLE;
        }
        return EXIT_OK;
    }

    /**
     * Writes the input table, and unless the file only lists variables, the output table of a circuit
     * expression file.
     */
    private static int generate(List<String> args, PrintStream out, PrintStream err) {
        if (args.isEmpty() || args.size() > 2) {
            err.println(USAGE);
            return EXIT_INVALID_INPUT;
        }
        try {
            Path directory = Path.of(args.size() == 2 ? args.get(1) : DEFAULT_OUTPUT_DIRECTORY);
            List<String> lines;
            try (BufferedReader reader = reader(args.get(0))) {
                lines = ExpressionReader.lines(reader);
            }
            Map<String, TruthTable> inputs;
            @Nullable
            Map<String, TruthTable> targets;
            if (ExpressionReader.isInputsOnly(lines)) {
                inputs = ExpressionReader.parseInputsOnly(lines);
                targets = null;
            } else {
                SynthesisProblem problem = ExpressionReader.parse(lines);
                inputs = problem.inputs();
                targets = problem.targets();
            }

            Files.createDirectories(directory);
            write(directory.resolve(INPUT_FILE), inputs, out);
            if (targets == null) {
                out.println("No " + OUTPUT_FILE + " written, the circuit only lists inputs");
            } else {
                write(directory.resolve(OUTPUT_FILE), targets, out);
            }
        } catch (IOException | InvalidFormatException | IllegalArgumentException e) {
            logger.log(Level.FINE, "Invalid input", e);
            err.println("Invalid input: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }
        return EXIT_OK;
    }

    private static void write(Path file, Map<String, TruthTable> columns, PrintStream out) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            TableWriter.writeTable(writer, columns);
        }
        out.printf("Wrote %s (%d columns, %d rows)%n", file, columns.size(),
                columns.values().iterator().next().length());
    }

    private static BufferedReader reader(String file) throws IOException {
        return Files.newBufferedReader(Path.of(file), StandardCharsets.UTF_8);
    }
}
