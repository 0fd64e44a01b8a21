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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Picks one realization per target such that the combined circuit, with shared signals counted
 * once, is as cheap as possible. Small candidate spaces are enumerated completely, larger ones are
 * improved by local descent starting from the individually cheapest choice. Either way, only the
 * given candidates are considered, so the result is the best combination of what the search found,
 * not a global optimum.
 */
final class SolutionSelector {
    private static final Logger logger = Logger.getLogger(SolutionSelector.class.getName());

    private SolutionSelector() {}

    /**
     * @param candidates
     *     For each target a non-empty list of realizations, individually cheapest first.
     * @param maxEnumerated
     *     Largest number of assignments to enumerate exhaustively.
     *
     * @return The chosen index for each target.
     */
    static int[] select(List<List<Signal>> candidates, int maxEnumerated) {
        assert candidates.stream().noneMatch(List::isEmpty);
        long assignments = 1L;
        for (List<Signal> realizations : candidates) {
            assignments = Math.min(assignments * realizations.size(), (long) maxEnumerated + 1L);
        }
        if (assignments <= maxEnumerated) {
            return enumerate(candidates);
        }
        logger.log(Level.FINE, "More than {0} assignments, using local descent", maxEnumerated);
        return descend(candidates);
    }

    private static int[] enumerate(List<List<Signal>> candidates) {
        int targets = candidates.size();
        int[] current = new int[targets];
        int[] best = current.clone();
        int bestCost = cost(candidates, current);
        while (true) {
            int position = targets - 1;
            while (position >= 0 && current[position] == candidates.get(position).size() - 1) {
                current[position] = 0;
                position -= 1;
            }
            if (position < 0) {
                return best;
            }
            current[position] += 1;
            int cost = cost(candidates, current);
            if (cost < bestCost) {
                bestCost = cost;
                best = current.clone();
            }
        }
    }

    private static int[] descend(List<List<Signal>> candidates) {
        int[] current = new int[candidates.size()];
        int currentCost = cost(candidates, current);
        boolean improved = true;
        while (improved) {
            improved = false;
            for (int target = 0; target < current.length; target++) {
                int original = current[target];
                for (int choice = 0; choice < candidates.get(target).size(); choice++) {
                    if (choice == original) {
                        continue;
                    }
                    current[target] = choice;
                    int cost = cost(candidates, current);
                    if (cost < currentCost) {
                        currentCost = cost;
                        original = choice;
                        improved = true;
                    }
                }
                current[target] = original;
            }
        }
        return current;
    }

    static int cost(List<List<Signal>> candidates, int[] choice) {
        List<Signal> selected = new ArrayList<>(choice.length);
        for (int target = 0; target < choice.length; target++) {
            selected.add(candidates.get(target).get(choice[target]));
        }
        return Circuits.cost(selected);
    }
}
