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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives progress snapshots of a search, at the cadence given by
 * {@link SynthesisConfiguration#progressInterval()}.
 */
@FunctionalInterface
public interface SynthesisListener {
    void onProgress(Progress progress);

    static SynthesisListener silent() {
        return progress -> {};
    }

    /**
     * Writes every snapshot to the given logger at {@link Level#FINE}.
     */
    static SynthesisListener logging(Logger logger) {
        return progress -> logger.log(Level.FINE, "Progress: {0}", progress);
    }
}
