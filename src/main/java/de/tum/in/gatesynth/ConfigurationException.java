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

/**
 * Signals an invalid search setup, e.g. a gate with unsupported arity or input columns of
 * different lengths. Always raised before the search starts; the engine never recovers from it.
 */
public class ConfigurationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
