/*
 * This file is part of JSDD.
 * Copyright (c) 2024 Tobias Meggendorfer.
 *
 * JSDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JSDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JSDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jsdd;

import java.util.Map;
import org.immutables.value.Value;

/**
 * Options of the {@link DotExporter}.
 */
@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class DotConfiguration {
    public static DotConfiguration defaults() {
        return ImmutableDotConfiguration.builder().build();
    }

    /**
     * Whether to annotate circuit nodes with their id and vtree position, and vtree nodes with
     * their position.
     */
    @Value.Default
    public boolean showIdentity() {
        return false;
    }

    /**
     * Names displayed instead of literals (for circuits) or variables (for vtrees). A name given
     * for variable {@code v} is only used for the positive literal {@code v}.
     */
    public abstract Map<Integer, String> literalNames();
}
