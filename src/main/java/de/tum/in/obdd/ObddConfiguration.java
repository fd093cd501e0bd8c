/*
 * This file is part of JOBDD.
 * Copyright (c) 2024 Tobias Meggendorfer.
 *
 * JOBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JOBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JOBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.obdd;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class ObddConfiguration {
    public static final int DEFAULT_INITIAL_NODE_TABLE_SIZE = 1024;
    public static final int DEFAULT_INITIAL_DIAGRAM_TABLE_SIZE = 256;

    /**
     * Whether the if-then-else, negation, restriction and path enumeration algorithms run on an
     * explicit work stack instead of recursing on the call stack. Traversals always use an explicit
     * stack. Building a diagram from an expression recurses once per variable of the expression,
     * regardless of this setting.
     */
    @Value.Default
    public boolean iterative() {
        return false;
    }

    /**
     * Whether lookups and inserts into the node and diagram tables are guarded by a lock. Only
     * disable this if the factory is confined to a single thread.
     */
    @Value.Default
    public boolean synchronizedTables() {
        return true;
    }

    @Value.Default
    public int initialNodeTableSize() {
        return DEFAULT_INITIAL_NODE_TABLE_SIZE;
    }

    @Value.Default
    public int initialDiagramTableSize() {
        return DEFAULT_INITIAL_DIAGRAM_TABLE_SIZE;
    }

    @Value.Default
    public boolean logStatisticsOnShutdown() {
        return false;
    }

    @Value.Check
    protected void check() {
        if (initialNodeTableSize() <= 0 || initialDiagramTableSize() <= 0) {
            throw new IllegalArgumentException("Table sizes must be positive");
        }
    }
}
