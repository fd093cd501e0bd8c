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

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class FactoryState {
    @Param({"true", "false"})
    private boolean iterative;

    @Param({"true", "false"})
    private boolean synchronizedTables;

    @Param({"1", "16"})
    private int tableSizeFactor;

    private DiagramFactory factory;

    @Setup(Level.Iteration)
    public void setUpFactory() {
        factory = DiagramFactory.create(ImmutableObddConfiguration.builder()
                .iterative(iterative)
                .synchronizedTables(synchronizedTables)
                .initialNodeTableSize(ObddConfiguration.DEFAULT_INITIAL_NODE_TABLE_SIZE * tableSizeFactor)
                .initialDiagramTableSize(ObddConfiguration.DEFAULT_INITIAL_DIAGRAM_TABLE_SIZE * tableSizeFactor)
                .build());
    }

    public DiagramFactory factory() {
        return factory;
    }
}
