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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A Boolean function, represented by its canonical ordered binary decision diagram. Diagrams of a
 * factory are canonical: two diagrams represent the same function iff they are the same object, so
 * {@link #equals(Object)} is identity.
 */
public interface Diagram extends BooleanExpression {
    enum Kind {
        /** One of the two constants. */
        CONSTANT,
        /** A single (positive) variable. */
        VARIABLE,
        /** Any other function. */
        FUNCTION
    }

    /**
     * Returns the root node of this diagram.
     */
    Node node();

    Kind kind();

    /**
     * Returns the variable represented by this diagram if it is of kind {@link Kind#VARIABLE}.
     */
    Optional<Variable> variable();

    @Override
    boolean isZero();

    @Override
    boolean isOne();

    Diagram not();

    Diagram or(Diagram other);

    Diagram and(Diagram other);

    Diagram xor(Diagram other);

    /**
     * Returns the diagram of {@code this IMPLIES other}.
     */
    Diagram implies(Diagram other);

    /**
     * Returns the diagram of {@code other IMPLIES this}.
     */
    Diagram impliedBy(Diagram other);

    /**
     * Returns the diagram of {@code IF this THEN thenDiagram ELSE elseDiagram}.
     */
    Diagram ifThenElse(Diagram thenDiagram, Diagram elseDiagram);

    /**
     * Replaces each variable in the key set of {@code assignment} by the associated constant.
     * Variables of other factories are matched by their names and indices.
     */
    Diagram restrict(Map<Variable, Boolean> assignment);

    @Override
    Diagram restrict(Variable variable, boolean value);

    /**
     * Checks whether this and {@code other} represent the same function. Since diagrams are
     * canonical, this is a constant time operation.
     */
    boolean equivalent(Diagram other);

    /**
     * Returns the variables this function depends on, in diagram order.
     */
    List<Variable> support();

    /**
     * Returns the first variable of the {@link #support()}, or nothing for constants.
     */
    @Override
    Optional<Variable> top();

    /**
     * Returns the nodes of this diagram in depth-first pre-order. Each iteration traverses the
     * diagram anew and returns every node once.
     */
    Iterable<Node> preOrder();

    /**
     * Returns the nodes of this diagram in depth-first post-order. Each iteration traverses the
     * diagram anew and returns every node once.
     */
    Iterable<Node> postOrder();

    /**
     * Returns the number of distinct nodes of this diagram, including terminals.
     */
    int nodeCount();

    /**
     * Evaluates this function. Variables absent from {@code assignment} are treated as {@code false}.
     */
    boolean evaluate(Map<Variable, Boolean> assignment);

    /**
     * Returns the assignment along some path to {@code true}, or nothing if this is the zero
     * diagram. Variables not on the path are absent.
     */
    Optional<Map<Variable, Boolean>> satisfyingAssignment();

    /**
     * Executes {@code action} for each path to {@code true}, in lexicographic order with low edges
     * first.
     *
     * <p><b>Note:</b> The passed map is modified in-place. If all paths should be gathered, they
     * have to be copied in each call to the consumer.</p>
     */
    void forEachPath(Consumer<? super Map<Variable, Boolean>> action);
}
