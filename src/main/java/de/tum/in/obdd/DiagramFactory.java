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

import java.util.Arrays;
import java.util.List;
import java.util.Map;

public interface DiagramFactory {
    static DiagramFactory create() {
        return create(ImmutableObddConfiguration.builder().build());
    }

    static DiagramFactory create(ObddConfiguration configuration) {
        return new DiagramFactoryImpl(configuration);
    }

    /**
     * Returns the process-wide factory, created with the default configuration on first use.
     */
    static DiagramFactory shared() {
        return DiagramFactoryImpl.shared();
    }

    /**
     * Returns the unique variable with the given identity, registering it if it is requested for
     * the first time.
     *
     * @throws InvalidIdentifierException
     *     if {@code names} is empty or contains {@code null}, or if an index is negative.
     */
    Variable resolve(List<String> names, List<Integer> indices);

    /**
     * Returns the diagram representing the given variable.
     */
    Diagram variable(Variable variable);

    default Diagram variable(List<String> names, List<Integer> indices) {
        return variable(resolve(names, indices));
    }

    default Diagram variable(String name, Integer... indices) {
        return variable(List.of(name), Arrays.asList(indices));
    }

    Diagram zero();

    Diagram one();

    default Diagram of(boolean booleanConstant) {
        return booleanConstant ? one() : zero();
    }

    /**
     * Converts the given object into a diagram. Accepted are diagrams of this factory, {@link
     * Boolean}s and the integers (or strings) {@code 0} and {@code 1}.
     *
     * @throws InvalidIdentifierException
     *     if the object cannot be converted.
     */
    Diagram box(Object value);

    default Diagram ifThenElse(Diagram ifDiagram, Diagram thenDiagram, Diagram elseDiagram) {
        return ifDiagram.ifThenElse(thenDiagram, elseDiagram);
    }

    /**
     * Restricts the given diagram. The keys of {@code assignment} may be {@link Variable}s or
     * variable diagrams, values are {@link #box(Object) boxed} and have to be constant.
     *
     * @throws InvalidIdentifierException
     *     if a key is not a variable or a value is not a constant.
     */
    Diagram restrict(Diagram diagram, Map<?, ?> assignment);

    /**
     * Builds the diagram of the given expression by recursively splitting on its top variable.
     * Variables of the expression are identified with the variables of this factory by their names
     * and indices.
     */
    Diagram fromExpression(BooleanExpression expression);

    /**
     * Performs integrity checks on all live nodes.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     * @throws InvariantViolationException if the node structure is broken.
     */
    boolean check();

    /**
     * Returns a string containing some statistics about the factory. The content and formatting of
     * this string may change drastically and are only intended as human-readable output.
     */
    String statistics();
}
