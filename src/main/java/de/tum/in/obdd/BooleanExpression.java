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

import java.util.Optional;

/**
 * A Boolean function which can be converted into a diagram by {@link
 * DiagramFactory#fromExpression(BooleanExpression)}.
 */
public interface BooleanExpression {
    boolean isZero();

    boolean isOne();

    /**
     * Returns the first variable this expression depends on, or nothing for constants. The
     * conversion splits on this variable.
     */
    Optional<Variable> top();

    /**
     * Returns the expression obtained by replacing {@code variable} with the given constant.
     */
    BooleanExpression restrict(Variable variable, boolean value);
}
