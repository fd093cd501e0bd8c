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

/**
 * Thrown when a variable identity or a value to be converted into a diagram is malformed. The
 * offending input is named by {@link #field()}.
 */
public class InvalidIdentifierException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String field;

    public InvalidIdentifierException(String field, String message) {
        super(String.format("Invalid %s: %s", field, message));
        this.field = field;
    }

    /**
     * Returns the name of the offending input, e.g. {@code names}, {@code indices} or {@code value}.
     */
    public String field() {
        return field;
    }
}
