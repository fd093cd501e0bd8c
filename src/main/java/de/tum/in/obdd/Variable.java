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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A symbolic Boolean variable, identified by a non-empty list of qualifying names (innermost name
 * first) and a possibly empty list of non-negative indices. Instances are canonical: a {@link
 * VariableRegistry} hands out exactly one instance per identity, hence variables are compared by
 * identity.
 *
 * <p>The natural order of variables is by names and then by indices, both lexicographically. The
 * order in which variables appear in diagrams is given by their {@link #uniqueId() unique id}, see
 * {@link #DIAGRAM_ORDER}.</p>
 */
public final class Variable implements Comparable<Variable> {
    /**
     * Orders variables by their position in the diagrams, i.e. by the order in which they were
     * first requested.
     */
    public static final Comparator<Variable> DIAGRAM_ORDER = Comparator.comparingInt(Variable::uniqueId);

    private final List<String> names;
    private final List<Integer> indices;
    private final int uniqueId;

    Variable(List<String> names, List<Integer> indices, int uniqueId) {
        assert !names.isEmpty() && uniqueId > 0;
        this.names = List.copyOf(names);
        this.indices = List.copyOf(indices);
        this.uniqueId = uniqueId;
    }

    public List<String> names() {
        return names;
    }

    public List<Integer> indices() {
        return indices;
    }

    /**
     * Returns the id of this variable, which is unique for its registry and determines the position
     * of the variable in every diagram. Ids are assigned sequentially, starting from 1.
     */
    public int uniqueId() {
        return uniqueId;
    }

    /**
     * Returns the innermost name.
     */
    public String name() {
        return names.get(0);
    }

    /**
     * Returns the fully qualified name, i.e. all names from outermost to innermost, separated by a
     * dot.
     */
    public String qualifiedName() {
        List<String> qualified = new ArrayList<>(names);
        Collections.reverse(qualified);
        return String.join(".", qualified);
    }

    @Override
    public int compareTo(Variable other) {
        int comparison = compareLexicographic(names, other.names);
        return comparison == 0 ? compareLexicographic(indices, other.indices) : comparison;
    }

    private static <T extends Comparable<T>> int compareLexicographic(List<T> first, List<T> second) {
        int length = Math.min(first.size(), second.size());
        for (int i = 0; i < length; i++) {
            int comparison = first.get(i).compareTo(second.get(i));
            if (comparison != 0) {
                return comparison;
            }
        }
        return Integer.compare(first.size(), second.size());
    }

    @Override
    public String toString() {
        if (indices.isEmpty()) {
            return qualifiedName();
        }
        return indices.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(",", qualifiedName() + "[", "]"));
    }
}
