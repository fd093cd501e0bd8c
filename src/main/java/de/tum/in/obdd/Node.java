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

import static de.tum.in.obdd.Util.checkState;

import javax.annotation.Nullable;

/**
 * A node of an ordered binary decision diagram. A node is either one of the two terminals {@link
 * #FALSE} and {@link #TRUE} or an internal node, which splits on a {@link #variable()} and has a
 * {@link #low()} child (the cofactor for {@code false}) and a {@link #high()} child (the cofactor
 * for {@code true}).
 *
 * <p>Nodes are hash-consed by their {@link NodeTable}: there never are two live internal nodes with
 * the same variable and children, hence nodes are compared by identity.</p>
 */
@SuppressWarnings("ObjectEquality")
public final class Node {
    public static final int FALSE_ROOT = -1;
    public static final int TRUE_ROOT = -2;

    static final Node FALSE = new Node(FALSE_ROOT, HashUtil.FALSE_HASH);
    static final Node TRUE = new Node(TRUE_ROOT, HashUtil.TRUE_HASH);

    private final int root;
    @Nullable
    final Variable variable;
    @Nullable
    final Node low;
    @Nullable
    final Node high;
    private final int hash;

    private Node(int root, int hash) {
        this.root = root;
        this.variable = null;
        this.low = null;
        this.high = null;
        this.hash = hash;
    }

    Node(Variable variable, Node low, Node high, int hash) {
        checkState(low != null && high != null, "Node on %s is missing a child", variable);
        checkState(low != high, "Node on %s has identical children", variable);
        this.root = variable.uniqueId();
        this.variable = variable;
        this.low = low;
        this.high = high;
        this.hash = hash;
    }

    /**
     * Returns the unique id of the variable of this node, or {@link #FALSE_ROOT} / {@link
     * #TRUE_ROOT} for the terminals.
     */
    public int root() {
        return root;
    }

    public boolean isLeaf() {
        return variable == null;
    }

    /**
     * Returns the constant represented by this terminal.
     *
     * @throws IllegalStateException if this node is not a terminal.
     */
    public boolean value() {
        if (!isLeaf()) {
            throw new IllegalStateException(String.format("%s is not a terminal", this));
        }
        return this == TRUE;
    }

    /**
     * Returns the variable this node splits on.
     *
     * @throws IllegalStateException if this node is a terminal.
     */
    public Variable variable() {
        if (variable == null) {
            throw new IllegalStateException(String.format("Terminal %s has no variable", this));
        }
        return variable;
    }

    public Node low() {
        if (low == null) {
            throw new IllegalStateException(String.format("Terminal %s has no children", this));
        }
        return low;
    }

    public Node high() {
        if (high == null) {
            throw new IllegalStateException(String.format("Terminal %s has no children", this));
        }
        return high;
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (this == FALSE) {
            return "0";
        }
        if (this == TRUE) {
            return "1";
        }
        return String.format("(%s: %08x / %08x)", variable, low.hash, high.hash);
    }
}
