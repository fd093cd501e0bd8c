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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Lazy depth-first traversal of the nodes below a root node, low child before high child. Every
 * node is returned exactly once, even if it is shared by several parents.
 */
abstract class NodeIterator implements Iterator<Node> {
    final Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    @Nullable
    private Node next;
    private boolean computed = false;

    static Iterator<Node> preOrder(Node root) {
        return new PreOrder(root);
    }

    static Iterator<Node> postOrder(Node root) {
        return new PostOrder(root);
    }

    /**
     * Returns the next node of the traversal or {@code null} if the traversal is finished.
     */
    @Nullable
    abstract Node advance();

    @Override
    public boolean hasNext() {
        if (!computed) {
            next = advance();
            computed = true;
        }
        return next != null;
    }

    @Override
    public Node next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Node current = next;
        computed = false;
        next = null;
        return current;
    }

    private static final class PreOrder extends NodeIterator {
        private final Deque<Node> stack = new ArrayDeque<>();

        PreOrder(Node root) {
            stack.push(root);
        }

        @Nullable
        @Override
        Node advance() {
            while (!stack.isEmpty()) {
                Node node = stack.pop();
                if (!visited.add(node)) {
                    continue;
                }
                if (!node.isLeaf()) {
                    stack.push(node.high);
                    stack.push(node.low);
                }
                return node;
            }
            return null;
        }
    }

    private static final class PostOrder extends NodeIterator {
        private final Deque<Frame> stack = new ArrayDeque<>();

        PostOrder(Node root) {
            stack.push(new Frame(root));
        }

        @Nullable
        @Override
        Node advance() {
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                Node node = frame.node;
                if (!frame.expanded) {
                    frame.expanded = true;
                    if (!node.isLeaf()) {
                        if (!visited.contains(node.high)) {
                            stack.push(new Frame(node.high));
                        }
                        if (!visited.contains(node.low)) {
                            stack.push(new Frame(node.low));
                        }
                    }
                    continue;
                }
                stack.pop();
                if (visited.add(node)) {
                    return node;
                }
            }
            return null;
        }
    }

    private static final class Frame {
        final Node node;
        boolean expanded = false;

        Frame(Node node) {
            this.node = node;
        }
    }
}
