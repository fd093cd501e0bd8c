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
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * The diagram engine. All Boolean connectives are reduced to {@link #ifThenElse(Node, Node, Node)},
 * which, together with {@link #restrict(Node, Map)} and {@link #not(Node)}, is the only place where
 * new internal nodes are created (apart from variables).
 *
 * <p>Each top-level operation memoizes its intermediate results in a cache local to the call.
 * Across calls, the node table already guarantees that no structure is materialized twice.</p>
 */
@SuppressWarnings({
    "ObjectEquality",
    "PMD.AvoidReassigningParameters",
    "AssignmentToMethodParameter",
    "ReassignedVariable"
})
final class ObddImpl {
    private static final int STAGE_START = 0;
    private static final int STAGE_LOW = 1;
    private static final int STAGE_HIGH = 2;
    private static final int STAGE_FORWARD = 3;

    private final VariableRegistry registry;
    private final NodeTable nodeTable;
    private final boolean iterative;

    ObddImpl(ObddConfiguration configuration) {
        this.registry = new VariableRegistry();
        this.nodeTable = new NodeTable(configuration.initialNodeTableSize(), configuration.synchronizedTables());
        this.iterative = configuration.iterative();
    }

    // Variables and base nodes

    Node falseNode() {
        return Node.FALSE;
    }

    Node trueNode() {
        return Node.TRUE;
    }

    Variable resolve(List<String> names, List<Integer> indices) {
        return registry.resolve(names, indices);
    }

    @Nullable
    Variable find(Variable variable) {
        return registry.find(variable.names(), variable.indices());
    }

    int numberOfVariables() {
        return registry.size();
    }

    Node variableNode(Variable variable) {
        return nodeTable.makeNode(variable, Node.FALSE, Node.TRUE);
    }

    Node makeNode(Variable variable, Node low, Node high) {
        return nodeTable.makeNode(variable, low, high);
    }

    // Connectives

    Node not(Node node) {
        return negate(node, new HashMap<>());
    }

    Node and(Node node1, Node node2) {
        return ifThenElse(node1, node2, Node.FALSE);
    }

    Node or(Node node1, Node node2) {
        return ifThenElse(node1, Node.TRUE, node2);
    }

    Node xor(Node node1, Node node2) {
        IteCache cache = new IteCache();
        return ifThenElse(node1, negate(node2, cache.negations), node2, cache);
    }

    Node implication(Node node1, Node node2) {
        IteCache cache = new IteCache();
        return ifThenElse(negate(node1, cache.negations), Node.TRUE, node2, cache);
    }

    Node ifThenElse(Node ifNode, Node thenNode, Node elseNode) {
        return ifThenElse(ifNode, thenNode, elseNode, new IteCache());
    }

    private Node ifThenElse(Node ifNode, Node thenNode, Node elseNode, IteCache cache) {
        return iterative
                ? ifThenElseIterative(ifNode, thenNode, elseNode, cache)
                : ifThenElseRecursive(ifNode, thenNode, elseNode, cache);
    }

    /* Terminal cases of if-then-else. The order of the checks matters. */
    @Nullable
    private Node ifThenElseTerminal(Node ifNode, Node thenNode, Node elseNode, IteCache cache) {
        if (thenNode == Node.TRUE && elseNode == Node.FALSE) {
            return ifNode;
        }
        if (thenNode == Node.FALSE && elseNode == Node.TRUE) {
            return negate(ifNode, cache.negations);
        }
        if (ifNode == Node.TRUE) {
            return thenNode;
        }
        if (ifNode == Node.FALSE) {
            return elseNode;
        }
        if (thenNode == elseNode) {
            return thenNode;
        }
        return cache.results.get(new IteKey(ifNode, thenNode, elseNode));
    }

    private Node ifThenElseRecursive(Node ifNode, Node thenNode, Node elseNode, IteCache cache) {
        Node terminal = ifThenElseTerminal(ifNode, thenNode, elseNode, cache);
        if (terminal != null) {
            return terminal;
        }

        Variable variable = splitVariable(ifNode, thenNode, elseNode);
        Node lowNode = ifThenElseRecursive(
                cofactor(ifNode, variable, false),
                cofactor(thenNode, variable, false),
                cofactor(elseNode, variable, false),
                cache);
        Node highNode = ifThenElseRecursive(
                cofactor(ifNode, variable, true),
                cofactor(thenNode, variable, true),
                cofactor(elseNode, variable, true),
                cache);
        Node result = makeNode(variable, lowNode, highNode);
        cache.results.put(new IteKey(ifNode, thenNode, elseNode), result);
        return result;
    }

    private Node ifThenElseIterative(Node ifNode, Node thenNode, Node elseNode, IteCache cache) {
        Deque<Task> stack = new ArrayDeque<>();
        stack.push(new Task(ifNode, thenNode, elseNode));
        Node returned = null;

        while (!stack.isEmpty()) {
            Task task = stack.peek();
            Variable variable = task.variable;
            switch (task.stage) {
                case STAGE_START:
                    Node terminal = ifThenElseTerminal(task.first, task.second, task.third, cache);
                    if (terminal != null) {
                        returned = terminal;
                        stack.pop();
                        break;
                    }
                    variable = splitVariable(task.first, task.second, task.third);
                    task.variable = variable;
                    task.stage = STAGE_LOW;
                    stack.push(new Task(
                            cofactor(task.first, variable, false),
                            cofactor(task.second, variable, false),
                            cofactor(task.third, variable, false)));
                    break;
                case STAGE_LOW:
                    assert variable != null;
                    task.low = returned;
                    task.stage = STAGE_HIGH;
                    stack.push(new Task(
                            cofactor(task.first, variable, true),
                            cofactor(task.second, variable, true),
                            cofactor(task.third, variable, true)));
                    break;
                case STAGE_HIGH:
                    assert variable != null && task.low != null && returned != null;
                    returned = makeNode(variable, task.low, returned);
                    cache.results.put(new IteKey(task.first, task.second, task.third), returned);
                    stack.pop();
                    break;
                default:
                    throw new AssertionError("Unexpected stage " + task.stage);
            }
        }
        assert returned != null;
        return returned;
    }

    /* The variable with the smallest id among the non-terminal nodes. */
    private static Variable splitVariable(Node ifNode, Node thenNode, Node elseNode) {
        Variable variable = null;
        for (Node node : new Node[] {ifNode, thenNode, elseNode}) {
            if (!node.isLeaf() && (variable == null || node.root() < variable.uniqueId())) {
                variable = node.variable;
            }
        }
        if (variable == null) {
            throw new InvariantViolationException(String.format(
                    "No split variable for (%s, %s, %s)", ifNode, thenNode, elseNode));
        }
        return variable;
    }

    /*
     * Restriction of the node to variable = value, where variable is at most the variable of the
     * node. Then either the node splits on variable or does not depend on it at all.
     */
    private static Node cofactor(Node node, Variable variable, boolean value) {
        if (node.isLeaf() || node.root() != variable.uniqueId()) {
            assert node.isLeaf() || variable.uniqueId() < node.root();
            return node;
        }
        return value ? node.high : node.low;
    }

    // Negation

    private Node negate(Node node, Map<Node, Node> cache) {
        return iterative ? notIterative(node, cache) : notRecursive(node, cache);
    }

    private Node notRecursive(Node node, Map<Node, Node> cache) {
        if (node == Node.FALSE) {
            return Node.TRUE;
        }
        if (node == Node.TRUE) {
            return Node.FALSE;
        }
        Node cached = cache.get(node);
        if (cached != null) {
            return cached;
        }

        Node lowNode = notRecursive(node.low, cache);
        Node highNode = notRecursive(node.high, cache);
        Node resultNode = makeNode(node.variable, lowNode, highNode);
        cache.put(node, resultNode);
        return resultNode;
    }

    private Node notIterative(Node node, Map<Node, Node> cache) {
        Deque<Task> stack = new ArrayDeque<>();
        stack.push(new Task(node));
        Node returned = null;

        while (!stack.isEmpty()) {
            Task task = stack.peek();
            Node current = task.first;
            switch (task.stage) {
                case STAGE_START:
                    if (current.isLeaf()) {
                        returned = current == Node.FALSE ? Node.TRUE : Node.FALSE;
                        stack.pop();
                        break;
                    }
                    Node cached = cache.get(current);
                    if (cached != null) {
                        returned = cached;
                        stack.pop();
                        break;
                    }
                    task.stage = STAGE_LOW;
                    stack.push(new Task(current.low));
                    break;
                case STAGE_LOW:
                    task.low = returned;
                    task.stage = STAGE_HIGH;
                    stack.push(new Task(current.high));
                    break;
                case STAGE_HIGH:
                    assert task.low != null && returned != null;
                    returned = makeNode(current.variable, task.low, returned);
                    cache.put(current, returned);
                    stack.pop();
                    break;
                default:
                    throw new AssertionError("Unexpected stage " + task.stage);
            }
        }
        assert returned != null;
        return returned;
    }

    // Restriction

    /**
     * Computes the restriction of {@code node}, where each variable whose id is a key of {@code
     * assignment} is replaced by the associated constant.
     */
    Node restrict(Node node, Map<Integer, Boolean> assignment) {
        if (node.isLeaf() || assignment.isEmpty()) {
            return node;
        }
        Map<Node, Node> cache = new HashMap<>();
        return iterative ? restrictIterative(node, assignment, cache) : restrictRecursive(node, assignment, cache);
    }

    private Node restrictRecursive(Node node, Map<Integer, Boolean> assignment, Map<Node, Node> cache) {
        if (node.isLeaf()) {
            return node;
        }
        Node cached = cache.get(node);
        if (cached != null) {
            return cached;
        }

        Boolean value = assignment.get(node.root());
        Node resultNode;
        if (value == null) {
            Node lowNode = restrictRecursive(node.low, assignment, cache);
            Node highNode = restrictRecursive(node.high, assignment, cache);
            resultNode = makeNode(node.variable, lowNode, highNode);
        } else {
            resultNode = restrictRecursive(value ? node.high : node.low, assignment, cache);
        }
        cache.put(node, resultNode);
        return resultNode;
    }

    private Node restrictIterative(Node node, Map<Integer, Boolean> assignment, Map<Node, Node> cache) {
        Deque<Task> stack = new ArrayDeque<>();
        stack.push(new Task(node));
        Node returned = null;

        while (!stack.isEmpty()) {
            Task task = stack.peek();
            Node current = task.first;
            switch (task.stage) {
                case STAGE_START:
                    if (current.isLeaf()) {
                        returned = current;
                        stack.pop();
                        break;
                    }
                    Node cached = cache.get(current);
                    if (cached != null) {
                        returned = cached;
                        stack.pop();
                        break;
                    }
                    Boolean value = assignment.get(current.root());
                    if (value == null) {
                        task.stage = STAGE_LOW;
                        stack.push(new Task(current.low));
                    } else {
                        task.stage = STAGE_FORWARD;
                        stack.push(new Task(value ? current.high : current.low));
                    }
                    break;
                case STAGE_LOW:
                    task.low = returned;
                    task.stage = STAGE_HIGH;
                    stack.push(new Task(current.high));
                    break;
                case STAGE_HIGH:
                    assert task.low != null && returned != null;
                    returned = makeNode(current.variable, task.low, returned);
                    cache.put(current, returned);
                    stack.pop();
                    break;
                case STAGE_FORWARD:
                    assert returned != null;
                    cache.put(current, returned);
                    stack.pop();
                    break;
                default:
                    throw new AssertionError("Unexpected stage " + task.stage);
            }
        }
        assert returned != null;
        return returned;
    }

    // Inspection

    /**
     * Returns the variables the function represented by {@code node} depends on, in diagram order.
     */
    List<Variable> support(Node node) {
        Set<Variable> seen = new HashSet<>();
        List<Variable> support = new ArrayList<>();
        Iterator<Node> iterator = NodeIterator.postOrder(node);
        while (iterator.hasNext()) {
            Node current = iterator.next();
            if (!current.isLeaf() && seen.add(current.variable)) {
                support.add(current.variable);
            }
        }
        // Post-order yields inner variables first. Reversing alone gives a topological order of the
        // graph, which need not coincide with the diagram order, hence the sort.
        support.sort(Variable.DIAGRAM_ORDER);
        return support;
    }

    int nodeCount(Node node) {
        int count = 0;
        Iterator<Node> iterator = NodeIterator.preOrder(node);
        while (iterator.hasNext()) {
            iterator.next();
            count += 1;
        }
        return count;
    }

    /**
     * Evaluates {@code node} under the given assignment. Variables not contained in the assignment
     * are treated as {@code false}.
     */
    boolean evaluate(Node node, Map<Variable, Boolean> assignment) {
        Node current = node;
        while (!current.isLeaf()) {
            current = Boolean.TRUE.equals(assignment.get(current.variable)) ? current.high : current.low;
        }
        return current == Node.TRUE;
    }

    /**
     * Returns the assignment along some path from {@code node} to {@code true}, preferring low
     * edges.
     */
    Optional<Map<Variable, Boolean>> satisfyingAssignment(Node node) {
        if (node == Node.FALSE) {
            return Optional.empty();
        }

        Map<Variable, Boolean> path = new LinkedHashMap<>();
        Node current = node;
        while (current != Node.TRUE) {
            // Due to reduction, every internal node reaches true via one of its children
            if (current.low == Node.FALSE) {
                path.put(current.variable, Boolean.TRUE);
                current = current.high;
            } else {
                path.put(current.variable, Boolean.FALSE);
                current = current.low;
            }
        }
        return Optional.of(path);
    }

    /**
     * Executes {@code action} for every path from {@code node} to {@code true}. The paths are
     * generated in lexicographic order, low edges first. The passed map is modified in place.
     */
    void forEachPath(Node node, Consumer<? super Map<Variable, Boolean>> action) {
        if (node == Node.FALSE) {
            return;
        }
        if (iterative) {
            forEachPathIterative(node, new LinkedHashMap<>(), action);
        } else {
            forEachPathRecursive(node, new LinkedHashMap<>(), action);
        }
    }

    private void forEachPathRecursive(
            Node node, Map<Variable, Boolean> path, Consumer<? super Map<Variable, Boolean>> action) {
        assert node != Node.FALSE;

        if (node == Node.TRUE) {
            action.accept(path);
            return;
        }

        if (node.low != Node.FALSE) {
            path.put(node.variable, Boolean.FALSE);
            forEachPathRecursive(node.low, path, action);
        }
        if (node.high != Node.FALSE) {
            path.put(node.variable, Boolean.TRUE);
            forEachPathRecursive(node.high, path, action);
        }
        path.remove(node.variable);
    }

    private static void forEachPathIterative(
            Node node, Map<Variable, Boolean> path, Consumer<? super Map<Variable, Boolean>> action) {
        Deque<Task> stack = new ArrayDeque<>();
        stack.push(new Task(node));

        while (!stack.isEmpty()) {
            Task task = stack.peek();
            Node current = task.first;
            assert current != Node.FALSE;
            switch (task.stage) {
                case STAGE_START:
                    if (current == Node.TRUE) {
                        action.accept(path);
                        stack.pop();
                        break;
                    }
                    task.stage = STAGE_LOW;
                    if (current.low != Node.FALSE) {
                        path.put(current.variable, Boolean.FALSE);
                        stack.push(new Task(current.low));
                    }
                    break;
                case STAGE_LOW:
                    task.stage = STAGE_HIGH;
                    if (current.high != Node.FALSE) {
                        path.put(current.variable, Boolean.TRUE);
                        stack.push(new Task(current.high));
                    }
                    break;
                case STAGE_HIGH:
                    path.remove(current.variable);
                    stack.pop();
                    break;
                default:
                    throw new AssertionError("Unexpected stage " + task.stage);
            }
        }
    }

    // Integrity checks and utility

    boolean check() {
        return nodeTable.check();
    }

    String getStatistics() {
        return String.format("%d variables%n", numberOfVariables()) + nodeTable.getStatistics();
    }

    int liveNodeCount() {
        return nodeTable.purge();
    }

    @Override
    public String toString() {
        return String.format("OBDD%s@%d", iterative ? "iter" : "rec", System.identityHashCode(this));
    }

    private static final class IteCache {
        final Map<IteKey, Node> results = new HashMap<>();
        final Map<Node, Node> negations = new HashMap<>();
    }

    private static final class IteKey {
        private final Node ifNode;
        private final Node thenNode;
        private final Node elseNode;
        private final int hash;

        IteKey(Node ifNode, Node thenNode, Node elseNode) {
            this.ifNode = ifNode;
            this.thenNode = thenNode;
            this.elseNode = elseNode;
            this.hash = HashUtil.hash(ifNode.hashCode(), thenNode.hashCode(), elseNode.hashCode());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof IteKey)) {
                return false;
            }
            IteKey other = (IteKey) o;
            return ifNode == other.ifNode && thenNode == other.thenNode && elseNode == other.elseNode;
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    /* A pending operation on the explicit work stack. */
    private static final class Task {
        final Node first;
        @Nullable
        final Node second;
        @Nullable
        final Node third;
        int stage = STAGE_START;
        @Nullable
        Variable variable;
        @Nullable
        Node low;

        Task(Node node) {
            this(node, null, null);
        }

        Task(Node first, @Nullable Node second, @Nullable Node third) {
            this.first = first;
            this.second = second;
            this.third = third;
        }
    }
}
