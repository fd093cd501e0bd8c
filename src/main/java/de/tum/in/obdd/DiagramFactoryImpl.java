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

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

@SuppressWarnings("ObjectEquality")
final class DiagramFactoryImpl extends DiagramReferenceManager<DiagramFactoryImpl.DiagramImpl>
        implements DiagramFactory {
    private static final Logger logger = Logger.getLogger(DiagramFactoryImpl.class.getName());
    private static final Collection<DiagramFactoryImpl> factoryShutdownHook = new ConcurrentLinkedDeque<>();

    private final ObddImpl obdd;
    private final DiagramImpl zero;
    private final DiagramImpl one;

    DiagramFactoryImpl(ObddConfiguration configuration) {
        super(configuration.initialDiagramTableSize(), configuration.synchronizedTables());
        obdd = new ObddImpl(configuration);
        zero = make(obdd.falseNode());
        one = make(obdd.trueNode());

        if (logger.isLoggable(Level.INFO) && configuration.logStatisticsOnShutdown()) {
            logger.log(Level.FINER, "Adding {0} to shutdown hook", this);
            ShutdownHookLazyHolder.init();
            factoryShutdownHook.add(this);
        }
    }

    static DiagramFactory shared() {
        return SharedFactoryHolder.factory;
    }

    @Override
    protected DiagramImpl construct(Node node) {
        return new DiagramImpl(this, node);
    }

    @Override
    public Variable resolve(List<String> names, List<Integer> indices) {
        return obdd.resolve(names, indices);
    }

    @Override
    public Diagram variable(Variable variable) {
        return make(obdd.variableNode(obdd.resolve(variable.names(), variable.indices())));
    }

    @Override
    public Diagram zero() {
        return zero;
    }

    @Override
    public Diagram one() {
        return one;
    }

    @Override
    public Diagram box(Object value) {
        if (value instanceof Diagram) {
            node((Diagram) value);
            return (Diagram) value;
        }
        if (value instanceof Boolean) {
            return of((Boolean) value);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long number = ((Number) value).longValue();
            if (number == 0L || number == 1L) {
                return of(number == 1L);
            }
        }
        if ("0".equals(value) || "1".equals(value)) {
            return of("1".equals(value));
        }
        throw new InvalidIdentifierException("value", String.format("cannot convert %s to a diagram", value));
    }

    @Override
    public Diagram restrict(Diagram diagram, Map<?, ?> assignment) {
        Map<Variable, Boolean> variableAssignment = new HashMap<>();
        for (Map.Entry<?, ?> entry : assignment.entrySet()) {
            Diagram value = box(entry.getValue());
            if (value.kind() != Diagram.Kind.CONSTANT) {
                throw new InvalidIdentifierException(
                        "value", String.format("expected a constant for %s, got %s", entry.getKey(), value));
            }
            variableAssignment.put(asVariable(entry.getKey()), value.isOne());
        }
        return diagram.restrict(variableAssignment);
    }

    private static Variable asVariable(@Nullable Object key) {
        if (key instanceof Variable) {
            return (Variable) key;
        }
        if (key instanceof Diagram) {
            Optional<Variable> variable = ((Diagram) key).variable();
            if (variable.isPresent()) {
                return variable.get();
            }
        }
        throw new InvalidIdentifierException("variable", String.format("%s is not a variable", key));
    }

    @Override
    public Diagram fromExpression(BooleanExpression expression) {
        return make(expressionNode(expression));
    }

    private Node expressionNode(BooleanExpression expression) {
        if (expression.isZero()) {
            return obdd.falseNode();
        }
        if (expression.isOne()) {
            return obdd.trueNode();
        }
        Variable top = expression.top().orElseThrow(() ->
                new IllegalArgumentException(String.format("Non-constant expression %s has no top variable", expression)));
        Variable variable = obdd.resolve(top.names(), top.indices());
        Node lowNode = expressionNode(expression.restrict(top, false));
        Node highNode = expressionNode(expression.restrict(top, true));
        // The expression may order its variables differently from the diagrams
        return obdd.ifThenElse(obdd.variableNode(variable), highNode, lowNode);
    }

    @Override
    public boolean check() {
        return obdd.check();
    }

    @Override
    public String statistics() {
        return obdd.getStatistics() + '\n' + getReferenceStatistics();
    }

    int liveNodeCount() {
        return obdd.liveNodeCount();
    }

    int liveDiagramCount() {
        return purge();
    }

    /* Keys of a restriction, translated to the ids of this factory. */
    private Map<Integer, Boolean> toIdAssignment(Map<Variable, Boolean> assignment) {
        Map<Integer, Boolean> idAssignment = new HashMap<>(assignment.size());
        assignment.forEach((variable, value) -> {
            Variable registered = obdd.find(variable);
            if (registered != null) {
                // Variables which were never registered do not occur in any diagram
                idAssignment.put(registered.uniqueId(), value);
            }
        });
        return idAssignment;
    }

    private Map<Variable, Boolean> toLocalAssignment(Map<Variable, Boolean> assignment) {
        Map<Variable, Boolean> localAssignment = new HashMap<>(assignment.size());
        assignment.forEach((variable, value) -> {
            Variable registered = obdd.find(variable);
            if (registered != null) {
                localAssignment.put(registered, value);
            }
        });
        return localAssignment;
    }

    @SuppressWarnings("MethodOnlyUsedFromInnerClass")
    private Node node(Diagram diagram) {
        if (!(diagram instanceof DiagramImpl) || ((DiagramImpl) diagram).factory != this) {
            throw new IllegalArgumentException(String.format("Diagram %s belongs to a different factory", diagram));
        }
        return ((DiagramImpl) diagram).node;
    }

    @Override
    public String toString() {
        return String.format("F{%s}", obdd);
    }

    static final class DiagramImpl implements Diagram, DiagramContainer {
        private final DiagramFactoryImpl factory;
        private final Node node;

        @Nullable
        private List<Variable> supportCache;

        DiagramImpl(DiagramFactoryImpl factory, Node node) {
            this.factory = factory;
            this.node = node;
        }

        private DiagramImpl make(Node node) {
            return node == this.node ? this : factory.make(node);
        }

        @Override
        public Node node() {
            return node;
        }

        @Override
        public Kind kind() {
            if (node.isLeaf()) {
                return Kind.CONSTANT;
            }
            return isVariableNode(node) ? Kind.VARIABLE : Kind.FUNCTION;
        }

        @Override
        public Optional<Variable> variable() {
            return isVariableNode(node) ? Optional.of(node.variable()) : Optional.empty();
        }

        @Override
        public boolean isZero() {
            return this == factory.zero;
        }

        @Override
        public boolean isOne() {
            return this == factory.one;
        }

        @Override
        public Diagram not() {
            return make(factory.obdd.not(node));
        }

        @Override
        public Diagram or(Diagram other) {
            return make(factory.obdd.or(node, factory.node(other)));
        }

        @Override
        public Diagram and(Diagram other) {
            return make(factory.obdd.and(node, factory.node(other)));
        }

        @Override
        public Diagram xor(Diagram other) {
            return make(factory.obdd.xor(node, factory.node(other)));
        }

        @Override
        public Diagram implies(Diagram other) {
            return make(factory.obdd.implication(node, factory.node(other)));
        }

        @Override
        public Diagram impliedBy(Diagram other) {
            return make(factory.obdd.implication(factory.node(other), node));
        }

        @Override
        public Diagram ifThenElse(Diagram thenDiagram, Diagram elseDiagram) {
            return make(factory.obdd.ifThenElse(node, factory.node(thenDiagram), factory.node(elseDiagram)));
        }

        @Override
        public Diagram restrict(Map<Variable, Boolean> assignment) {
            return make(factory.obdd.restrict(node, factory.toIdAssignment(assignment)));
        }

        @Override
        public Diagram restrict(Variable variable, boolean value) {
            return restrict(Map.of(variable, value));
        }

        @Override
        public boolean equivalent(Diagram other) {
            return node == factory.node(other);
        }

        private List<Variable> getSupport() {
            if (supportCache == null) {
                supportCache = List.copyOf(factory.obdd.support(node));
            }
            return supportCache;
        }

        @Override
        public List<Variable> support() {
            return getSupport();
        }

        @Override
        public Optional<Variable> top() {
            List<Variable> support = getSupport();
            return support.isEmpty() ? Optional.empty() : Optional.of(support.get(0));
        }

        @Override
        public Iterable<Node> preOrder() {
            return () -> NodeIterator.preOrder(node);
        }

        @Override
        public Iterable<Node> postOrder() {
            return () -> NodeIterator.postOrder(node);
        }

        @Override
        public int nodeCount() {
            return factory.obdd.nodeCount(node);
        }

        @Override
        public boolean evaluate(Map<Variable, Boolean> assignment) {
            return factory.obdd.evaluate(node, factory.toLocalAssignment(assignment));
        }

        @Override
        public Optional<Map<Variable, Boolean>> satisfyingAssignment() {
            return factory.obdd.satisfyingAssignment(node);
        }

        @Override
        public void forEachPath(Consumer<? super Map<Variable, Boolean>> action) {
            factory.obdd.forEachPath(node, action);
        }

        @Override
        public boolean equals(Object o) {
            assert (this == o) == (o instanceof DiagramImpl && this.node == ((DiagramImpl) o).node
                    && this.factory == ((DiagramImpl) o).factory);
            return this == o;
        }

        @Override
        public int hashCode() {
            return node.hashCode();
        }

        @Override
        public String toString() {
            if (node.isLeaf()) {
                return node.value() ? "1" : "0";
            }
            if (isVariableNode(node)) {
                return node.variable().toString();
            }
            return String.format("%s@[%s]", node, factory);
        }
    }

    private static final class SharedFactoryHolder {
        private static final DiagramFactory factory = new DiagramFactoryImpl(ImmutableObddConfiguration.builder().build());
    }

    private static final class ShutdownHookLazyHolder {
        private static final Runnable shutdownHook = new ShutdownHookPrinter();

        static {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));
        }

        static void init() {
            // bogus method to force static initialization
        }
    }

    private static final class ShutdownHookPrinter implements Runnable {
        @Override
        public void run() {
            if (!logger.isLoggable(Level.INFO)) {
                return;
            }
            for (DiagramFactoryImpl factory : factoryShutdownHook) {
                logger.info(factory.statistics());
            }
        }
    }
}
