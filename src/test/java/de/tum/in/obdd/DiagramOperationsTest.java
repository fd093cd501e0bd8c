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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class DiagramOperationsTest {
    public static Stream<DiagramFactory> factories() {
        return Stream.of(
                DiagramFactory.create(),
                DiagramFactory.create(ImmutableObddConfiguration.builder().iterative(true).build()),
                DiagramFactory.create(ImmutableObddConfiguration.builder()
                        .iterative(true)
                        .synchronizedTables(false)
                        .build()));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testFirstRequestOrder(DiagramFactory factory) {
        Diagram a = factory.variable("a");
        Diagram b = factory.variable("b");
        Diagram c = factory.variable("c");

        assertThat(a.variable().orElseThrow().uniqueId(), is(1));
        assertThat(b.variable().orElseThrow().uniqueId(), is(2));
        assertThat(c.variable().orElseThrow().uniqueId(), is(3));
        assertThat(factory.variable("a"), sameInstance(a));

        Diagram f = a.and(b).or(c);
        assertThat(f.top(), is(a.variable()));
        assertThat(f.restrict(a.variable().orElseThrow(), false), sameInstance(c));
        assertThat(f.restrict(a.variable().orElseThrow(), true), sameInstance(b.or(c)));
        assertThat(f.equivalent(c.or(a.and(b))), is(true));
        assertThat(f, sameInstance(c.or(a.and(b))));
        assertThat(f.support(), contains(a.variable().orElseThrow(), b.variable().orElseThrow(),
                c.variable().orElseThrow()));
        assertThat(factory.check(), is(true));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testSelfCombination(DiagramFactory factory) {
        Diagram a = factory.variable("a");

        assertThat(a.xor(a), sameInstance(factory.zero()));
        assertThat(a.xor(a.not()), sameInstance(factory.one()));
        assertThat(a.and(a), sameInstance(a));
        assertThat(a.or(a), sameInstance(a));
        assertThat(a.implies(a), sameInstance(factory.one()));
        assertThat(a.not().not(), sameInstance(a));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testTerminals(DiagramFactory factory) {
        Diagram zero = factory.zero();
        Diagram one = factory.one();

        assertThat(zero.isZero(), is(true));
        assertThat(one.isOne(), is(true));
        assertThat(zero.node(), sameInstance(Node.FALSE));
        assertThat(one.node(), sameInstance(Node.TRUE));
        assertThat(zero.not(), sameInstance(one));
        assertThat(one.not(), sameInstance(zero));
        assertThat(zero.kind(), is(Diagram.Kind.CONSTANT));
        assertThat(zero.variable(), is(Optional.empty()));
        assertThat(zero.top(), is(Optional.empty()));
        assertThat(one.support(), empty());
        assertThat(one.nodeCount(), is(1));
        assertThat(zero.satisfyingAssignment(), is(Optional.empty()));
        assertThat(one.satisfyingAssignment(), is(Optional.of(Map.of())));
        assertThat(zero.toString(), is("0"));
        assertThat(one.toString(), is("1"));

        Diagram a = factory.variable("a");
        assertThat(zero.and(a), sameInstance(zero));
        assertThat(one.and(a), sameInstance(a));
        assertThat(zero.or(a), sameInstance(a));
        assertThat(one.or(a), sameInstance(one));
        assertThat(zero.implies(a), sameInstance(one));
        assertThat(one.ifThenElse(a, zero), sameInstance(a));
        assertThat(zero.ifThenElse(zero, a), sameInstance(a));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testKind(DiagramFactory factory) {
        Diagram a = factory.variable(List.of("a", "q"), List.of(2, 0));
        Diagram b = factory.variable("b");

        assertThat(a.kind(), is(Diagram.Kind.VARIABLE));
        assertThat(a.not().kind(), is(Diagram.Kind.FUNCTION));
        assertThat(a.and(b).kind(), is(Diagram.Kind.FUNCTION));
        assertThat(a.not().variable(), is(Optional.empty()));
        assertThat(a.variable().orElseThrow().names(), contains("a", "q"));
        assertThat(a.variable().orElseThrow().indices(), contains(2, 0));
        assertThat(a.toString(), is(a.variable().orElseThrow().toString()));
        assertThat(a.nodeCount(), is(3));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testDeMorgan(DiagramFactory factory) {
        Diagram a = factory.variable("a");
        Diagram b = factory.variable("b");
        Diagram c = factory.variable("c");
        Diagram f = a.xor(c).or(b);
        Diagram g = b.implies(a.and(c));

        assertThat(f.and(g).not(), sameInstance(f.not().or(g.not())));
        assertThat(f.or(g).not(), sameInstance(f.not().and(g.not())));
        assertThat(f.and(g.or(c)), sameInstance(f.and(g).or(f.and(c))));
        assertThat(f.impliedBy(g), sameInstance(g.implies(f)));
        assertThat(f.xor(g), sameInstance(f.and(g.not()).or(f.not().and(g))));
        assertThat(factory.ifThenElse(f, g, c), sameInstance(f.and(g).or(f.not().and(c))));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testRestrict(DiagramFactory factory) {
        Diagram a = factory.variable("a");
        Diagram b = factory.variable("b");
        Diagram c = factory.variable("c");
        Variable va = a.variable().orElseThrow();
        Variable vb = b.variable().orElseThrow();
        Diagram f = a.and(b).or(a.not().and(c));

        Map<Variable, Boolean> assignment = Map.of(va, true, vb, false);
        Diagram restricted = f.restrict(assignment);
        assertThat(restricted, sameInstance(factory.zero()));
        assertThat(restricted.restrict(assignment), sameInstance(restricted));
        assertThat(f.restrict(Map.of(va, false)), sameInstance(c));
        assertThat(f.restrict(Map.of()), sameInstance(f));

        // Variables unknown to this factory do not occur in its diagrams
        Variable foreign = DiagramFactory.create().resolve(List.of("z"), List.of());
        assertThat(f.restrict(foreign, true), sameInstance(f));

        assertThat(factory.restrict(f, Map.of(a, 1, vb, "1")), sameInstance(factory.one()));
        assertThat(factory.restrict(f, Map.of(a, false)), sameInstance(c));
        assertThat(factory.restrict(f, Map.of(a, factory.one(), b, 0L)), sameInstance(factory.zero()));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testRestrictInvalid(DiagramFactory factory) {
        Diagram a = factory.variable("a");
        Diagram b = factory.variable("b");
        Diagram f = a.or(b);

        InvalidIdentifierException notVariable =
                assertThrows(InvalidIdentifierException.class, () -> factory.restrict(f, Map.of(a.not(), true)));
        assertThat(notVariable.field(), is("variable"));
        assertThrows(InvalidIdentifierException.class, () -> factory.restrict(f, Map.of("a", true)));

        InvalidIdentifierException notConstant =
                assertThrows(InvalidIdentifierException.class, () -> factory.restrict(f, Map.of(a, b)));
        assertThat(notConstant.field(), is("value"));
        assertThrows(InvalidIdentifierException.class, () -> factory.restrict(f, Map.of(a, 2)));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testBox(DiagramFactory factory) {
        Diagram a = factory.variable("a");

        assertThat(factory.box(a), sameInstance(a));
        assertThat(factory.box(true), sameInstance(factory.one()));
        assertThat(factory.box(false), sameInstance(factory.zero()));
        assertThat(factory.box(1), sameInstance(factory.one()));
        assertThat(factory.box(0L), sameInstance(factory.zero()));
        assertThat(factory.box("1"), sameInstance(factory.one()));
        assertThat(factory.box("0"), sameInstance(factory.zero()));

        assertThrows(InvalidIdentifierException.class, () -> factory.box(2));
        assertThrows(InvalidIdentifierException.class, () -> factory.box(1.0));
        assertThrows(InvalidIdentifierException.class, () -> factory.box("true"));
        assertThrows(InvalidIdentifierException.class, () -> factory.box(List.of()));
        assertThrows(IllegalArgumentException.class, () -> factory.box(DiagramFactory.create().one()));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testForeignDiagram(DiagramFactory factory) {
        DiagramFactory other = DiagramFactory.create();
        Diagram a = factory.variable("a");
        Diagram otherA = other.variable("a");

        assertThat(otherA, not(sameInstance(a)));
        assertThrows(IllegalArgumentException.class, () -> a.and(otherA));
        assertThrows(IllegalArgumentException.class, () -> a.ifThenElse(factory.one(), otherA));
        assertThrows(IllegalArgumentException.class, () -> a.equivalent(otherA));

        // Expressions are rebuilt by identity of their variables
        assertThat(factory.fromExpression(otherA.and(other.variable("b").not())),
                sameInstance(a.and(factory.variable("b").not())));
        assertThat(factory.variable(otherA.variable().orElseThrow()), sameInstance(a));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testFromExpressionOrder(DiagramFactory factory) {
        // The syntax tree splits on variables by name, which is the reverse of their request order
        Variable z = factory.resolve(List.of("z"), List.of());
        Variable y = factory.resolve(List.of("y"), List.of());
        Variable x = factory.resolve(List.of("x"), List.of());
        SyntaxTree tree = SyntaxTree.or(
                SyntaxTree.and(SyntaxTree.literal(x), SyntaxTree.literal(z)),
                SyntaxTree.xor(SyntaxTree.literal(y), SyntaxTree.not(SyntaxTree.literal(x))));
        assertThat(tree.top(), is(Optional.of(x)));

        Diagram diagram = factory.fromExpression(tree);
        Diagram dx = factory.variable(x);
        Diagram dy = factory.variable(y);
        Diagram dz = factory.variable(z);
        assertThat(diagram, sameInstance(dx.and(dz).or(dy.xor(dx.not()))));
        assertThat(diagram.top(), is(Optional.of(z)));
        assertThat(factory.fromExpression(SyntaxTree.constant(true)), sameInstance(factory.one()));
        assertThat(factory.check(), is(true));
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testTraversal(DiagramFactory factory) {
        Diagram a = factory.variable("a");
        Diagram b = factory.variable("b");
        Diagram c = factory.variable("c");
        Diagram f = a.and(b).or(c);

        List<Node> preOrder = new ArrayList<>();
        f.preOrder().forEach(preOrder::add);
        List<Node> postOrder = new ArrayList<>();
        f.postOrder().forEach(postOrder::add);

        // a, b, c and both terminals
        assertThat(f.nodeCount(), is(5));
        assertThat(preOrder.get(0), sameInstance(f.node()));
        assertThat(postOrder.get(postOrder.size() - 1), sameInstance(f.node()));
        assertThat(postOrder, containsInAnyOrder(preOrder.toArray()));
        for (Node node : preOrder) {
            if (!node.isLeaf()) {
                assertThat(postOrder.indexOf(node.low()) < postOrder.indexOf(node), is(true));
                assertThat(postOrder.indexOf(node.high()) < postOrder.indexOf(node), is(true));
            }
        }
    }

    @ParameterizedTest
    @MethodSource("factories")
    public void testPaths(DiagramFactory factory) {
        Diagram a = factory.variable("a");
        Diagram b = factory.variable("b");
        Diagram c = factory.variable("c");
        Variable va = a.variable().orElseThrow();
        Variable vb = b.variable().orElseThrow();
        Variable vc = c.variable().orElseThrow();
        Diagram f = a.and(b).or(c);

        List<Map<Variable, Boolean>> paths = new ArrayList<>();
        f.forEachPath(path -> paths.add(Map.copyOf(path)));
        assertThat(paths, contains(
                Map.of(va, false, vc, true),
                Map.of(va, true, vb, false, vc, true),
                Map.of(va, true, vb, true)));

        Map<Variable, Boolean> assignment = f.satisfyingAssignment().orElseThrow();
        assertThat(assignment, is(Map.of(va, false, vc, true)));

        Map<Variable, Boolean> valuation = new HashMap<>();
        assertThat(f.evaluate(valuation), is(false));
        valuation.put(vc, true);
        assertThat(f.evaluate(valuation), is(true));
        valuation.put(vc, false);
        valuation.put(va, true);
        assertThat(f.evaluate(valuation), is(false));
        valuation.put(vb, true);
        assertThat(f.evaluate(valuation), is(true));

        List<Map<Variable, Boolean>> none = new ArrayList<>();
        factory.zero().forEachPath(none::add);
        assertThat(none, empty());
        List<Map<Variable, Boolean>> all = new ArrayList<>();
        factory.one().forEachPath(path -> all.add(Map.copyOf(path)));
        assertThat(all, contains(Map.of()));
    }

    @Test
    public void testDeepChainIterative() {
        int depth = 100_000;
        DiagramFactory factory = DiagramFactory.create(ImmutableObddConfiguration.builder().iterative(true).build());
        List<Variable> variables = new ArrayList<>(depth);
        for (int i = 0; i < depth; i++) {
            variables.add(factory.resolve(List.of("x"), List.of(i)));
        }

        // Built bottom-up, so every conjunction only adds one node on top
        Diagram chain = factory.one();
        for (int i = depth - 1; i >= 0; i--) {
            chain = factory.variable(variables.get(i)).and(chain);
        }
        assertThat(chain.nodeCount(), is(depth + 2));

        List<Map<Variable, Boolean>> paths = new ArrayList<>();
        chain.forEachPath(path -> paths.add(Map.copyOf(path)));
        assertThat(paths.size(), is(1));
        assertThat(paths.get(0).size(), is(depth));
        assertThat(paths.get(0).values().stream().allMatch(Boolean::booleanValue), is(true));

        // The negation has one path per variable, ending at its first false literal
        List<Integer> negatedPathSizes = new ArrayList<>(depth);
        chain.not().forEachPath(path -> negatedPathSizes.add(path.size()));
        assertThat(negatedPathSizes.size(), is(depth));
        assertThat(negatedPathSizes.get(0), is(1));
        assertThat(negatedPathSizes.get(depth - 1), is(depth));
        assertThat(chain.restrict(variables.get(depth - 1), true).support().size(), is(depth - 1));
    }

    @Test
    public void testShared() {
        DiagramFactory shared = DiagramFactory.shared();
        assertThat(DiagramFactory.shared(), sameInstance(shared));
        Diagram variable = shared.variable("shared", 0);
        assertThat(shared.variable("shared", 0), sameInstance(variable));
        assertThat(shared.check(), is(true));
    }

    @Test
    public void testConfigurationValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableObddConfiguration.builder().initialNodeTableSize(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableObddConfiguration.builder().initialDiagramTableSize(-1).build());

        ObddConfiguration configuration = ImmutableObddConfiguration.builder().build();
        assertThat(configuration.iterative(), is(false));
        assertThat(configuration.synchronizedTables(), is(true));
        assertThat(configuration.initialNodeTableSize(), is(ObddConfiguration.DEFAULT_INITIAL_NODE_TABLE_SIZE));
    }
}
