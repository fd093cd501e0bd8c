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
import static org.hamcrest.Matchers.is;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class SyntheticTest {
    private static final int[][] nQueensPairs = {
        {4, 2},
        {5, 10},
        {6, 4},
        {7, 40}
    };

    @Test
    public void testQueens() {
        for (int[] pair : nQueensPairs) {
            DiagramFactory factory = DiagramFactory.create();
            Diagram queens = DiagramBuilder.makeQueens(factory, pair[0]);
            assertThat(DiagramBuilder.countSatisfyingAssignments(queens, pair[0] * pair[0]), is((long) pair[1]));
        }
    }

    @Test
    public void testQueensIterative() {
        DiagramFactory factory = DiagramFactory.create(ImmutableObddConfiguration.builder().iterative(true).build());
        Diagram queens = DiagramBuilder.makeQueens(factory, 6);
        assertThat(DiagramBuilder.countSatisfyingAssignments(queens, 36), is(4L));
        assertThat(queens, is(DiagramBuilder.makeQueens(factory, 6)));
        assertThat(factory.check(), is(true));
    }

    @Test
    public void testAdder() {
        int bits = 8;
        DiagramFactory factory = DiagramFactory.create();
        Diagram[][] adder = DiagramBuilder.makeAdder(factory, bits);

        Random random = new Random(0L);
        for (int sample = 0; sample < 200; sample++) {
            int a = random.nextInt(1 << bits);
            int b = random.nextInt(1 << bits);
            int sum = a + b;

            Map<Variable, Boolean> assignment = new HashMap<>();
            for (int i = 0; i < bits; i++) {
                assignment.put(adder[0][i].variable().orElseThrow(), (a & (1 << i)) != 0);
                assignment.put(adder[1][i].variable().orElseThrow(), (b & (1 << i)) != 0);
            }
            for (int i = 0; i < bits; i++) {
                assertThat(adder[2][i].evaluate(assignment), is((sum & (1 << i)) != 0));
            }
        }
        // Each sum bit is true on exactly half of all inputs
        for (int i = 0; i < bits; i++) {
            assertThat(DiagramBuilder.countSatisfyingAssignments(adder[2][i], 2 * bits), is(1L << (2 * bits - 1)));
        }
    }
}
