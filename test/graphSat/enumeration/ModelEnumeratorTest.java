/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat.enumeration;

import graphSat.encoding.CardinalityEncoder;
import graphSat.encoding.ConstraintEncoder;
import graphSat.encoding.Encoding;
import graphSat.graphs.Graph;
import graphSat.graphs.Graphs;
import graphSat.properties.*;
import graphSat.theories.BruteForceOracle;
import graphSat.theories.Sat4jOracle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class ModelEnumeratorTest {

    private final ConstraintEncoder encoder = new ConstraintEncoder();

    private <S extends Solution> EnumerationResult<S> enumerateAll(ConstraintEncoder encoder, Graph graph, GraphProperty<S> property) throws EnumerationException {
        return new ModelEnumerator<S>(encoder.encode(graph, property), new Sat4jOracle()).enumerate();
    }

    @Test
    public void cycleOfFourHasTwoTwoColorings() throws EnumerationException {
        CountingOracle oracle = new CountingOracle(new Sat4jOracle());
        ModelEnumerator<Coloring> enumerator = new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(2)), oracle);
        EnumerationResult<Coloring> result = enumerator.enumerate();

        assertEquals(2, result.countSolutions());
        assertEquals(3, oracle.calls());
        assertEquals(3, result.oracleCalls());
        assertFalse(oracle.outcomes.get(2).isSatisfiable());
        assertEquals(Termination.EXHAUSTED, result.termination());
        Set<Coloring> expected = new HashSet<Coloring>();
        expected.add(coloring(0, 1, 0, 1));
        expected.add(coloring(1, 0, 1, 0));
        assertEquals(expected, new HashSet<Coloring>(result.solutions()));
        assertEquals(EnumerationState.DONE, enumerator.state());
        assertTrue(result.tree().isFrozen());
    }

    @Test
    public void cycleOfFourIsNotOneColorable() throws EnumerationException {
        CountingOracle oracle = new CountingOracle(new Sat4jOracle());
        EnumerationResult<Coloring> result = new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(1)), oracle).enumerate();
        assertEquals(0, result.countSolutions());
        assertEquals(1, oracle.calls());
        assertTrue(result.isComplete());
        assertTrue(result.tree().isEmpty());
    }

    @Test
    public void triangleIndependentSets() throws EnumerationException {
        Graph triangle = Graphs.complete(3);
        assertEquals(0, enumerateAll(encoder, triangle, new IndependentSet(2)).countSolutions());

        EnumerationResult<NodeSubset> singles = enumerateAll(encoder, triangle, new IndependentSet(1));
        assertEquals(3, singles.countSolutions());
        assertEquals(4, singles.oracleCalls());
        Set<Set<Integer>> found = new HashSet<Set<Integer>>();
        for (NodeSubset s : singles.solutions()){
            assertEquals(1, s.size());
            found.add(s.nodes());
        }
        assertEquals(3, found.size());
    }

    @Test
    public void solutionCountsMatchKnownValues() throws EnumerationException {
        // chromatic polynomial of C4 at 3: 2^4 + 2
        assertEquals(18, enumerateAll(encoder, Graphs.cycle(4), new Colorability(3)).countSolutions());
        assertEquals(6, enumerateAll(encoder, Graphs.complete(3), new Colorability(3)).countSolutions());
        assertEquals(6, enumerateAll(encoder, Graphs.cycle(4), new IndependentSet(1)).countSolutions());
        assertEquals(7, enumerateAll(encoder, Graphs.cycle(4), new IndependentSet(0)).countSolutions());
        assertEquals(2, enumerateAll(encoder, Graphs.cycle(4), new IndependentSet(2)).countSolutions());
        assertEquals(4, enumerateAll(encoder, Graphs.complete(3), new Clique(2)).countSolutions());
        assertEquals(4, enumerateAll(encoder, Graphs.cycle(4), new Clique(2)).countSolutions());
        assertEquals(0, enumerateAll(encoder, Graphs.cycle(4), new Clique(3)).countSolutions());
        // automorphisms of C4 form the dihedral group of order 8
        assertEquals(8, enumerateAll(encoder, Graphs.cycle(4), new Isomorphism(Graphs.cycle(4))).countSolutions());
        assertEquals(6, enumerateAll(encoder, Graphs.complete(3), new Isomorphism(Graphs.complete(3))).countSolutions());
    }

    @Test
    public void partialMappingRestrictsIsomorphisms() throws EnumerationException {
        Map<Integer, Integer> fixed = new HashMap<Integer, Integer>();
        fixed.put(1, 3);
        EnumerationResult<NodeMapping> result = enumerateAll(encoder, Graphs.cycle(4), new Isomorphism(Graphs.cycle(4), fixed));
        assertEquals(2, result.countSolutions());
        for (NodeMapping m : result.solutions()){
            assertEquals(3, m.imageOf(1));
            assertEquals(1, m.imageOf(3));
        }
    }

    @Test
    public void everySolutionIsAWitnessAndNoneRepeats() throws EnumerationException {
        Graph petal = Graph.fromEdges(new int[]{1, 2}, new int[]{2, 3}, new int[]{3, 1}, new int[]{3, 4}, new int[]{4, 5},
                new int[]{5, 3}, new int[]{6});
        List<GraphProperty<?>> properties = new ArrayList<GraphProperty<?>>();
        properties.add(new Colorability(3));
        properties.add(new Colorability(3, true));
        properties.add(new IndependentSet(2));
        properties.add(new IndependentSet(3));
        properties.add(new Clique(3));
        properties.add(new Clique(1));
        properties.add(new Isomorphism(petal));
        for (GraphProperty<?> property : properties){
            checkSound(petal, property);
        }
    }

    private <S extends Solution> void checkSound(Graph graph, GraphProperty<S> property) throws EnumerationException {
        EnumerationResult<S> result = enumerateAll(encoder, graph, property);
        assertFalse(result.solutions().isEmpty(), property.toString());
        assertEquals(result.countSolutions(), new HashSet<S>(result.solutions()).size(), property.toString());
        assertEquals(result.countSolutions() + 1, result.oracleCalls());
        for (S solution : result.solutions()){
            assertTrue(property.isWitness(graph, solution), property + ": " + solution);
        }
    }

    @Test
    public void counterVariablesDoNotMultiplySolutions() throws EnumerationException {
        ConstraintEncoder counting = new ConstraintEncoder(new CardinalityEncoder(0));
        // C5: the five non-adjacent pairs, no independent triple
        EnumerationResult<NodeSubset> c5 = enumerateAll(counting, Graphs.cycle(5), new IndependentSet(2));
        assertEquals(5, c5.countSolutions());
        // P5: six non-adjacent pairs and {1,3,5}
        EnumerationResult<NodeSubset> p5 = enumerateAll(counting, Graphs.path(5), new IndependentSet(2));
        assertEquals(7, p5.countSolutions());
        assertEquals(p5.countSolutions(), enumerateAll(encoder, Graphs.path(5), new IndependentSet(2)).countSolutions());
        assertEquals(p5.countSolutions(), new HashSet<NodeSubset>(p5.solutions()).size());
    }

    @Test
    public void bruteForceAndSat4jAgree() throws EnumerationException {
        Encoding<Coloring> a = encoder.encode(Graphs.path(4), new Colorability(2));
        Encoding<Coloring> b = encoder.encode(Graphs.path(4), new Colorability(2));
        List<Coloring> viaSat4j = new ModelEnumerator<Coloring>(a, new Sat4jOracle()).enumerate().solutions();
        List<Coloring> viaBruteForce = new ModelEnumerator<Coloring>(b, new BruteForceOracle()).enumerate().solutions();
        assertEquals(new HashSet<Coloring>(viaSat4j), new HashSet<Coloring>(viaBruteForce));
        assertEquals(2, viaSat4j.size());
    }

    @Test
    public void limitStopsWithoutAFinalQuery() throws EnumerationException {
        CountingOracle oracle = new CountingOracle(new Sat4jOracle());
        EnumerationResult<Coloring> result = new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(3)), oracle)
                .setMaxSolutions(5)
                .enumerate();
        assertEquals(5, result.countSolutions());
        assertEquals(5, oracle.calls());
        assertEquals(Termination.LIMIT_REACHED, result.termination());
        assertFalse(result.isComplete());
    }

    @Test
    public void zeroLimitMakesNoQuery() throws EnumerationException {
        CountingOracle oracle = new CountingOracle(new Sat4jOracle());
        EnumerationResult<Coloring> result = new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(2)), oracle)
                .setMaxSolutions(0)
                .enumerate();
        assertEquals(0, oracle.calls());
        assertTrue(result.tree().isFrozen());
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                new ModelEnumerator<Coloring>(null, oracle).setMaxSolutions(-2);
            }
        });
    }

    @Test
    public void cancellationKeepsTheSolutionsFoundSoFar() throws EnumerationException {
        CountingOracle oracle = new CountingOracle(new Sat4jOracle());
        final Cancellation cancellation = new Cancellation();
        ModelEnumerator<Coloring> enumerator = new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(3)), oracle)
                .setCancellation(cancellation)
                .addListener(new EnumerationListener() {
                    @Override
                    public void stepRecorded(EnumerationStep<?> step) {
                        if (step.index() == 2){
                            cancellation.cancel();
                        }
                    }

                    @Override
                    public void finished(EnumerationResult<?> result) {
                    }
                });
        EnumerationResult<Coloring> result = enumerator.enumerate();
        assertEquals(Termination.CANCELLED, result.termination());
        assertEquals(3, result.countSolutions());
        assertEquals(3, oracle.calls());
        assertTrue(result.tree().isFrozen());
    }

    @Test
    public void cancellationBeforeStartGivesAnEmptyFinalizedTree() throws EnumerationException {
        CountingOracle oracle = new CountingOracle(new Sat4jOracle());
        Cancellation cancellation = new Cancellation();
        cancellation.cancel();
        EnumerationResult<Coloring> result = new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(2)), oracle)
                .setCancellation(cancellation)
                .enumerate();
        assertEquals(0, oracle.calls());
        assertEquals(0, result.countSolutions());
        assertTrue(result.tree().isFrozen());
        assertEquals(Termination.CANCELLED, result.termination());
    }

    @Test
    public void oracleFailurePreservesThePartialTree() {
        CountingOracle oracle = new CountingOracle(new Sat4jOracle(), 3);
        ModelEnumerator<Coloring> enumerator = new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(3)), oracle);
        EnumerationException e = assertThrows(EnumerationException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                enumerator.enumerate();
            }
        });
        assertEquals(2, e.partialTree().size());
        assertTrue(e.partialTree().isFrozen());
        assertEquals(3, e.oracleCalls());
        assertTrue(e.getCause().getMessage().contains("simulated"));
        assertEquals(EnumerationState.DONE, enumerator.state());
    }

    @Test
    public void listenersHearAboutAFailedRun() {
        final List<EnumerationResult<?>> finished = new ArrayList<EnumerationResult<?>>();
        final List<Integer> steps = new ArrayList<Integer>();
        CountingOracle oracle = new CountingOracle(new Sat4jOracle(), 2);
        ModelEnumerator<Coloring> enumerator = new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(3)), oracle)
                .addListener(new EnumerationListener() {
                    @Override
                    public void stepRecorded(EnumerationStep<?> step) {
                        steps.add(step.index());
                    }

                    @Override
                    public void finished(EnumerationResult<?> result) {
                        finished.add(result);
                    }
                });
        EnumerationException e = assertThrows(EnumerationException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                enumerator.enumerate();
            }
        });
        assertEquals(Arrays.asList(0), steps);
        assertEquals(1, finished.size());
        assertEquals(Termination.FAILED, finished.get(0).termination());
        assertFalse(finished.get(0).isComplete());
        assertSame(e.partialTree(), finished.get(0).tree());
        assertEquals(2, finished.get(0).oracleCalls());
    }

    @Test
    public void stepTimesAreMeasuredFromTheSessionStart() throws EnumerationException {
        final List<Long> times = new ArrayList<Long>();
        EnumerationListener recorder = new EnumerationListener() {
            @Override
            public void stepRecorded(EnumerationStep<?> step) {
                times.add(step.elapsedMillis());
            }

            @Override
            public void finished(EnumerationResult<?> result) {
                times.add(result.elapsedMillis());
            }
        };
        ProgressLogger shared = new ProgressLogger(1);
        for (int run = 0; run < 2; run++){
            times.clear();
            new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(3)), new Sat4jOracle())
                    .addListener(shared)
                    .addListener(recorder)
                    .enumerate();
            assertEquals(19, times.size());
            for (int i = 1; i < times.size(); i++){
                assertTrue(times.get(i - 1) <= times.get(i));
            }
            assertTrue(times.get(0) >= 0);
        }
    }

    @Test
    public void eachQueryCarriesAllPreviousBlockingClauses() throws EnumerationException {
        CountingOracle oracle = new CountingOracle(new Sat4jOracle());
        Encoding<Coloring> encoding = encoder.encode(Graphs.cycle(4), new Colorability(2));
        ModelEnumerator<Coloring> enumerator = new ModelEnumerator<Coloring>(encoding, oracle);
        enumerator.enumerate();
        int base = encoding.formula().countClauses();
        for (int i = 0; i < oracle.calls(); i++){
            assertEquals(base + i, oracle.formulas.get(i).countClauses());
        }
        assertEquals(base, encoding.formula().countClauses());
        assertEquals(2, enumerator.blockingClauses().size());
        assertEquals(enumerator.tree().step(0).blockingClause(), enumerator.blockingClauses().get(0));
    }

    @Test
    public void graphWithoutRelevantVariablesHasOneEmptySolution() throws EnumerationException {
        EnumerationResult<Coloring> result = enumerateAll(encoder, Graph.builder().build(), new Colorability(0));
        assertEquals(1, result.countSolutions());
        assertEquals(2, result.oracleCalls());
        assertTrue(result.solutions().get(0).colors().isEmpty());
    }

    @Test
    public void failingListenersDoNotChangeResults() throws EnumerationException {
        EnumerationResult<Coloring> result = new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(2)), new Sat4jOracle())
                .addListener(new EnumerationListener() {
                    @Override
                    public void stepRecorded(EnumerationStep<?> step) {
                        throw new IllegalStateException("listener bug");
                    }

                    @Override
                    public void finished(EnumerationResult<?> result) {
                        throw new IllegalStateException("listener bug");
                    }
                })
                .addListener(new ProgressLogger(1))
                .enumerate();
        assertEquals(2, result.countSolutions());
    }

    @Test
    public void enumeratorRunsOnce() throws EnumerationException {
        ModelEnumerator<Coloring> enumerator = new ModelEnumerator<Coloring>(encoder.encode(Graphs.cycle(4), new Colorability(2)), new Sat4jOracle());
        enumerator.enumerate();
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                enumerator.enumerate();
            }
        });
    }

    private static Coloring coloring(int... colors){
        Map<Integer, Integer> map = new HashMap<Integer, Integer>();
        for (int i = 0; i < colors.length; i++){
            map.put(i + 1, colors[i]);
        }
        return new Coloring(map);
    }
}
