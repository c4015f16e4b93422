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

import graphSat.EngineSettings;
import graphSat.graphs.Graph;
import graphSat.graphs.Graphs;
import graphSat.graphs.InvalidGraphException;
import graphSat.properties.*;
import graphSat.theories.Sat4jOracle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.*;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

public class SolutionExplorerTest {

    @Test
    public void encodingErrorsHappenBeforeAnyOracleCall() {
        CountingOracle oracle = new CountingOracle(new Sat4jOracle());
        SolutionExplorer explorer = new SolutionExplorer(new EngineSettings(), oracle);
        assertThrows(InvalidGraphException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                explorer.explore(Graphs.cycle(4), new Colorability(0));
            }
        });
        assertEquals(0, oracle.calls());
    }

    @Test
    public void bruteForceAgreesWithSat4j() throws EnumerationException {
        EngineSettings settings = new EngineSettings();
        SolutionExplorer sat4j = new SolutionExplorer(settings);
        SolutionExplorer bruteForce = SolutionExplorer.bruteForce(settings);
        Graph c5 = Graphs.cycle(5);
        assertEquals(new HashSet<Coloring>(sat4j.explore(c5, new Colorability(3)).solutions()),
                new HashSet<Coloring>(bruteForce.explore(c5, new Colorability(3)).solutions()));
        assertEquals(new HashSet<NodeSubset>(sat4j.explore(c5, new IndependentSet(2)).solutions()),
                new HashSet<NodeSubset>(bruteForce.explore(c5, new IndependentSet(2)).solutions()));
    }

    @Test
    public void bruteForceRespectsTheVariableLimit() {
        EngineSettings settings = new EngineSettings();
        settings.setBruteForceMaxVariables(4);
        EnumerationException e = assertThrows(EnumerationException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                SolutionExplorer.bruteForce(settings).explore(Graphs.cycle(5), new Colorability(3));
            }
        });
        assertEquals(1, e.oracleCalls());
        assertTrue(e.partialTree().isEmpty());
    }

    @Test
    public void graphSatisfiabilityUsesTheConfiguredOracle() throws Exception {
        Graph path = Graph.fromEdges(new int[]{1, 2}, new int[]{2, 3});
        assertTrue(new SolutionExplorer(new EngineSettings()).isGraphSatisfiable(path));
        assertTrue(SolutionExplorer.bruteForce(new EngineSettings()).isGraphSatisfiable(path));
        CountingOracle oracle = new CountingOracle(new Sat4jOracle());
        new SolutionExplorer(new EngineSettings(), oracle).isGraphSatisfiable(path);
        assertEquals(16, oracle.calls());
    }

    @Test
    public void settingsLimitApplies() throws EnumerationException {
        EngineSettings settings = new EngineSettings();
        settings.setMaxSolutions(3);
        EnumerationResult<Coloring> result = new SolutionExplorer(settings).explore(Graphs.complete(3), new Colorability(3));
        assertEquals(3, result.countSolutions());
        assertEquals(Termination.LIMIT_REACHED, result.termination());
    }

    @Test
    public void satisfiabilityCheck() throws EnumerationException {
        SolutionExplorer explorer = new SolutionExplorer(new EngineSettings());
        assertTrue(explorer.isSatisfiable(Graphs.cycle(4), new Colorability(2)));
        assertFalse(explorer.isSatisfiable(Graphs.cycle(5), new Colorability(2)));
        assertFalse(explorer.isSatisfiable(Graphs.complete(3), new IndependentSet(2)));
    }

    @Test
    public void symmetryBreakingRemovesPermutedColorings() throws EnumerationException {
        SolutionExplorer explorer = new SolutionExplorer(new EngineSettings());
        assertEquals(1, explorer.explore(Graphs.cycle(4), new Colorability(2, true)).countSolutions());
        assertEquals(1, explorer.explore(Graphs.complete(3), new Colorability(3, true)).countSolutions());
        EnumerationResult<Coloring> c4 = explorer.explore(Graphs.cycle(4), new Colorability(3, true));
        Set<Coloring> canonical = new HashSet<Coloring>();
        for (Coloring c : c4.solutions()){
            assertTrue(new Colorability(3).isWitness(Graphs.cycle(4), c));
            canonical.add(c.canonical());
        }
        assertEquals(3, canonical.size());
        assertTrue(c4.countSolutions() < 18);
    }

    @Test
    public void listenersSeeEveryStep() throws EnumerationException {
        final List<Integer> seen = new ArrayList<Integer>();
        final List<EnumerationResult<?>> finished = new ArrayList<EnumerationResult<?>>();
        SolutionExplorer explorer = new SolutionExplorer(new EngineSettings()).addListener(new EnumerationListener() {
            @Override
            public void stepRecorded(EnumerationStep<?> step) {
                seen.add(step.index());
            }

            @Override
            public void finished(EnumerationResult<?> result) {
                finished.add(result);
            }
        });
        EnumerationResult<NodeSubset> result = explorer.explore(Graphs.cycle(4), new IndependentSet(1));
        assertEquals(Arrays.asList(0, 1, 2, 3, 4, 5), seen);
        assertEquals(1, finished.size());
        assertSame(result, finished.get(0));
    }

    @Test
    public void independentSessionsRunConcurrently() throws Exception {
        final SolutionExplorer explorer = new SolutionExplorer(new EngineSettings());
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> futures = new ArrayList<Future<Integer>>();
            for (int i = 0; i < 8; i++){
                final int colors = 2 + i % 2;
                futures.add(pool.submit(new Callable<Integer>() {
                    @Override
                    public Integer call() throws Exception {
                        return explorer.explore(Graphs.cycle(4), new Colorability(colors)).countSolutions();
                    }
                }));
            }
            for (int i = 0; i < futures.size(); i++){
                assertEquals(i % 2 == 0 ? 2 : 18, futures.get(i).get(30, TimeUnit.SECONDS).intValue());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void cancellationFromAnotherThreadStopsBetweenQueries() throws Exception {
        final Cancellation cancellation = new Cancellation();
        final CountDownLatch firstStep = new CountDownLatch(1);
        final CountDownLatch cancelled = new CountDownLatch(1);
        SolutionExplorer explorer = new SolutionExplorer(new EngineSettings()).addListener(new EnumerationListener() {
            @Override
            public void stepRecorded(EnumerationStep<?> step) {
                firstStep.countDown();
                try {
                    cancelled.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e){
                    Thread.currentThread().interrupt();
                }
            }

            @Override
            public void finished(EnumerationResult<?> result) {
            }
        });
        Thread canceller = new Thread(new Runnable() {
            @Override
            public void run() {
                try {
                    firstStep.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e){
                    Thread.currentThread().interrupt();
                }
                cancellation.cancel();
                cancelled.countDown();
            }
        });
        canceller.start();
        Graph k4 = Graphs.complete(4);
        EnumerationResult<Coloring> result = explorer.explore(k4, new Colorability(4), ModelEnumerator.ALL, cancellation);
        canceller.join();
        assertEquals(Termination.CANCELLED, result.termination());
        assertEquals(1, result.countSolutions());
        assertTrue(result.tree().isFrozen());
    }
}
