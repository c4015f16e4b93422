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
import graphSat.encoding.CardinalityEncoder;
import graphSat.encoding.ConstraintEncoder;
import graphSat.encoding.Encoding;
import graphSat.graphs.Graph;
import graphSat.properties.GraphProperty;
import graphSat.properties.Solution;
import graphSat.theories.BruteForceOracle;
import graphSat.theories.GraphSatChecker;
import graphSat.theories.OracleException;
import graphSat.theories.Sat4jOracle;
import graphSat.theories.SatOracle;

import java.util.*;

/**
 * Entry point: encodes a property on a graph and enumerates its witnesses. Every call is an independent session with
 * its own registry, formula and tree, so an explorer may be used from several threads as long as its oracle is
 * stateless.
 */
public class SolutionExplorer {

    private final ConstraintEncoder encoder;

    private final SatOracle oracle;

    private final int maxSolutions;

    private final List<EnumerationListener> listeners = new ArrayList<EnumerationListener>();

    public SolutionExplorer(){
        this(EngineSettings.load());
    }

    public SolutionExplorer(EngineSettings settings){
        this(settings, new Sat4jOracle(settings.getOracleTimeout()));
    }

    public SolutionExplorer(EngineSettings settings, SatOracle oracle){
        this.encoder = new ConstraintEncoder(new CardinalityEncoder(settings.getDirectCardinalityLimit()));
        this.oracle = oracle;
        this.maxSolutions = settings.getMaxSolutions();
    }

    /**
     * Explorer answering with {@link BruteForceOracle}, bounded by the configured variable limit. Used to cross-check
     * the default oracle on small instances.
     */
    public static SolutionExplorer bruteForce(EngineSettings settings){
        return new SolutionExplorer(settings, new BruteForceOracle(settings.getBruteForceMaxVariables()));
    }

    /**
     * Listener added to every enumeration started afterwards.
     */
    public SolutionExplorer addListener(EnumerationListener listener){
        synchronized (this.listeners){
            this.listeners.add(listener);
        }
        return this;
    }

    public <S extends Solution> EnumerationResult<S> explore(Graph graph, GraphProperty<S> property) throws EnumerationException {
        return explore(graph, property, this.maxSolutions, new Cancellation());
    }

    public <S extends Solution> EnumerationResult<S> explore(Graph graph, GraphProperty<S> property, int maxSolutions) throws EnumerationException {
        return explore(graph, property, maxSolutions, new Cancellation());
    }

    /**
     * Encoding errors are raised before the oracle is called for the first time.
     */
    public <S extends Solution> EnumerationResult<S> explore(Graph graph, GraphProperty<S> property, int maxSolutions,
                                                            Cancellation cancellation) throws EnumerationException {
        Encoding<S> encoding = this.encoder.encode(graph, property);
        ModelEnumerator<S> enumerator = new ModelEnumerator<S>(encoding, this.oracle)
                .setMaxSolutions(maxSolutions)
                .setCancellation(cancellation);
        synchronized (this.listeners){
            for (EnumerationListener listener : this.listeners){
                enumerator.addListener(listener);
            }
        }
        return enumerator.enumerate();
    }

    /**
     * True if the graph has the property, i.e. at least one witness exists.
     */
    public boolean isSatisfiable(Graph graph, GraphProperty<?> property) throws EnumerationException {
        return explore(graph, property, 1).countSolutions() > 0;
    }

    /**
     * True if every CNF supported on the graph is satisfiable, checked with this explorer's oracle.
     */
    public boolean isGraphSatisfiable(Graph graph) throws OracleException {
        return new GraphSatChecker(this.oracle).isSatisfiable(graph);
    }

    public ConstraintEncoder encoder(){
        return this.encoder;
    }
}
