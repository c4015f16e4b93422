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

import graphSat.encoding.Clause;
import graphSat.encoding.CnfFormula;
import graphSat.encoding.Encoding;
import graphSat.properties.Solution;
import graphSat.theories.Model;
import graphSat.theories.OracleException;
import graphSat.theories.Outcome;
import graphSat.theories.SatOracle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Enumerates the distinct solutions of an encoding by repeated oracle calls. Each call gets the base formula plus
 * every blocking clause found so far. A blocking clause ranges over the relevant variables only, so models that
 * differ in auxiliary variables alone are not reported twice.
 *
 * <p>An exhaustive run makes exactly (number of solutions + 1) oracle calls. One enumerator runs once, on one
 * thread.</p>
 */
public class ModelEnumerator<S extends Solution> {

    public final static int ALL = -1;

    private static final Logger log = LogManager.getFormatterLogger();

    private final Encoding<S> encoding;

    private final SatOracle oracle;

    private int maxSolutions = ALL;

    private Cancellation cancellation = new Cancellation();

    private final List<EnumerationListener> listeners = new ArrayList<EnumerationListener>();

    private EnumerationState state = EnumerationState.READY;

    private final SolutionTree<S> tree = new SolutionTree<S>();

    private final List<Clause> blockingClauses = new ArrayList<Clause>();

    private int oracleCalls = 0;

    private boolean started = false;

    private long startNanos;

    public ModelEnumerator(Encoding<S> encoding, SatOracle oracle){
        this.encoding = encoding;
        this.oracle = oracle;
    }

    /**
     * Listeners are told about the end of the run in every case, including a {@link Termination#FAILED} run.
     *
     * @throws EnumerationException if the oracle fails; the exception carries the finalized partial tree
     */
    public EnumerationResult<S> enumerate() throws EnumerationException {
        if (this.started){
            throw new IllegalStateException("An enumerator can only run once");
        }
        this.started = true;
        this.startNanos = System.nanoTime();
        log.info("enumerating %s (%d variables, %d clauses, limit %s)", this.encoding.property(),
                this.encoding.formula().variableCount(), this.encoding.formula().countClauses(),
                this.maxSolutions == ALL ? "none" : String.valueOf(this.maxSolutions));
        Termination termination;
        try {
            termination = loop();
        } catch (OracleException e){
            log.error("oracle failed after %d solutions: %s", this.tree.size(), e.getMessage());
            finish(Termination.FAILED);
            throw new EnumerationException(e, this.tree, this.oracleCalls);
        }
        EnumerationResult<S> result = finish(termination);
        log.info("%s", result);
        return result;
    }

    private EnumerationResult<S> finish(Termination termination){
        this.state = EnumerationState.DONE;
        this.tree.freeze();
        EnumerationResult<S> result = new EnumerationResult<S>(this.tree, termination, this.oracleCalls, elapsedMillis());
        for (EnumerationListener listener : this.listeners){
            try {
                listener.finished(result);
            } catch (RuntimeException e){
                log.warn("listener %s failed: %s", listener, e);
            }
        }
        return result;
    }

    private long elapsedMillis(){
        return (System.nanoTime() - this.startNanos) / 1000000L;
    }

    private Termination loop() throws OracleException {
        if (this.maxSolutions == 0){
            return Termination.LIMIT_REACHED;
        }
        while (true){
            if (this.cancellation.isCancelled()){
                log.info("cancelled after %d solutions", this.tree.size());
                return Termination.CANCELLED;
            }
            this.state = EnumerationState.QUERYING;
            CnfFormula snapshot = this.encoding.formula().with(this.blockingClauses);
            this.oracleCalls++;
            Outcome outcome = this.oracle.solve(snapshot);
            if (!outcome.isSatisfiable()){
                return Termination.EXHAUSTED;
            }
            this.state = EnumerationState.EXTRACTING;
            Model model = outcome.model();
            S solution = this.encoding.decode(model);
            Clause blocking = this.encoding.blockingClause(model);
            this.blockingClauses.add(blocking);
            EnumerationStep<S> step = new EnumerationStep<S>(this.tree.size(), model, solution, blocking, elapsedMillis());
            this.tree.append(step);
            log.debug("%s", step);
            for (EnumerationListener listener : this.listeners){
                try {
                    listener.stepRecorded(step);
                } catch (RuntimeException e){
                    log.warn("listener %s failed on step %d: %s", listener, step.index(), e);
                }
            }
            if (this.maxSolutions != ALL && this.tree.size() >= this.maxSolutions){
                return Termination.LIMIT_REACHED;
            }
            this.state = EnumerationState.READY;
        }
    }

    public EnumerationState state(){
        return this.state;
    }

    /**
     * The tree built so far; frozen once the enumeration has ended.
     */
    public SolutionTree<S> tree(){
        return this.tree;
    }

    public int oracleCalls(){
        return this.oracleCalls;
    }

    public List<Clause> blockingClauses(){
        return Collections.unmodifiableList(this.blockingClauses);
    }

    public ModelEnumerator<S> addListener(EnumerationListener listener){
        this.listeners.add(listener);
        return this;
    }

    public int getMaxSolutions() {
        return maxSolutions;
    }

    /**
     * @param maxSolutions {@link #ALL} or a non-negative limit
     */
    public ModelEnumerator<S> setMaxSolutions(int maxSolutions) {
        if (maxSolutions < ALL){
            throw new IllegalArgumentException("maxSolutions must be ALL (-1) or non-negative, got " + maxSolutions);
        }
        this.maxSolutions = maxSolutions;
        return this;
    }

    public Cancellation getCancellation() {
        return cancellation;
    }

    public ModelEnumerator<S> setCancellation(Cancellation cancellation) {
        if (cancellation == null){
            throw new NullPointerException("cancellation");
        }
        this.cancellation = cancellation;
        return this;
    }
}
