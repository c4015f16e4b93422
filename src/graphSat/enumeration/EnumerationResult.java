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

import graphSat.properties.Solution;

import java.util.List;

/**
 * Finalized outcome of one enumeration.
 */
public class EnumerationResult<S extends Solution> {

    private final SolutionTree<S> tree;

    private final Termination termination;

    private final int oracleCalls;

    private final long elapsedMillis;

    EnumerationResult(SolutionTree<S> tree, Termination termination, int oracleCalls, long elapsedMillis){
        this.tree = tree;
        this.termination = termination;
        this.oracleCalls = oracleCalls;
        this.elapsedMillis = elapsedMillis;
    }

    public SolutionTree<S> tree(){
        return this.tree;
    }

    public List<S> solutions(){
        return this.tree.solutions();
    }

    public int countSolutions(){
        return this.tree.size();
    }

    public Termination termination(){
        return this.termination;
    }

    public boolean isComplete(){
        return this.termination == Termination.EXHAUSTED;
    }

    public int oracleCalls(){
        return this.oracleCalls;
    }

    /**
     * Wall-clock duration of the whole session.
     */
    public long elapsedMillis(){
        return this.elapsedMillis;
    }

    @Override
    public String toString(){
        return termination + ": " + tree.size() + " solutions, " + oracleCalls + " oracle calls";
    }
}
