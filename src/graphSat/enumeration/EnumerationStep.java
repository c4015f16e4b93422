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
import graphSat.properties.Solution;
import graphSat.theories.Model;

/**
 * One recorded iteration: the model the oracle returned, its decoded solution and the clause that blocks it.
 */
public final class EnumerationStep<S extends Solution> {

    private final int index;

    private final Model model;

    private final S solution;

    private final Clause blockingClause;

    private final long elapsedMillis;

    EnumerationStep(int index, Model model, S solution, Clause blockingClause, long elapsedMillis){
        this.index = index;
        this.model = model;
        this.solution = solution;
        this.blockingClause = blockingClause;
        this.elapsedMillis = elapsedMillis;
    }

    /**
     * Position in enumeration order, starting at 0.
     */
    public int index(){
        return this.index;
    }

    public Model model(){
        return this.model;
    }

    public S solution(){
        return this.solution;
    }

    public Clause blockingClause(){
        return this.blockingClause;
    }

    /**
     * Milliseconds from the start of the enumeration session to the moment this step was recorded.
     */
    public long elapsedMillis(){
        return this.elapsedMillis;
    }

    @Override
    public String toString(){
        return "#" + index + " " + solution + " blocked by " + blockingClause;
    }
}
