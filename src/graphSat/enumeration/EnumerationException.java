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

import graphSat.theories.OracleException;

/**
 * An oracle failure stopped the enumeration. The solutions found before the failure are kept in
 * {@link #partialTree()}, which is finalized.
 */
public class EnumerationException extends Exception {

    private final SolutionTree<?> partialTree;

    private final int oracleCalls;

    public EnumerationException(OracleException cause, SolutionTree<?> partialTree, int oracleCalls){
        super("Enumeration aborted after " + partialTree.size() + " solutions and " + oracleCalls + " oracle calls: "
                + cause.getMessage(), cause);
        this.partialTree = partialTree;
        this.oracleCalls = oracleCalls;
    }

    public SolutionTree<?> partialTree(){
        return this.partialTree;
    }

    public int oracleCalls(){
        return this.oracleCalls;
    }

    @Override
    public synchronized OracleException getCause() {
        return (OracleException) super.getCause();
    }
}
