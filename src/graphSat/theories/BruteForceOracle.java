/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat.theories;

import graphSat.encoding.Clause;
import graphSat.encoding.CnfFormula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tries all 2^n assignments in order. Only usable on tiny formulas, mainly as a reference to check other oracles
 * against.
 */
public class BruteForceOracle implements SatOracle {

    public final static int DEFAULT_MAX_VARIABLES = 22;

    private static final Logger log = LogManager.getFormatterLogger();

    private int maxVariables = DEFAULT_MAX_VARIABLES;

    public BruteForceOracle(){
    }

    public BruteForceOracle(int maxVariables){
        setMaxVariables(maxVariables);
    }

    @Override
    public Outcome solve(CnfFormula formula) throws OracleException {
        int n = formula.variableCount();
        if (n > this.maxVariables){
            throw new OracleException("Brute force refuses " + n + " variables (limit " + this.maxVariables + ")");
        }
        if (formula.containsContradiction()){
            return Outcome.unsatisfiable();
        }
        log.debug("brute force: %d variables, %d clauses", n, formula.countClauses());
        boolean[] assignment = new boolean[n + 1];
        long total = 1L << n;
        for (long bits = 0; bits < total; bits++){
            for (int v = 1; v <= n; v++){
                assignment[v] = ((bits >>> (v - 1)) & 1L) == 1L;
            }
            if (satisfies(formula, assignment)){
                int[] literals = new int[n];
                for (int v = 1; v <= n; v++){
                    literals[v - 1] = assignment[v] ? v : -v;
                }
                return Outcome.satisfiable(new Model(literals));
            }
        }
        return Outcome.unsatisfiable();
    }

    private static boolean satisfies(CnfFormula formula, boolean[] assignment){
        for (Clause c : formula.clauses()){
            if (!c.isSatisfiedBy(assignment)){
                return false;
            }
        }
        return true;
    }

    public int getMaxVariables() {
        return maxVariables;
    }

    public void setMaxVariables(int maxVariables) {
        if (maxVariables < 0 || maxVariables > 62){
            throw new IllegalArgumentException("maxVariables must be within 0..62, got " + maxVariables);
        }
        this.maxVariables = maxVariables;
    }
}
