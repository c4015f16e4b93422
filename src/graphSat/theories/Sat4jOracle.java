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
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

/**
 * Oracle backed by sat4j's default MiniSat-style solver. A fresh solver is created for every call.
 */
public class Sat4jOracle implements SatOracle {

    private static final Logger log = LogManager.getFormatterLogger();

    // seconds, 0 means no limit
    private int timeout = 0;

    public Sat4jOracle(){
    }

    public Sat4jOracle(int timeout){
        setTimeout(timeout);
    }

    @Override
    public Outcome solve(CnfFormula formula) throws OracleException {
        log.debug("sat4j: %d variables, %d clauses", formula.variableCount(), formula.countClauses());
        ISolver solver = SolverFactory.newDefault();
        if (this.timeout > 0){
            solver.setTimeout(this.timeout);
        }
        solver.newVar(formula.variableCount());
        solver.setExpectedNumberOfClauses(formula.countClauses());
        try {
            for (Clause clause : formula.clauses()){
                if (clause.isContradiction()){
                    return Outcome.unsatisfiable();
                }
                solver.addClause(new VecInt(clause.literals()));
            }
        } catch (ContradictionException ce){
            return Outcome.unsatisfiable();
        }
        try {
            if (solver.isSatisfiable()){
                return Outcome.satisfiable(new Model(solver.model()));
            }
            return Outcome.unsatisfiable();
        } catch (TimeoutException e){
            throw new OracleException("sat4j gave up after " + this.timeout + "s on " + formula.variableCount()
                    + " variables and " + formula.countClauses() + " clauses", e);
        } catch (RuntimeException e){
            throw new OracleException("sat4j failed: " + e.getMessage(), e);
        } finally {
            solver.reset();
        }
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        if (timeout < 0){
            throw new IllegalArgumentException("timeout must be non-negative, got " + timeout);
        }
        this.timeout = timeout;
    }
}
