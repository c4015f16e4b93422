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

import graphSat.encoding.CnfFormula;
import graphSat.encoding.SupportedCnfs;
import graphSat.graphs.Graph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Satisfiability of a graph: a graph is satisfiable iff every CNF supported on it is. The supported CNFs are
 * generated lazily and checked one by one, stopping at the first unsatisfiable one.
 *
 * @see SupportedCnfs
 */
public class GraphSatChecker {

    private static final Logger log = LogManager.getFormatterLogger();

    private final SatOracle oracle;

    public GraphSatChecker(SatOracle oracle){
        this.oracle = oracle;
    }

    public boolean isSatisfiable(Graph graph) throws OracleException {
        return findUnsatisfiable(graph) == null;
    }

    /**
     * First supported CNF the oracle refutes, or null if the graph is satisfiable.
     */
    public CnfFormula findUnsatisfiable(Graph graph) throws OracleException {
        log.info("checking %d CNFs supported on %s", SupportedCnfs.count(graph), graph);
        int checked = 0;
        for (CnfFormula cnf : SupportedCnfs.cnfsOn(graph)){
            checked++;
            if (!this.oracle.solve(cnf).isSatisfiable()){
                log.info("unsatisfiable CNF after %d checks: %s", checked, cnf.clauses());
                return cnf;
            }
        }
        log.info("all %d supported CNFs are satisfiable", checked);
        return null;
    }
}
