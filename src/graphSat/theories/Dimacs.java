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

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.*;

/**
 * DIMACS CNF output and parsing of solver result files.
 */
public class Dimacs {

    private Dimacs(){}

    public static void write(CnfFormula formula, Writer out) throws IOException {
        out.write("p cnf " + formula.variableCount() + " " + formula.countClauses() + "\n");
        for (Clause c : formula.clauses()){
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < c.size(); i++){
                sb.append(c.get(i)).append(' ');
            }
            out.write(sb.append("0\n").toString());
        }
        out.flush();
    }

    public static String toString(CnfFormula formula){
        StringWriter sw = new StringWriter();
        try {
            write(formula, sw);
        } catch (IOException e){
            // StringWriter does not throw
            throw new IllegalStateException(e);
        }
        return sw.toString();
    }

    /**
     * Reads either a MiniSat result file ({@code SAT} followed by a literal line, or {@code UNSAT}) or SAT competition
     * output ({@code s SATISFIABLE} with {@code v} lines). Comment lines starting with {@code c} are skipped.
     *
     * @throws OracleException if the solver answered neither SAT nor UNSAT, or the model is unreadable
     */
    public static Outcome parseResult(List<String> lines) throws OracleException {
        String status = null;
        List<Integer> literals = new ArrayList<Integer>();
        for (String raw : lines){
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("c ") || line.equals("c")){
                continue;
            }
            if (status == null){
                status = line.startsWith("s ") ? line.substring(2).trim() : line;
                continue;
            }
            if (line.startsWith("v ")){
                line = line.substring(2);
            }
            for (String token : line.split("\\s+")){
                if (token.isEmpty()){
                    continue;
                }
                int literal;
                try {
                    literal = Integer.parseInt(token);
                } catch (NumberFormatException e){
                    throw new OracleException("Unreadable literal '" + token + "' in solver output", e);
                }
                if (literal != 0){
                    literals.add(literal);
                }
            }
        }
        if ("UNSAT".equals(status) || "UNSATISFIABLE".equals(status)){
            return Outcome.unsatisfiable();
        }
        if ("SAT".equals(status) || "SATISFIABLE".equals(status)){
            int[] model = new int[literals.size()];
            for (int i = 0; i < model.length; i++){
                model[i] = literals.get(i);
            }
            return Outcome.satisfiable(new Model(model));
        }
        throw new OracleException("Solver reported neither SAT nor UNSAT: " + status);
    }
}
