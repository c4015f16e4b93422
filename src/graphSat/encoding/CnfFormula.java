/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat.encoding;

import java.util.*;

/**
 * Immutable snapshot of a CNF formula: its clauses, the number of variables it ranges over and, when it came out of
 * an encoder, the registry that named those variables. Adding clauses produces a new snapshot, so a formula handed
 * to an oracle never changes afterwards.
 */
public final class CnfFormula {

    private final List<Clause> clauses;

    private final int variableCount;

    private final VariableRegistry registry;

    CnfFormula(List<Clause> clauses, int variableCount, VariableRegistry registry){
        this.clauses = Collections.unmodifiableList(new ArrayList<Clause>(clauses));
        int max = variableCount;
        for (Clause c : this.clauses){
            max = Math.max(max, c.maxVariable());
        }
        this.variableCount = max;
        this.registry = registry;
    }

    /**
     * Formula over plain DIMACS clauses, with no registry behind it.
     */
    public static CnfFormula of(int[]... clauses){
        List<Clause> list = new ArrayList<Clause>();
        for (int[] c : clauses){
            list.add(c.length == 0 ? Clause.contradiction() : Clause.of(c));
        }
        return new CnfFormula(list, 0, null);
    }

    public List<Clause> clauses(){
        return this.clauses;
    }

    public int countClauses(){
        return this.clauses.size();
    }

    public int variableCount(){
        return this.variableCount;
    }

    /**
     * May be null for formulas built from raw clauses.
     */
    public VariableRegistry registry(){
        return this.registry;
    }

    public boolean containsContradiction(){
        for (Clause c : this.clauses){
            if (c.isContradiction()){
                return true;
            }
        }
        return false;
    }

    /**
     * New snapshot holding these clauses followed by the given ones.
     */
    public CnfFormula with(Collection<Clause> additionalClauses){
        if (additionalClauses.isEmpty()){
            return this;
        }
        List<Clause> union = new ArrayList<Clause>(this.clauses.size() + additionalClauses.size());
        union.addAll(this.clauses);
        union.addAll(additionalClauses);
        return new CnfFormula(union, this.variableCount, this.registry);
    }

    @Override
    public String toString(){
        return "CnfFormula{variables=" + variableCount + ", clauses=" + clauses + "}";
    }
}
