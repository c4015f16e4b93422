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
 * Append-only clause sink of one encoding session. Owns the session's {@link VariableRegistry}.
 */
public class CnfBuilder {

    private final VariableRegistry registry;

    private final List<Clause> clauses = new ArrayList<Clause>();

    private int counterGroups = 0;

    public CnfBuilder(){
        this(new VariableRegistry());
    }

    public CnfBuilder(VariableRegistry registry){
        this.registry = registry;
    }

    public VariableRegistry registry(){
        return this.registry;
    }

    public int variable(Proposition proposition){
        return this.registry.allocate(proposition);
    }

    public CnfBuilder add(int... literals){
        this.clauses.add(Clause.of(literals));
        return this;
    }

    public CnfBuilder add(Clause clause){
        this.clauses.add(clause);
        return this;
    }

    /**
     * Adds the empty clause, which no assignment satisfies.
     */
    public CnfBuilder contradiction(){
        this.clauses.add(Clause.contradiction());
        return this;
    }

    public CnfBuilder atLeastOne(int[] literals){
        if (literals.length == 0){
            return contradiction();
        }
        return add(literals);
    }

    /**
     * Pairwise encoding, n(n-1)/2 binary clauses and no auxiliary variables.
     */
    public CnfBuilder atMostOne(int[] literals){
        for (int i = 0; i < literals.length; i++){
            for (int j = i + 1; j < literals.length; j++){
                add(-literals[i], -literals[j]);
            }
        }
        return this;
    }

    public CnfBuilder exactlyOne(int[] literals){
        atLeastOne(literals);
        return atMostOne(literals);
    }

    /**
     * Fresh id for a group of auxiliary counter propositions, unique within this session.
     */
    int nextCounterGroup(){
        return ++this.counterGroups;
    }

    public int countClauses(){
        return this.clauses.size();
    }

    public CnfFormula build(){
        return new CnfFormula(this.clauses, this.registry.size(), this.registry);
    }
}
