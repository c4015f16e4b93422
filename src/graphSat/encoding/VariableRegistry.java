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
 * Bijection between propositions and DIMACS variable ids. Ids are handed out from 1 upwards in order of first
 * allocation and are never reused or rebound. One registry belongs to exactly one encoding session, it is not
 * thread-safe and must not be shared.
 */
public class VariableRegistry {

    private final Map<Proposition, Integer> propositionToVariable = new HashMap<Proposition, Integer>();

    // index i holds the proposition of variable i+1
    private final List<Proposition> variableToProposition = new ArrayList<Proposition>();

    /**
     * Returns the id of the proposition, allocating the next free id on first use.
     */
    public int allocate(Proposition proposition){
        Integer variable = this.propositionToVariable.get(proposition);
        if (variable == null){
            this.variableToProposition.add(proposition);
            variable = this.variableToProposition.size();
            this.propositionToVariable.put(proposition, variable);
        }
        return variable;
    }

    /**
     * @throws UnknownVariableException if the id was never allocated
     */
    public Proposition lookup(int variable){
        if (variable <= 0 || variable > this.variableToProposition.size()){
            throw new UnknownVariableException(variable);
        }
        return this.variableToProposition.get(variable - 1);
    }

    /**
     * Id of an already allocated proposition, or 0 if there is none.
     */
    public int find(Proposition proposition){
        Integer variable = this.propositionToVariable.get(proposition);
        return variable == null ? 0 : variable;
    }

    public boolean contains(Proposition proposition){
        return this.propositionToVariable.containsKey(proposition);
    }

    public int size(){
        return this.variableToProposition.size();
    }

    /**
     * Ids of all non-auxiliary propositions, ascending.
     */
    public int[] relevantVariables(){
        int count = 0;
        for (Proposition p : this.variableToProposition){
            if (!p.isAuxiliary()){
                count++;
            }
        }
        int[] retVal = new int[count];
        int i = 0;
        for (int variable = 1; variable <= this.variableToProposition.size(); variable++){
            if (!this.variableToProposition.get(variable - 1).isAuxiliary()){
                retVal[i++] = variable;
            }
        }
        return retVal;
    }
}
