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

import graphSat.graphs.Graph;
import graphSat.properties.GraphProperty;
import graphSat.properties.Solution;
import graphSat.theories.Model;

/**
 * Result of encoding one property on one graph: the base formula, the variables that distinguish witnesses from
 * each other, and the decoder back to graph level.
 */
public class Encoding<S extends Solution> {

    private final Graph graph;

    private final GraphProperty<S> property;

    private final PropertyEncoder<GraphProperty<S>, S> encoder;

    private final CnfFormula formula;

    private final int[] relevantVariables;

    Encoding(Graph graph, GraphProperty<S> property, PropertyEncoder<GraphProperty<S>, S> encoder, CnfFormula formula){
        this.graph = graph;
        this.property = property;
        this.encoder = encoder;
        this.formula = formula;
        this.relevantVariables = formula.registry().relevantVariables();
    }

    public Graph graph(){
        return this.graph;
    }

    public GraphProperty<S> property(){
        return this.property;
    }

    public CnfFormula formula(){
        return this.formula;
    }

    public VariableRegistry registry(){
        return this.formula.registry();
    }

    /**
     * Ids of the non-auxiliary variables, ascending. Two models that agree on them decode to the same witness.
     */
    public int[] relevantVariables(){
        return this.relevantVariables.clone();
    }

    public S decode(Model model){
        return this.encoder.decode(this.graph, this.property, this.formula.registry(), model);
    }

    /**
     * Clause that is false exactly on the assignments agreeing with the model on every relevant variable.
     * Relevant variables the model leaves unassigned are read as false, consistently with {@link #decode(Model)}.
     * With no relevant variables this is the empty clause.
     */
    public Clause blockingClause(Model model){
        if (this.relevantVariables.length == 0){
            return Clause.contradiction();
        }
        int[] literals = new int[this.relevantVariables.length];
        for (int i = 0; i < literals.length; i++){
            int v = this.relevantVariables[i];
            literals[i] = model.isTrue(v) ? -v : v;
        }
        return Clause.of(literals);
    }
}
