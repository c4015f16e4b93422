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
import graphSat.properties.PropertyKind;
import graphSat.properties.Solution;
import graphSat.theories.Model;

/**
 * Clause recipe for one property kind, together with the way back from a model to a witness.
 * Every model of the clauses must decode to a witness, and every witness must be reachable from some model.
 */
public abstract class PropertyEncoder<P extends GraphProperty<S>, S extends Solution> {

    public abstract PropertyKind kind();

    public abstract Class<P> propertyType();

    /**
     * Adds the clauses of the property. The property has already been validated against the graph.
     */
    public abstract void encode(Graph graph, P property, CnfBuilder cnf);

    public abstract S decode(Graph graph, P property, VariableRegistry registry, Model model);

}
