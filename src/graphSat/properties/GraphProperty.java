/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat.properties;

import graphSat.graphs.Graph;
import graphSat.graphs.InvalidGraphException;

/**
 * A property of a graph together with its parameters, e.g. "3-colourable" or "has an independent set of size 4".
 *
 * @param <S> the kind of witness a satisfying assignment decodes to
 */
public abstract class GraphProperty<S extends Solution> {

    public abstract PropertyKind kind();

    /**
     * Checks the preconditions this property puts on the graph.
     *
     * @throws InvalidGraphException if the request is malformed for this graph
     */
    public abstract void validate(Graph graph);

    /**
     * Checks a witness directly against the graph, without going through any encoding.
     */
    public abstract boolean isWitness(Graph graph, S solution);

}
