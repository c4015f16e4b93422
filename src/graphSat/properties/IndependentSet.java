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

import graphSat.graphs.Edge;
import graphSat.graphs.Graph;
import graphSat.graphs.InvalidGraphException;

/**
 * A set of at least {@code minSize} pairwise non-adjacent nodes. Every such set is a distinct witness, not only the
 * ones of size exactly {@code minSize}.
 */
public class IndependentSet extends GraphProperty<NodeSubset> {

    private final int minSize;

    public IndependentSet(int minSize){
        this.minSize = minSize;
    }

    @Override
    public PropertyKind kind() {
        return PropertyKind.INDEPENDENT_SET;
    }

    public int minSize(){
        return this.minSize;
    }

    @Override
    public void validate(Graph graph) {
        if (this.minSize < 0){
            throw new InvalidGraphException("Minimum independent set size must be non-negative, got " + this.minSize);
        }
    }

    @Override
    public boolean isWitness(Graph graph, NodeSubset solution) {
        if (solution.size() < this.minSize || !graph.nodes().containsAll(solution.nodes())){
            return false;
        }
        for (Edge e : graph.edges()){
            if (solution.contains(e.first()) && solution.contains(e.second())){
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString(){
        return "independent set of size >= " + this.minSize;
    }
}
