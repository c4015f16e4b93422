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

import java.util.*;

/**
 * A set of at least {@code minSize} pairwise adjacent nodes.
 */
public class Clique extends GraphProperty<NodeSubset> {

    private final int minSize;

    public Clique(int minSize){
        this.minSize = minSize;
    }

    @Override
    public PropertyKind kind() {
        return PropertyKind.CLIQUE;
    }

    public int minSize(){
        return this.minSize;
    }

    @Override
    public void validate(Graph graph) {
        if (this.minSize < 0){
            throw new InvalidGraphException("Minimum clique size must be non-negative, got " + this.minSize);
        }
    }

    @Override
    public boolean isWitness(Graph graph, NodeSubset solution) {
        if (solution.size() < this.minSize || !graph.nodes().containsAll(solution.nodes())){
            return false;
        }
        List<Integer> nodes = new ArrayList<Integer>(solution.nodes());
        for (int i = 0; i < nodes.size(); i++){
            for (int j = i + 1; j < nodes.size(); j++){
                if (!graph.adjacent(nodes.get(i), nodes.get(j))){
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public String toString(){
        return "clique of size >= " + this.minSize;
    }
}
