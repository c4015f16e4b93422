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
 * Isomorphism onto a target graph that extends a fixed partial node mapping (possibly empty).
 */
public class Isomorphism extends GraphProperty<NodeMapping> {

    private final Graph target;

    private final SortedMap<Integer, Integer> fixed;

    public Isomorphism(Graph target){
        this(target, Collections.<Integer, Integer>emptyMap());
    }

    public Isomorphism(Graph target, Map<Integer, Integer> partialMapping){
        if (target == null){
            throw new NullPointerException("target");
        }
        this.target = target;
        this.fixed = Collections.unmodifiableSortedMap(new TreeMap<Integer, Integer>(partialMapping));
    }

    @Override
    public PropertyKind kind() {
        return PropertyKind.ISOMORPHISM;
    }

    public Graph target(){
        return this.target;
    }

    public SortedMap<Integer, Integer> partialMapping(){
        return this.fixed;
    }

    @Override
    public void validate(Graph graph) {
        Set<Integer> images = new HashSet<Integer>();
        for (Map.Entry<Integer, Integer> entry : this.fixed.entrySet()){
            if (!graph.containsNode(entry.getKey())){
                throw new InvalidGraphException("Partial mapping names node " + entry.getKey() + " which is not in the graph");
            }
            if (!this.target.containsNode(entry.getValue())){
                throw new InvalidGraphException("Partial mapping names target node " + entry.getValue() + " which is not in the target graph");
            }
            if (!images.add(entry.getValue())){
                throw new InvalidGraphException("Partial mapping sends two nodes to target node " + entry.getValue());
            }
        }
    }

    @Override
    public boolean isWitness(Graph graph, NodeMapping solution) {
        SortedMap<Integer, Integer> m = solution.mapping();
        if (!m.keySet().equals(graph.nodes()) || graph.countNodes() != this.target.countNodes()){
            return false;
        }
        if (!new HashSet<Integer>(m.values()).equals(this.target.nodes())){
            return false;
        }
        for (Map.Entry<Integer, Integer> entry : this.fixed.entrySet()){
            if (!entry.getValue().equals(m.get(entry.getKey()))){
                return false;
            }
        }
        for (int u : graph.nodes()){
            for (int v : graph.nodes()){
                if (u < v && graph.adjacent(u, v) != this.target.adjacent(m.get(u), m.get(v))){
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public String toString(){
        return "isomorphic to " + this.target + (this.fixed.isEmpty() ? "" : " fixing " + this.fixed);
    }
}
