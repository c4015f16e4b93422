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

import java.util.*;

/**
 * Bijection from the nodes of a graph to the nodes of a target graph.
 */
public final class NodeMapping implements Solution {

    private final SortedMap<Integer, Integer> mapping;

    public NodeMapping(Map<Integer, Integer> mapping){
        this.mapping = Collections.unmodifiableSortedMap(new TreeMap<Integer, Integer>(mapping));
    }

    @Override
    public PropertyKind kind() {
        return PropertyKind.ISOMORPHISM;
    }

    public SortedMap<Integer, Integer> mapping(){
        return this.mapping;
    }

    /**
     * Image of the node, or -1 if the node is not mapped.
     */
    public int imageOf(int node){
        Integer t = this.mapping.get(node);
        return t == null ? -1 : t;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeMapping)) return false;
        return mapping.equals(((NodeMapping) o).mapping);
    }

    @Override
    public int hashCode() {
        return mapping.hashCode();
    }

    @Override
    public String toString(){
        return "NodeMapping" + mapping;
    }
}
