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
 * A selected set of nodes, the witness of independent-set and clique properties.
 */
public final class NodeSubset implements Solution {

    private final PropertyKind kind;

    private final SortedSet<Integer> nodes;

    public NodeSubset(PropertyKind kind, Collection<Integer> nodes){
        this.kind = kind;
        this.nodes = Collections.unmodifiableSortedSet(new TreeSet<Integer>(nodes));
    }

    @Override
    public PropertyKind kind() {
        return this.kind;
    }

    public SortedSet<Integer> nodes(){
        return this.nodes;
    }

    public int size(){
        return this.nodes.size();
    }

    public boolean contains(int node){
        return this.nodes.contains(node);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeSubset)) return false;
        NodeSubset that = (NodeSubset) o;
        return kind == that.kind && nodes.equals(that.nodes);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + nodes.hashCode();
    }

    @Override
    public String toString(){
        return kind.name().toLowerCase() + nodes;
    }
}
