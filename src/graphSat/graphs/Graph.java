/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat.graphs;

import java.util.*;

/**
 * Immutable simple graph over positive integer node ids. Edges are unordered, duplicates are collapsed
 * and self-loops are rejected. Nodes and edges may carry string attributes.
 *
 * Iteration order of nodes and edges is ascending, which keeps variable numbering deterministic.
 */
public class Graph {

    private final SortedSet<Integer> nodes;

    private final SortedSet<Edge> edges;

    private final Map<Integer, Set<Integer>> neighbours;

    private final Map<Integer, Map<String, String>> nodeAttributes;

    private final Map<Edge, Map<String, String>> edgeAttributes;

    private Graph(Builder builder){
        this.nodes = Collections.unmodifiableSortedSet(new TreeSet<Integer>(builder.nodes));
        this.edges = Collections.unmodifiableSortedSet(new TreeSet<Edge>(builder.edges));
        Map<Integer, Set<Integer>> adjacency = new HashMap<Integer, Set<Integer>>();
        for (Integer node : this.nodes){
            adjacency.put(node, new TreeSet<Integer>());
        }
        for (Edge e : this.edges){
            adjacency.get(e.first()).add(e.second());
            adjacency.get(e.second()).add(e.first());
        }
        for (Map.Entry<Integer, Set<Integer>> entry : adjacency.entrySet()){
            entry.setValue(Collections.unmodifiableSet(entry.getValue()));
        }
        this.neighbours = adjacency;
        this.nodeAttributes = copyAttributes(builder.nodeAttributes);
        this.edgeAttributes = copyAttributes(builder.edgeAttributes);
    }

    private static <K> Map<K, Map<String, String>> copyAttributes(Map<K, Map<String, String>> attributes){
        Map<K, Map<String, String>> retVal = new HashMap<K, Map<String, String>>();
        for (Map.Entry<K, Map<String, String>> entry : attributes.entrySet()){
            retVal.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<String, String>(entry.getValue())));
        }
        return retVal;
    }

    /**
     * Builds a graph from edge arrays. A one-element array declares an isolated node, a two-element array an edge.
     *
     * @throws InvalidGraphException if a node is declared isolated and also appears in an edge
     */
    public static Graph fromEdges(int[]... edges){
        Builder builder = builder();
        Set<Integer> isolated = new TreeSet<Integer>();
        Set<Integer> endpoints = new TreeSet<Integer>();
        for (int[] e : edges){
            if (e.length == 1){
                builder.addNode(e[0]);
                isolated.add(e[0]);
            } else if (e.length == 2){
                builder.addEdge(e[0], e[1]);
                endpoints.add(e[0]);
                endpoints.add(e[1]);
            } else {
                throw new InvalidGraphException("Edges must have one or two endpoints, found " + Arrays.toString(e));
            }
        }
        isolated.retainAll(endpoints);
        if (!isolated.isEmpty()){
            throw new InvalidGraphException("Nodes " + isolated + " are declared isolated but appear in an edge");
        }
        return builder.build();
    }

    public static Builder builder(){
        return new Builder();
    }

    public SortedSet<Integer> nodes(){
        return this.nodes;
    }

    public SortedSet<Edge> edges(){
        return this.edges;
    }

    public int countNodes(){
        return this.nodes.size();
    }

    public int countEdges(){
        return this.edges.size();
    }

    public boolean containsNode(int node){
        return this.nodes.contains(node);
    }

    public boolean adjacent(int u, int v){
        Set<Integer> n = this.neighbours.get(u);
        return n != null && n.contains(v);
    }

    public Set<Integer> neighbours(int node){
        Set<Integer> n = this.neighbours.get(node);
        if (n == null){
            throw new IllegalArgumentException("Unknown node " + node);
        }
        return n;
    }

    public Map<String, String> nodeAttributes(int node){
        Map<String, String> attributes = this.nodeAttributes.get(node);
        return attributes == null ? Collections.<String, String>emptyMap() : attributes;
    }

    public Map<String, String> edgeAttributes(Edge edge){
        Map<String, String> attributes = this.edgeAttributes.get(edge);
        return attributes == null ? Collections.<String, String>emptyMap() : attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Graph)) return false;
        Graph graph = (Graph) o;
        return nodes.equals(graph.nodes) && edges.equals(graph.edges);
    }

    @Override
    public int hashCode() {
        return 31 * nodes.hashCode() + edges.hashCode();
    }

    @Override
    public String toString(){
        StringBuilder sb = new StringBuilder("Graph{nodes=").append(nodes).append(", edges=");
        for (Edge e : edges){
            sb.append(e);
        }
        return sb.append("}").toString();
    }

    public static class Builder {

        private final Set<Integer> nodes = new TreeSet<Integer>();

        private final Set<Edge> edges = new TreeSet<Edge>();

        private final Map<Integer, Map<String, String>> nodeAttributes = new HashMap<Integer, Map<String, String>>();

        private final Map<Edge, Map<String, String>> edgeAttributes = new HashMap<Edge, Map<String, String>>();

        private Builder(){}

        public Builder addNode(int node){
            if (node <= 0){
                throw new InvalidGraphException("Nodes must be positive integers, found " + node);
            }
            this.nodes.add(node);
            return this;
        }

        public Builder addNodes(int... nodes){
            for (int node : nodes){
                addNode(node);
            }
            return this;
        }

        /**
         * Adds an edge together with its endpoints.
         */
        public Builder addEdge(int u, int v){
            Edge e = new Edge(u, v);
            addNode(u);
            addNode(v);
            this.edges.add(e);
            return this;
        }

        /**
         * Adds an edge whose endpoints must already have been added.
         */
        public Builder addEdge(Edge e){
            if (!this.nodes.contains(e.first()) || !this.nodes.contains(e.second())){
                throw new InvalidGraphException("Edge " + e + " references a node outside the node set " + this.nodes);
            }
            this.edges.add(e);
            return this;
        }

        public Builder setNodeAttribute(int node, String key, String value){
            if (!this.nodes.contains(node)){
                throw new InvalidGraphException("Cannot attach an attribute to unknown node " + node);
            }
            Map<String, String> attributes = this.nodeAttributes.get(node);
            if (attributes == null){
                this.nodeAttributes.put(node, attributes = new LinkedHashMap<String, String>());
            }
            attributes.put(key, value);
            return this;
        }

        public Builder setEdgeAttribute(int u, int v, String key, String value){
            Edge e = new Edge(u, v);
            if (!this.edges.contains(e)){
                throw new InvalidGraphException("Cannot attach an attribute to unknown edge " + e);
            }
            Map<String, String> attributes = this.edgeAttributes.get(e);
            if (attributes == null){
                this.edgeAttributes.put(e, attributes = new LinkedHashMap<String, String>());
            }
            attributes.put(key, value);
            return this;
        }

        public Graph build(){
            return new Graph(this);
        }
    }
}
