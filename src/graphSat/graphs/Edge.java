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

/**
 * Unordered pair of distinct nodes. The smaller id is always stored first, so (u,v) and (v,u) are equal.
 */
public final class Edge implements Comparable<Edge> {

    private final int first;

    private final int second;

    public Edge(int u, int v){
        if (u == v){
            throw new InvalidGraphException("Self-loops are not allowed: (" + u + "," + v + ")");
        }
        this.first = Math.min(u, v);
        this.second = Math.max(u, v);
    }

    public int first(){
        return this.first;
    }

    public int second(){
        return this.second;
    }

    public boolean isIncidentTo(int node){
        return this.first == node || this.second == node;
    }

    public int other(int node){
        if (node == this.first){
            return this.second;
        } else if (node == this.second){
            return this.first;
        }
        throw new IllegalArgumentException("Node " + node + " is not an endpoint of " + this);
    }

    @Override
    public int compareTo(Edge o) {
        if (this.first != o.first){
            return Integer.compare(this.first, o.first);
        }
        return Integer.compare(this.second, o.second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge edge = (Edge) o;
        return first == edge.first && second == edge.second;
    }

    @Override
    public int hashCode() {
        return 31 * first + second;
    }

    @Override
    public String toString(){
        return "(" + first + "," + second + ")";
    }
}
