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
 * Small factory of named graphs.
 */
public class Graphs {

    private Graphs(){}

    /**
     * Cycle 1-2-...-n-1.
     */
    public static Graph cycle(int n){
        if (n < 3){
            throw new InvalidGraphException("A cycle needs at least 3 nodes, got " + n);
        }
        Graph.Builder builder = Graph.builder();
        for (int i = 1; i <= n; i++){
            builder.addEdge(i, i % n + 1);
        }
        return builder.build();
    }

    public static Graph path(int n){
        if (n < 1){
            throw new InvalidGraphException("A path needs at least 1 node, got " + n);
        }
        Graph.Builder builder = Graph.builder().addNode(1);
        for (int i = 1; i < n; i++){
            builder.addEdge(i, i + 1);
        }
        return builder.build();
    }

    public static Graph complete(int n){
        Graph.Builder builder = Graph.builder();
        for (int i = 1; i <= n; i++){
            builder.addNode(i);
            for (int j = i + 1; j <= n; j++){
                builder.addEdge(i, j);
            }
        }
        return builder.build();
    }

    public static Graph empty(int n){
        Graph.Builder builder = Graph.builder();
        for (int i = 1; i <= n; i++){
            builder.addNode(i);
        }
        return builder.build();
    }
}
