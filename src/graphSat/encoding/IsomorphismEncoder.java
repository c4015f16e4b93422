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
import graphSat.properties.Isomorphism;
import graphSat.properties.NodeMapping;
import graphSat.properties.PropertyKind;
import graphSat.theories.Model;

import java.util.*;

/**
 * mapsTo(u,t) for every node u and target node t; exactly one target per node and exactly one node per target;
 * -mapsTo(u,t) | -mapsTo(v,s) whenever u-v and t-s disagree on adjacency; a unit clause per fixed pair.
 * Graphs of different order or size get the empty clause. O(n^4) clauses.
 */
public class IsomorphismEncoder extends PropertyEncoder<Isomorphism, NodeMapping> {

    @Override
    public PropertyKind kind() {
        return PropertyKind.ISOMORPHISM;
    }

    @Override
    public Class<Isomorphism> propertyType() {
        return Isomorphism.class;
    }

    @Override
    public void encode(Graph graph, Isomorphism property, CnfBuilder cnf) {
        Graph target = property.target();
        if (graph.countNodes() != target.countNodes() || graph.countEdges() != target.countEdges()){
            cnf.contradiction();
            return;
        }
        List<Integer> sources = new ArrayList<Integer>(graph.nodes());
        List<Integer> targets = new ArrayList<Integer>(target.nodes());
        int n = sources.size();
        int[][] m = new int[n][n];
        for (int i = 0; i < n; i++){
            for (int j = 0; j < n; j++){
                m[i][j] = cnf.variable(Proposition.mapsTo(sources.get(i), targets.get(j)));
            }
        }
        for (int i = 0; i < n; i++){
            cnf.exactlyOne(m[i]);
        }
        for (int j = 0; j < n; j++){
            int[] column = new int[n];
            for (int i = 0; i < n; i++){
                column[i] = m[i][j];
            }
            cnf.exactlyOne(column);
        }
        for (int u = 0; u < n; u++){
            for (int v = u + 1; v < n; v++){
                boolean sourceEdge = graph.adjacent(sources.get(u), sources.get(v));
                for (int t = 0; t < n; t++){
                    for (int s = 0; s < n; s++){
                        if (t != s && sourceEdge != target.adjacent(targets.get(t), targets.get(s))){
                            cnf.add(-m[u][t], -m[v][s]);
                        }
                    }
                }
            }
        }
        for (Map.Entry<Integer, Integer> entry : property.partialMapping().entrySet()){
            cnf.add(cnf.variable(Proposition.mapsTo(entry.getKey(), entry.getValue())));
        }
    }

    @Override
    public NodeMapping decode(Graph graph, Isomorphism property, VariableRegistry registry, Model model) {
        Map<Integer, Integer> mapping = new HashMap<Integer, Integer>();
        for (int u : graph.nodes()){
            for (int t : property.target().nodes()){
                int variable = registry.find(Proposition.mapsTo(u, t));
                if (variable != 0 && model.isTrue(variable)){
                    mapping.put(u, t);
                    break;
                }
            }
        }
        return new NodeMapping(mapping);
    }
}
