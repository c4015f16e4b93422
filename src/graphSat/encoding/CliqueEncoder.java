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
import graphSat.properties.Clique;
import graphSat.properties.NodeSubset;
import graphSat.properties.PropertyKind;
import graphSat.theories.Model;

import java.util.*;

/**
 * member(v) per node; -member(u) | -member(v) per non-adjacent pair; at least k members.
 */
public class CliqueEncoder extends PropertyEncoder<Clique, NodeSubset> {

    private final CardinalityEncoder cardinality;

    public CliqueEncoder(CardinalityEncoder cardinality){
        this.cardinality = cardinality;
    }

    @Override
    public PropertyKind kind() {
        return PropertyKind.CLIQUE;
    }

    @Override
    public Class<Clique> propertyType() {
        return Clique.class;
    }

    @Override
    public void encode(Graph graph, Clique property, CnfBuilder cnf) {
        int[] members = Subsets.memberVariables(graph, cnf);
        List<Integer> nodes = new ArrayList<Integer>(graph.nodes());
        for (int i = 0; i < nodes.size(); i++){
            for (int j = i + 1; j < nodes.size(); j++){
                if (!graph.adjacent(nodes.get(i), nodes.get(j))){
                    cnf.add(-members[i], -members[j]);
                }
            }
        }
        this.cardinality.atLeast(cnf, property.minSize(), members);
    }

    @Override
    public NodeSubset decode(Graph graph, Clique property, VariableRegistry registry, Model model) {
        return Subsets.decode(PropertyKind.CLIQUE, graph, registry, model);
    }
}
