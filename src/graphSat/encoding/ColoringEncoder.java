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

import graphSat.graphs.Edge;
import graphSat.graphs.Graph;
import graphSat.properties.Colorability;
import graphSat.properties.Coloring;
import graphSat.properties.PropertyKind;
import graphSat.theories.Model;

import java.util.*;

/**
 * color(v,c) for every node and colour; exactly one colour per node (at-least-one plus pairwise at-most-one);
 * -color(u,c) | -color(v,c) for every edge and colour. With symmetry breaking the i-th node in ascending order is
 * additionally restricted to colours 0..i.
 */
public class ColoringEncoder extends PropertyEncoder<Colorability, Coloring> {

    @Override
    public PropertyKind kind() {
        return PropertyKind.COLORING;
    }

    @Override
    public Class<Colorability> propertyType() {
        return Colorability.class;
    }

    @Override
    public void encode(Graph graph, Colorability property, CnfBuilder cnf) {
        int k = property.colors();
        for (int node : graph.nodes()){
            int[] colors = new int[k];
            for (int c = 0; c < k; c++){
                colors[c] = cnf.variable(Proposition.color(node, c));
            }
            cnf.exactlyOne(colors);
        }
        for (Edge e : graph.edges()){
            for (int c = 0; c < k; c++){
                cnf.add(-cnf.variable(Proposition.color(e.first(), c)), -cnf.variable(Proposition.color(e.second(), c)));
            }
        }
        if (property.breaksSymmetry()){
            int i = 0;
            for (int node : graph.nodes()){
                for (int c = i + 1; c < k; c++){
                    cnf.add(-cnf.variable(Proposition.color(node, c)));
                }
                i++;
            }
        }
    }

    @Override
    public Coloring decode(Graph graph, Colorability property, VariableRegistry registry, Model model) {
        Map<Integer, Integer> colors = new HashMap<Integer, Integer>();
        for (int node : graph.nodes()){
            for (int c = 0; c < property.colors(); c++){
                int variable = registry.find(Proposition.color(node, c));
                if (variable != 0 && model.isTrue(variable)){
                    colors.put(node, c);
                    break;
                }
            }
        }
        return new Coloring(colors);
    }
}
