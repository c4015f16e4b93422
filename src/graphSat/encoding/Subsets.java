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
import graphSat.properties.NodeSubset;
import graphSat.properties.PropertyKind;
import graphSat.theories.Model;

import java.util.*;

/**
 * Shared member(v) handling of the subset properties.
 */
class Subsets {

    private Subsets(){}

    // in ascending node order
    static int[] memberVariables(Graph graph, CnfBuilder cnf){
        int[] retVal = new int[graph.countNodes()];
        int i = 0;
        for (int node : graph.nodes()){
            retVal[i++] = cnf.variable(Proposition.member(node));
        }
        return retVal;
    }

    static NodeSubset decode(PropertyKind kind, Graph graph, VariableRegistry registry, Model model){
        List<Integer> selected = new ArrayList<Integer>();
        for (int node : graph.nodes()){
            int variable = registry.find(Proposition.member(node));
            if (variable != 0 && model.isTrue(variable)){
                selected.add(node);
            }
        }
        return new NodeSubset(kind, selected);
    }
}
