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

import graphSat.graphs.Edge;
import graphSat.graphs.Graph;
import graphSat.graphs.InvalidGraphException;

/**
 * Proper colouring with at most k colours: adjacent nodes never share a colour.
 */
public class Colorability extends GraphProperty<Coloring> {

    private final int colors;

    private final boolean breakSymmetry;

    public Colorability(int colors){
        this(colors, false);
    }

    /**
     * @param breakSymmetry restrict the i-th node (ascending id order) to colours 0..i, which removes part of the
     *                      colour-permutation duplicates from an enumeration
     */
    public Colorability(int colors, boolean breakSymmetry){
        this.colors = colors;
        this.breakSymmetry = breakSymmetry;
    }

    @Override
    public PropertyKind kind() {
        return PropertyKind.COLORING;
    }

    public int colors(){
        return this.colors;
    }

    public boolean breaksSymmetry(){
        return this.breakSymmetry;
    }

    @Override
    public void validate(Graph graph) {
        if (this.colors < 0){
            throw new InvalidGraphException("Number of colours must be non-negative, got " + this.colors);
        }
        if (this.colors == 0 && graph.countNodes() > 0){
            throw new InvalidGraphException("Cannot colour " + graph.countNodes() + " nodes with 0 colours");
        }
    }

    @Override
    public boolean isWitness(Graph graph, Coloring solution) {
        if (!solution.colors().keySet().equals(graph.nodes())){
            return false;
        }
        for (int c : solution.colors().values()){
            if (c < 0 || c >= this.colors){
                return false;
            }
        }
        for (Edge e : graph.edges()){
            if (solution.colorOf(e.first()) == solution.colorOf(e.second())){
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString(){
        return this.colors + "-colorable" + (this.breakSymmetry ? " (symmetry breaking)" : "");
    }
}
