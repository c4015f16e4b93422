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
 * Assignment of a colour in 0..k-1 to every node.
 */
public final class Coloring implements Solution {

    private final SortedMap<Integer, Integer> colors;

    public Coloring(Map<Integer, Integer> colors){
        this.colors = Collections.unmodifiableSortedMap(new TreeMap<Integer, Integer>(colors));
    }

    @Override
    public PropertyKind kind() {
        return PropertyKind.COLORING;
    }

    public SortedMap<Integer, Integer> colors(){
        return this.colors;
    }

    /**
     * Colour of the node, or -1 if the node is not coloured.
     */
    public int colorOf(int node){
        Integer c = this.colors.get(node);
        return c == null ? -1 : c;
    }

    public int countColorsUsed(){
        return new HashSet<Integer>(this.colors.values()).size();
    }

    /**
     * The same partition of nodes with colours renumbered by first use in ascending node order. Two colourings that
     * differ only by a permutation of colours have equal canonical forms.
     */
    public Coloring canonical(){
        Map<Integer, Integer> renaming = new HashMap<Integer, Integer>();
        Map<Integer, Integer> canonical = new TreeMap<Integer, Integer>();
        for (Map.Entry<Integer, Integer> entry : this.colors.entrySet()){
            Integer renamed = renaming.get(entry.getValue());
            if (renamed == null){
                renaming.put(entry.getValue(), renamed = renaming.size());
            }
            canonical.put(entry.getKey(), renamed);
        }
        return new Coloring(canonical);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coloring)) return false;
        return colors.equals(((Coloring) o).colors);
    }

    @Override
    public int hashCode() {
        return colors.hashCode();
    }

    @Override
    public String toString(){
        return "Coloring" + colors;
    }
}
