/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat.enumeration;

import graphSat.properties.Solution;

/**
 * A node visited by a tree traversal. Depth 1 entries are children of the (implicit) root. Group headers carry a
 * label and no solution.
 */
public final class TreeEntry<S extends Solution> {

    private final int depth;

    private final String label;

    private final S solution;

    private final int stepIndex;

    TreeEntry(int depth, String label, S solution, int stepIndex){
        this.depth = depth;
        this.label = label;
        this.solution = solution;
        this.stepIndex = stepIndex;
    }

    public int depth(){
        return this.depth;
    }

    public String label(){
        return this.label;
    }

    /**
     * Null for group headers.
     */
    public S solution(){
        return this.solution;
    }

    public boolean isGroup(){
        return this.solution == null;
    }

    /**
     * Index of the recorded step, -1 for group headers.
     */
    public int stepIndex(){
        return this.stepIndex;
    }

    @Override
    public String toString(){
        return depth + ":" + label;
    }
}
