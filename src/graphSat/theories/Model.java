/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat.theories;

import java.util.Arrays;

/**
 * Assignment returned by an oracle, as signed DIMACS literals. It may be partial: variables the oracle left out
 * read as unassigned.
 */
public final class Model {

    private final int[] literals;

    // index v: 1 true, -1 false, 0 unassigned
    private final byte[] values;

    public Model(int[] literals){
        int max = 0;
        for (int l : literals){
            if (l == 0){
                throw new IllegalArgumentException("0 is not a literal: " + Arrays.toString(literals));
            }
            max = Math.max(max, Math.abs(l));
        }
        this.literals = literals.clone();
        this.values = new byte[max + 1];
        for (int l : literals){
            this.values[Math.abs(l)] = (byte)(l > 0 ? 1 : -1);
        }
    }

    public boolean isAssigned(int variable){
        return variable < this.values.length && this.values[variable] != 0;
    }

    /**
     * Unassigned variables read as false.
     */
    public boolean isTrue(int variable){
        return variable < this.values.length && this.values[variable] > 0;
    }

    public int[] literals(){
        return this.literals.clone();
    }

    public int size(){
        return this.literals.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Model)) return false;
        return Arrays.equals(values, ((Model) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString(){
        return Arrays.toString(literals);
    }
}
