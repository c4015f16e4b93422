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

import java.util.Arrays;

/**
 * Disjunction of DIMACS literals, kept in insertion order. Literal 0 is never allowed. The only empty clause is
 * {@link #contradiction()}, which marks a formula as unsatisfiable outright.
 */
public final class Clause {

    private static final Clause CONTRADICTION = new Clause(new int[0]);

    private final int[] literals;

    private Clause(int[] literals){
        this.literals = literals;
    }

    public static Clause of(int... literals){
        if (literals.length == 0){
            throw new IllegalArgumentException("Use Clause.contradiction() for the empty clause");
        }
        for (int l : literals){
            if (l == 0){
                throw new IllegalArgumentException("0 is not a literal: " + Arrays.toString(literals));
            }
        }
        return new Clause(literals.clone());
    }

    public static Clause contradiction(){
        return CONTRADICTION;
    }

    public boolean isContradiction(){
        return this.literals.length == 0;
    }

    public int size(){
        return this.literals.length;
    }

    public int get(int i){
        return this.literals[i];
    }

    public int[] literals(){
        return this.literals.clone();
    }

    public int maxVariable(){
        int max = 0;
        for (int l : this.literals){
            max = Math.max(max, Math.abs(l));
        }
        return max;
    }

    /**
     * True if some literal is satisfied by the assignment, where assignment[v] is the value of variable v.
     */
    public boolean isSatisfiedBy(boolean[] assignment){
        for (int l : this.literals){
            if (l > 0 ? assignment[l] : !assignment[-l]){
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clause)) return false;
        return Arrays.equals(literals, ((Clause) o).literals);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(literals);
    }

    @Override
    public String toString(){
        return Arrays.toString(literals);
    }
}
