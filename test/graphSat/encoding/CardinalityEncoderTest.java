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

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class CardinalityEncoderTest {

    @Test
    public void schemeDependsOnSizeRegime() {
        CardinalityEncoder encoder = new CardinalityEncoder(10);
        assertEquals(CardinalityEncoder.Scheme.TRIVIAL, encoder.atLeastScheme(0, 5));
        assertEquals(CardinalityEncoder.Scheme.CONTRADICTION, encoder.atLeastScheme(6, 5));
        assertEquals(CardinalityEncoder.Scheme.SINGLE_CLAUSE, encoder.atLeastScheme(1, 5));
        // C(5,1) = 5 clauses
        assertEquals(CardinalityEncoder.Scheme.DIRECT, encoder.atLeastScheme(5, 5));
        // C(5,3) = 10 clauses
        assertEquals(CardinalityEncoder.Scheme.DIRECT, encoder.atLeastScheme(3, 5));
        // C(6,4) = 15 clauses
        assertEquals(CardinalityEncoder.Scheme.SEQUENTIAL_COUNTER, encoder.atLeastScheme(3, 6));
        assertEquals(CardinalityEncoder.Scheme.TRIVIAL, encoder.atMostScheme(5, 5));
        assertEquals(CardinalityEncoder.Scheme.SEQUENTIAL_COUNTER, encoder.atMostScheme(2, 6));
    }

    @Test
    public void binomialSaturates() {
        assertEquals(10, CardinalityEncoder.binomial(5, 2));
        assertEquals(1, CardinalityEncoder.binomial(7, 0));
        assertEquals(0, CardinalityEncoder.binomial(3, 4));
        assertEquals(Long.MAX_VALUE, CardinalityEncoder.binomial(200, 100));
    }

    @Test
    public void directAtLeastUsesNoAuxiliaryVariables() {
        CnfBuilder cnf = new CnfBuilder();
        int[] xs = members(cnf, 5);
        new CardinalityEncoder().atLeast(cnf, 3, xs);
        assertEquals(5, cnf.registry().size());
        assertEquals(10, cnf.countClauses());
    }

    @Test
    public void counterClauseCountIsLinearInNTimesBound() {
        CnfBuilder cnf = new CnfBuilder();
        int[] xs = members(cnf, 20);
        new CardinalityEncoder(0).atMost(cnf, 3, xs);
        assertEquals(20 + 19 * 3, cnf.registry().size());
        assertTrue(cnf.countClauses() <= 2 * 20 * 3 + 20);
    }

    @Test
    public void atLeastAcceptsExactlyTheLargeEnoughSubsets() {
        int n = 4;
        for (int limit : new int[]{0, 1000}){
            for (int k = 0; k <= n + 1; k++){
                CnfBuilder cnf = new CnfBuilder();
                int[] xs = members(cnf, n);
                new CardinalityEncoder(limit).atLeast(cnf, k, xs);
                Set<Integer> expected = new HashSet<Integer>();
                for (int mask = 0; mask < (1 << n); mask++){
                    if (Integer.bitCount(mask) >= k){
                        expected.add(mask);
                    }
                }
                assertEquals(expected, projections(cnf.build(), n), "k=" + k + ", limit=" + limit);
            }
        }
    }

    @Test
    public void atMostAcceptsExactlyTheSmallEnoughSubsets() {
        int n = 4;
        for (int limit : new int[]{0, 1000}){
            for (int m = 0; m <= n; m++){
                CnfBuilder cnf = new CnfBuilder();
                int[] xs = members(cnf, n);
                new CardinalityEncoder(limit).atMost(cnf, m, xs);
                Set<Integer> expected = new HashSet<Integer>();
                for (int mask = 0; mask < (1 << n); mask++){
                    if (Integer.bitCount(mask) <= m){
                        expected.add(mask);
                    }
                }
                assertEquals(expected, projections(cnf.build(), n), "m=" + m + ", limit=" + limit);
            }
        }
    }

    private static int[] members(CnfBuilder cnf, int n){
        int[] xs = new int[n];
        for (int i = 0; i < n; i++){
            xs[i] = cnf.variable(Proposition.member(i + 1));
        }
        return xs;
    }

    // bitmasks over variables 1..n of all satisfying assignments, auxiliary variables projected away
    private static Set<Integer> projections(CnfFormula formula, int n){
        Set<Integer> retVal = new HashSet<Integer>();
        int total = formula.variableCount();
        boolean[] assignment = new boolean[total + 1];
        for (long bits = 0; bits < (1L << total); bits++){
            for (int v = 1; v <= total; v++){
                assignment[v] = ((bits >>> (v - 1)) & 1L) == 1L;
            }
            boolean satisfied = true;
            for (Clause c : formula.clauses()){
                if (!c.isSatisfiedBy(assignment)){
                    satisfied = false;
                    break;
                }
            }
            if (satisfied){
                retVal.add((int)(bits & ((1L << n) - 1)));
            }
        }
        return retVal;
    }
}
