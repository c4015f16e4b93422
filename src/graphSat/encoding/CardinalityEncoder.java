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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Cardinality constraints over literals.
 *
 * <p>{@code atLeast(k, x1..xn)} picks one of two schemes:</p>
 * <ul>
 *     <li>direct enumeration, when C(n, n-k+1) does not exceed {@link #getDirectLimit()}: one clause per subset of
 *     n-k+1 literals, no auxiliary variables;</li>
 *     <li>otherwise Sinz's sequential counter over the negated literals, i.e. {@code atMost(n-k, -x1..-xn)}, with
 *     O(n(n-k)) clauses and (n-1)(n-k) auxiliary {@link Proposition.Kind#COUNTER} variables.</li>
 * </ul>
 * {@code atMost} uses the same rule with C(n, m+1).
 */
public class CardinalityEncoder {

    public enum Scheme {
        TRIVIAL, CONTRADICTION, SINGLE_CLAUSE, DIRECT, SEQUENTIAL_COUNTER
    }

    public final static int DEFAULT_DIRECT_LIMIT = 256;

    private static final Logger log = LogManager.getFormatterLogger();

    private int directLimit = DEFAULT_DIRECT_LIMIT;

    public CardinalityEncoder(){
    }

    public CardinalityEncoder(int directLimit){
        setDirectLimit(directLimit);
    }

    public Scheme atLeastScheme(int k, int n){
        if (k <= 0){
            return Scheme.TRIVIAL;
        } else if (k > n){
            return Scheme.CONTRADICTION;
        } else if (k == 1){
            return Scheme.SINGLE_CLAUSE;
        } else if (binomial(n, n - k + 1) <= this.directLimit){
            return Scheme.DIRECT;
        }
        return Scheme.SEQUENTIAL_COUNTER;
    }

    public Scheme atMostScheme(int m, int n){
        if (m >= n){
            return Scheme.TRIVIAL;
        } else if (m < 0){
            return Scheme.CONTRADICTION;
        } else if (binomial(n, m + 1) <= this.directLimit){
            return Scheme.DIRECT;
        }
        return Scheme.SEQUENTIAL_COUNTER;
    }

    /**
     * At least k of the literals are true.
     */
    public void atLeast(CnfBuilder cnf, int k, int[] literals){
        Scheme scheme = atLeastScheme(k, literals.length);
        log.debug("atLeast(%d of %d) using %s", k, literals.length, scheme);
        switch (scheme){
            case TRIVIAL:
                break;
            case CONTRADICTION:
                cnf.contradiction();
                break;
            case SINGLE_CLAUSE:
                cnf.add(literals);
                break;
            case DIRECT:
                addAllSubsets(cnf, literals, literals.length - k + 1, false);
                break;
            default:
                sequentialCounter(cnf, literals.length - k, negate(literals));
        }
    }

    /**
     * At most m of the literals are true.
     */
    public void atMost(CnfBuilder cnf, int m, int[] literals){
        Scheme scheme = atMostScheme(m, literals.length);
        log.debug("atMost(%d of %d) using %s", m, literals.length, scheme);
        switch (scheme){
            case TRIVIAL:
                break;
            case CONTRADICTION:
                cnf.contradiction();
                break;
            case DIRECT:
                addAllSubsets(cnf, literals, m + 1, true);
                break;
            default:
                sequentialCounter(cnf, m, literals);
        }
    }

    // one clause per subset of the given size; negated subsets forbid all of them being true at once
    private static void addAllSubsets(CnfBuilder cnf, int[] literals, int size, boolean negated){
        int[] indices = new int[size];
        for (int i = 0; i < size; i++){
            indices[i] = i;
        }
        int n = literals.length;
        while (true){
            int[] clause = new int[size];
            for (int i = 0; i < size; i++){
                clause[i] = negated ? -literals[indices[i]] : literals[indices[i]];
            }
            cnf.add(clause);
            int i = size - 1;
            while (i >= 0 && indices[i] == n - size + i){
                i--;
            }
            if (i < 0){
                return;
            }
            indices[i]++;
            for (int j = i + 1; j < size; j++){
                indices[j] = indices[j - 1] + 1;
            }
        }
    }

    // Sinz (2005), LTseq: s(i,j) holds when at least j of the first i literals are true
    private static void sequentialCounter(CnfBuilder cnf, int m, int[] l){
        int n = l.length;
        if (m >= n){
            return;
        }
        if (m == 0){
            for (int x : l){
                cnf.add(-x);
            }
            return;
        }
        int group = cnf.nextCounterGroup();
        int[][] s = new int[n][m + 1];
        for (int i = 1; i < n; i++){
            for (int j = 1; j <= m; j++){
                s[i][j] = cnf.variable(Proposition.counter(group, i, j));
            }
        }
        cnf.add(-l[0], s[1][1]);
        for (int j = 2; j <= m; j++){
            cnf.add(-s[1][j]);
        }
        for (int i = 2; i < n; i++){
            cnf.add(-l[i - 1], s[i][1]);
            cnf.add(-s[i - 1][1], s[i][1]);
            for (int j = 2; j <= m; j++){
                cnf.add(-l[i - 1], -s[i - 1][j - 1], s[i][j]);
                cnf.add(-s[i - 1][j], s[i][j]);
            }
            cnf.add(-l[i - 1], -s[i - 1][m]);
        }
        cnf.add(-l[n - 1], -s[n - 1][m]);
    }

    private static int[] negate(int[] literals){
        int[] retVal = new int[literals.length];
        for (int i = 0; i < literals.length; i++){
            retVal[i] = -literals[i];
        }
        return retVal;
    }

    /**
     * C(n,k), saturating at Long.MAX_VALUE.
     */
    static long binomial(int n, int k){
        if (k < 0 || k > n){
            return 0;
        }
        k = Math.min(k, n - k);
        long retVal = 1;
        for (int i = 1; i <= k; i++){
            long next = retVal * (n - k + i);
            if (next / (n - k + i) != retVal){
                return Long.MAX_VALUE;
            }
            retVal = next / i;
        }
        return retVal;
    }

    public int getDirectLimit() {
        return directLimit;
    }

    public void setDirectLimit(int directLimit) {
        if (directLimit < 0){
            throw new IllegalArgumentException("directLimit must be non-negative, got " + directLimit);
        }
        this.directLimit = directLimit;
    }
}
