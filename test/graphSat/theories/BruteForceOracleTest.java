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

import graphSat.encoding.CnfFormula;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.*;

public class BruteForceOracleTest {

    @Test
    public void returnsATotalModel() throws OracleException {
        Outcome outcome = new BruteForceOracle().solve(CnfFormula.of(new int[]{-1}, new int[]{3}));
        assertTrue(outcome.isSatisfiable());
        Model model = outcome.model();
        assertEquals(3, model.size());
        assertFalse(model.isTrue(1));
        assertTrue(model.isTrue(3));
        assertTrue(model.isAssigned(2));
    }

    @Test
    public void refusesLargeFormulas() {
        BruteForceOracle oracle = new BruteForceOracle(4);
        OracleException e = assertThrows(OracleException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                oracle.solve(CnfFormula.of(new int[]{1, 5}));
            }
        });
        assertTrue(e.getMessage().contains("5 variables"));
    }

    @Test
    public void unsatisfiable() throws OracleException {
        assertFalse(new BruteForceOracle().solve(CnfFormula.of(new int[]{1, 2}, new int[]{-1}, new int[]{-2})).isSatisfiable());
    }

    @Test
    public void outcomeOfUnsatHasNoModel() {
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Outcome.unsatisfiable().model();
            }
        });
    }
}
