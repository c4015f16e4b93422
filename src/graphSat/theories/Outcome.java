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

/**
 * Answer of an oracle: satisfiable with a model, or unsatisfiable.
 */
public final class Outcome {

    private static final Outcome UNSATISFIABLE = new Outcome(null);

    private final Model model;

    private Outcome(Model model){
        this.model = model;
    }

    public static Outcome satisfiable(Model model){
        if (model == null){
            throw new NullPointerException("model");
        }
        return new Outcome(model);
    }

    public static Outcome unsatisfiable(){
        return UNSATISFIABLE;
    }

    public boolean isSatisfiable(){
        return this.model != null;
    }

    /**
     * @throws IllegalStateException if the outcome is unsatisfiable
     */
    public Model model(){
        if (this.model == null){
            throw new IllegalStateException("An unsatisfiable outcome has no model");
        }
        return this.model;
    }

    @Override
    public String toString(){
        return this.model == null ? "UNSAT" : "SAT " + this.model;
    }
}
