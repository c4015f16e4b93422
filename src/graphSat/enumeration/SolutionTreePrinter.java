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

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Indented text rendering of a tree or a grouped view, for debugging.
 */
public class SolutionTreePrinter {

    private final String indent;

    public SolutionTreePrinter(){
        this("  ");
    }

    public SolutionTreePrinter(String indent){
        this.indent = indent;
    }

    public void print(Iterable<? extends TreeEntry<?>> entries, Writer out) throws IOException {
        out.write("*\n");
        for (TreeEntry<?> entry : entries){
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < entry.depth(); i++){
                sb.append(this.indent);
            }
            if (entry.isGroup()){
                sb.append("[").append(entry.label()).append("]");
            } else {
                sb.append(entry.stepIndex()).append(": ").append(entry.label());
            }
            out.write(sb.append('\n').toString());
        }
        out.flush();
    }

    public String toString(Iterable<? extends TreeEntry<?>> entries){
        StringWriter sw = new StringWriter();
        try {
            print(entries, sw);
        } catch (IOException e){
            throw new IllegalStateException(e);
        }
        return sw.toString();
    }
}
