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
 * A Boolean statement about a graph, keyed by its kind and a tuple of integers
 * (node id, colour, target node, counter position...).
 */
public final class Proposition {

    public enum Kind {
        /** node, colour: "node takes colour" */
        COLOR(false),
        /** node: "node belongs to the selected subset" */
        MEMBER(false),
        /** node, target node: "node is mapped to target node" */
        MAPS_TO(false),
        /** counter group, position, count: sequential counter register bit */
        COUNTER(true);

        private final boolean auxiliary;

        Kind(boolean auxiliary){
            this.auxiliary = auxiliary;
        }

        public boolean isAuxiliary(){
            return this.auxiliary;
        }
    }

    private final Kind kind;

    private final int[] key;

    private final int hashCode;

    private Proposition(Kind kind, int[] key){
        this.kind = kind;
        this.key = key;
        this.hashCode = 31 * kind.hashCode() + Arrays.hashCode(key);
    }

    public static Proposition of(Kind kind, int... key){
        if (kind == null){
            throw new NullPointerException("kind");
        }
        return new Proposition(kind, key.clone());
    }

    public static Proposition color(int node, int color){
        return new Proposition(Kind.COLOR, new int[]{node, color});
    }

    public static Proposition member(int node){
        return new Proposition(Kind.MEMBER, new int[]{node});
    }

    public static Proposition mapsTo(int node, int target){
        return new Proposition(Kind.MAPS_TO, new int[]{node, target});
    }

    public static Proposition counter(int group, int position, int count){
        return new Proposition(Kind.COUNTER, new int[]{group, position, count});
    }

    public Kind kind(){
        return this.kind;
    }

    public int get(int i){
        return this.key[i];
    }

    public int arity(){
        return this.key.length;
    }

    public boolean isAuxiliary(){
        return this.kind.isAuxiliary();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Proposition)) return false;
        Proposition that = (Proposition) o;
        return this.hashCode == that.hashCode && this.kind == that.kind && Arrays.equals(this.key, that.key);
    }

    @Override
    public int hashCode() {
        return this.hashCode;
    }

    @Override
    public String toString(){
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase()).append("(");
        for (int i = 0; i < key.length; i++){
            if (i > 0){
                sb.append(",");
            }
            sb.append(key[i]);
        }
        return sb.append(")").toString();
    }
}
