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

import java.util.*;
import java.util.function.Function;

/**
 * Trace of an enumeration: recorded steps kept in an arena, in the order they were found, all children of one root.
 * Only the enumerator appends. Once frozen the tree is read-only. Traversals are lazy and can be restarted; grouped
 * views are computed over the recorded steps and never modify them.
 */
public class SolutionTree<S extends Solution> implements Iterable<TreeEntry<S>> {

    private final List<EnumerationStep<S>> steps = new ArrayList<EnumerationStep<S>>();

    private boolean frozen = false;

    SolutionTree(){
    }

    void append(EnumerationStep<S> step){
        if (this.frozen){
            throw new IllegalStateException("The solution tree is finalized");
        }
        if (step.index() != this.steps.size()){
            throw new IllegalArgumentException("Expected step " + this.steps.size() + ", got " + step.index());
        }
        this.steps.add(step);
    }

    void freeze(){
        this.frozen = true;
    }

    public boolean isFrozen(){
        return this.frozen;
    }

    public int size(){
        return this.steps.size();
    }

    public boolean isEmpty(){
        return this.steps.isEmpty();
    }

    public EnumerationStep<S> step(int index){
        return this.steps.get(index);
    }

    public List<EnumerationStep<S>> steps(){
        return Collections.unmodifiableList(this.steps);
    }

    public List<S> solutions(){
        List<S> retVal = new ArrayList<S>(this.steps.size());
        for (EnumerationStep<S> step : this.steps){
            retVal.add(step.solution());
        }
        return retVal;
    }

    /**
     * Solutions in construction order, each at depth 1.
     */
    @Override
    public Iterator<TreeEntry<S>> iterator() {
        return new Iterator<TreeEntry<S>>() {

            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < steps.size();
            }

            @Override
            public TreeEntry<S> next() {
                if (!hasNext()){
                    throw new NoSuchElementException();
                }
                EnumerationStep<S> step = steps.get(next++);
                return new TreeEntry<S>(1, String.valueOf(step.solution()), step.solution(), step.index());
            }
        };
    }

    /**
     * View with one group node per equivalence class (depth 1, in order of first appearance) and the member
     * solutions below it (depth 2, in construction order).
     */
    public <K> Grouping<K, S> groupBy(Function<? super S, K> equivalence){
        return new Grouping<K, S>(this, equivalence);
    }

    public static class Grouping<K, S extends Solution> implements Iterable<TreeEntry<S>> {

        private final SolutionTree<S> tree;

        private final LinkedHashMap<K, List<Integer>> groups = new LinkedHashMap<K, List<Integer>>();

        private Grouping(SolutionTree<S> tree, Function<? super S, K> equivalence){
            this.tree = tree;
            for (EnumerationStep<S> step : tree.steps){
                K key = equivalence.apply(step.solution());
                List<Integer> members = this.groups.get(key);
                if (members == null){
                    this.groups.put(key, members = new ArrayList<Integer>());
                }
                members.add(step.index());
            }
        }

        public int countGroups(){
            return this.groups.size();
        }

        public Set<K> keys(){
            return Collections.unmodifiableSet(this.groups.keySet());
        }

        public List<S> members(K key){
            List<Integer> indices = this.groups.get(key);
            if (indices == null){
                return Collections.emptyList();
            }
            List<S> retVal = new ArrayList<S>(indices.size());
            for (int i : indices){
                retVal.add(this.tree.step(i).solution());
            }
            return retVal;
        }

        @Override
        public Iterator<TreeEntry<S>> iterator() {
            final List<Map.Entry<K, List<Integer>>> entries = new ArrayList<Map.Entry<K, List<Integer>>>(this.groups.entrySet());
            return new Iterator<TreeEntry<S>>() {

                private int group = 0;

                // -1: the group header comes next
                private int member = -1;

                @Override
                public boolean hasNext() {
                    return group < entries.size();
                }

                @Override
                public TreeEntry<S> next() {
                    if (!hasNext()){
                        throw new NoSuchElementException();
                    }
                    Map.Entry<K, List<Integer>> entry = entries.get(group);
                    TreeEntry<S> retVal;
                    if (member < 0){
                        retVal = new TreeEntry<S>(1, String.valueOf(entry.getKey()), null, -1);
                    } else {
                        EnumerationStep<S> step = tree.step(entry.getValue().get(member));
                        retVal = new TreeEntry<S>(2, String.valueOf(step.solution()), step.solution(), step.index());
                    }
                    member++;
                    if (member >= entry.getValue().size()){
                        group++;
                        member = -1;
                    }
                    return retVal;
                }
            };
        }
    }
}
