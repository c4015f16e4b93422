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

import graphSat.graphs.Edge;
import graphSat.graphs.Graph;
import graphSat.graphs.InvalidGraphException;

import java.util.*;

/**
 * CNFs supported on a graph. A CNF is supported on a graph when the variables of every clause are exactly the
 * endpoints of one edge (or one isolated node), and each edge carries as many distinct clauses as its multiplicity.
 * Node ids double as DIMACS variables.
 *
 * <p>Multiplicities are read from the {@value #MULTIPLICITY} attribute of edges and isolated nodes and default to 1.
 * An edge {u,v} supports 4 clauses and an isolated node 2, so an edge of multiplicity m contributes C(4,m) choices and
 * the graph supports the product of those counts.</p>
 */
public class SupportedCnfs {

    public final static String MULTIPLICITY = "multiplicity";

    private SupportedCnfs(){}

    /**
     * The 2^|hyperedge| clauses over exactly the given variables, in sign order: all positive first, then the last
     * variable negated, and so on.
     */
    public static List<Clause> clausesOn(int... hyperedge){
        List<Clause> retVal = new ArrayList<Clause>();
        int n = hyperedge.length;
        for (int signs = 0; signs < (1 << n); signs++){
            int[] literals = new int[n];
            for (int i = 0; i < n; i++){
                boolean negative = ((signs >>> (n - 1 - i)) & 1) == 1;
                literals[i] = negative ? -hyperedge[i] : hyperedge[i];
            }
            retVal.add(Clause.of(literals));
        }
        return retVal;
    }

    /**
     * All CNFs made of {@code multiplicity} distinct clauses over exactly the given variables.
     *
     * @throws InvalidGraphException if the multiplicity is not within 1..2^|hyperedge|
     */
    public static List<List<Clause>> cnfsOn(int[] hyperedge, int multiplicity){
        checkMultiplicity(hyperedge, multiplicity);
        List<Clause> clauses = clausesOn(hyperedge);
        List<List<Clause>> retVal = new ArrayList<List<Clause>>();
        int[] indices = new int[multiplicity];
        for (int i = 0; i < multiplicity; i++){
            indices[i] = i;
        }
        int n = clauses.size();
        while (true){
            List<Clause> cnf = new ArrayList<Clause>(multiplicity);
            for (int index : indices){
                cnf.add(clauses.get(index));
            }
            retVal.add(cnf);
            int i = multiplicity - 1;
            while (i >= 0 && indices[i] == n - multiplicity + i){
                i--;
            }
            if (i < 0){
                return retVal;
            }
            indices[i]++;
            for (int j = i + 1; j < multiplicity; j++){
                indices[j] = indices[j - 1] + 1;
            }
        }
    }

    /**
     * Number of CNFs supported on the graph, saturating at Long.MAX_VALUE.
     *
     * @throws InvalidGraphException if a multiplicity is out of range or not an integer
     */
    public static long count(Graph graph){
        long retVal = 1;
        for (Map.Entry<int[], Integer> hedge : hyperedges(graph).entrySet()){
            checkMultiplicity(hedge.getKey(), hedge.getValue());
            long choices = CardinalityEncoder.binomial(1 << hedge.getKey().length, hedge.getValue());
            if (retVal > Long.MAX_VALUE / choices){
                return Long.MAX_VALUE;
            }
            retVal *= choices;
        }
        return retVal;
    }

    /**
     * Lazily generates every CNF supported on the graph. The sequence can be iterated more than once.
     *
     * @throws InvalidGraphException if a multiplicity is out of range or not an integer
     */
    public static Iterable<CnfFormula> cnfsOn(Graph graph){
        final List<List<List<Clause>>> choices = new ArrayList<List<List<Clause>>>();
        int variables = 0;
        for (Map.Entry<int[], Integer> hedge : hyperedges(graph).entrySet()){
            choices.add(cnfsOn(hedge.getKey(), hedge.getValue()));
        }
        if (!graph.nodes().isEmpty()){
            variables = graph.nodes().last();
        }
        final int variableCount = variables;
        return new Iterable<CnfFormula>() {
            @Override
            public Iterator<CnfFormula> iterator() {
                return new Iterator<CnfFormula>() {

                    // odometer over the choices of every hyperedge, null once exhausted
                    private int[] position = new int[choices.size()];

                    @Override
                    public boolean hasNext() {
                        return position != null;
                    }

                    @Override
                    public CnfFormula next() {
                        if (position == null){
                            throw new NoSuchElementException();
                        }
                        List<Clause> clauses = new ArrayList<Clause>();
                        for (int i = 0; i < position.length; i++){
                            clauses.addAll(choices.get(i).get(position[i]));
                        }
                        advance();
                        return new CnfFormula(clauses, variableCount, null);
                    }

                    private void advance(){
                        int i = position.length - 1;
                        while (i >= 0 && position[i] == choices.get(i).size() - 1){
                            position[i] = 0;
                            i--;
                        }
                        if (i < 0){
                            position = null;
                        } else {
                            position[i]++;
                        }
                    }
                };
            }
        };
    }

    /**
     * The graph supporting a CNF, with the number of distinct clauses per edge or isolated node recorded as its
     * {@value #MULTIPLICITY}. Tautological clauses and repeated literals or clauses are dropped first.
     *
     * @throws InvalidGraphException if the CNF reduces to true or false, has a clause over more than two variables,
     *                               or mentions a variable both in a unit clause and in a binary one
     */
    public static Graph supportingGraph(CnfFormula formula){
        Set<SortedSet<Integer>> distinctClauses = new LinkedHashSet<SortedSet<Integer>>();
        for (Clause c : formula.clauses()){
            if (c.isContradiction()){
                throw new InvalidGraphException("The CNF contains the empty clause and has no supporting graph");
            }
            SortedSet<Integer> literals = new TreeSet<Integer>();
            boolean tautology = false;
            for (int i = 0; i < c.size(); i++){
                literals.add(c.get(i));
                tautology |= literals.contains(-c.get(i));
            }
            if (!tautology){
                distinctClauses.add(literals);
            }
        }
        if (distinctClauses.isEmpty()){
            throw new InvalidGraphException("The CNF reduces to true and has no supporting graph");
        }
        Map<SortedSet<Integer>, Integer> multiplicities = new LinkedHashMap<SortedSet<Integer>, Integer>();
        for (SortedSet<Integer> literals : distinctClauses){
            SortedSet<Integer> variables = new TreeSet<Integer>();
            for (int l : literals){
                variables.add(Math.abs(l));
            }
            if (variables.size() > 2){
                throw new InvalidGraphException("Clause " + literals + " spans " + variables.size()
                        + " variables, only edges and single nodes are supported");
            }
            Integer m = multiplicities.get(variables);
            multiplicities.put(variables, m == null ? 1 : m + 1);
        }
        List<int[]> edges = new ArrayList<int[]>();
        for (SortedSet<Integer> variables : multiplicities.keySet()){
            int[] edge = new int[variables.size()];
            int i = 0;
            for (int v : variables){
                edge[i++] = v;
            }
            edges.add(edge);
        }
        // validates the isolated-node / edge split
        Graph shape = Graph.fromEdges(edges.toArray(new int[edges.size()][]));
        Graph.Builder builder = Graph.builder();
        for (int node : shape.nodes()){
            builder.addNode(node);
        }
        for (Edge e : shape.edges()){
            builder.addEdge(e);
        }
        for (Map.Entry<SortedSet<Integer>, Integer> entry : multiplicities.entrySet()){
            String m = String.valueOf(entry.getValue());
            if (entry.getKey().size() == 1){
                builder.setNodeAttribute(entry.getKey().first(), MULTIPLICITY, m);
            } else {
                builder.setEdgeAttribute(entry.getKey().first(), entry.getKey().last(), MULTIPLICITY, m);
            }
        }
        return builder.build();
    }

    // isolated nodes first, then edges, both ascending
    private static LinkedHashMap<int[], Integer> hyperedges(Graph graph){
        LinkedHashMap<int[], Integer> retVal = new LinkedHashMap<int[], Integer>();
        for (int node : graph.nodes()){
            if (graph.neighbours(node).isEmpty()){
                retVal.put(new int[]{node}, multiplicity(graph.nodeAttributes(node), "node " + node));
            }
        }
        for (Edge e : graph.edges()){
            retVal.put(new int[]{e.first(), e.second()}, multiplicity(graph.edgeAttributes(e), "edge " + e));
        }
        return retVal;
    }

    private static void checkMultiplicity(int[] hyperedge, int multiplicity){
        int supported = 1 << hyperedge.length;
        if (multiplicity < 1 || multiplicity > supported){
            throw new InvalidGraphException("Multiplicity of " + Arrays.toString(hyperedge) + " must be within 1.."
                    + supported + ", got " + multiplicity);
        }
    }

    private static int multiplicity(Map<String, String> attributes, String owner){
        String value = attributes.get(MULTIPLICITY);
        if (value == null){
            return 1;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e){
            throw new InvalidGraphException("Multiplicity of " + owner + " is not an integer: '" + value + "'");
        }
    }
}
