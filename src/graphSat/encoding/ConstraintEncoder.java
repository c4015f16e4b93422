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

import graphSat.graphs.Graph;
import graphSat.graphs.InvalidGraphException;
import graphSat.properties.GraphProperty;
import graphSat.properties.PropertyKind;
import graphSat.properties.Solution;
import graphSat.properties.UnsupportedPropertyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Turns a graph and a property into CNF. Each call starts a new session with its own registry, so one encoder can
 * be shared by concurrent callers.
 */
public class ConstraintEncoder {

    private static final Logger log = LogManager.getFormatterLogger();

    private final Map<PropertyKind, PropertyEncoder<?, ?>> encoders = new EnumMap<PropertyKind, PropertyEncoder<?, ?>>(PropertyKind.class);

    public ConstraintEncoder(){
        this(EnumSet.allOf(PropertyKind.class), new CardinalityEncoder());
    }

    public ConstraintEncoder(CardinalityEncoder cardinality){
        this(EnumSet.allOf(PropertyKind.class), cardinality);
    }

    /**
     * Encoder limited to the given kinds; any other kind is rejected as unsupported.
     */
    public ConstraintEncoder(Set<PropertyKind> kinds, CardinalityEncoder cardinality){
        for (PropertyKind kind : kinds){
            switch (kind){
                case COLORING:
                    register(new ColoringEncoder());
                    break;
                case INDEPENDENT_SET:
                    register(new IndependentSetEncoder(cardinality));
                    break;
                case CLIQUE:
                    register(new CliqueEncoder(cardinality));
                    break;
                case ISOMORPHISM:
                    register(new IsomorphismEncoder());
                    break;
                default:
                    throw new UnsupportedPropertyException(kind);
            }
        }
    }

    private void register(PropertyEncoder<?, ?> encoder){
        this.encoders.put(encoder.kind(), encoder);
    }

    public Set<PropertyKind> supportedKinds(){
        return Collections.unmodifiableSet(this.encoders.keySet());
    }

    /**
     * @throws UnsupportedPropertyException if the property kind is not one this encoder handles
     * @throws InvalidGraphException if the graph violates a precondition of the property
     */
    @SuppressWarnings("unchecked")
    public <S extends Solution> Encoding<S> encode(Graph graph, GraphProperty<S> property){
        PropertyKind kind = property.kind();
        PropertyEncoder<?, ?> encoder = kind == null ? null : this.encoders.get(kind);
        if (encoder == null || !encoder.propertyType().isInstance(property)){
            throw new UnsupportedPropertyException(kind);
        }
        property.validate(graph);
        PropertyEncoder<GraphProperty<S>, S> typed = (PropertyEncoder<GraphProperty<S>, S>) encoder;
        CnfBuilder cnf = new CnfBuilder();
        typed.encode(graph, property, cnf);
        CnfFormula formula = cnf.build();
        log.debug("encoded %s on %d nodes: %d variables, %d clauses", property, graph.countNodes(),
                formula.variableCount(), formula.countClauses());
        return new Encoding<S>(graph, property, typed, formula);
    }
}
