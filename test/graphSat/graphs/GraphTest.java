/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat.graphs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.Arrays;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

public class GraphTest {

    @Test
    public void duplicateAndReversedEdgesCollapse() {
        Graph g = Graph.fromEdges(new int[]{1, 2}, new int[]{1, 2}, new int[]{2, 3}, new int[]{3, 1}, new int[]{3, 2});
        assertEquals(3, g.countNodes());
        assertEquals(3, g.countEdges());
        assertTrue(g.adjacent(1, 3));
        assertTrue(g.adjacent(3, 1));
    }

    @Test
    public void singletonDeclaresIsolatedNode() {
        Graph g = Graph.fromEdges(new int[]{1, 2}, new int[]{5});
        assertEquals(new TreeSet<Integer>(Arrays.asList(1, 2, 5)), g.nodes());
        assertTrue(g.neighbours(5).isEmpty());
    }

    @Test
    public void nodeCannotBeBothIsolatedAndAnEndpoint() {
        assertThrows(InvalidGraphException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Graph.fromEdges(new int[]{1}, new int[]{1, 2});
            }
        });
        assertThrows(InvalidGraphException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Graph.fromEdges(new int[]{2, 3}, new int[]{3});
            }
        });
        assertEquals(3, Graph.fromEdges(new int[]{1}, new int[]{1}, new int[]{2, 3}).countNodes());
    }

    @Test
    public void selfLoopsAreRejected() {
        assertThrows(InvalidGraphException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Graph.fromEdges(new int[]{2, 2});
            }
        });
    }

    @Test
    public void nodesMustBePositive() {
        assertThrows(InvalidGraphException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Graph.builder().addNode(0);
            }
        });
        assertThrows(InvalidGraphException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Graph.fromEdges(new int[]{-1, 2});
            }
        });
    }

    @Test
    public void edgeEndpointsMustBeKnownNodes() {
        Graph.Builder builder = Graph.builder().addNodes(1, 2);
        assertThrows(InvalidGraphException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                builder.addEdge(new Edge(2, 3));
            }
        });
        builder.addEdge(new Edge(2, 1));
        assertEquals(1, builder.build().countEdges());
    }

    @Test
    public void hyperedgesAreRejected() {
        assertThrows(InvalidGraphException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Graph.fromEdges(new int[]{1, 2, 3});
            }
        });
    }

    @Test
    public void attributesAttachToNodesAndEdges() {
        Graph g = Graph.builder()
                .addEdge(1, 2)
                .setNodeAttribute(1, "label", "a")
                .setEdgeAttribute(2, 1, "weight", "3")
                .build();
        assertEquals("a", g.nodeAttributes(1).get("label"));
        assertTrue(g.nodeAttributes(2).isEmpty());
        assertEquals("3", g.edgeAttributes(new Edge(1, 2)).get("weight"));
        assertThrows(InvalidGraphException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Graph.builder().addNode(1).setEdgeAttribute(1, 2, "k", "v");
            }
        });
    }

    @Test
    public void namedGraphs() {
        Graph c4 = Graphs.cycle(4);
        assertEquals(4, c4.countEdges());
        assertTrue(c4.adjacent(4, 1));
        assertFalse(c4.adjacent(1, 3));
        assertEquals(6, Graphs.complete(4).countEdges());
        assertEquals(2, Graphs.path(3).countEdges());
        assertEquals(0, Graphs.empty(3).countEdges());
        assertEquals(Graph.fromEdges(new int[]{1, 2}, new int[]{2, 3}, new int[]{3, 1}), Graphs.complete(3));
    }

    @Test
    public void edgeIsUnordered() {
        Edge e = new Edge(5, 2);
        assertEquals(new Edge(2, 5), e);
        assertEquals(2, e.first());
        assertEquals(5, e.other(2));
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                e.other(3);
            }
        });
    }
}
