package org.Aayush.pivot.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BestFirstSearch")
class BestFirstSearchTest {

    /**
     * Small weighted digraph over string states.
     */
    private static final class Graph implements NeighborExpander<String> {
        private final Map<String, Map<String, Integer>> edges = new HashMap<>();
        private int expansions;

        Graph edge(String from, String to, int cost) {
            edges.computeIfAbsent(from, k -> new LinkedHashMap<>()).put(to, cost);
            return this;
        }

        @Override
        public void expand(String state, Sink<String> sink) {
            expansions++;
            for (Map.Entry<String, Integer> edge : edges.getOrDefault(state, Map.of()).entrySet()) {
                sink.accept(edge.getKey(), edge.getValue());
            }
        }
    }

    @Nested
    @DisplayName("Uniform cost")
    class UniformCost {

        @Test
        @DisplayName("Finds the cheapest path, not the shortest")
        void testCheapestPath() {
            Graph graph = new Graph()
                    .edge("A", "D", 10)
                    .edge("A", "B", 1)
                    .edge("B", "C", 1)
                    .edge("C", "D", 1);

            SearchResult<String> result = BestFirstSearch
                    .search("A", 4, graph, s -> 0, "D"::equals)
                    .orElseThrow();

            assertEquals(List.of("A", "B", "C", "D"), result.path());
            assertEquals(3, result.totalCost());
            assertEquals("D", result.goal());
            assertEquals(3, result.expandedStates());
        }

        @Test
        @DisplayName("Improved route replaces a stale queued entry")
        void testStaleEntrySkipped() {
            Graph graph = new Graph()
                    .edge("S", "X", 5)
                    .edge("S", "Y", 1)
                    .edge("Y", "X", 1)
                    .edge("X", "G", 10);

            SearchResult<String> result = BestFirstSearch
                    .search("S", 4, graph, s -> 0, "G"::equals)
                    .orElseThrow();

            assertEquals(List.of("S", "Y", "X", "G"), result.path());
            assertEquals(12, result.totalCost());
            assertEquals(3, graph.expansions);
        }

        @Test
        @DisplayName("Start that satisfies the goal returns immediately")
        void testStartIsGoal() {
            Graph graph = new Graph().edge("A", "B", 1);
            SearchResult<String> result = BestFirstSearch
                    .search("A", 0, graph, s -> 0, "A"::equals)
                    .orElseThrow();
            assertEquals(List.of("A"), result.path());
            assertEquals(0, result.totalCost());
            assertEquals(0, graph.expansions);
        }

        @Test
        @DisplayName("Exhausted state space yields no result")
        void testUnreachable() {
            Graph graph = new Graph()
                    .edge("A", "B", 1)
                    .edge("B", "A", 1)
                    .edge("C", "D", 1);
            Optional<SearchResult<String>> result = BestFirstSearch.search("A", 4, graph, s -> 0, "D"::equals);
            assertTrue(result.isEmpty());
            assertEquals(2, graph.expansions);
        }

        @Test
        @DisplayName("Equal-cost alternatives resolve the same way every run")
        void testDeterministicTies() {
            Graph graph = new Graph()
                    .edge("S", "L", 1)
                    .edge("S", "R", 1)
                    .edge("L", "G", 1)
                    .edge("R", "G", 1);
            SearchResult<String> first = BestFirstSearch.search("S", 4, graph, s -> 0, "G"::equals).orElseThrow();
            for (int run = 0; run < 5; run++) {
                SearchResult<String> again = BestFirstSearch.search("S", 4, graph, s -> 0, "G"::equals).orElseThrow();
                assertEquals(first.path(), again.path());
            }
            assertEquals(List.of("S", "L", "G"), first.path());
        }
    }

    @Nested
    @DisplayName("Heuristic guidance")
    class Guided {

        @Test
        @DisplayName("Admissible heuristic keeps the optimal path and expands less")
        void testHeuristicPrunes() {
            Map<String, Integer> remaining = Map.of("S", 2, "A", 1, "B", 5, "G", 0);
            Graph blind = new Graph()
                    .edge("S", "A", 1)
                    .edge("S", "B", 1)
                    .edge("A", "G", 1)
                    .edge("B", "G", 5);
            Graph guided = new Graph()
                    .edge("S", "A", 1)
                    .edge("S", "B", 1)
                    .edge("A", "G", 1)
                    .edge("B", "G", 5);

            SearchResult<String> uninformed = BestFirstSearch.search("S", 4, blind, s -> 0, "G"::equals).orElseThrow();
            SearchResult<String> informed = BestFirstSearch
                    .search("S", 4, guided, remaining::get, "G"::equals)
                    .orElseThrow();

            assertEquals(uninformed.totalCost(), informed.totalCost());
            assertEquals(List.of("S", "A", "G"), informed.path());
            assertTrue(guided.expansions < blind.expansions);
        }
    }

    @Nested
    @DisplayName("Contracts")
    class Contracts {

        @Test
        @DisplayName("Negative edge costs and estimates are rejected")
        void testNegativeValues() {
            Graph negativeEdge = new Graph().edge("A", "B", -1);
            assertThrows(IllegalStateException.class,
                    () -> BestFirstSearch.search("A", 2, negativeEdge, s -> 0, "B"::equals));

            Graph graph = new Graph().edge("A", "B", 1);
            assertThrows(IllegalStateException.class,
                    () -> BestFirstSearch.search("A", 2, graph, s -> -1, "B"::equals));
        }

        @Test
        @DisplayName("Missing arguments are rejected")
        void testMissingArguments() {
            Graph graph = new Graph();
            assertThrows(NullPointerException.class,
                    () -> BestFirstSearch.search(null, 2, graph, s -> 0, "B"::equals));
            assertThrows(IllegalArgumentException.class,
                    () -> BestFirstSearch.search("A", -1, graph, s -> 0, "B"::equals));
        }
    }
}
