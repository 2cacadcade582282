package io.github.eutro.ilcore.util;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GraphWalkerTest {
    private static final Map<String, List<String>> GRAPH = new HashMap<>();

    static {
        GRAPH.put("a", Arrays.asList("c", "b"));
        GRAPH.put("b", Collections.singletonList("d"));
        GRAPH.put("c", Arrays.asList("d", "a"));
        GRAPH.put("d", Collections.emptyList());
    }

    private final GraphWalker<String> walker = new GraphWalker<>("a", GRAPH::get);

    @Test
    void testPreOrder() {
        assertEquals(Arrays.asList("a", "b", "d", "c"), walker.preOrder().toList());
    }

    @Test
    void testPostOrder() {
        assertEquals(Arrays.asList("d", "b", "c", "a"), walker.postOrder().toList());
    }
}
