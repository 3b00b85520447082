package org.carball.tiercheck.analyzer;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of calculation elements. Each node maps to the nodes it points at, in insertion order.
 * Traversals use an explicit stack so deep or cyclic inputs cannot overflow the call stack.
 */
@Slf4j
public final class DependencyGraph {

    private final Map<String, List<String>> adjacency;

    private DependencyGraph(Map<String, List<String>> adjacency) {
        this.adjacency = adjacency;
    }

    public static DependencyGraph empty() {
        return new DependencyGraph(new LinkedHashMap<>());
    }

    public DependencyGraph addEdge(String from, String to) {
        adjacency.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
        return this;
    }

    /**
     * Replaces the outgoing edges of {@code node}.
     */
    public DependencyGraph putNode(String node, List<String> targets) {
        adjacency.put(node, new ArrayList<>(targets));
        return this;
    }

    public boolean isEmpty() {
        return adjacency.isEmpty();
    }

    public Set<String> nodesWithEdges() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    public List<String> targetsOf(String node) {
        return adjacency.getOrDefault(node, List.of());
    }

    public int maxOutDegree() {
        int max = 0;
        for (List<String> targets : adjacency.values()) {
            max = Math.max(max, targets.size());
        }
        return max;
    }

    /**
     * Highest number of edges pointing at a single node, duplicates included.
     */
    public int maxInDegree() {
        Map<String, Integer> inDegree = new HashMap<>();
        int max = 0;
        for (List<String> targets : adjacency.values()) {
            for (String target : targets) {
                int degree = inDegree.merge(target, 1, Integer::sum);
                max = Math.max(max, degree);
            }
        }
        return max;
    }

    public boolean hasCycle() {
        Set<String> finished = new HashSet<>();
        Set<String> onStack = new HashSet<>();

        for (String root : adjacency.keySet()) {
            if (finished.contains(root)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root));
            onStack.add(root);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<String> targets = targetsOf(frame.node);
                if (frame.next < targets.size()) {
                    String target = targets.get(frame.next++);
                    if (onStack.contains(target)) {
                        log.debug("Cycle detected through {} -> {}", frame.node, target);
                        return true;
                    }
                    if (!finished.contains(target)) {
                        stack.push(new Frame(target));
                        onStack.add(target);
                    }
                } else {
                    stack.pop();
                    onStack.remove(frame.node);
                    finished.add(frame.node);
                }
            }
        }
        return false;
    }

    public int longestPathDepth() {
        return longestPathDepth(CycleBreakPolicy.COUNT_BACK_EDGE_AS_LEAF);
    }

    /**
     * Length of the longest edge path starting at any node with outgoing edges.
     * Depths are memoized per node; a node reached again while still on the stack is resolved by {@code policy}.
     */
    public int longestPathDepth(CycleBreakPolicy policy) {
        Map<String, Integer> memo = new HashMap<>();
        Set<String> visiting = new HashSet<>();
        int maxDepth = 0;

        for (String root : adjacency.keySet()) {
            if (!memo.containsKey(root)) {
                Deque<Frame> stack = new ArrayDeque<>();
                stack.push(new Frame(root));
                visiting.add(root);

                while (!stack.isEmpty()) {
                    Frame frame = stack.peek();
                    List<String> targets = targetsOf(frame.node);

                    if (frame.next < targets.size()) {
                        String target = targets.get(frame.next++);
                        if (memo.containsKey(target)) {
                            frame.depth = Math.max(frame.depth, memo.get(target) + 1);
                        } else if (visiting.contains(target)) {
                            if (policy == CycleBreakPolicy.COUNT_BACK_EDGE_AS_LEAF) {
                                frame.depth = Math.max(frame.depth, 1);
                            }
                        } else {
                            stack.push(new Frame(target));
                            visiting.add(target);
                        }
                    } else {
                        stack.pop();
                        visiting.remove(frame.node);
                        memo.put(frame.node, frame.depth);
                        Frame parent = stack.peek();
                        if (parent != null) {
                            parent.depth = Math.max(parent.depth, frame.depth + 1);
                        }
                    }
                }
            }
            maxDepth = Math.max(maxDepth, memo.get(root));
        }
        return maxDepth;
    }

    private static final class Frame {
        private final String node;
        private int next;
        private int depth;

        private Frame(String node) {
            this.node = node;
        }
    }
}
