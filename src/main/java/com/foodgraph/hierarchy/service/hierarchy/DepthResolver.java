package com.foodgraph.hierarchy.service.hierarchy;

import com.foodgraph.hierarchy.model.Warn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes hierarchy depth over a child to parents graph.
 *
 * <p>Depth is 0 for a node without parents, otherwise one more than the deepest
 * parent. The traversal is iterative with an in-progress marker and memoized
 * finished depths, so every node and edge is visited once however many parent
 * chains share it.
 *
 * <p>Edges are expected to form a DAG. A parent reached again while its own
 * depth is still being resolved closes a cycle: it contributes 0 on that path,
 * the node itself resolves to depth 0, and a {@code CYCLE_DETECTED} warning names
 * it. Resolution always terminates.
 */
public class DepthResolver {
    private static final Logger log = LoggerFactory.getLogger(DepthResolver.class);

    private enum State { IN_PROGRESS, DONE }

    private static final class Frame {
        final String node;
        final Iterator<String> parents;
        final boolean hasParents;
        int deepestParent;

        Frame(String node, List<String> parents) {
            this.node = node;
            this.parents = parents.iterator();
            this.hasParents = !parents.isEmpty();
        }
    }

    /**
     * Resolves the depth of every node.
     *
     * @param nodes nodes in the order their traversals should start
     * @param childToParents parents of each child; nodes absent from the map have none
     * @return depth per node in {@code nodes} order, plus cycle warnings
     */
    public Result resolve(List<String> nodes, Map<String, List<String>> childToParents) {
        Map<String, State> state = new HashMap<>();
        Map<String, Integer> depths = new LinkedHashMap<>();
        Set<String> cyclic = new LinkedHashSet<>();
        List<Warn> warnings = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (String root : nodes) {
            if (state.containsKey(root)) continue;
            state.put(root, State.IN_PROGRESS);
            stack.push(new Frame(root, childToParents.getOrDefault(root, List.of())));

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.parents.hasNext()) {
                    String parent = top.parents.next();
                    State s = state.get(parent);
                    if (s == State.DONE) {
                        top.deepestParent = Math.max(top.deepestParent, depths.get(parent));
                    } else if (s == State.IN_PROGRESS) {
                        if (cyclic.add(parent)) {
                            String path = pathOf(stack, parent);
                            log.warn("Cycle detected involving {} ({})", parent, path);
                            warnings.add(Warn.cycleDetected(parent, path));
                        }
                    } else {
                        state.put(parent, State.IN_PROGRESS);
                        stack.push(new Frame(parent, childToParents.getOrDefault(parent, List.of())));
                    }
                    continue;
                }

                stack.pop();
                int depth = top.hasParents && !cyclic.contains(top.node) ? top.deepestParent + 1 : 0;
                depths.put(top.node, depth);
                state.put(top.node, State.DONE);
                Frame below = stack.peek();
                if (below != null) {
                    below.deepestParent = Math.max(below.deepestParent, depth);
                }
            }
        }

        // keep caller order for nodes first reached as someone's parent
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (String n : nodes) ordered.put(n, depths.get(n));
        depths.forEach(ordered::putIfAbsent);
        return new Result(ordered, warnings);
    }

    private static String pathOf(Deque<Frame> stack, String closing) {
        List<String> chain = stack.stream().map(f -> f.node).collect(Collectors.toList());
        Collections.reverse(chain);
        int start = chain.indexOf(closing);
        List<String> cycle = new ArrayList<>(chain.subList(Math.max(start, 0), chain.size()));
        cycle.add(closing);
        return String.join(" <- ", cycle);
    }

    public static final class Result {
        private final Map<String, Integer> depths;
        private final List<Warn> warnings;

        Result(Map<String, Integer> depths, List<Warn> warnings) {
            this.depths = Collections.unmodifiableMap(depths);
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public Map<String, Integer> getDepths() { return depths; }
        public List<Warn> getWarnings() { return warnings; }

        public int depthOf(String node) {
            return depths.getOrDefault(node, 0);
        }
    }
}
