package com.example.ajml.validation;

import com.example.ajml.domain.Agent;
import com.example.ajml.domain.Node;
import com.example.ajml.domain.SubgraphNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Project-wide checks run after every agent passed its own validation.
 * <p>
 * Order: duplicate agent names, subgraph references and their field mappings (agents in the order
 * given, nodes in declaration order), then cycle detection over the reference graph.
 * </p>
 */
public final class CrossDocumentResolver {

    private CrossDocumentResolver() {
    }

    /**
     * @param agents validated agents, in processing order
     * @return the agents keyed by name, in processing order
     */
    public static Map<String, Agent> resolve(List<Agent> agents) {
        Map<String, Agent> byName = new LinkedHashMap<>();
        for (Agent agent : agents) {
            if (byName.putIfAbsent(agent.name(), agent) != null) {
                throw new CompilationException(DiagnosticCode.DUPLICATE_AGENT_NAME,
                        "Duplicate agent name `" + agent.name() + "` across project.", agent.sourceFile());
            }
        }
        for (Agent agent : agents) {
            for (Node node : agent.nodes()) {
                if (node instanceof SubgraphNode subgraph) {
                    checkSubgraph(agent, subgraph, byName);
                }
            }
        }
        checkCycles(byName);
        return byName;
    }

    private static void checkSubgraph(Agent parent, SubgraphNode node, Map<String, Agent> byName) {
        String file = parent.sourceFile();
        Agent child = byName.get(node.agentRef());
        if (child == null) {
            throw new CompilationException(DiagnosticCode.UNKNOWN_AGENT_REF,
                    "Agent reference `" + node.agentRef() + "` does not match any .ajml file in the project.",
                    file, node.line());
        }
        for (SubgraphNode.FieldMapping mapping : node.inputMap()) {
            if (child.field(mapping.target()).isEmpty()) {
                throw new CompilationException(DiagnosticCode.INPUT_MAP_TARGET_NOT_IN_CHILD,
                        "Input map target `" + mapping.target() + "` does not exist in child agent `"
                                + node.agentRef() + "` state.", file, node.line());
            }
        }
        for (SubgraphNode.FieldMapping mapping : node.outputMap()) {
            if (child.field(mapping.source()).isEmpty()) {
                throw new CompilationException(DiagnosticCode.OUTPUT_MAP_SOURCE_NOT_IN_CHILD,
                        "Output map source `" + mapping.source() + "` does not exist in child agent `"
                                + node.agentRef() + "` state.", file, node.line());
            }
        }
    }

    /**
     * Iterative depth-first search with an explicit stack. Roots and dependencies are visited in sorted
     * order so the reported cycle is the same on every run.
     */
    static void checkCycles(Map<String, Agent> byName) {
        Map<String, Set<String>> references = new TreeMap<>();
        byName.forEach((name, agent) -> {
            Set<String> targets = new TreeSet<>();
            agent.nodes().stream()
                    .filter(SubgraphNode.class::isInstance)
                    .map(n -> ((SubgraphNode) n).agentRef())
                    .forEach(targets::add);
            references.put(name, targets);
        });

        Set<String> visited = new HashSet<>();
        for (String root : references.keySet()) {
            if (visited.contains(root)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            Set<String> onPath = new HashSet<>();
            stack.push(new Frame(root, references.get(root).iterator()));
            path.add(root);
            onPath.add(root);
            visited.add(root);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.pending().hasNext()) {
                    stack.pop();
                    onPath.remove(path.remove(path.size() - 1));
                    continue;
                }
                String next = frame.pending().next();
                if (onPath.contains(next)) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    cycle.add(next);
                    throw new CircularReferenceException(cycle, byName.get(frame.agent()).sourceFile());
                }
                if (visited.add(next)) {
                    stack.push(new Frame(next, references.getOrDefault(next, Set.of()).iterator()));
                    path.add(next);
                    onPath.add(next);
                }
            }
        }
    }

    private record Frame(String agent, Iterator<String> pending) {
    }
}
