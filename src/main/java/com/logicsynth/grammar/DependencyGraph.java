package com.logicsynth.grammar;

import com.logicsynth.ir.Clause;
import com.logicsynth.ir.Premise;
import com.logicsynth.ir.Program;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Predicate dependency graph of a program. An edge runs from a head predicate to each
 * body predicate; it is negative when the body atom is negated or the clause aggregates.
 */
public final class DependencyGraph {

    private record Edge(String target, boolean negative) {}

    private final Map<String, List<Edge>> edges = new LinkedHashMap<>();

    private DependencyGraph() {}

    public static DependencyGraph of(Program program) {
        DependencyGraph graph = new DependencyGraph();
        for (Clause clause : program.clauses()) {
            String head = clause.head().predicate();
            graph.node(head);
            boolean aggregates = clause.transformOpt().map(t -> t.aggregates()).orElse(false);
            for (Premise premise : clause.body()) {
                if (premise instanceof Premise.Positive p) {
                    graph.edge(head, p.atom().predicate(), aggregates);
                } else if (premise instanceof Premise.Negated n) {
                    graph.edge(head, n.atom().predicate(), true);
                }
            }
        }
        return graph;
    }

    private List<Edge> node(String predicate) {
        return edges.computeIfAbsent(predicate, k -> new ArrayList<>());
    }

    private void edge(String from, String to, boolean negative) {
        node(to);
        node(from).add(new Edge(to, negative));
    }

    /**
     * Strongly connected components that contain a negative edge. Such a program has no
     * stratification. Each component is returned with its predicates sorted.
     */
    public List<Set<String>> unstratifiableComponents() {
        List<Set<String>> out = new ArrayList<>();
        for (Set<String> component : stronglyConnectedComponents()) {
            boolean negativeInside = component.stream()
                .flatMap(p -> edges.get(p).stream())
                .anyMatch(e -> e.negative() && component.contains(e.target()));
            if (negativeInside) {
                out.add(new TreeSet<>(component));
            }
        }
        return out;
    }

    /** Tarjan's algorithm. */
    List<Set<String>> stronglyConnectedComponents() {
        Tarjan tarjan = new Tarjan();
        for (String node : edges.keySet()) {
            if (!tarjan.index.containsKey(node)) {
                tarjan.visit(node);
            }
        }
        return tarjan.components;
    }

    private final class Tarjan {
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new LinkedHashSet<>();
        private final List<Set<String>> components = new ArrayList<>();
        private int counter;

        void visit(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (Edge edge : edges.get(node)) {
                if (!index.containsKey(edge.target())) {
                    visit(edge.target());
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(edge.target())));
                } else if (onStack.contains(edge.target())) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(edge.target())));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                Set<String> component = new LinkedHashSet<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                components.add(component);
            }
        }
    }
}
