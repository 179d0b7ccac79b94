package com.wiregen.core.graph;

import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.model.Edge;
import com.wiregen.core.model.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds circular dependencies with a three-color depth-first search over the non-collection
 * edges.
 *
 * <p>Every back-edge (an edge into a node still on the DFS stack) yields one cycle: the stack
 * segment from that node to the top. A large cycle can therefore show up as several
 * overlapping paths. External types never appear as nodes. The search is iterative so deep
 * graphs cannot overflow the call stack.
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    private enum Color { WHITE, GREY, BLACK }

    /**
     * Detects cycles and reports one diagnostic per back-edge.
     *
     * @param graph dependency graph
     * @param reporter receives cycle diagnostics
     * @return each cycle as the list of its types, starting and ending at the same type
     */
    public List<List<String>> detect(DependencyGraph graph, DiagnosticReporter reporter) {
        TreeSet<String> nodes = new TreeSet<>();
        for (Edge edge : graph.edges()) {
            if (edge.isHard()) {
                nodes.add(edge.from());
                nodes.add(edge.to());
            }
        }

        Map<String, Color> colors = new HashMap<>();
        List<List<String>> cycles = new ArrayList<>();
        for (String start : nodes) {
            if (colors.getOrDefault(start, Color.WHITE) == Color.WHITE) {
                search(start, graph, colors, cycles);
            }
        }

        for (List<String> cycle : cycles) {
            TypeDescriptor first = graph.registry().get(cycle.get(0));
            String path = cycle.stream()
                .map(name -> graph.registry().get(name).simpleName())
                .collect(Collectors.joining(" → "));
            reporter.report(DiagnosticCode.CYCLE_DETECTED, cycle.subList(0, cycle.size() - 1),
                first.sourcePath(), path);
        }
        log.debug("Cycle detection over {} nodes found {} cycle(s)", nodes.size(), cycles.size());
        return cycles;
    }

    private static void search(String start, DependencyGraph graph, Map<String, Color> colors,
                               List<List<String>> cycles) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();

        colors.put(start, Color.GREY);
        path.add(start);
        stack.push(new Frame(graph.hardSuccessors(start).iterator()));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.successors().hasNext()) {
                colors.put(path.remove(path.size() - 1), Color.BLACK);
                stack.pop();
                continue;
            }
            String next = frame.successors().next();
            Color color = colors.getOrDefault(next, Color.WHITE);
            if (color == Color.GREY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                cycles.add(List.copyOf(cycle));
            } else if (color == Color.WHITE) {
                colors.put(next, Color.GREY);
                path.add(next);
                stack.push(new Frame(graph.hardSuccessors(next).iterator()));
            }
        }
    }

    private record Frame(Iterator<String> successors) {
    }
}
