package com.github.salilvnair.formassist.engine.factory;

import com.github.salilvnair.formassist.engine.exception.FormEngineErrorCode;
import com.github.salilvnair.formassist.engine.exception.FormEngineException;
import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import com.github.salilvnair.formassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formassist.engine.pipeline.annotation.MustRunBefore;
import com.github.salilvnair.formassist.engine.pipeline.annotation.TerminalStep;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Precedence graph over step classes, built from {@link MustRunAfter}, {@link MustRunBefore} and
 * {@link TerminalStep}. Steps with no ordering between them run in class-name order.
 */
final class StepDependencyGraph {

    private static final Comparator<Class<?>> BY_NAME = Comparator.comparing(Class::getName);

    private final Map<Class<?>, Node> nodes = new TreeMap<>(BY_NAME);

    private StepDependencyGraph() {
    }

    static List<EngineStep> sort(List<EngineStep> steps) {
        StepDependencyGraph graph = new StepDependencyGraph();
        steps.forEach(graph::register);
        Class<?> terminal = graph.terminalStep();
        graph.linkDeclaredConstraints();
        graph.nodes.keySet().stream()
                .filter(type -> type != terminal)
                .toList()
                .forEach(type -> graph.link(type, terminal));
        return graph.drain();
    }

    private void register(EngineStep step) {
        Node previous = nodes.putIfAbsent(step.getClass(), new Node(step));
        if (previous != null) {
            throw new FormEngineException(
                    FormEngineErrorCode.DUPLICATE_ENGINE_STEP,
                    "Duplicate EngineStep bean for class: " + step.getClass().getName());
        }
    }

    private Class<?> terminalStep() {
        List<Class<?>> terminals = nodes.keySet().stream()
                .filter(type -> type.isAnnotationPresent(TerminalStep.class))
                .toList();
        if (terminals.size() != 1) {
            throw new FormEngineException(
                    FormEngineErrorCode.MISSING_TERMINAL_STEP,
                    "Exactly one @TerminalStep required, found: " + names(terminals));
        }
        return terminals.get(0);
    }

    private void linkDeclaredConstraints() {
        for (Class<?> type : List.copyOf(nodes.keySet())) {
            MustRunBefore before = type.getAnnotation(MustRunBefore.class);
            if (before != null) {
                for (Class<? extends EngineStep> later : before.value()) {
                    link(type, requireRegistered(type, later));
                }
            }
            MustRunAfter after = type.getAnnotation(MustRunAfter.class);
            if (after != null) {
                for (Class<? extends EngineStep> earlier : after.value()) {
                    link(requireRegistered(type, earlier), type);
                }
            }
        }
    }

    private Class<?> requireRegistered(Class<?> owner, Class<?> dependency) {
        if (!nodes.containsKey(dependency)) {
            throw new FormEngineException(
                    FormEngineErrorCode.MISSING_DEPENDENT_STEP,
                    owner.getSimpleName() + " depends on missing step: " + dependency.getName());
        }
        return dependency;
    }

    private void link(Class<?> earlier, Class<?> later) {
        if (earlier == later) {
            return;
        }
        if (nodes.get(earlier).successors.add(later)) {
            nodes.get(later).unresolved++;
        }
    }

    private List<EngineStep> drain() {
        NavigableSet<Class<?>> ready = new TreeSet<>(BY_NAME);
        nodes.forEach((type, node) -> {
            if (node.unresolved == 0) {
                ready.add(type);
            }
        });

        List<EngineStep> ordered = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            Node node = nodes.get(ready.pollFirst());
            ordered.add(node.step);
            for (Class<?> next : node.successors) {
                if (--nodes.get(next).unresolved == 0) {
                    ready.add(next);
                }
            }
        }

        if (ordered.size() < nodes.size()) {
            List<Class<?>> stuck = nodes.entrySet().stream()
                    .filter(e -> e.getValue().unresolved > 0)
                    .map(Map.Entry::getKey)
                    .toList();
            throw new FormEngineException(
                    FormEngineErrorCode.DAG_CYCLE,
                    "EngineStep ordering has a cycle among: " + names(stuck));
        }
        return ordered;
    }

    private static String names(List<Class<?>> types) {
        return types.stream().map(Class::getSimpleName).collect(Collectors.joining(", "));
    }

    private static final class Node {
        private final EngineStep step;
        private final Set<Class<?>> successors = new TreeSet<>(BY_NAME);
        private int unresolved;

        private Node(EngineStep step) {
            this.step = step;
        }
    }
}
