package com.questrail.cue.action;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Ordered, immutable sequence of actions owned by a single parent.
 */
public record ActionList(List<Action> actions)
{
    private static final ActionList EMPTY = new ActionList(List.of());

    public ActionList {
        Objects.requireNonNull(actions, "actions");
        actions = List.copyOf(actions);
    }

    public static ActionList empty() {
        return EMPTY;
    }

    public static ActionList of(Action... actions) {
        return new ActionList(List.of(actions));
    }

    public int size() {
        return actions.size();
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public Action get(int index) {
        return actions.get(index);
    }

    public List<String> keywords() {
        return actions.stream()
                .map(a -> a.type().keyword())
                .collect(Collectors.toList());
    }

    /**
     * Human-readable count of actions per keyword, e.g.
     * {@code ActionList(3 actions: delay: 1, tell: 2)}.
     */
    public String summary() {
        if (actions.isEmpty()) {
            return "Empty action list";
        }
        Map<String, Long> counts = actions.stream()
                .collect(Collectors.groupingBy(a -> a.type().keyword(), TreeMap::new, Collectors.counting()));
        String perType = counts.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", "));
        return "ActionList(" + actions.size() + " actions: " + perType + ")";
    }
}
