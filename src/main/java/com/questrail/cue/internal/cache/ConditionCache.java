package com.questrail.cue.internal.cache;

import com.questrail.cue.condition.Condition;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Memoizes parsed conditions by normalized source text.
 *
 * <p>
 * Only successful parses are stored; a parser that throws leaves the cache
 * unchanged and the exception reaches the caller. Conditions are immutable,
 * so one cached tree is shared by every actor and thread.
 * </p>
 */
public final class ConditionCache
{
    private final ConcurrentHashMap<String, Condition> entries = new ConcurrentHashMap<>();

    public Condition computeIfAbsent(String normalizedText, Function<String, Condition> parser) {
        Objects.requireNonNull(normalizedText, "normalizedText");
        Objects.requireNonNull(parser, "parser");
        return entries.computeIfAbsent(normalizedText, parser);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
