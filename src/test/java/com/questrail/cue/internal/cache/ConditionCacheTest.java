package com.questrail.cue.internal.cache;

import com.questrail.cue.condition.Condition;
import com.questrail.cue.condition.Permission;
import com.questrail.cue.internal.parse.ConditionParser;
import com.questrail.cue.internal.parse.CueParseException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConditionCacheTest {

    private final ConditionParser parser = new ConditionParser(16);

    @Test
    void parsesOncePerText() {
        ConditionCache cache = new ConditionCache();
        AtomicInteger parses = new AtomicInteger();

        Condition first = cache.computeIfAbsent("perm a", t -> {
            parses.incrementAndGet();
            return parser.parse(t);
        });
        Condition second = cache.computeIfAbsent("perm a", t -> {
            parses.incrementAndGet();
            return parser.parse(t);
        });

        assertSame(first, second);
        assertEquals(Permission.of("a"), first);
        assertEquals(1, parses.get());
        assertEquals(1, cache.size());
    }

    @Test
    void failuresAreNotCached() {
        ConditionCache cache = new ConditionCache();

        assertThrows(CueParseException.class, () -> cache.computeIfAbsent("any []", parser::parse));
        assertEquals(0, cache.size());
    }

    @Test
    void clearEmptiesTheCache() {
        ConditionCache cache = new ConditionCache();
        cache.computeIfAbsent("perm a", parser::parse);
        cache.computeIfAbsent("perm b", parser::parse);

        cache.clear();

        assertEquals(0, cache.size());
    }
}
