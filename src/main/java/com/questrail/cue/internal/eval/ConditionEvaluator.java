package com.questrail.cue.internal.eval;

import com.questrail.cue.api.PermissionLookup;
import com.questrail.cue.api.PlaceholderResolver;
import com.questrail.cue.condition.All;
import com.questrail.cue.condition.Any;
import com.questrail.cue.condition.Condition;
import com.questrail.cue.condition.Not;
import com.questrail.cue.condition.Permission;
import com.questrail.cue.condition.PlaceholderComparison;

import java.util.Objects;

/**
 * ConditionEvaluator
 * =============================================================================
 * Evaluates a {@link Condition} tree against one actor.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@code Any} / {@code All} short-circuit left to right</li>
 *   <li>a placeholder without operator is true when the resolved value is
 *       non-empty and differs from the key</li>
 *   <li>a placeholder resolved to {@code null} is false</li>
 * </ul>
 *
 * Exceptions from the collaborators propagate to the caller unchanged; the
 * executor turns them into evaluation errors.
 *
 * @param <A> the host's actor type
 */
public final class ConditionEvaluator<A>
{
    private final PermissionLookup<A> permissions;
    private final PlaceholderResolver<A> placeholders;

    public ConditionEvaluator(PermissionLookup<A> permissions, PlaceholderResolver<A> placeholders) {
        this.permissions = Objects.requireNonNull(permissions, "permissions");
        this.placeholders = Objects.requireNonNull(placeholders, "placeholders");
    }

    public boolean evaluate(Condition condition, A actor) {
        Objects.requireNonNull(condition, "condition");

        if (condition instanceof Permission p) {
            return permissions.hasPermission(actor, p.value()) != p.negated();
        }
        if (condition instanceof PlaceholderComparison pc) {
            return placeholder(pc, actor);
        }
        if (condition instanceof Any any) {
            for (Condition child : any.children()) {
                if (evaluate(child, actor)) {
                    return true;
                }
            }
            return false;
        }
        if (condition instanceof All all) {
            for (Condition child : all.children()) {
                if (!evaluate(child, actor)) {
                    return false;
                }
            }
            return true;
        }
        if (condition instanceof Not not) {
            return !evaluate(not.child(), actor);
        }
        throw new IllegalStateException("Unhandled condition: " + condition.getClass().getName());
    }

    private boolean placeholder(PlaceholderComparison pc, A actor) {
        String resolved = placeholders.resolve(actor, pc.key());
        if (resolved == null) {
            return false;
        }
        if (pc.operator().isEmpty()) {
            return !resolved.isEmpty() && !resolved.equals(pc.key());
        }
        return pc.operator().get().compare(resolved, pc.rhs().orElseThrow());
    }
}
