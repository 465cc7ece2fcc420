package com.manning.macaroons;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a first-party caveat condition holds. An unmet condition
 * is signalled by throwing; verification stops and the exception reaches
 * the caller of {@link Macaroon#verify} unchanged.
 */
@FunctionalInterface
public interface ConditionChecker {
    void check(String condition);

    /**
     * Accepts a condition if either this checker or {@code other} accepts
     * it. When both reject, the exception from {@code other} is thrown with
     * the first rejection attached as suppressed.
     */
    default ConditionChecker or(ConditionChecker other) {
        return condition -> {
            try {
                check(condition);
            } catch (RuntimeException first) {
                try {
                    other.check(condition);
                } catch (RuntimeException second) {
                    if (second != first) {
                        second.addSuppressed(first);
                    }
                    throw second;
                }
            }
        };
    }

    static ConditionChecker exact(Set<String> satisfied) {
        var conditions = Set.copyOf(satisfied);
        return condition -> {
            if (!conditions.contains(condition)) {
                throw new CaveatNotSatisfiedException(condition);
            }
        };
    }

    static ConditionChecker exact(String... satisfied) {
        return exact(Set.copyOf(List.of(satisfied)));
    }

    static ConditionChecker never() {
        return condition -> {
            throw new CaveatNotSatisfiedException(condition);
        };
    }
}
