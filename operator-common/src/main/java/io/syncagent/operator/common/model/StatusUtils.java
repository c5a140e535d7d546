/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.operator.common.model;

import io.syncagent.api.model.common.Condition;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Utility methods for working with status conditions
 */
public class StatusUtils {
    private static final DateTimeFormatter ISO8601 = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssX").withZone(ZoneOffset.UTC);

    private StatusUtils() {
        // Utility class
    }

    /**
     * Formats the instant as ISO 8601 timestamp with second precision, as used by Kubernetes
     *
     * @param instant   The instant
     *
     * @return  Formatted timestamp
     */
    public static String iso8601(Instant instant) {
        return ISO8601.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Returns a new list of conditions where the condition with the same type as the new condition is replaced by it.
     * When no condition of that type exists, the new condition is appended. The other conditions keep their order.
     * An existing condition which differs from the new one only in its transition time is kept as it is.
     *
     * @param existing      Existing conditions (can be null)
     * @param condition     The new condition
     *
     * @return  New list with the updated conditions
     */
    public static List<Condition> setCondition(List<Condition> existing, Condition condition) {
        List<Condition> updated = new ArrayList<>(existing != null ? existing.size() + 1 : 1);
        boolean replaced = false;

        if (existing != null) {
            for (Condition c : existing) {
                if (c.getType() != null && c.getType().equals(condition.getType())) {
                    if (!replaced) {
                        updated.add(isSameExceptTransitionTime(c, condition) ? c : condition);
                        replaced = true;
                    }
                } else {
                    updated.add(c);
                }
            }
        }

        if (!replaced) {
            updated.add(condition);
        }

        return updated;
    }

    private static boolean isSameExceptTransitionTime(Condition existing, Condition condition) {
        return Objects.equals(existing.getType(), condition.getType())
                && Objects.equals(existing.getStatus(), condition.getStatus())
                && Objects.equals(existing.getReason(), condition.getReason())
                && Objects.equals(existing.getMessage(), condition.getMessage());
    }
}
