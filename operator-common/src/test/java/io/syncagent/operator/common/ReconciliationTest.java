/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.operator.common;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

public class ReconciliationTest {
    @Test
    public void testNamespacedReconciliation() {
        Reconciliation reconciliation = new Reconciliation("watch", "PostgreSQLInstance", "team-a", "db");

        assertThat(reconciliation.kind(), is("PostgreSQLInstance"));
        assertThat(reconciliation.namespace(), is("team-a"));
        assertThat(reconciliation.name(), is("db"));
        assertThat(reconciliation.toString(), containsString("(watch) PostgreSQLInstance(team-a/db)"));
        assertThat(reconciliation.getMarker().getName(), is("PostgreSQLInstance(team-a/db)"));
    }

    @Test
    public void testClusterScopedReconciliation() {
        Reconciliation reconciliation = new Reconciliation("timer", "Composition", null, "my-composition");

        assertThat(reconciliation.namespace(), is(nullValue()));
        assertThat(reconciliation.toString(), containsString("(timer) Composition(my-composition)"));
    }
}
