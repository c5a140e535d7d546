/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.apiextensions;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.syncagent.agent.metrics.ReconcilerMetrics;
import io.syncagent.agent.resource.kubernetes.CrdOperator;
import io.syncagent.agent.resource.kubernetes.CustomResourceDefinitionOperator;
import io.syncagent.api.model.apiextensions.Composition;
import io.syncagent.api.model.apiextensions.CompositionList;
import io.syncagent.operator.common.MicrometerMetricsProvider;
import io.syncagent.operator.common.Reconciliation;
import io.syncagent.operator.common.ReconciliationException;
import io.vertx.core.Future;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static io.syncagent.agent.util.AgentTestFixtures.WAITS;
import static io.syncagent.agent.util.AgentTestFixtures.composition;
import static io.syncagent.agent.util.AgentTestFixtures.compositionReconciliation;
import static io.syncagent.agent.util.AgentTestFixtures.compositions;
import static io.syncagent.agent.util.AgentTestFixtures.crd;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("apiextensions-unit")
@ExtendWith(VertxExtension.class)
public class ExtensionReconcilerTest {
    private static final RuntimeException BOOM = new RuntimeException("boom");
    private static final String NAME = "my-composition";

    private CustomResourceDefinitionOperator crdOps;
    private CrdOperator<KubernetesClient, Composition, CompositionList> localOps;
    private CrdOperator<KubernetesClient, Composition, CompositionList> remoteOps;
    private SimpleMeterRegistry registry;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setup() {
        crdOps = mock(CustomResourceDefinitionOperator.class);
        localOps = mock(CrdOperator.class);
        remoteOps = mock(CrdOperator.class);
        registry = new SimpleMeterRegistry();

        when(crdOps.getAsync(null, Composition.CRD_NAME)).thenReturn(Future.succeededFuture(crd(Composition.CRD_NAME, "True")));
        when(remoteOps.getAsync(null, NAME)).thenAnswer(i -> Future.succeededFuture(composition(NAME)));
        when(localOps.createOrUpdate(any(), any())).thenAnswer(i -> Future.succeededFuture(i.getArgument(1)));
        when(localOps.listAsync(any())).thenAnswer(i -> Future.succeededFuture(compositions(NAME)));
        when(remoteOps.listAsync(any())).thenAnswer(i -> Future.succeededFuture(compositions(NAME)));
        when(localOps.deleteAsync(any(), any(), any())).thenReturn(Future.succeededFuture());
    }

    private ExtensionReconciler<Composition, CompositionList> reconciler() {
        return new ExtensionReconciler<>(Composition.CRD_NAME, crdOps, localOps, remoteOps, ApiExtensionsKinds.COMPOSITIONS, WAITS)
                .withMetrics(new ReconcilerMetrics(Composition.RESOURCE_KIND, new MicrometerMetricsProvider(registry)));
    }

    private static void assertError(Throwable error, String message) {
        assertThat(error, instanceOf(ReconciliationException.class));
        assertThat(error.getMessage(), is(message));
        assertThat(((ReconciliationException) error).getResult(), is(WAITS.requeueShort()));
    }

    @Test
    public void testFailedCrdGet(VertxTestContext context) {
        when(crdOps.getAsync(null, Composition.CRD_NAME)).thenReturn(Future.failedFuture(BOOM));

        reconciler().reconcile(compositionReconciliation(NAME))
                .onComplete(context.failing(error -> context.verify(() -> {
                    assertError(error, "local: get custom resource definition failed: boom");
                    verify(remoteOps, never()).getAsync(any(), any());

                    context.completeNow();
                })));
    }

    @Test
    public void testCrdNotEstablished(VertxTestContext context) {
        when(crdOps.getAsync(null, Composition.CRD_NAME)).thenReturn(Future.succeededFuture(crd(Composition.CRD_NAME, "False")));

        reconciler().reconcile(compositionReconciliation(NAME))
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result, is(WAITS.requeueTiny()));
                    verify(remoteOps, never()).getAsync(any(), any());
                    verify(localOps, never()).listAsync(any());

                    context.completeNow();
                })));
    }

    @Test
    public void testMissingCrdIsTreatedAsNotEstablished(VertxTestContext context) {
        when(crdOps.getAsync(null, Composition.CRD_NAME)).thenReturn(Future.succeededFuture(null));

        reconciler().reconcile(compositionReconciliation(NAME))
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result, is(WAITS.requeueTiny()));

                    context.completeNow();
                })));
    }

    @Test
    public void testFailedRemoteGet(VertxTestContext context) {
        when(remoteOps.getAsync(null, NAME)).thenReturn(Future.failedFuture(BOOM));

        reconciler().reconcile(compositionReconciliation(NAME))
                .onComplete(context.failing(error -> context.verify(() -> {
                    assertError(error, "remote: get instance of compositions.apiextensions.crossplane.io failed: boom");
                    verify(localOps, never()).createOrUpdate(any(), any());

                    context.completeNow();
                })));
    }

    @Test
    public void testFailedApply(VertxTestContext context) {
        when(localOps.createOrUpdate(any(), any())).thenReturn(Future.failedFuture(BOOM));

        reconciler().reconcile(compositionReconciliation(NAME))
                .onComplete(context.failing(error -> context.verify(() -> {
                    assertError(error, "local: apply instance of compositions.apiextensions.crossplane.io failed: boom");
                    verify(localOps, never()).listAsync(any());

                    context.completeNow();
                })));
    }

    @Test
    public void testFailedLocalList(VertxTestContext context) {
        when(localOps.listAsync(any())).thenReturn(Future.failedFuture(BOOM));

        reconciler().reconcile(compositionReconciliation(NAME))
                .onComplete(context.failing(error -> context.verify(() -> {
                    assertError(error, "local: list instances of compositions.apiextensions.crossplane.io failed: boom");
                    verify(remoteOps, never()).listAsync(any());

                    context.completeNow();
                })));
    }

    @Test
    public void testFailedRemoteList(VertxTestContext context) {
        when(remoteOps.listAsync(any())).thenReturn(Future.failedFuture(BOOM));

        reconciler().reconcile(compositionReconciliation(NAME))
                .onComplete(context.failing(error -> context.verify(() -> {
                    assertError(error, "remote: list instances of compositions.apiextensions.crossplane.io failed: boom");
                    verify(localOps, never()).deleteAsync(any(), any(), any());

                    context.completeNow();
                })));
    }

    @Test
    public void testAppliedInstanceIsSanitized(VertxTestContext context) {
        reconciler().reconcile(compositionReconciliation(NAME))
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result, is(WAITS.requeueLong()));

                    ArgumentCaptor<Composition> captor = ArgumentCaptor.forClass(Composition.class);
                    verify(localOps, times(1)).createOrUpdate(any(), captor.capture());
                    assertThat(captor.getValue().getMetadata().getName(), is(NAME));
                    assertThat(captor.getValue().getMetadata().getUid(), is(nullValue()));
                    assertThat(captor.getValue().getMetadata().getResourceVersion(), is(nullValue()));

                    verify(localOps, never()).deleteAsync(any(), any(), any());

                    context.completeNow();
                })));
    }

    @Test
    public void testMissingRemoteInstanceIsNotApplied(VertxTestContext context) {
        when(remoteOps.getAsync(null, NAME)).thenReturn(Future.succeededFuture(null));
        when(localOps.listAsync(any())).thenAnswer(i -> Future.succeededFuture(compositions(NAME)));
        when(remoteOps.listAsync(any())).thenAnswer(i -> Future.succeededFuture(compositions()));

        reconciler().reconcile(compositionReconciliation(NAME))
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result, is(WAITS.requeueLong()));

                    verify(localOps, never()).createOrUpdate(any(), any());
                    verify(localOps, times(1)).deleteAsync(any(), isNull(), eq(NAME));

                    context.completeNow();
                })));
    }

    @Test
    public void testOrphanedInstanceIsDeleted(VertxTestContext context) {
        when(remoteOps.getAsync(null, "a")).thenAnswer(i -> Future.succeededFuture(composition("a")));
        when(localOps.listAsync(any())).thenAnswer(i -> Future.succeededFuture(compositions("a", "b")));
        when(remoteOps.listAsync(any())).thenAnswer(i -> Future.succeededFuture(compositions("a")));

        reconciler().reconcile(compositionReconciliation("a"))
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result, is(WAITS.requeueLong()));

                    verify(localOps, times(1)).deleteAsync(any(), any(), any());
                    verify(localOps, times(1)).deleteAsync(any(), isNull(), eq("b"));

                    context.completeNow();
                })));
    }

    @Test
    public void testNothingIsDeletedWhenRemoteHasMore(VertxTestContext context) {
        when(remoteOps.getAsync(null, "a")).thenAnswer(i -> Future.succeededFuture(composition("a")));
        when(localOps.listAsync(any())).thenAnswer(i -> Future.succeededFuture(compositions("a")));
        when(remoteOps.listAsync(any())).thenAnswer(i -> Future.succeededFuture(compositions("a", "b")));

        reconciler().reconcile(compositionReconciliation("a"))
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result, is(WAITS.requeueLong()));
                    verify(localOps, never()).deleteAsync(any(), any(), any());

                    context.completeNow();
                })));
    }

    @Test
    public void testFirstFailedDeletionAbortsTheRest(VertxTestContext context) {
        when(localOps.listAsync(any())).thenAnswer(i -> Future.succeededFuture(compositions(NAME, "b", "c")));
        when(localOps.deleteAsync(any(), any(), eq("b"))).thenReturn(Future.failedFuture(BOOM));

        reconciler().reconcile(compositionReconciliation(NAME))
                .onComplete(context.failing(error -> context.verify(() -> {
                    assertError(error, "local: delete instance of compositions.apiextensions.crossplane.io failed: boom");

                    verify(localOps, times(1)).deleteAsync(any(), any(), eq("b"));
                    verify(localOps, never()).deleteAsync(any(), any(), eq("c"));

                    context.completeNow();
                })));
    }

    @Test
    public void testReconciliationIsIdempotent(VertxTestContext context) {
        when(localOps.listAsync(any())).thenAnswer(i -> Future.succeededFuture(compositions(NAME, "b")));
        ExtensionReconciler<Composition, CompositionList> reconciler = reconciler();
        Reconciliation reconciliation = compositionReconciliation(NAME);

        reconciler.reconcile(reconciliation)
                .compose(first -> reconciler.reconcile(reconciliation)
                        .map(second -> List.of(first, second)))
                .onComplete(context.succeeding(results -> context.verify(() -> {
                    assertThat(results.get(0), is(WAITS.requeueLong()));
                    assertThat(results.get(1), is(results.get(0)));

                    verify(localOps, times(2)).deleteAsync(any(), any(), eq("b"));
                    assertThat(registry.get("sync_agent.reconciliations.successful").tag("kind", Composition.RESOURCE_KIND).counter().count(), is(2.0));

                    context.completeNow();
                })));
    }

    @Test
    public void testOrphans() {
        List<Composition> orphans = ExtensionReconciler.orphans(compositions("a", "b", "c").getItems(), compositions("b", "d").getItems());

        assertThat(orphans.size(), is(2));
        assertThat(orphans.get(0).getMetadata().getName(), is("a"));
        assertThat(orphans.get(1).getMetadata().getName(), is("c"));
        assertThat(ExtensionReconciler.orphans(List.<Composition>of(), compositions("a").getItems()).isEmpty(), is(true));
    }

    @Test
    public void testMetricsDefaultToFirstUse() {
        ExtensionReconciler<Composition, CompositionList> reconciler = new ExtensionReconciler<>(Composition.CRD_NAME, crdOps, localOps, remoteOps, ApiExtensionsKinds.COMPOSITIONS, WAITS);

        ReconcilerMetrics metrics = reconciler.metrics();
        assertThat(reconciler.metrics(), is(sameInstance(metrics)));

        ReconcilerMetrics configured = new ReconcilerMetrics(Composition.RESOURCE_KIND, new MicrometerMetricsProvider(registry));
        assertThat(reconciler.withMetrics(configured).metrics(), is(sameInstance(configured)));
    }
}
