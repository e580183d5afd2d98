package com.ceiling.quota;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ceiling.quota.store.InMemoryQuotaStore;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LimitResolver")
class LimitResolverTest {

    private static final Tag GLOBAL_DASH = new Tag("dashboards", "dashboard", Scope.GLOBAL);
    private static final Tag ORG_DASH = new Tag("dashboards", "dashboard", Scope.ORG);
    private static final Tag USER_DASH = new Tag("dashboards", "dashboard", Scope.USER);
    private static final Tag ORG_ALERTS = new Tag("alerting", "alert_rule", Scope.ORG);

    private QuotaMap defaults;
    private InMemoryQuotaStore store;
    private LimitResolver resolver;

    @BeforeEach
    void setUp() {
        defaults = new QuotaMap()
                .put(GLOBAL_DASH, -1)
                .put(ORG_DASH, 100)
                .put(USER_DASH, 10)
                .put(ORG_ALERTS, 50);
        store = new InMemoryQuotaStore();
        resolver = new LimitResolver(defaults, store);
    }

    @Test
    @DisplayName("returns only the requested service's tags, in default order")
    void returnsOnlyRequestedService() {
        Map<Tag, Long> limits = resolver.resolve("dashboards", new ScopeParameters(1, 2));

        assertThat(limits.keySet()).containsExactly(GLOBAL_DASH, ORG_DASH, USER_DASH);
        assertThat(limits).containsEntry(ORG_DASH, 100L).containsEntry(USER_DASH, 10L);
    }

    @Test
    @DisplayName("substitutes the caller's overrides for defaults")
    void substitutesOverrides() {
        store.updateOverride(new QuotaOverride(ORG_DASH, 1, 0, 250));
        store.updateOverride(new QuotaOverride(ORG_DASH, 9, 0, 3));

        Map<Tag, Long> limits = resolver.resolve("dashboards", new ScopeParameters(1, 2));

        assertThat(limits).containsEntry(ORG_DASH, 250L);
        assertThat(limits).containsEntry(USER_DASH, 10L);
    }

    @Test
    @DisplayName("without scope parameters only global tags apply")
    void noneRestrictsToGlobal() {
        Map<Tag, Long> limits = resolver.resolve("dashboards", ScopeParameters.none());

        assertThat(limits).containsOnlyKeys(GLOBAL_DASH);
    }

    @Test
    @DisplayName("org-only parameters leave user tags out")
    void orgOnlyParametersSkipUserTags() {
        Map<Tag, Long> limits = resolver.resolve("dashboards", ScopeParameters.forOrg(4));

        assertThat(limits).containsOnlyKeys(GLOBAL_DASH, ORG_DASH);
    }

    @Test
    @DisplayName("propagates the store's failure unchanged")
    void propagatesStoreFailure() {
        QuotaStore failing = mock(QuotaStore.class);
        var failure = new IllegalStateException("database unavailable");
        when(failing.getOverrides(any())).thenThrow(failure);

        var failingResolver = new LimitResolver(defaults, failing);

        assertThatThrownBy(() -> failingResolver.resolve("dashboards", ScopeParameters.none()))
                .isSameAs(failure);
    }

    @Test
    @DisplayName("sees defaults merged after construction")
    void seesLaterDefaults() {
        Tag lateTag = new Tag("dashboards", "folder", Scope.GLOBAL);
        defaults.put(lateTag, 5);

        assertThat(resolver.resolve("dashboards", ScopeParameters.none())).containsEntry(lateTag, 5L);
    }
}
