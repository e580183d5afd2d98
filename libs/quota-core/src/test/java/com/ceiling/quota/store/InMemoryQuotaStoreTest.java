package com.ceiling.quota.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.ceiling.quota.QuotaMap;
import com.ceiling.quota.QuotaOverride;
import com.ceiling.quota.Scope;
import com.ceiling.quota.ScopeParameters;
import com.ceiling.quota.Tag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryQuotaStore")
class InMemoryQuotaStoreTest {

    private static final Tag GLOBAL_DASH = new Tag("dashboards", "dashboard", Scope.GLOBAL);
    private static final Tag ORG_DASH = new Tag("dashboards", "dashboard", Scope.ORG);
    private static final Tag USER_DASH = new Tag("dashboards", "dashboard", Scope.USER);

    private final InMemoryQuotaStore store = new InMemoryQuotaStore();

    @Test
    @DisplayName("global overrides are visible to everyone")
    void globalVisibleToAll() {
        store.updateOverride(new QuotaOverride(GLOBAL_DASH, 0, 0, 500));

        assertThat(store.getOverrides(ScopeParameters.none()).get(GLOBAL_DASH)).hasValue(500);
        assertThat(store.getOverrides(new ScopeParameters(3, 4)).get(GLOBAL_DASH)).hasValue(500);
    }

    @Test
    @DisplayName("org and user overrides are visible only to their owner")
    void scopedOverridesVisibleToOwner() {
        store.updateOverride(new QuotaOverride(ORG_DASH, 3, 0, 50));
        store.updateOverride(new QuotaOverride(USER_DASH, 0, 4, 5));

        QuotaMap owner = store.getOverrides(new ScopeParameters(3, 4));
        QuotaMap stranger = store.getOverrides(new ScopeParameters(9, 9));
        QuotaMap anonymous = store.getOverrides(ScopeParameters.none());

        assertThat(owner.get(ORG_DASH)).hasValue(50);
        assertThat(owner.get(USER_DASH)).hasValue(5);
        assertThat(stranger.isEmpty()).isTrue();
        assertThat(anonymous.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("writing the same override twice replaces the limit")
    void upserts() {
        store.updateOverride(new QuotaOverride(ORG_DASH, 3, 0, 50));
        store.updateOverride(new QuotaOverride(ORG_DASH, 3, 0, 80));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.getOverrides(ScopeParameters.forOrg(3)).get(ORG_DASH)).hasValue(80);
    }

    @Test
    @DisplayName("deleting a user's overrides leaves other overrides in place")
    void deleteForUser() {
        store.updateOverride(new QuotaOverride(USER_DASH, 0, 4, 5));
        store.updateOverride(new QuotaOverride(USER_DASH, 0, 5, 6));
        store.updateOverride(new QuotaOverride(ORG_DASH, 4, 0, 50));

        store.deleteOverridesForUser(4);

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.getOverrides(ScopeParameters.forUser(4)).isEmpty()).isTrue();
        assertThat(store.getOverrides(ScopeParameters.forOrg(4)).get(ORG_DASH)).hasValue(50);
    }
}
