package com.ceiling.quota;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ceiling.quota.testing.StubUsageReporter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QuotaReporterRegistration")
class QuotaReporterRegistrationTest {

    private static final Tag ORG_DASH = new Tag("dashboards", "dashboard", Scope.ORG);
    private static final Tag ORG_ALERTS = new Tag("alerting", "alert_rule", Scope.ORG);

    @Test
    @DisplayName("rejects default limits owned by another service")
    void rejectsForeignTags() {
        var defaults = new QuotaMap().put(ORG_DASH, 10).put(ORG_ALERTS, 5);

        assertThatThrownBy(() -> new QuotaReporterRegistration("dashboards", new StubUsageReporter(), defaults))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alerting:alert_rule:org");
    }

    @Test
    @DisplayName("later changes to the caller's map do not reach the registration")
    void keepsOwnCopyOfDefaults() {
        var defaults = new QuotaMap().put(ORG_DASH, 10);
        var registration = new QuotaReporterRegistration("dashboards", new StubUsageReporter(), defaults);

        defaults.put(ORG_ALERTS, 5);
        defaults.put(ORG_DASH, 0);
        registration.defaultLimits().put(ORG_ALERTS, 5);

        assertThat(registration.defaultLimits().size()).isEqualTo(1);
        assertThat(registration.defaultLimits().get(ORG_DASH)).hasValue(10);
        assertThat(registration.defaultLimits().get(ORG_ALERTS)).isEmpty();
    }

    @Test
    @DisplayName("missing default limits become an empty map")
    void nullDefaultsBecomeEmpty() {
        var registration = new QuotaReporterRegistration("dashboards", new StubUsageReporter(), null);

        assertThat(registration.defaultLimits().isEmpty()).isTrue();
    }
}
