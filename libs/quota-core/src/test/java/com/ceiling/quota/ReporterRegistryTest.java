package com.ceiling.quota;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ceiling.quota.testing.StubUsageReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ReporterRegistry")
class ReporterRegistryTest {

    private ReporterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ReporterRegistry();
    }

    @Test
    @DisplayName("looks up registered reporters")
    void looksUpRegisteredReporters() {
        var reporter = new StubUsageReporter();
        registry.register("dashboards", reporter);

        assertThat(registry.lookup("dashboards")).containsSame(reporter);
        assertThat(registry.lookup("alerts")).isEmpty();
    }

    @Test
    @DisplayName("rejects a second registration and keeps the first reporter")
    void rejectsDuplicateRegistration() {
        var first = new StubUsageReporter();
        registry.register("dashboards", first);

        assertThatThrownBy(() -> registry.register("dashboards", new StubUsageReporter()))
                .isInstanceOf(QuotaException.class)
                .extracting(e -> ((QuotaException) e).code())
                .isEqualTo(QuotaErrorCode.REGISTRATION_CONFLICT);
        assertThat(registry.lookup("dashboards")).containsSame(first);
        assertThat(registry.snapshot()).containsOnlyKeys("dashboards");
    }

    @Test
    @DisplayName("snapshot is detached from later registrations")
    void snapshotIsDetached() {
        registry.register("dashboards", new StubUsageReporter());
        var snapshot = registry.snapshot();

        registry.register("alerts", new StubUsageReporter());

        assertThat(snapshot).containsOnlyKeys("dashboards");
        assertThat(registry.snapshot()).containsOnlyKeys("dashboards", "alerts");
    }

    @Test
    @DisplayName("rejects blank service ids and null reporters")
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> registry.register(" ", new StubUsageReporter()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("alerts", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
