package com.ceiling.quota;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ceiling.quota.testing.StubUsageReporter;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DisabledQuotaService")
class DisabledQuotaServiceTest {

    private final DisabledQuotaService service = new DisabledQuotaService();

    private static void assertDisabled(ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOf(QuotaException.class)
                .extracting(e -> ((QuotaException) e).code())
                .isEqualTo(QuotaErrorCode.FEATURE_DISABLED);
    }

    @Test
    @DisplayName("decisions fail with FEATURE_DISABLED")
    void decisionsFail() {
        assertDisabled(() -> service.checkQuotaReached("dashboards", ScopeParameters.none()));
        assertDisabled(() -> service.checkQuotaReachedForRequest(RequestContext.anonymous(), "dashboards"));
        assertDisabled(() -> service.checkQuotaReachedForRequest(null, "dashboards"));
    }

    @Test
    @DisplayName("listing and overrides fail with FEATURE_DISABLED")
    void administrationFails() {
        assertDisabled(() -> service.listQuotas("org", 1));
        assertDisabled(() -> service.updateQuota(new UpdateQuotaCommand("dashboard", 5, 1, 0)));
        assertDisabled(() -> service.deleteByUser(1));
    }

    @Test
    @DisplayName("registration succeeds and is ignored")
    void registrationIgnored() {
        var registration = new QuotaReporterRegistration("dashboards", new StubUsageReporter(), new QuotaMap());

        assertThatCode(() -> service.registerUsageSource(registration)).doesNotThrowAnyException();
        assertThatCode(() -> service.registerUsageSource(registration)).doesNotThrowAnyException();
        assertThat(service.isEnabled()).isFalse();
    }
}
