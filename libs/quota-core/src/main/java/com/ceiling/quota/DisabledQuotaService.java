package com.ceiling.quota;

import java.util.List;

/**
 * {@link QuotaService} installed when quota enforcement is switched off.
 * <p>
 * Every decision, listing and override operation fails with
 * {@link QuotaErrorCode#FEATURE_DISABLED}. Registration is accepted and ignored, so services can
 * register unconditionally at startup.
 */
public final class DisabledQuotaService implements QuotaService {

    @Override
    public boolean checkQuotaReachedForRequest(RequestContext requestContext, String targetService) {
        throw QuotaException.disabled();
    }

    @Override
    public boolean checkQuotaReached(String targetService, ScopeParameters scopeParameters, ReportContext parent) {
        throw QuotaException.disabled();
    }

    @Override
    public List<QuotaStatus> listQuotas(String scope, long id, ReportContext parent) {
        throw QuotaException.disabled();
    }

    @Override
    public void updateQuota(UpdateQuotaCommand command) {
        throw QuotaException.disabled();
    }

    @Override
    public void deleteByUser(long userId) {
        throw QuotaException.disabled();
    }

    @Override
    public void registerUsageSource(QuotaReporterRegistration registration) {
        // accepted and dropped
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
