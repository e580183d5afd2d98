package com.ceiling.quota;

/**
 * A resolved override write, as handed to the {@link QuotaStore}.
 *
 * @param tag    the default-limit tag being overridden
 * @param orgId  owning organization for org-scoped tags, otherwise 0
 * @param userId owning user for user-scoped tags, otherwise 0
 * @param limit  the override value
 */
public record QuotaOverride(Tag tag, long orgId, long userId, long limit) {

    public QuotaOverride {
        if (tag == null) {
            throw new IllegalArgumentException("tag must not be null");
        }
        switch (tag.scope()) {
            case GLOBAL -> {
                orgId = 0;
                userId = 0;
            }
            case ORG -> {
                if (orgId == 0) {
                    throw new IllegalArgumentException("org override requires an orgId: " + tag);
                }
                userId = 0;
            }
            case USER -> {
                if (userId == 0) {
                    throw new IllegalArgumentException("user override requires a userId: " + tag);
                }
                orgId = 0;
            }
        }
    }
}
