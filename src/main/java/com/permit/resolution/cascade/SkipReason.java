package com.permit.resolution.cascade;

/**
 * Why a mention was rejected by the cascade.
 */
public enum SkipReason {
    EMPTY_NAME,
    MISSING_PERMIT_ID,
    INVALID_RECORD
}
