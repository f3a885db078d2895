package com.hcltech.lineage;

import com.hcltech.lineage.common.IEnvGetter;

/**
 * Knobs for hierarchy construction and lookup.
 *
 * @param chainValidation when a chain node with two children is reported
 * @param strictLifecycle if true, resolving against a hierarchy that has not been frozen fails
 */
public record LineageConfig(ChainValidationMode chainValidation, boolean strictLifecycle) {
    public static final String CHAIN_VALIDATION_ENV = "LINEAGE_CHAIN_VALIDATION";
    public static final String STRICT_LIFECYCLE_ENV = "LINEAGE_STRICT_LIFECYCLE";

    public enum ChainValidationMode {
        /** Registering a second child under a chain node throws. */
        EAGER,
        /** Registration is allowed; the resolver throws if its walk meets the branch. */
        DEFERRED
    }

    public LineageConfig {
        if (chainValidation == null) throw new IllegalArgumentException("chainValidation must not be null");
    }

    public static LineageConfig defaults() {
        return new LineageConfig(ChainValidationMode.EAGER, false);
    }

    public static LineageConfig fromEnv(IEnvGetter env) {
        var d = defaults();
        return new LineageConfig(
                IEnvGetter.getEnumOr(env, CHAIN_VALIDATION_ENV, ChainValidationMode.class, d.chainValidation()),
                IEnvGetter.getBooleanOr(env, STRICT_LIFECYCLE_ENV, d.strictLifecycle()));
    }
}
