package com.ryuqq.ruledispatch.adapter.inmemory.config;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.spi.RuleConfigurationSource;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link RuleConfigurationSource} SPI for testing and reference purposes.
 *
 * <p>Enforcement flags are kept in {@link ConcurrentHashMap}s, so reads and updates are
 * thread-safe and O(1).</p>
 *
 * <p><strong>Lookup Order:</strong></p>
 * <ol>
 *   <li>Scope-specific flag: (tag, scope)</li>
 *   <li>Tag-global flag: tag</li>
 *   <li>Default flag (constructor argument, {@code true} by default)</li>
 * </ol>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No change notification; handlers read the current value on every call</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRuleConfigurationSource source = new InMemoryRuleConfigurationSource();
 * source.disable(WEEKLY_HOURS);                  // off everywhere
 * source.enable(WEEKLY_HOURS, "LOCATION-7");     // except one location
 *
 * source.isEnforced(WEEKLY_HOURS, "LOCATION-7"); // true
 * source.isEnforced(WEEKLY_HOURS, "LOCATION-1"); // false
 * </pre>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public class InMemoryRuleConfigurationSource implements RuleConfigurationSource {

    private final boolean enforcedByDefault;
    private final Map<ParameterTypeTag, Boolean> globalFlags = new ConcurrentHashMap<>();
    private final Map<ScopedKey, Boolean> scopedFlags = new ConcurrentHashMap<>();

    /**
     * Creates a source that enforces every rule unless told otherwise.
     */
    public InMemoryRuleConfigurationSource() {
        this(true);
    }

    /**
     * Creates a source with the given fallback flag.
     *
     * @param enforcedByDefault flag returned when neither a scoped nor a global flag exists
     */
    public InMemoryRuleConfigurationSource(boolean enforcedByDefault) {
        this.enforcedByDefault = enforcedByDefault;
    }

    @Override
    public boolean isEnforced(ParameterTypeTag tag, String scope) {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        if (scope != null) {
            Boolean scoped = scopedFlags.get(new ScopedKey(tag, scope));
            if (scoped != null) {
                return scoped;
            }
        }
        Boolean global = globalFlags.get(tag);
        return global != null ? global : enforcedByDefault;
    }

    /**
     * Enables a rule for every scope without a scope-specific flag.
     *
     * @param tag rule tag
     */
    public void enable(ParameterTypeTag tag) {
        globalFlags.put(requireTag(tag), Boolean.TRUE);
    }

    /**
     * Disables a rule for every scope without a scope-specific flag.
     *
     * @param tag rule tag
     */
    public void disable(ParameterTypeTag tag) {
        globalFlags.put(requireTag(tag), Boolean.FALSE);
    }

    /**
     * Enables a rule for one scope.
     *
     * @param tag rule tag
     * @param scope scope identifier
     */
    public void enable(ParameterTypeTag tag, String scope) {
        scopedFlags.put(new ScopedKey(requireTag(tag), requireScope(scope)), Boolean.TRUE);
    }

    /**
     * Disables a rule for one scope.
     *
     * @param tag rule tag
     * @param scope scope identifier
     */
    public void disable(ParameterTypeTag tag, String scope) {
        scopedFlags.put(new ScopedKey(requireTag(tag), requireScope(scope)), Boolean.FALSE);
    }

    /**
     * Removes every global and scoped flag (test cleanup).
     */
    public void clear() {
        globalFlags.clear();
        scopedFlags.clear();
    }

    private static ParameterTypeTag requireTag(ParameterTypeTag tag) {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        return tag;
    }

    private static String requireScope(String scope) {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("scope cannot be null or blank");
        }
        return scope;
    }

    private record ScopedKey(ParameterTypeTag tag, String scope) {
        ScopedKey {
            Objects.requireNonNull(tag);
            Objects.requireNonNull(scope);
        }
    }
}
