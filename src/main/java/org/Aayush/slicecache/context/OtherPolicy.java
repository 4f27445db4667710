package org.Aayush.slicecache.context;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * How a dimension treats its catch-all {@value ContextDefinitions#OTHER} value.
 *
 * <p>The policy decides which values a complete partition must contain and whether a
 * partition may be summed away at all.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum OtherPolicy {
    /** Listed values are MECE without a catch-all; {@code other} is never expected. */
    NULL("null", true),
    /** A catch-all holds whatever is left; {@code other} is always expected, listed or not. */
    COMPUTED("computed", true),
    /** Listed values, {@code other} included if listed, are MECE as declared. */
    EXPLICIT("explicit", true),
    /** Listed values do not partition the universe; {@code other} is never expected. */
    UNDEFINED("undefined", false);

    /** Stable id used in diagnostics. */
    private final String id;
    /** Whether a complete partition may be summed into a total. */
    private final boolean reducible;
}
