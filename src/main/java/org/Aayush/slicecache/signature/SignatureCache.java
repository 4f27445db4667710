package org.Aayush.slicecache.signature;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caller-owned memo of parsed signature text.
 *
 * <p>Instances are passed explicitly into a resolver and may be shared across calls and
 * threads. Failed parses are cached too, so legacy text is rejected without re-parsing.
 * Call {@link #invalidate()} when the underlying storage changes (for example after a
 * workspace switch).</p>
 */
public final class SignatureCache {
    private final ConcurrentMap<String, SignatureCodec.ParseResult> resultsByText = new ConcurrentHashMap<>();

    /**
     * Returns the parse result for one signature text, parsing at most once per text.
     *
     * @param text serialized signature (nullable).
     * @return tagged parse result.
     */
    public SignatureCodec.ParseResult parse(String text) {
        if (text == null) {
            return SignatureCodec.parse(null);
        }
        return resultsByText.computeIfAbsent(text, SignatureCodec::parse);
    }

    /**
     * Drops every cached entry.
     */
    public void invalidate() {
        resultsByText.clear();
    }

    /**
     * Returns current number of cached signature texts.
     */
    public int size() {
        return resultsByText.size();
    }
}
