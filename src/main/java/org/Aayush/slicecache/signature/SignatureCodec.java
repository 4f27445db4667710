package org.Aayush.slicecache.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Total parser and canonical serializer for persisted signature text.
 *
 * <p>The persisted form is {@code {"c":"<coreHash>","x":{"<dimension>":"<hash>",...}}}.
 * Parsing never throws: malformed or legacy text yields a failed {@link ParseResult}
 * so the slice is excluded like any other ineligible slice.</p>
 */
public final class SignatureCodec {
    public static final String FAILURE_ABSENT = "signature_absent";
    public static final String FAILURE_NOT_JSON = "signature_not_json";
    public static final String FAILURE_NOT_OBJECT = "signature_not_object";
    public static final String FAILURE_CORE_HASH = "core_hash_not_text";
    public static final String FAILURE_CONTEXT_HASHES = "context_hashes_not_object";
    public static final String FAILURE_CONTEXT_HASH_VALUE = "context_hash_not_text";

    private static final String FIELD_CORE = "c";
    private static final String FIELD_CONTEXT = "x";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SignatureCodec() {
    }

    /**
     * Parses persisted signature text.
     *
     * @param text serialized signature (nullable).
     * @return tagged result; never {@code null}.
     */
    public static ParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            return ParseResult.failure(FAILURE_ABSENT);
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException ex) {
            return ParseResult.failure(FAILURE_NOT_JSON);
        }
        if (root == null || !root.isObject()) {
            return ParseResult.failure(FAILURE_NOT_OBJECT);
        }
        JsonNode core = root.get(FIELD_CORE);
        if (core == null || !core.isTextual()) {
            return ParseResult.failure(FAILURE_CORE_HASH);
        }

        TreeMap<String, String> contextHashes = new TreeMap<>();
        JsonNode context = root.get(FIELD_CONTEXT);
        if (context != null && !context.isNull()) {
            if (!context.isObject()) {
                return ParseResult.failure(FAILURE_CONTEXT_HASHES);
            }
            Iterator<Map.Entry<String, JsonNode>> fields = context.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isTextual()) {
                    return ParseResult.failure(FAILURE_CONTEXT_HASH_VALUE + ":" + field.getKey());
                }
                contextHashes.put(field.getKey(), field.getValue().asText());
            }
        }
        return ParseResult.success(new Signature(core.asText(), contextHashes));
    }

    /**
     * Serializes a signature into canonical text with keys in sorted order.
     */
    public static String serialize(Signature signature) {
        Signature nonNullSignature = Objects.requireNonNull(signature, "signature");
        ObjectNode root = MAPPER.createObjectNode();
        root.put(FIELD_CORE, nonNullSignature.coreHash());
        ObjectNode context = root.putObject(FIELD_CONTEXT);
        for (Map.Entry<String, String> entry : nonNullSignature.contextHashes().entrySet()) {
            context.put(entry.getKey(), entry.getValue());
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize signature", ex);
        }
    }

    /**
     * Tagged signature parse result: a signature on success, a reason on failure.
     *
     * @param signature parsed signature, {@code null} on failure.
     * @param failureReason failure reason, {@code null} on success.
     */
    public record ParseResult(Signature signature, String failureReason) {

        static ParseResult success(Signature signature) {
            return new ParseResult(Objects.requireNonNull(signature, "signature"), null);
        }

        static ParseResult failure(String reason) {
            return new ParseResult(null, Objects.requireNonNull(reason, "reason"));
        }

        /**
         * Returns whether parsing produced a signature.
         */
        public boolean succeeded() {
            return signature != null;
        }
    }
}
