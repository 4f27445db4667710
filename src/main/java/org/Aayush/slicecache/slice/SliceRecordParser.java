package org.Aayush.slicecache.slice;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.Aayush.slicecache.core.CoverageReason;
import org.Aayush.slicecache.core.SliceDiagnostic;
import org.Aayush.slicecache.signature.Signature;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads slices from a persisted parameter record.
 *
 * <p>Accepted document shapes are {@code {"values":[...]}} or a bare array of entries.
 * Each entry follows the slice schema:</p>
 * <pre>
 * {
 *   "sliceId": "...",                      (optional, defaults to "values[i]")
 *   "dimensionConstraints": {"channel": "google",
 *                            "device": {"anyOf": ["ios", "android"]},
 *                            "promo": {"case": "promo-test", "variant": "b"},
 *                            "region": {"not": "eu"}},
 *   "signature": {"coreHash": "...", "contextHashes": {...}} | "{\"c\":...,\"x\":{...}}",
 *   "series": [{"date": "2025-11-01", "n": 100, "k": 12, "...": 1.5}],
 *   "retrievedAt": "2025-11-04T10:00:00Z",
 *   "windowFrom": "2025-11-01", "windowTo": "2025-11-03"
 * }
 * </pre>
 * <p>Entries that cannot be read are skipped with a {@code malformed_slice_skipped}
 * diagnostic. Only an unreadable document fails the whole parse.</p>
 */
public final class SliceRecordParser {
    public static final String REASON_RECORD_UNREADABLE = "SC_SLICE_RECORD_UNREADABLE";
    public static final String REASON_RECORD_SHAPE = "SC_SLICE_RECORD_SHAPE";

    private static final Set<String> RESERVED_POINT_FIELDS = Set.of("date", "n", "k");
    private static final double LONG_RANGE_MIN = -0x1p63;
    private static final double LONG_RANGE_MAX = 0x1p63;

    private final ObjectMapper mapper;

    /**
     * Creates a parser with a default object mapper.
     */
    public SliceRecordParser() {
        this(new ObjectMapper());
    }

    /**
     * Creates a parser with a caller-provided object mapper.
     */
    public SliceRecordParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Parses a record from JSON text.
     *
     * @throws SliceRecordException when the text is not a readable record.
     */
    public ParsedRecord parse(String json) {
        try {
            return parse(mapper.readTree(Objects.requireNonNull(json, "json")));
        } catch (JsonProcessingException ex) {
            throw new SliceRecordException(REASON_RECORD_UNREADABLE, "parameter record is not valid JSON", ex);
        }
    }

    /**
     * Parses a record from a stream. The stream is not closed.
     *
     * @throws SliceRecordException when the stream is not a readable record.
     */
    public ParsedRecord parse(InputStream in) {
        try {
            return parse(mapper.readTree(Objects.requireNonNull(in, "in")));
        } catch (IOException ex) {
            throw new SliceRecordException(REASON_RECORD_UNREADABLE, "failed to read parameter record", ex);
        }
    }

    /**
     * Parses a record from an already-read JSON tree.
     *
     * @throws SliceRecordException when the tree is neither an entry array nor an object with {@code values}.
     */
    public ParsedRecord parse(JsonNode root) {
        JsonNode entries = root;
        if (root != null && root.isObject()) {
            entries = root.get("values");
        }
        if (entries == null || !entries.isArray()) {
            throw new SliceRecordException(
                    REASON_RECORD_SHAPE,
                    "parameter record must be an array or an object with a 'values' array"
            );
        }

        List<Slice> slices = new ArrayList<>(entries.size());
        List<SliceDiagnostic> diagnostics = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            String label = "values[" + i + "]";
            JsonNode entry = entries.get(i);
            try {
                slices.add(readSlice(entry, label));
            } catch (MalformedEntryException ex) {
                diagnostics.add(SliceDiagnostic.builder()
                        .sliceId(textOrDefault(entry, "sliceId", label))
                        .reason(CoverageReason.MALFORMED_SLICE_SKIPPED.code(null))
                        .detail(ex.getMessage())
                        .build());
            }
        }
        return new ParsedRecord(List.copyOf(slices), List.copyOf(diagnostics));
    }

    private Slice readSlice(JsonNode entry, String label) throws MalformedEntryException {
        if (entry == null || !entry.isObject()) {
            throw new MalformedEntryException("entry is not an object");
        }
        Slice.SliceBuilder builder = Slice.builder()
                .sliceId(textOrDefault(entry, "sliceId", label))
                .signature(readSignature(entry.get("signature")))
                .retrievedAt(readInstant(entry.get("retrievedAt")))
                .windowFrom(readOptionalDate(entry.get("windowFrom"), "windowFrom"))
                .windowTo(readOptionalDate(entry.get("windowTo"), "windowTo"));

        JsonNode constraints = entry.get("dimensionConstraints");
        if (constraints != null && !constraints.isNull()) {
            if (!constraints.isObject()) {
                throw new MalformedEntryException("dimensionConstraints is not an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = constraints.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.dimensionConstraint(field.getKey(), readConstraint(field.getKey(), field.getValue()));
            }
        }

        JsonNode series = entry.get("series");
        if (series == null || !series.isArray()) {
            throw new MalformedEntryException("series is not an array");
        }
        for (JsonNode point : series) {
            builder.point(readPoint(point));
        }
        return builder.build();
    }

    private String readSignature(JsonNode node) throws MalformedEntryException {
        if (node == null || node.isNull()) {
            throw new MalformedEntryException("signature is required");
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isObject() && node.has("coreHash")) {
            JsonNode core = node.get("coreHash");
            if (!core.isTextual()) {
                throw new MalformedEntryException("signature.coreHash is not text");
            }
            TreeMap<String, String> hashes = new TreeMap<>();
            JsonNode context = node.get("contextHashes");
            if (context != null && !context.isNull()) {
                if (!context.isObject()) {
                    throw new MalformedEntryException("signature.contextHashes is not an object");
                }
                Iterator<Map.Entry<String, JsonNode>> fields = context.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (!field.getValue().isTextual()) {
                        throw new MalformedEntryException("signature.contextHashes." + field.getKey() + " is not text");
                    }
                    hashes.put(field.getKey(), field.getValue().asText());
                }
            }
            return new Signature(core.asText(), hashes).serialized();
        }
        // Compact {"c":..,"x":..} objects are validated later by the signature codec.
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new MalformedEntryException("signature could not be re-serialized");
        }
    }

    private static DimensionConstraint readConstraint(String key, JsonNode node) throws MalformedEntryException {
        if (node != null && node.isTextual()) {
            return DimensionConstraint.exact(node.asText());
        }
        if (node == null || !node.isObject()) {
            throw new MalformedEntryException("constraint for " + key + " has unsupported shape");
        }
        if (node.has("anyOf")) {
            JsonNode values = node.get("anyOf");
            if (!values.isArray()) {
                throw new MalformedEntryException("constraint " + key + ".anyOf is not an array");
            }
            List<String> parsed = new ArrayList<>();
            for (JsonNode value : values) {
                parsed.add(requireText(value, "constraint " + key + ".anyOf entry"));
            }
            return DimensionConstraint.anyValue(parsed);
        }
        if (node.has("case")) {
            return DimensionConstraint.caseSelector(
                    requireText(node.get("case"), "constraint " + key + ".case"),
                    requireText(node.get("variant"), "constraint " + key + ".variant")
            );
        }
        if (node.has("not")) {
            return DimensionConstraint.exclusion(requireText(node.get("not"), "constraint " + key + ".not"));
        }
        if (node.has("value")) {
            return DimensionConstraint.exact(requireText(node.get("value"), "constraint " + key + ".value"));
        }
        throw new MalformedEntryException("constraint for " + key + " has unsupported shape");
    }

    private static SeriesPoint readPoint(JsonNode node) throws MalformedEntryException {
        if (node == null || !node.isObject()) {
            throw new MalformedEntryException("series point is not an object");
        }
        LocalDate date = readOptionalDate(node.get("date"), "series.date");
        if (date == null) {
            throw new MalformedEntryException("series point without date");
        }
        SeriesPoint.SeriesPointBuilder builder = SeriesPoint.builder()
                .date(date)
                .n(readCount(node.get("n"), "n", date))
                .k(readCount(node.get("k"), "k", date));
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!RESERVED_POINT_FIELDS.contains(field.getKey()) && field.getValue().isNumber()) {
                builder.metric(field.getKey(), field.getValue().asDouble());
            }
        }
        return builder.build();
    }

    private static long readCount(JsonNode node, String field, LocalDate date) throws MalformedEntryException {
        if (node == null || !node.isNumber()) {
            throw new MalformedEntryException(field + " on " + date + " is not a number");
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new MalformedEntryException(field + " on " + date + " is out of range");
            }
            return node.asLong();
        }
        double value = node.asDouble();
        if (value != Math.rint(value)) {
            throw new MalformedEntryException(field + " on " + date + " is not a whole count");
        }
        // 2^63 is the first double above Long.MAX_VALUE.
        if (value < LONG_RANGE_MIN || value >= LONG_RANGE_MAX) {
            throw new MalformedEntryException(field + " on " + date + " is out of range");
        }
        return (long) value;
    }

    private static Instant readInstant(JsonNode node) throws MalformedEntryException {
        String text = requireText(node, "retrievedAt");
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException ex) {
                throw new MalformedEntryException("retrievedAt is not an ISO-8601 timestamp: " + text);
            }
        }
    }

    private static LocalDate readOptionalDate(JsonNode node, String field) throws MalformedEntryException {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = requireText(node, field);
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException ex) {
            throw new MalformedEntryException(field + " is not an ISO-8601 date: " + text);
        }
    }

    private static String requireText(JsonNode node, String field) throws MalformedEntryException {
        if (node == null || !node.isTextual()) {
            throw new MalformedEntryException(field + " is not text");
        }
        return node.asText();
    }

    private static String textOrDefault(JsonNode node, String field, String fallback) {
        if (node == null || !node.isObject()) {
            return fallback;
        }
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : fallback;
    }

    /**
     * Parse output: readable slices plus diagnostics for skipped entries.
     *
     * @param slices slices in record order.
     * @param diagnostics one diagnostic per skipped entry.
     */
    public record ParsedRecord(List<Slice> slices, List<SliceDiagnostic> diagnostics) {
    }

    private static final class MalformedEntryException extends Exception {
        MalformedEntryException(String message) {
            super(message);
        }
    }
}
