package org.Aayush.slicecache.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.slicecache.aggregation.SliceAggregator;
import org.Aayush.slicecache.context.ContextDefinitions;
import org.Aayush.slicecache.generation.Contribution;
import org.Aayush.slicecache.generation.DateCandidate;
import org.Aayush.slicecache.generation.DateCoverageAnalyzer;
import org.Aayush.slicecache.generation.DimensionGrouping;
import org.Aayush.slicecache.generation.Generation;
import org.Aayush.slicecache.generation.WinnerSelector;
import org.Aayush.slicecache.signature.CompatibilityVerdict;
import org.Aayush.slicecache.signature.Signature;
import org.Aayush.slicecache.signature.SignatureCache;
import org.Aayush.slicecache.signature.SignatureCodec;
import org.Aayush.slicecache.signature.SignatureCompatibilityFilter;
import org.Aayush.slicecache.slice.AdmittedSlice;
import org.Aayush.slicecache.slice.SeriesPoint;
import org.Aayush.slicecache.slice.Slice;
import org.Aayush.slicecache.slice.SliceDeduplicator;
import org.Aayush.slicecache.slice.SliceEligibilityFilter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Main coverage-resolution entry point.
 *
 * <p>Resolution is a linear pipeline of pure stages over one call's inputs:</p>
 * <ul>
 * <li>Validate the call contract; violations throw {@link CoverageResolutionException}.</li>
 * <li>Parse each slice signature and compare it with the query signature.</li>
 * <li>Exclude malformed and non-partitionable slices with diagnostics.</li>
 * <li>Collapse duplicates to the freshest slice.</li>
 * <li>Group survivors into generations by key set and relevant signature bundle.</li>
 * <li>Per date, assess every generation, rank the satisfying ones and aggregate the first
 * whose count totals fit in a {@code long}.</li>
 * <li>Report uncovered dates with the most specific failure observed.</li>
 * </ul>
 * <p>The resolver holds no per-call state and is safe to share between threads. The only
 * cross-call state is the optional caller-owned {@link SignatureCache}.</p>
 */
@Slf4j
public final class CoverageResolver implements SliceCoverageService {
    public static final String REASON_QUERY_REQUIRED = "SC_QUERY_REQUIRED";
    public static final String REASON_QUERY_SIGNATURE_REQUIRED = "SC_QUERY_SIGNATURE_REQUIRED";
    public static final String REASON_QUERY_DATE_REQUIRED = "SC_QUERY_DATE_REQUIRED";
    public static final String REASON_SLICES_REQUIRED = "SC_SLICES_REQUIRED";
    public static final String REASON_CONTEXT_DEFINITIONS_REQUIRED = "SC_CONTEXT_DEFINITIONS_REQUIRED";
    public static final String REASON_BREAKDOWN_DIMENSION_INVALID = "SC_BREAKDOWN_DIMENSION_INVALID";
    public static final String REASON_CONTEXT_DEFINITION_MISSING = "SC_CONTEXT_DEFINITION_MISSING";

    private final SignatureCache signatureCache;
    private final ResolutionBudget budget;
    private final SignatureCompatibilityFilter signatureFilter = new SignatureCompatibilityFilter();
    private final SliceEligibilityFilter eligibilityFilter = new SliceEligibilityFilter();
    private final SliceDeduplicator deduplicator = new SliceDeduplicator();
    private final DimensionGrouping grouping = new DimensionGrouping();
    private final DateCoverageAnalyzer analyzer;
    private final WinnerSelector winnerSelector = new WinnerSelector();
    private final SliceAggregator aggregator = new SliceAggregator();

    /**
     * Creates a resolver.
     *
     * @param signatureCache optional caller-owned parse memo shared across calls.
     * @param budget optional work budget; defaults to {@link ResolutionBudget#defaults()}.
     */
    @Builder
    public CoverageResolver(SignatureCache signatureCache, ResolutionBudget budget) {
        this.signatureCache = signatureCache;
        this.budget = budget == null ? ResolutionBudget.defaults() : budget;
        this.analyzer = new DateCoverageAnalyzer(this.budget);
    }

    /**
     * Creates a resolver with default budget and no cross-call cache.
     */
    public CoverageResolver() {
        this(null, null);
    }

    @Override
    public CoverageResult resolve(CoverageQuery query, List<Slice> slices, ContextDefinitions definitions) {
        List<LocalDate> dates = validateQuery(query);
        if (slices == null) {
            throw new CoverageResolutionException(REASON_SLICES_REQUIRED, "slices must be provided (may be empty)");
        }
        if (definitions == null) {
            throw new CoverageResolutionException(REASON_CONTEXT_DEFINITIONS_REQUIRED, "contextDefinitions must be provided");
        }
        Set<String> breakdown = validateBreakdown(query, definitions);

        LinkedHashMap<LocalDate, List<CoverageFailure>> failuresByDate = new LinkedHashMap<>();
        for (LocalDate date : dates) {
            failuresByDate.put(date, new ArrayList<>());
        }

        CoverageResult.CoverageResultBuilder result = CoverageResult.builder();
        List<AdmittedSlice> admitted = admit(query, breakdown, slices, failuresByDate, result);
        SliceDeduplicator.Result deduped = deduplicator.dedupe(admitted);
        List<Generation> generations = grouping.group(deduped.retained());
        result.duplicatesRemoved(deduped.removed());

        int covered = 0;
        for (LocalDate date : dates) {
            List<DateCandidate> candidates = new ArrayList<>();
            List<CoverageFailure> failures = failuresByDate.get(date);
            for (Generation generation : generations) {
                DateCoverageAnalyzer.Assessment assessment = analyzer.assess(generation, date, breakdown, definitions);
                if (assessment.satisfied()) {
                    candidates.add(assessment.candidate());
                } else if (assessment.failure() != null) {
                    failures.add(assessment.failure());
                }
            }

            boolean answered = false;
            for (DateCandidate candidate : winnerSelector.rank(candidates)) {
                DateValue value = aggregateOrRecord(candidate, !breakdown.isEmpty(), failures);
                if (value != null) {
                    covered++;
                    result.value(value);
                    result.traceEntry(toTrace(candidate));
                    answered = true;
                    break;
                }
            }
            if (!answered) {
                result.uncoveredDate(toUncovered(date, failures));
            }
        }

        result.fullyCovered(covered == dates.size());
        CoverageResult resolved = result.build();
        log.debug(
                "resolved {} dates ({} covered): {} slices in, {} admitted, {} duplicates, {} generations, {} excluded",
                dates.size(),
                covered,
                slices.size(),
                admitted.size(),
                deduped.removed(),
                generations.size(),
                resolved.getSliceDiagnostics().size()
        );
        return resolved;
    }

    private List<AdmittedSlice> admit(
            CoverageQuery query,
            Set<String> breakdown,
            List<Slice> slices,
            Map<LocalDate, List<CoverageFailure>> failuresByDate,
            CoverageResult.CoverageResultBuilder result
    ) {
        Signature querySignature = query.getSignature();
        Map<String, SignatureCodec.ParseResult> localParses = new HashMap<>();
        List<AdmittedSlice> admitted = new ArrayList<>(slices.size());
        for (int i = 0; i < slices.size(); i++) {
            Slice slice = slices.get(i);
            String label = "slices[" + i + "]";
            if (slice == null) {
                result.sliceDiagnostic(malformed(label, "slice is null"));
                continue;
            }
            String id = slice.getSliceId() == null || slice.getSliceId().isBlank() ? label : slice.getSliceId();

            SignatureCodec.ParseResult parsed = parseSignature(slice.getSignature(), localParses);
            if (!parsed.succeeded()) {
                result.sliceDiagnostic(malformed(id, "signature: " + parsed.failureReason()));
                continue;
            }

            CompatibilityVerdict verdict = signatureFilter.check(
                    parsed.signature(),
                    querySignature,
                    relevantKeys(querySignature, breakdown, slice)
            );
            if (!verdict.compatible()) {
                attributeToDates(slice, verdict.toFailure(id), failuresByDate);
                result.sliceDiagnostic(SliceDiagnostic.builder()
                        .sliceId(id)
                        .reason(verdict.reasonCode())
                        .detail(verdict.dimension() == null ? "core hash" : "dimension " + verdict.dimension())
                        .build());
                continue;
            }

            SliceEligibilityFilter.Eligibility eligibility = eligibilityFilter.evaluate(slice, parsed.signature(), label);
            if (!eligibility.eligible()) {
                result.sliceDiagnostic(eligibility.diagnostic());
                continue;
            }
            admitted.add(eligibility.admitted());
        }
        return admitted;
    }

    private SignatureCodec.ParseResult parseSignature(String text, Map<String, SignatureCodec.ParseResult> localParses) {
        if (signatureCache != null) {
            return signatureCache.parse(text);
        }
        if (text == null) {
            return SignatureCodec.parse(null);
        }
        return localParses.computeIfAbsent(text, SignatureCodec::parse);
    }

    private static Set<String> relevantKeys(Signature querySignature, Set<String> breakdown, Slice slice) {
        TreeSet<String> keys = new TreeSet<>(breakdown);
        keys.addAll(querySignature.contextHashes().keySet());
        if (slice.getDimensionConstraints() != null) {
            for (String key : slice.getDimensionConstraints().keySet()) {
                if (key != null) {
                    keys.add(key);
                }
            }
        }
        return keys;
    }

    private static void attributeToDates(
            Slice slice,
            CoverageFailure failure,
            Map<LocalDate, List<CoverageFailure>> failuresByDate
    ) {
        if (slice.getSeries() == null) {
            return;
        }
        for (SeriesPoint point : slice.getSeries()) {
            if (point == null || point.getDate() == null) {
                continue;
            }
            List<CoverageFailure> failures = failuresByDate.get(point.getDate());
            if (failures != null) {
                failures.add(failure);
            }
        }
    }

    private DateValue aggregateOrRecord(DateCandidate candidate, boolean includeCells, List<CoverageFailure> failures) {
        try {
            return aggregator.aggregate(candidate, includeCells);
        } catch (ArithmeticException ex) {
            log.warn(
                    "count totals overflow for generation {} on {}; falling back to the next candidate",
                    candidate.generation().key(),
                    candidate.date()
            );
            failures.add(CoverageFailure.of(
                    CoverageReason.AGGREGATE_OVERFLOW,
                    Map.of("generation", candidate.generation().key().keySetLabel())
            ));
            return null;
        }
    }

    private static SelectionTraceEntry toTrace(DateCandidate winner) {
        TreeSet<String> sliceIds = new TreeSet<>();
        for (Contribution contribution : winner.contributions()) {
            sliceIds.add(contribution.slice().sliceId());
        }
        return SelectionTraceEntry.builder()
                .date(winner.date())
                .dimensionKeys(winner.generation().dimensionKeys())
                .kind(winner.kind())
                .signature(winner.generation().key().signatureBundle())
                .recency(winner.recency())
                .contributingSliceIds(sliceIds)
                .build();
    }

    private static UncoveredDate toUncovered(LocalDate date, List<CoverageFailure> failures) {
        if (failures.isEmpty()) {
            return UncoveredDate.builder()
                    .date(date)
                    .reason(CoverageReason.GAP_IN_COVERAGE.code(null))
                    .detail(Map.of())
                    .build();
        }
        CoverageFailure mostSpecific = failures.stream().min(CoverageFailure.MOST_SPECIFIC_FIRST).orElseThrow();
        return UncoveredDate.builder()
                .date(date)
                .reason(mostSpecific.code())
                .detail(mostSpecific.detail())
                .build();
    }

    private static SliceDiagnostic malformed(String id, String detail) {
        return SliceDiagnostic.builder()
                .sliceId(id)
                .reason(CoverageReason.MALFORMED_SLICE_SKIPPED.code(null))
                .detail(detail)
                .build();
    }

    private static List<LocalDate> validateQuery(CoverageQuery query) {
        if (query == null) {
            throw new CoverageResolutionException(REASON_QUERY_REQUIRED, "query must be provided");
        }
        if (query.getSignature() == null) {
            throw new CoverageResolutionException(REASON_QUERY_SIGNATURE_REQUIRED, "query signature must be provided");
        }
        LinkedHashSet<LocalDate> dates = new LinkedHashSet<>();
        for (LocalDate date : query.getDates()) {
            if (date == null) {
                throw new CoverageResolutionException(REASON_QUERY_DATE_REQUIRED, "query dates must not contain null");
            }
            dates.add(date);
        }
        return List.copyOf(dates);
    }

    private static Set<String> validateBreakdown(CoverageQuery query, ContextDefinitions definitions) {
        TreeSet<String> breakdown = new TreeSet<>();
        for (String dimension : query.getBreakdownDimensions()) {
            if (dimension == null || dimension.isBlank()) {
                throw new CoverageResolutionException(
                        REASON_BREAKDOWN_DIMENSION_INVALID,
                        "breakdown dimensions must be non-blank"
                );
            }
            if (!definitions.defines(dimension)) {
                throw new CoverageResolutionException(
                        REASON_CONTEXT_DEFINITION_MISSING,
                        "no context definition for breakdown dimension: " + dimension
                );
            }
            breakdown.add(dimension);
        }
        return breakdown;
    }
}
