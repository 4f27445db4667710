package org.Aayush.slicecache.aggregation;

import org.Aayush.slicecache.core.CellValue;
import org.Aayush.slicecache.core.DateValue;
import org.Aayush.slicecache.generation.Contribution;
import org.Aayush.slicecache.generation.DateCandidate;
import org.Aayush.slicecache.slice.SeriesPoint;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Stage 7: sums the winning generation's contributions for one date.
 *
 * <p>{@code n} and {@code k} are always summed. An extra metric is summed only when every
 * contributing point carries it.</p>
 */
public final class SliceAggregator {

    /**
     * Aggregates one winning candidate.
     *
     * @param winner winning candidate for a date.
     * @param includeCells whether to emit per-cell values.
     * @return aggregated date value.
     * @throws ArithmeticException when the {@code n} or {@code k} total exceeds the {@code long} range.
     */
    public DateValue aggregate(DateCandidate winner, boolean includeCells) {
        DateCandidate nonNullWinner = Objects.requireNonNull(winner, "winner");
        long n = 0L;
        long k = 0L;
        Set<String> sharedMetrics = null;
        for (Contribution contribution : nonNullWinner.contributions()) {
            SeriesPoint point = contribution.point();
            n = Math.addExact(n, point.getN());
            k = Math.addExact(k, point.getK());
            if (sharedMetrics == null) {
                sharedMetrics = new TreeSet<>(point.getMetrics().keySet());
            } else {
                sharedMetrics.retainAll(point.getMetrics().keySet());
            }
        }

        TreeMap<String, Double> metrics = new TreeMap<>();
        if (sharedMetrics != null) {
            for (String metric : sharedMetrics) {
                double sum = 0.0d;
                for (Contribution contribution : nonNullWinner.contributions()) {
                    sum += contribution.point().getMetrics().get(metric);
                }
                metrics.put(metric, sum);
            }
        }

        DateValue.DateValueBuilder builder = DateValue.builder()
                .date(nonNullWinner.date())
                .n(n)
                .k(k)
                .metrics(metrics);
        if (includeCells) {
            for (Contribution contribution : nonNullWinner.contributions()) {
                builder.cell(toCell(contribution));
            }
        }
        return builder.build();
    }

    private static CellValue toCell(Contribution contribution) {
        SeriesPoint point = contribution.point();
        CellValue.CellValueBuilder cell = CellValue.builder()
                .sliceId(contribution.slice().sliceId())
                .n(point.getN())
                .k(point.getK())
                .metrics(new TreeMap<>(point.getMetrics()));
        for (Map.Entry<String, String> coordinate : contribution.slice().coordinates().entrySet()) {
            cell.coordinate(coordinate.getKey(), coordinate.getValue());
        }
        return cell.build();
    }
}
