package dev.pekelund.reconcile.lines;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Match progress of an invoice's lines.
 *
 * @param matchedCount lines that are auto matched, manually matched or confirmed
 * @param matchPercentage matched lines as a whole percentage of all lines
 */
public record LineSummary(
    int totalLines,
    BigDecimal totalAmount,
    int matchedCount,
    int unmatchedCount,
    int newItemCount,
    int skippedCount,
    int discrepancyCount,
    int matchPercentage,
    Map<MatchStatus, Integer> byStatus
) {

    public static LineSummary of(Collection<InvoiceLineItem> lines) {
        Map<MatchStatus, Integer> byStatus = new EnumMap<>(MatchStatus.class);
        for (MatchStatus status : MatchStatus.values()) {
            byStatus.put(status, 0);
        }
        BigDecimal total = BigDecimal.ZERO;
        int matched = 0;
        int discrepancies = 0;
        for (InvoiceLineItem line : lines) {
            byStatus.merge(line.matchStatus(), 1, Integer::sum);
            if (line.totalPrice() != null) {
                total = total.add(line.totalPrice());
            }
            MatchStatus status = line.matchStatus();
            if (status == MatchStatus.CONFIRMED || status == MatchStatus.AUTO_MATCHED
                || status == MatchStatus.MANUAL_MATCHED) {
                matched++;
            }
            if (line.discrepancy()) {
                discrepancies++;
            }
        }
        int totalLines = lines.size();
        int percentage = totalLines > 0
            ? BigDecimal.valueOf(matched * 100L).divide(BigDecimal.valueOf(totalLines), 0, RoundingMode.HALF_UP)
                .intValue()
            : 0;
        return new LineSummary(totalLines, total.setScale(2, RoundingMode.HALF_UP), matched,
            byStatus.get(MatchStatus.UNMATCHED), byStatus.get(MatchStatus.NEW_ITEM),
            byStatus.get(MatchStatus.SKIPPED), discrepancies, percentage, Map.copyOf(byStatus));
    }

    public boolean allResolved() {
        return totalLines == byStatus.get(MatchStatus.CONFIRMED) + byStatus.get(MatchStatus.SKIPPED)
            + byStatus.get(MatchStatus.REJECTED);
    }
}
