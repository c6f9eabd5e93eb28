package sp.sistemaspalacios.api_timeledger.service.timeaccounting.week;

import java.util.List;

/**
 * Uso del tope anual de horas extra.
 *
 * @param weeks las mismas semanas, marcadas desde la que supera el tope
 */
public record AnnualOvertimeUsage(
        List<WeekSummary> weeks,
        int capMinutes,
        int usedMinutes,
        int remainingMinutes,
        boolean capExceeded
) {
    public AnnualOvertimeUsage {
        weeks = List.copyOf(weeks);
    }
}
