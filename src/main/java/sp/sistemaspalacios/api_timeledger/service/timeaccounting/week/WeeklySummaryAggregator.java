package sp.sistemaspalacios.api_timeledger.service.timeaccounting.week;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_timeledger.entity.labor.OvertimeRoundingMode;
import sp.sistemaspalacios.api_timeledger.service.common.TimeService;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.DayFlags;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.day.DayRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Agrupa días en semanas ISO y controla el tope anual de horas extra.
 */
@Service
@RequiredArgsConstructor
public class WeeklySummaryAggregator {

    private static final int ROUNDING_STEP_MINUTES = 30;

    private final TimeService timeService;

    /**
     * Semanas que tocan {@code days}, en orden.
     *
     * @param contractWeeklyMinutes tope del contrato, null si sigue la norma legal
     */
    public List<WeekSummary> summarize(List<DayRecord> days,
                                       Integer contractWeeklyMinutes,
                                       int legalWeeklyMinutes,
                                       OvertimeRoundingMode roundingMode) {
        Map<LocalDate, Bucket> buckets = new TreeMap<>();
        for (DayRecord day : days) {
            Bucket bucket = buckets.computeIfAbsent(timeService.isoWeekStart(day.date()), k -> new Bucket());
            bucket.worked += day.workedMinutes();
            bucket.planOvertime += Math.max(0, day.overtimeMinutes());
            day.flags().stream()
                    .filter(DayFlags.COMPLIANCE::contains)
                    .forEach(bucket.flags::add);
        }

        List<WeekSummary> weeks = new ArrayList<>();
        buckets.forEach((weekStart, bucket) -> {
            WeeklyLegalTotals legal = calculateWeeklyLegalTotals(
                    bucket.worked, contractWeeklyMinutes, legalWeeklyMinutes, roundingMode);
            weeks.add(WeekSummary.builder()
                    .weekStart(weekStart)
                    .weekEnd(weekStart.plusDays(6))
                    .workedMinutes(bucket.worked)
                    .planOvertimeMinutes(bucket.planOvertime)
                    .normalMinutes(Math.max(0, bucket.worked - bucket.planOvertime))
                    .extraWorkMinutes(0)
                    .overtimeMinutes(roundOvertime(bucket.planOvertime, roundingMode))
                    .legalNormalMinutes(legal.normalMinutes())
                    .legalExtraWorkMinutes(legal.extraWorkMinutes())
                    .legalOvertimeMinutes(legal.overtimeMinutes())
                    .flags(bucket.flags.toList())
                    .build());
        });
        return weeks;
    }

    public WeeklyLegalTotals calculateWeeklyLegalTotals(int workedMinutes,
                                                        Integer contractWeeklyMinutes,
                                                        int legalWeeklyMinutes,
                                                        OvertimeRoundingMode roundingMode) {
        int legalNorm = Math.max(0, legalWeeklyMinutes);
        int worked = Math.max(0, workedMinutes);
        int contract = contractWeeklyMinutes == null
                ? legalNorm
                : Math.min(Math.max(0, contractWeeklyMinutes), legalNorm);

        int normal = Math.min(worked, contract);
        int extraWork = contract < legalNorm
                ? Math.min(Math.max(0, worked - contract), legalNorm - contract)
                : 0;
        int overtime = roundOvertime(Math.max(0, worked - legalNorm), roundingMode);
        return new WeeklyLegalTotals(normal, extraWork, overtime);
    }

    public int roundOvertime(int minutes, OvertimeRoundingMode roundingMode) {
        if (minutes <= 0 || roundingMode == null || roundingMode == OvertimeRoundingMode.OFF) {
            return Math.max(0, minutes);
        }
        return ((minutes + ROUNDING_STEP_MINUTES - 1) / ROUNDING_STEP_MINUTES) * ROUNDING_STEP_MINUTES;
    }

    /**
     * Acumula horas extra por semana. Desde la semana que supera el tope, todas llevan
     * {@link DayFlags#ANNUAL_OVERTIME_CAP_EXCEEDED}.
     */
    public AnnualOvertimeUsage markAnnualCap(List<WeekSummary> weeks, int annualCapMinutes) {
        int cumulative = 0;
        List<WeekSummary> marked = new ArrayList<>(weeks.size());
        for (WeekSummary week : weeks) {
            cumulative += week.overtimeMinutes();
            if (cumulative > annualCapMinutes && !week.flags().contains(DayFlags.ANNUAL_OVERTIME_CAP_EXCEEDED)) {
                week = week.toBuilder()
                        .flags(DayFlags.with(week.flags(), DayFlags.ANNUAL_OVERTIME_CAP_EXCEEDED))
                        .build();
            }
            marked.add(week);
        }
        return new AnnualOvertimeUsage(
                marked,
                annualCapMinutes,
                cumulative,
                Math.max(0, annualCapMinutes - cumulative),
                cumulative > annualCapMinutes);
    }

    // Baja el flag del tope anual a los días
    public List<DayRecord> propagateAnnualCap(List<DayRecord> days, List<WeekSummary> weeks) {
        List<LocalDate> flaggedWeeks = weeks.stream()
                .filter(w -> w.flags().contains(DayFlags.ANNUAL_OVERTIME_CAP_EXCEEDED))
                .map(WeekSummary::weekStart)
                .toList();
        return days.stream()
                .map(day -> flaggedWeeks.contains(timeService.isoWeekStart(day.date()))
                        ? day.toBuilder().flags(DayFlags.with(day.flags(), DayFlags.ANNUAL_OVERTIME_CAP_EXCEEDED)).build()
                        : day)
                .toList();
    }

    private static final class Bucket {
        private int worked;
        private int planOvertime;
        private final DayFlags flags = new DayFlags();
    }
}
