package sp.sistemaspalacios.api_timeledger.service.timeaccounting.week;

import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.api_timeledger.entity.labor.OvertimeRoundingMode;
import sp.sistemaspalacios.api_timeledger.service.common.TimeService;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.DayFlags;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.day.DayRecord;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.day.DayStatus;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.rule.RuleSource;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WeeklySummaryAggregatorTest {

    private static final int HOUR = 60;
    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 1);

    private final WeeklySummaryAggregator aggregator = new WeeklySummaryAggregator(new TimeService());

    @Test
    void legalTotalsWithoutContractCap() {
        WeeklyLegalTotals totals = aggregator.calculateWeeklyLegalTotals(
                46 * HOUR, null, 45 * HOUR, OvertimeRoundingMode.OFF);

        assertThat(totals.normalMinutes()).isEqualTo(45 * HOUR);
        assertThat(totals.extraWorkMinutes()).isZero();
        assertThat(totals.overtimeMinutes()).isEqualTo(HOUR);
    }

    @Test
    void legalTotalsSplitExtraWorkBelowTheNorm() {
        WeeklyLegalTotals totals = aggregator.calculateWeeklyLegalTotals(
                44 * HOUR, 40 * HOUR, 45 * HOUR, OvertimeRoundingMode.OFF);

        assertThat(totals.normalMinutes()).isEqualTo(40 * HOUR);
        assertThat(totals.extraWorkMinutes()).isEqualTo(4 * HOUR);
        assertThat(totals.overtimeMinutes()).isZero();
    }

    @Test
    void contractAboveTheNormIsCappedAtTheNorm() {
        WeeklyLegalTotals totals = aggregator.calculateWeeklyLegalTotals(
                50 * HOUR, 48 * HOUR, 45 * HOUR, OvertimeRoundingMode.ROUND_UP_30MIN);

        assertThat(totals.normalMinutes()).isEqualTo(45 * HOUR);
        assertThat(totals.extraWorkMinutes()).isZero();
        assertThat(totals.overtimeMinutes()).isEqualTo(5 * HOUR);
    }

    @Test
    void roundingUpToHalfHours() {
        assertThat(aggregator.roundOvertime(1, OvertimeRoundingMode.ROUND_UP_30MIN)).isEqualTo(30);
        assertThat(aggregator.roundOvertime(30, OvertimeRoundingMode.ROUND_UP_30MIN)).isEqualTo(30);
        assertThat(aggregator.roundOvertime(31, OvertimeRoundingMode.ROUND_UP_30MIN)).isEqualTo(60);
        assertThat(aggregator.roundOvertime(0, OvertimeRoundingMode.ROUND_UP_30MIN)).isZero();
        assertThat(aggregator.roundOvertime(31, OvertimeRoundingMode.OFF)).isEqualTo(31);
        assertThat(aggregator.roundOvertime(-5, OvertimeRoundingMode.OFF)).isZero();
    }

    @Test
    void groupsDaysIntoIsoWeeks() {
        List<DayRecord> days = List.of(
                day(MONDAY, 540, 60, List.of(DayFlags.DAILY_MAX_EXCEEDED, DayFlags.UNDERWORKED)),
                day(MONDAY.plusDays(6), 480, 0, List.of()),
                day(MONDAY.plusDays(7), 500, 20, List.of(DayFlags.MIN_BREAK_NOT_MET)));

        List<WeekSummary> weeks = aggregator.summarize(days, 40 * HOUR, 45 * HOUR, OvertimeRoundingMode.ROUND_UP_30MIN);

        assertThat(weeks).hasSize(2);
        WeekSummary first = weeks.get(0);
        assertThat(first.weekStart()).isEqualTo(MONDAY);
        assertThat(first.weekEnd()).isEqualTo(MONDAY.plusDays(6));
        assertThat(first.workedMinutes()).isEqualTo(1020);
        assertThat(first.planOvertimeMinutes()).isEqualTo(60);
        assertThat(first.normalMinutes()).isEqualTo(960);
        assertThat(first.extraWorkMinutes()).isZero();
        assertThat(first.overtimeMinutes()).isEqualTo(60);
        assertThat(first.legalNormalMinutes()).isEqualTo(1020);
        assertThat(first.flags()).containsExactly(DayFlags.DAILY_MAX_EXCEEDED);

        WeekSummary second = weeks.get(1);
        assertThat(second.overtimeMinutes()).isEqualTo(30);
        assertThat(second.normalMinutes()).isEqualTo(480);
        assertThat(second.flags()).containsExactly(DayFlags.MIN_BREAK_NOT_MET);
    }

    @Test
    void annualCapFlagsFromTheCrossingWeekOn() {
        List<WeekSummary> weeks = List.of(week(MONDAY, 100), week(MONDAY.plusWeeks(1), 100), week(MONDAY.plusWeeks(2), 100));

        AnnualOvertimeUsage usage = aggregator.markAnnualCap(weeks, 150);

        assertThat(usage.weeks()).extracting(w -> w.flags().contains(DayFlags.ANNUAL_OVERTIME_CAP_EXCEEDED))
                .containsExactly(false, true, true);
        assertThat(usage.usedMinutes()).isEqualTo(300);
        assertThat(usage.remainingMinutes()).isZero();
        assertThat(usage.capExceeded()).isTrue();
    }

    @Test
    void reachingTheCapExactlyIsNotExceeding() {
        AnnualOvertimeUsage usage = aggregator.markAnnualCap(List.of(week(MONDAY, 150)), 150);

        assertThat(usage.weeks().get(0).flags()).isEmpty();
        assertThat(usage.remainingMinutes()).isZero();
        assertThat(usage.capExceeded()).isFalse();
    }

    @Test
    void capFlagReachesDaysOfFlaggedWeeks() {
        WeekSummary flagged = week(MONDAY, 100).toBuilder()
                .flags(List.of(DayFlags.ANNUAL_OVERTIME_CAP_EXCEEDED))
                .build();
        List<DayRecord> days = List.of(
                day(MONDAY.plusDays(2), 600, 120, List.of(DayFlags.UNDERWORKED)),
                day(MONDAY.plusDays(8), 480, 0, List.of()));

        List<DayRecord> result = aggregator.propagateAnnualCap(days, List.of(flagged));

        assertThat(result.get(0).flags())
                .containsExactly(DayFlags.ANNUAL_OVERTIME_CAP_EXCEEDED, DayFlags.UNDERWORKED);
        assertThat(result.get(1).flags()).isEmpty();
    }

    private DayRecord day(LocalDate date, int worked, int overtime, List<String> flags) {
        return DayRecord.builder()
                .date(date)
                .status(DayStatus.OK)
                .workedMinutes(worked)
                .overtimeMinutes(overtime)
                .ruleSource(RuleSource.WORK_RULE)
                .appliedPlannedMinutes(480)
                .appliedBreakMinutes(60)
                .flags(flags)
                .build();
    }

    private WeekSummary week(LocalDate start, int overtime) {
        return WeekSummary.builder()
                .weekStart(start)
                .weekEnd(start.plusDays(6))
                .overtimeMinutes(overtime)
                .flags(List.of())
                .build();
    }
}
