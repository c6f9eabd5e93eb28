package sp.sistemaspalacios.api_timeledger.service.timeaccounting.rule;

import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentShift;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentWeeklyRule;
import sp.sistemaspalacios.api_timeledger.entity.rule.WorkRule;
import sp.sistemaspalacios.api_timeledger.entity.schedulePlan.DepartmentSchedulePlan;
import sp.sistemaspalacios.api_timeledger.service.common.TimeService;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.DayFlags;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class RuleSourceResolverTest {

    private final RuleSourceResolver resolver = new RuleSourceResolver(new TimeService());

    @Test
    void fallsBackToBuiltInWorkRule() {
        RuleResolution result = resolver.resolve(null, null, null, null, null, null);

        assertThat(result.source()).isEqualTo(RuleSource.WORK_RULE);
        assertThat(result.plannedMinutesNet()).isEqualTo(480);
        assertThat(result.breakMinutes()).isEqualTo(60);
        assertThat(result.workday()).isTrue();
        assertThat(result.graceMinutes()).isEqualTo(5);
        assertThat(result.extraFlags()).isEmpty();
    }

    @Test
    void weeklyRuleDecidesWorkdayAndNetMinutes() {
        DepartmentWeeklyRule sunday = weekly(DayOfWeek.SUNDAY, false, 480, 60);

        RuleResolution result = resolver.resolve(WorkRule.defaults(), null, sunday, null, null, null);

        assertThat(result.source()).isEqualTo(RuleSource.WEEKLY);
        assertThat(result.plannedMinutesNet()).isEqualTo(420);
        assertThat(result.workday()).isFalse();
    }

    @Test
    void overnightShiftWrapsAndWinsOverWeeklyRule() {
        DepartmentShift night = shift(3L, LocalTime.of(22, 0), LocalTime.of(6, 0), 30);
        DepartmentWeeklyRule monday = weekly(DayOfWeek.MONDAY, true, 540, 60);

        RuleResolution result = resolver.resolve(WorkRule.defaults(), null, monday, night, null, null);

        assertThat(result.source()).isEqualTo(RuleSource.SHIFT);
        assertThat(result.plannedMinutesNet()).isEqualTo(450);
        assertThat(result.breakMinutes()).isEqualTo(30);
        assertThat(result.extraFlags()).containsExactly(DayFlags.SHIFT_WEEKLY_RULE_OVERRIDE);
    }

    @Test
    void matchingShiftAndWeeklyRuleRaiseNoConflict() {
        DepartmentShift day = shift(1L, LocalTime.of(8, 0), LocalTime.of(17, 0), 60);
        DepartmentWeeklyRule monday = weekly(DayOfWeek.MONDAY, true, 540, 60);

        RuleResolution result = resolver.resolve(null, null, monday, day, null, null);

        assertThat(result.plannedMinutesNet()).isEqualTo(480);
        assertThat(result.extraFlags()).isEmpty();
    }

    @Test
    void forcedWeeklyWithoutRuleKeepsNaturalResolution() {
        DepartmentShift day = shift(1L, LocalTime.of(8, 0), LocalTime.of(17, 0), 60);

        RuleResolution result = resolver.resolve(null, null, null, day, "WEEKLY", null);

        assertThat(result.source()).isEqualTo(RuleSource.SHIFT);
        assertThat(result.extraFlags()).containsExactly(DayFlags.RULE_OVERRIDE_INVALID);
    }

    @Test
    void forcedWorkRuleBeatsShift() {
        DepartmentShift day = shift(1L, LocalTime.of(8, 0), LocalTime.of(12, 0), 0);
        WorkRule rule = WorkRule.builder().dailyMinutesPlanned(600).breakMinutes(30).build();

        RuleResolution result = resolver.resolve(rule, null, null, day, "work_rule", null);

        assertThat(result.source()).isEqualTo(RuleSource.WORK_RULE);
        assertThat(result.plannedMinutesNet()).isEqualTo(570);
        assertThat(result.extraFlags()).containsExactly(DayFlags.RULE_SOURCE_MANUAL_OVERRIDE);
    }

    @Test
    void forcedShiftUsesOverrideShiftOrFailsWithoutOne() {
        DepartmentShift forced = shift(9L, LocalTime.of(14, 0), LocalTime.of(22, 0), 30);

        RuleResolution withShift = resolver.resolve(null, null, null, null, "SHIFT", forced);
        assertThat(withShift.source()).isEqualTo(RuleSource.SHIFT);
        assertThat(withShift.plannedMinutesNet()).isEqualTo(450);

        RuleResolution withoutShift = resolver.resolve(null, null, null, null, "SHIFT", null);
        assertThat(withoutShift.source()).isEqualTo(RuleSource.WORK_RULE);
        assertThat(withoutShift.extraFlags()).containsExactly(DayFlags.RULE_OVERRIDE_INVALID);
    }

    @Test
    void unknownOverrideValueIsInvalid() {
        RuleResolution result = resolver.resolve(null, null, null, null, "HOLIDAY", null);

        assertThat(result.source()).isEqualTo(RuleSource.WORK_RULE);
        assertThat(result.extraFlags()).containsExactly(DayFlags.RULE_OVERRIDE_INVALID);
    }

    @Test
    void schedulePlanReplacesBaseValuesAndGrace() {
        DepartmentSchedulePlan plan = DepartmentSchedulePlan.builder()
                .dailyMinutesPlanned(420)
                .graceMinutes(15)
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 12, 31))
                .build();

        RuleResolution result = resolver.resolve(WorkRule.defaults(), plan, null, null, null, null);

        assertThat(result.plannedMinutesNet()).isEqualTo(360);
        assertThat(result.breakMinutes()).isEqualTo(60);
        assertThat(result.graceMinutes()).isEqualTo(15);
    }

    private DepartmentWeeklyRule weekly(DayOfWeek weekday, boolean workday, int planned, int breakMinutes) {
        return DepartmentWeeklyRule.builder()
                .departmentId(1L)
                .weekday(weekday)
                .workday(workday)
                .plannedMinutes(planned)
                .breakMinutes(breakMinutes)
                .build();
    }

    private DepartmentShift shift(Long id, LocalTime start, LocalTime end, int breakMinutes) {
        return DepartmentShift.builder()
                .id(id)
                .departmentId(1L)
                .name("Turno " + id)
                .startTimeLocal(start)
                .endTimeLocal(end)
                .breakMinutes(breakMinutes)
                .build();
    }
}
