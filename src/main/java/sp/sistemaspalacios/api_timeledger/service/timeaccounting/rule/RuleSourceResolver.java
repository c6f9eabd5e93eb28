package sp.sistemaspalacios.api_timeledger.service.timeaccounting.rule;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentShift;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentWeeklyRule;
import sp.sistemaspalacios.api_timeledger.entity.rule.WorkRule;
import sp.sistemaspalacios.api_timeledger.entity.schedulePlan.DepartmentSchedulePlan;
import sp.sistemaspalacios.api_timeledger.service.common.TimeService;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.DayFlags;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decide qué capa fija los minutos planificados: turno, regla semanal, regla del departamento,
 * salvo que un ajuste manual fuerce una.
 */
@Service
@RequiredArgsConstructor
public class RuleSourceResolver {

    private final TimeService timeService;

    /**
     * @param workRule           regla del departamento, null para 540/60/5
     * @param ruleSourceOverride valor crudo del ajuste manual, puede ser null
     */
    public RuleResolution resolve(WorkRule workRule,
                                  DepartmentSchedulePlan plan,
                                  DepartmentWeeklyRule weekdayRule,
                                  DepartmentShift dayShift,
                                  String ruleSourceOverride,
                                  DepartmentShift overrideShift) {
        WorkRule base = workRule != null ? workRule : WorkRule.defaults();

        int basePlanned = plan != null && plan.getDailyMinutesPlanned() != null
                ? plan.getDailyMinutesPlanned() : base.getDailyMinutesPlanned();
        int baseBreak = plan != null && plan.getBreakMinutes() != null
                ? plan.getBreakMinutes() : base.getBreakMinutes();
        int grace = plan != null && plan.getGraceMinutes() != null
                ? plan.getGraceMinutes() : base.getGraceMinutes();

        Candidate workRuleCandidate = new Candidate(RuleSource.WORK_RULE,
                netPlanned(basePlanned, baseBreak), baseBreak, true);
        Candidate weeklyCandidate = weekdayRule == null ? null : new Candidate(RuleSource.WEEKLY,
                netPlanned(weekdayRule.getPlannedMinutes(), weekdayRule.getBreakMinutes()),
                weekdayRule.getBreakMinutes(),
                weekdayRule.isWorkday());
        Candidate shiftCandidate = dayShift == null ? null : shiftCandidate(dayShift);

        List<String> flags = new ArrayList<>();
        if (shiftCandidate != null && weeklyCandidate != null && disagree(shiftCandidate, weeklyCandidate)) {
            flags.add(DayFlags.SHIFT_WEEKLY_RULE_OVERRIDE);
        }

        Candidate applied = shiftCandidate != null ? shiftCandidate
                : weeklyCandidate != null ? weeklyCandidate
                : workRuleCandidate;

        if (ruleSourceOverride != null && !ruleSourceOverride.isBlank()) {
            Optional<RuleSource> forced = RuleSource.parse(ruleSourceOverride);
            Candidate forcedCandidate = forced.map(source -> switch (source) {
                case SHIFT -> {
                    DepartmentShift selected = overrideShift != null ? overrideShift : dayShift;
                    yield selected == null ? null : shiftCandidate(selected);
                }
                case WEEKLY -> weeklyCandidate;
                case WORK_RULE -> workRuleCandidate;
            }).orElse(null);

            if (forcedCandidate == null) {
                flags.add(DayFlags.RULE_OVERRIDE_INVALID);
            } else {
                applied = forcedCandidate;
                flags.add(DayFlags.RULE_SOURCE_MANUAL_OVERRIDE);
            }
        }

        return new RuleResolution(applied.source(), applied.plannedMinutesNet(), applied.breakMinutes(),
                applied.workday(), grace, flags);
    }

    /** Minutos netos del turno. */
    public int shiftPlannedMinutes(DepartmentShift shift) {
        int gross = timeService.wrappedDurationMinutes(shift.getStartTimeLocal(), shift.getEndTimeLocal());
        return Math.max(0, gross - Math.max(0, shift.getBreakMinutes()));
    }

    // Los valores de regla son brutos
    static int netPlanned(int plannedMinutes, int breakMinutes) {
        return Math.max(0, Math.max(0, plannedMinutes) - Math.max(0, breakMinutes));
    }

    private Candidate shiftCandidate(DepartmentShift shift) {
        return new Candidate(RuleSource.SHIFT, shiftPlannedMinutes(shift), shift.getBreakMinutes(), true);
    }

    private static boolean disagree(Candidate shift, Candidate weekly) {
        return !weekly.workday()
                || weekly.plannedMinutesNet() != shift.plannedMinutesNet()
                || weekly.breakMinutes() != shift.breakMinutes();
    }

    private record Candidate(RuleSource source, int plannedMinutesNet, int breakMinutes, boolean workday) {
    }
}
