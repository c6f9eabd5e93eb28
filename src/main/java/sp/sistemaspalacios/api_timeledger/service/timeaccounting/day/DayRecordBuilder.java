package sp.sistemaspalacios.api_timeledger.service.timeaccounting.day;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_timeledger.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_timeledger.entity.labor.LaborProfile;
import sp.sistemaspalacios.api_timeledger.entity.leave.Leave;
import sp.sistemaspalacios.api_timeledger.entity.leave.LeaveStatus;
import sp.sistemaspalacios.api_timeledger.entity.organization.Employee;
import sp.sistemaspalacios.api_timeledger.entity.override.ManualDayOverride;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentShift;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentWeekdayShiftAssignment;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentWeeklyRule;
import sp.sistemaspalacios.api_timeledger.entity.schedulePlan.DepartmentSchedulePlan;
import sp.sistemaspalacios.api_timeledger.service.common.TimeService;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.DayFlags;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.rule.RuleResolution;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.rule.RuleSourceResolver;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.schedule.SchedulePlanMatcher;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Un {@link DayRecord} por día. Orden: ajuste manual, permiso aprobado, día libre, marcaciones.
 * Las anomalías quedan como flags, nunca como excepciones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DayRecordBuilder {

    private final SchedulePlanMatcher schedulePlanMatcher;
    private final RuleSourceResolver ruleSourceResolver;
    private final DayMetricsCalculator dayMetricsCalculator;
    private final EventPairer eventPairer;
    private final TimeService timeService;

    public List<DayRecord> build(TimeAccountingInput input) {
        Employee employee = input.employee();
        ZoneId zone = input.zone();
        LaborProfile profile = input.laborProfile() != null ? input.laborProfile() : LaborProfile.builder().build();

        Map<DayOfWeek, DepartmentWeeklyRule> weeklyByDay = new HashMap<>();
        input.weeklyRules().stream()
                .filter(Objects::nonNull)
                .forEach(rule -> weeklyByDay.putIfAbsent(rule.getWeekday(), rule));

        Map<Long, DepartmentShift> shiftsById = new HashMap<>();
        input.shifts().stream()
                .filter(s -> s != null && s.getId() != null)
                .forEach(s -> shiftsById.put(s.getId(), s));

        Map<DayOfWeek, List<DepartmentShift>> weekdayCandidates = weekdayShiftCandidates(input.weekdayAssignments());

        List<Leave> approvedLeaves = input.leaves().stream()
                .filter(Objects::nonNull)
                .filter(l -> l.getStatus() == LeaveStatus.APPROVED)
                .filter(l -> l.getStartDate() != null && l.getEndDate() != null)
                .sorted(Comparator.comparing(Leave::getStartDate)
                        .thenComparing(Leave::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();

        // Si hay varios ajustes para el mismo día gana el de id más alto
        Map<LocalDate, ManualDayOverride> overrideByDay = new HashMap<>();
        input.overrides().stream()
                .filter(o -> o != null && o.getDayDate() != null)
                .sorted(Comparator.comparing(ManualDayOverride::getId, Comparator.nullsFirst(Comparator.naturalOrder())))
                .forEach(o -> overrideByDay.put(o.getDayDate(), o));

        EventPairer.Session session = eventPairer.open(input.events(), zone);

        List<DayRecord> records = new ArrayList<>();
        for (LocalDate day = input.startDate(); !day.isAfter(input.endDate()); day = day.plusDays(1)) {
            EventPair pair = session.pair(day);
            ManualDayOverride override = overrideByDay.get(day);
            Leave leave = approvedLeaves.stream().filter(covering(day)).findFirst().orElse(null);
            DepartmentSchedulePlan plan = schedulePlanMatcher
                    .resolveBestPlan(input.plans(), employee.getId(), day)
                    .orElse(null);

            DepartmentShift eventShift = eventShift(pair, shiftsById);
            DepartmentShift plannedShift = plan != null && plan.getShiftId() != null
                    ? shiftsById.get(plan.getShiftId()) : null;
            DepartmentShift dayShift = firstNonNull(
                    plannedShift,
                    eventShift,
                    employee.getShiftId() != null ? shiftsById.get(employee.getShiftId()) : null,
                    preferredWeekdayShift(employee, weekdayCandidates.getOrDefault(day.getDayOfWeek(), List.of())));
            DepartmentShift overrideShift = override != null && override.getRuleShiftIdOverride() != null
                    ? shiftsById.get(override.getRuleShiftIdOverride()) : null;

            RuleResolution rule = ruleSourceResolver.resolve(
                    input.workRule(),
                    plan,
                    weeklyByDay.get(day.getDayOfWeek()),
                    dayShift,
                    override != null ? override.getRuleSourceOverride() : null,
                    overrideShift);

            DayRecord.DayRecordBuilder base = DayRecord.builder()
                    .date(day)
                    .ruleSource(rule.source())
                    .appliedPlannedMinutes(rule.plannedMinutesNet())
                    .appliedBreakMinutes(rule.breakMinutes())
                    .graceMinutes(rule.graceMinutes())
                    .shiftId(dayShift != null ? dayShift.getId() : null)
                    .shiftName(dayShift != null ? dayShift.getName() : null);

            DayFlags ruleFlags = new DayFlags().addAll(rule.extraFlags());
            addPlanFlags(ruleFlags, plan, eventShift);

            if (override != null) {
                records.add(fromOverride(base, override, rule, ruleFlags, profile));
            } else if (leave != null) {
                records.add(base
                        .status(DayStatus.LEAVE)
                        .leaveType(leave.getType())
                        .flags(List.of(DayFlags.LEAVE_DAY))
                        .build());
            } else if (!rule.workday() && pair.isEmpty()) {
                records.add(base
                        .status(DayStatus.OFF)
                        .flags(List.of(DayFlags.OFF_DAY))
                        .build());
            } else {
                records.add(fromEvents(base, pair, rule, ruleFlags, profile, zone));
            }
        }

        log.debug("Días calculados para empleado {}: {} ({} a {})",
                employee.getId(), records.size(), input.startDate(), input.endDate());
        return records;
    }

    private DayRecord fromOverride(DayRecord.DayRecordBuilder base,
                                   ManualDayOverride override,
                                   RuleResolution rule,
                                   DayFlags flags,
                                   LaborProfile profile) {
        flags.add(DayFlags.MANUAL_OVERRIDE);

        if (override.isAbsent()) {
            flags.add(DayFlags.ABSENT_MARKED).add(DayFlags.MISSING_IN).add(DayFlags.MISSING_OUT);
            return base
                    .status(DayStatus.INCOMPLETE)
                    .missingMinutes(rule.workday() ? rule.plannedMinutesNet() : 0)
                    .flags(flags.toList())
                    .build();
        }

        DayComputation metrics = dayMetricsCalculator.calculate(
                override.getInTs(),
                override.getOutTs(),
                rule.plannedMinutesNet(),
                rule.breakMinutes(),
                profile.getDailyMaxMinutes(),
                profile.getNightWorkMaxMinutes(),
                profile.isEnforceMinBreakRules(),
                false);

        flags.addIf(override.getInTs() == null, DayFlags.MISSING_IN)
                .addIf(override.getOutTs() == null, DayFlags.MISSING_OUT);
        int missing = missingMinutes(metrics, rule);
        flags.addIf(missing > 0, DayFlags.UNDERWORKED);
        addComplianceFlags(flags, metrics);

        return base
                .status(metrics.status())
                .checkIn(override.getInTs())
                .checkOut(override.getOutTs())
                .workedMinutes(metrics.workedMinutesNet())
                .overtimeMinutes(metrics.overtimeMinutes())
                .missingMinutes(missing)
                .flags(flags.toList())
                .build();
    }

    private DayRecord fromEvents(DayRecord.DayRecordBuilder base,
                                 EventPair pair,
                                 RuleResolution rule,
                                 DayFlags flags,
                                 LaborProfile profile,
                                 ZoneId zone) {
        AttendanceEvent firstIn = pair.firstIn();
        AttendanceEvent lastOut = pair.lastOut();

        addEventFlags(flags, firstIn);
        addEventFlags(flags, lastOut);
        flags.addIf(firstIn == null, DayFlags.MISSING_IN)
                .addIf(lastOut == null, DayFlags.MISSING_OUT)
                .addIf(!rule.workday(), DayFlags.OFF_DAY_WORKED)
                .addIf(pair.crossMidnightCheckout(), DayFlags.CROSS_MIDNIGHT_CHECKOUT);
        if (pair.openShift()) {
            flags.add(DayFlags.OPEN_SHIFT_ACTIVE).add(DayFlags.MISSING_OUT);
        }

        boolean nightShift = (firstIn != null && firstIn.isNightShift())
                || (lastOut != null && lastOut.isNightShift())
                || (firstIn != null && lastOut != null
                && !timeService.toLocalDate(firstIn.getTsUtc(), zone)
                .equals(timeService.toLocalDate(lastOut.getTsUtc(), zone)));

        DayComputation metrics = dayMetricsCalculator.calculate(
                firstIn != null ? firstIn.getTsUtc() : null,
                lastOut != null ? lastOut.getTsUtc() : null,
                rule.plannedMinutesNet(),
                rule.breakMinutes(),
                profile.getDailyMaxMinutes(),
                profile.getNightWorkMaxMinutes(),
                profile.isEnforceMinBreakRules(),
                nightShift);

        DayStatus status = pair.openShift() ? DayStatus.INCOMPLETE : metrics.status();
        int missing = status == DayStatus.OK ? missingMinutes(metrics, rule) : 0;
        flags.addIf(missing > 0, DayFlags.UNDERWORKED);
        addComplianceFlags(flags, metrics);

        // Con turno abierto la salida anterior no se publica
        boolean showCheckout = !pair.openShift() && lastOut != null;
        return base
                .status(status)
                .checkIn(firstIn != null ? firstIn.getTsUtc() : null)
                .checkInLat(firstIn != null ? firstIn.getLat() : null)
                .checkInLon(firstIn != null ? firstIn.getLon() : null)
                .checkOut(showCheckout ? lastOut.getTsUtc() : null)
                .checkOutLat(showCheckout ? lastOut.getLat() : null)
                .checkOutLon(showCheckout ? lastOut.getLon() : null)
                .workedMinutes(metrics.workedMinutesNet())
                .overtimeMinutes(metrics.overtimeMinutes())
                .missingMinutes(missing)
                .flags(flags.toList())
                .build();
    }

    private int missingMinutes(DayComputation metrics, RuleResolution rule) {
        if (metrics.status() != DayStatus.OK || !rule.workday()) return 0;
        return Math.max(0, rule.plannedMinutesNet() - metrics.workedMinutesNet());
    }

    private void addEventFlags(DayFlags flags, AttendanceEvent event) {
        if (event == null) return;
        if (event.getFlags() != null) {
            event.getFlags().keySet().stream()
                    .filter(event::isFlagSet)
                    .forEach(flags::add);
        }
        flags.addIf(event.isManual(), DayFlags.MANUAL_EVENT);
    }

    private void addPlanFlags(DayFlags flags, DepartmentSchedulePlan plan, DepartmentShift eventShift) {
        if (plan == null) return;
        flags.add(DayFlags.SCHEDULE_PLAN_APPLIED)
                .addIf(plan.getShiftId() != null, DayFlags.SCHEDULE_PLAN_SHIFT)
                .addIf(plan.declaresRule(), DayFlags.SCHEDULE_PLAN_RULE);
        if (plan.isLocked()) {
            flags.add(DayFlags.SCHEDULE_PLAN_LOCKED)
                    .addIf(plan.getShiftId() != null && eventShift != null
                            && !plan.getShiftId().equals(eventShift.getId()), DayFlags.PLANNED_SHIFT_VIOLATION);
        }
    }

    private void addComplianceFlags(DayFlags flags, DayComputation metrics) {
        flags.addIf(metrics.dailyMaxExceeded(), DayFlags.DAILY_MAX_EXCEEDED)
                .addIf(metrics.minBreakNotMet(), DayFlags.MIN_BREAK_NOT_MET)
                .addIf(metrics.nightWorkExceeded(), DayFlags.NIGHT_WORK_EXCEEDED);
    }

    private DepartmentShift eventShift(EventPair pair, Map<Long, DepartmentShift> shiftsById) {
        return Stream.of(pair.firstIn(), pair.lastOut())
                .filter(Objects::nonNull)
                .map(AttendanceEvent::declaredShiftId)
                .filter(Objects::nonNull)
                .map(shiftsById::get)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

    private Map<DayOfWeek, List<DepartmentShift>> weekdayShiftCandidates(List<DepartmentWeekdayShiftAssignment> assignments) {
        Map<DayOfWeek, List<DepartmentShift>> byWeekday = new HashMap<>();
        assignments.stream()
                .filter(a -> a != null && a.isActive() && a.getWeekday() != null)
                .filter(a -> a.getShift() != null && a.getShift().isActive())
                .sorted(Comparator.comparingInt(DepartmentWeekdayShiftAssignment::getSortOrder)
                        .thenComparing(DepartmentWeekdayShiftAssignment::getId,
                                Comparator.nullsLast(Comparator.naturalOrder())))
                .forEach(a -> byWeekday.computeIfAbsent(a.getWeekday(), d -> new ArrayList<>()).add(a.getShift()));
        return byWeekday;
    }

    private DepartmentShift preferredWeekdayShift(Employee employee, List<DepartmentShift> candidates) {
        if (candidates.isEmpty()) return null;
        if (employee.getShiftId() != null) {
            for (DepartmentShift shift : candidates) {
                if (employee.getShiftId().equals(shift.getId())) return shift;
            }
        }
        return candidates.size() == 1 ? candidates.get(0) : null;
    }

    private static Predicate<Leave> covering(LocalDate day) {
        return leave -> leave.covers(day);
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) return value;
        }
        return null;
    }
}
