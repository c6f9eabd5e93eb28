package sp.sistemaspalacios.api_timeledger.service.timeaccounting;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Nombres de flags de días y semanas. El acumulador las ordena y quita duplicados.
 */
public final class DayFlags {

    public static final String MISSING_IN = "MISSING_IN";
    public static final String MISSING_OUT = "MISSING_OUT";
    public static final String OPEN_SHIFT_ACTIVE = "OPEN_SHIFT_ACTIVE";
    public static final String CROSS_MIDNIGHT_CHECKOUT = "CROSS_MIDNIGHT_CHECKOUT";
    public static final String MANUAL_EVENT = "MANUAL_EVENT";
    public static final String MANUAL_OVERRIDE = "MANUAL_OVERRIDE";
    public static final String ABSENT_MARKED = "ABSENT_MARKED";
    public static final String LEAVE_DAY = "LEAVE_DAY";
    public static final String OFF_DAY = "OFF_DAY";
    public static final String OFF_DAY_WORKED = "OFF_DAY_WORKED";
    public static final String UNDERWORKED = "UNDERWORKED";

    public static final String RULE_OVERRIDE_INVALID = "RULE_OVERRIDE_INVALID";
    public static final String RULE_SOURCE_MANUAL_OVERRIDE = "RULE_SOURCE_MANUAL_OVERRIDE";
    public static final String SHIFT_WEEKLY_RULE_OVERRIDE = "SHIFT_WEEKLY_RULE_OVERRIDE";

    public static final String SCHEDULE_PLAN_APPLIED = "SCHEDULE_PLAN_APPLIED";
    public static final String SCHEDULE_PLAN_SHIFT = "SCHEDULE_PLAN_SHIFT";
    public static final String SCHEDULE_PLAN_RULE = "SCHEDULE_PLAN_RULE";
    public static final String SCHEDULE_PLAN_LOCKED = "SCHEDULE_PLAN_LOCKED";
    public static final String PLANNED_SHIFT_VIOLATION = "PLANNED_SHIFT_VIOLATION";

    public static final String DAILY_MAX_EXCEEDED = "DAILY_MAX_EXCEEDED";
    public static final String MIN_BREAK_NOT_MET = "MIN_BREAK_NOT_MET";
    public static final String NIGHT_WORK_EXCEEDED = "NIGHT_WORK_EXCEEDED";
    public static final String ANNUAL_OVERTIME_CAP_EXCEEDED = "ANNUAL_OVERTIME_CAP_EXCEEDED";

    /** Flags que suben del día a la semana. */
    public static final Set<String> COMPLIANCE = Set.of(
            DAILY_MAX_EXCEEDED,
            MIN_BREAK_NOT_MET,
            NIGHT_WORK_EXCEEDED,
            ANNUAL_OVERTIME_CAP_EXCEEDED
    );

    private final TreeSet<String> values = new TreeSet<>();

    public DayFlags add(String flag) {
        values.add(flag);
        return this;
    }

    public DayFlags addIf(boolean condition, String flag) {
        if (condition) values.add(flag);
        return this;
    }

    public DayFlags addAll(Collection<String> flags) {
        values.addAll(flags);
        return this;
    }

    public boolean contains(String flag) {
        return values.contains(flag);
    }

    public List<String> toList() {
        return List.copyOf(values);
    }

    public static List<String> with(List<String> flags, String flag) {
        return new DayFlags().addAll(flags).add(flag).toList();
    }
}
