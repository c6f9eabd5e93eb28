package sp.sistemaspalacios.api_timeledger.service.timeaccounting.day;

import lombok.Builder;
import sp.sistemaspalacios.api_timeledger.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_timeledger.entity.labor.LaborProfile;
import sp.sistemaspalacios.api_timeledger.entity.leave.Leave;
import sp.sistemaspalacios.api_timeledger.entity.organization.Employee;
import sp.sistemaspalacios.api_timeledger.entity.override.ManualDayOverride;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentShift;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentWeekdayShiftAssignment;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentWeeklyRule;
import sp.sistemaspalacios.api_timeledger.entity.rule.WorkRule;
import sp.sistemaspalacios.api_timeledger.entity.schedulePlan.DepartmentSchedulePlan;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Datos de un empleado entre {@code startDate} y {@code endDate}. Los eventos pueden
 * llegar un día después de {@code endDate} para cerrar el turno nocturno del último día.
 */
@Builder
public record TimeAccountingInput(
        Employee employee,
        WorkRule workRule,
        LaborProfile laborProfile,
        List<DepartmentWeeklyRule> weeklyRules,
        List<DepartmentShift> shifts,
        List<DepartmentSchedulePlan> plans,
        List<DepartmentWeekdayShiftAssignment> weekdayAssignments,
        List<ManualDayOverride> overrides,
        List<Leave> leaves,
        List<AttendanceEvent> events,
        ZoneId zone,
        LocalDate startDate,
        LocalDate endDate
) {
    public TimeAccountingInput {
        weeklyRules = orEmpty(weeklyRules);
        shifts = orEmpty(shifts);
        plans = orEmpty(plans);
        weekdayAssignments = orEmpty(weekdayAssignments);
        overrides = orEmpty(overrides);
        leaves = orEmpty(leaves);
        events = orEmpty(events);
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
