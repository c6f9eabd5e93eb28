package sp.sistemaspalacios.api_timeledger.service.timeaccounting.schedule;

import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_timeledger.entity.schedulePlan.DepartmentSchedulePlan;
import sp.sistemaspalacios.api_timeledger.entity.schedulePlan.SchedulePlanTargetType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Elige el plan de horario de un empleado para un día.
 */
@Service
public class SchedulePlanMatcher {

    private static final Comparator<DepartmentSchedulePlan> PRECEDENCE = Comparator
            .comparingInt((DepartmentSchedulePlan p) -> p.getTargetType().getSpecificity())
            .thenComparing(DepartmentSchedulePlan::getStartDate)
            .thenComparing(p -> p.getUpdatedAt() == null ? Instant.EPOCH : p.getUpdatedAt())
            .thenComparing(p -> p.getId() == null ? Long.MIN_VALUE : p.getId());

    public boolean appliesToEmployee(DepartmentSchedulePlan plan, Long employeeId) {
        SchedulePlanTargetType target = plan.getTargetType() == null
                ? SchedulePlanTargetType.WHOLE_DEPARTMENT
                : plan.getTargetType();
        return switch (target) {
            case ONLY_EMPLOYEE -> plan.scopedEmployeeIds().contains(employeeId);
            case DEPARTMENT_EXCEPT -> !plan.scopedEmployeeIds().contains(employeeId);
            case WHOLE_DEPARTMENT -> true;
        };
    }

    public boolean coversDay(DepartmentSchedulePlan plan, LocalDate day) {
        return !day.isBefore(plan.getStartDate()) && !day.isAfter(plan.getEndDate());
    }

    /**
     * Gana el más específico; luego inicio, actualización e id más recientes.
     * Vacío si ningún plan aplica.
     */
    public Optional<DepartmentSchedulePlan> resolveBestPlan(Collection<DepartmentSchedulePlan> plans,
                                                            Long employeeId,
                                                            LocalDate day) {
        return plans.stream()
                .filter(Objects::nonNull)
                .filter(DepartmentSchedulePlan::isActive)
                .filter(plan -> plan.getTargetType() != null)
                .filter(plan -> coversDay(plan, day))
                .filter(plan -> appliesToEmployee(plan, employeeId))
                .max(PRECEDENCE);
    }
}
