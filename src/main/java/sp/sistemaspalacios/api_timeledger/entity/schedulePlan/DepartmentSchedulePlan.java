package sp.sistemaspalacios.api_timeledger.entity.schedulePlan;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Plan temporal de un departamento para un rango de fechas, opcionalmente por empleados.
 */
@Entity
@Table(name = "department_schedule_plans")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentSchedulePlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "department_id", nullable = false)
    private Long departmentId;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", nullable = false, length = 30)
    private SchedulePlanTargetType targetType = SchedulePlanTargetType.WHOLE_DEPARTMENT;

    // Columna antigua de un solo empleado
    @Column(name = "target_employee_id")
    private Long targetEmployeeId;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "department_schedule_plan_employees",
            joinColumns = @JoinColumn(name = "schedule_plan_id"))
    @Column(name = "employee_id")
    private Set<Long> targetEmployeeIds = new HashSet<>();

    @Column(name = "shift_id")
    private Long shiftId;

    @Column(name = "daily_minutes_planned")
    private Integer dailyMinutesPlanned;

    @Column(name = "break_minutes")
    private Integer breakMinutes;

    @Column(name = "grace_minutes")
    private Integer graceMinutes;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Builder.Default
    @Column(name = "is_locked", nullable = false)
    private boolean locked = false;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(length = 1000)
    private String note;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Set<Long> scopedEmployeeIds() {
        Set<Long> scoped = new HashSet<>();
        if (targetEmployeeIds != null) {
            scoped.addAll(targetEmployeeIds);
        }
        if (targetEmployeeId != null) {
            scoped.add(targetEmployeeId);
        }
        return scoped;
    }

    public boolean declaresRule() {
        return dailyMinutesPlanned != null || breakMinutes != null;
    }
}
