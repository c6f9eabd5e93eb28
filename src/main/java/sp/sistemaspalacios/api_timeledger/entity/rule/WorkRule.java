package sp.sistemaspalacios.api_timeledger.entity.rule;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Jornada por defecto del departamento. Minutos brutos; se descuenta el descanso.
 */
@Entity
@Table(name = "work_rules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkRule {

    public static final int DEFAULT_PLANNED_MINUTES = 540;
    public static final int DEFAULT_BREAK_MINUTES = 60;
    public static final int DEFAULT_GRACE_MINUTES = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "department_id", nullable = false, unique = true)
    private Long departmentId;

    @Builder.Default
    @Column(name = "daily_minutes_planned", nullable = false)
    private int dailyMinutesPlanned = DEFAULT_PLANNED_MINUTES;

    @Builder.Default
    @Column(name = "break_minutes", nullable = false)
    private int breakMinutes = DEFAULT_BREAK_MINUTES;

    @Builder.Default
    @Column(name = "grace_minutes", nullable = false)
    private int graceMinutes = DEFAULT_GRACE_MINUTES;

    public static WorkRule defaults() {
        return WorkRule.builder().build();
    }
}
