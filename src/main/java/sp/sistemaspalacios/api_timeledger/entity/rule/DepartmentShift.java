package sp.sistemaspalacios.api_timeledger.entity.rule;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

/**
 * Turno de un departamento. Si termina antes o igual que empieza, cruza la medianoche.
 */
@Entity
@Table(name = "department_shifts",
        uniqueConstraints = @UniqueConstraint(columnNames = {"department_id", "name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentShift {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "department_id", nullable = false)
    private Long departmentId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "start_time_local", nullable = false)
    private LocalTime startTimeLocal;

    @Column(name = "end_time_local", nullable = false)
    private LocalTime endTimeLocal;

    @Builder.Default
    @Column(name = "break_minutes", nullable = false)
    private int breakMinutes = WorkRule.DEFAULT_BREAK_MINUTES;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
