package sp.sistemaspalacios.api_timeledger.entity.rule;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;

@Entity
@Table(name = "department_weekly_rules",
        uniqueConstraints = @UniqueConstraint(columnNames = {"department_id", "weekday"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentWeeklyRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "department_id", nullable = false)
    private Long departmentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DayOfWeek weekday;

    @Builder.Default
    @Column(name = "is_workday", nullable = false)
    private boolean workday = true;

    @Builder.Default
    @Column(name = "planned_minutes", nullable = false)
    private int plannedMinutes = WorkRule.DEFAULT_PLANNED_MINUTES;

    @Builder.Default
    @Column(name = "break_minutes", nullable = false)
    private int breakMinutes = WorkRule.DEFAULT_BREAK_MINUTES;
}
