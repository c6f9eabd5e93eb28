package sp.sistemaspalacios.api_timeledger.entity.organization;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "employees")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Employee {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "full_name", nullable = false)
    private String fullName;

    @Column(name = "region_id")
    private Long regionId;

    @Column(name = "department_id")
    private Long departmentId;

    // Turno por defecto, puede estar inactivo
    @Column(name = "shift_id")
    private Long shiftId;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    // null: aplica la norma semanal legal
    @Column(name = "contract_weekly_minutes")
    private Integer contractWeeklyMinutes;
}
