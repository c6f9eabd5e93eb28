package sp.sistemaspalacios.api_timeledger.entity.override;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Corrección manual de un día: ausencia o marcaciones, y opcionalmente la fuente de regla.
 */
@Entity
@Table(name = "manual_day_overrides")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualDayOverride {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "day_date", nullable = false)
    private LocalDate dayDate;

    @Column(name = "in_ts")
    private Instant inTs;

    @Column(name = "out_ts")
    private Instant outTs;

    @Builder.Default
    @Column(name = "is_absent", nullable = false)
    private boolean absent = false;

    // SHIFT, WEEKLY o WORK_RULE, guardado tal cual
    @Column(name = "rule_source_override", length = 20)
    private String ruleSourceOverride;

    @Column(name = "rule_shift_id_override")
    private Long ruleShiftIdOverride;

    @Column(length = 1000)
    private String note;

    @Builder.Default
    @Column(name = "created_by", nullable = false)
    private String createdBy = "admin";
}
