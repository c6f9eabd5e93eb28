package sp.sistemaspalacios.api_timeledger.entity.labor;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Constantes legales del cálculo de horas. Todo en minutos.
 */
@Entity
@Table(name = "labor_profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LaborProfile {

    public static final String DEFAULT_NAME = "TR_DEFAULT";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Builder.Default
    @Column(nullable = false, unique = true)
    private String name = DEFAULT_NAME;

    @Builder.Default
    @Column(name = "weekly_normal_minutes_default", nullable = false)
    private int weeklyNormalMinutes = 45 * 60;

    @Builder.Default
    @Column(name = "daily_max_minutes", nullable = false)
    private int dailyMaxMinutes = 11 * 60;

    @Builder.Default
    @Column(name = "enforce_min_break_rules", nullable = false)
    private boolean enforceMinBreakRules = false;

    @Builder.Default
    @Column(name = "night_work_max_minutes_default", nullable = false)
    private int nightWorkMaxMinutes = 450;

    @Builder.Default
    @Column(name = "night_work_exceptions_note_enabled", nullable = false)
    private boolean nightWorkExceptionsNoteEnabled = true;

    @Builder.Default
    @Column(name = "overtime_annual_cap_minutes", nullable = false)
    private int overtimeAnnualCapMinutes = 270 * 60;

    @Builder.Default
    @Column(name = "overtime_premium", nullable = false)
    private double overtimePremium = 1.5;

    @Builder.Default
    @Column(name = "extra_work_premium", nullable = false)
    private double extraWorkPremium = 1.25;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "overtime_rounding_mode", nullable = false, length = 20)
    private OvertimeRoundingMode overtimeRoundingMode = OvertimeRoundingMode.OFF;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @PrePersist
    public void prePersist() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
