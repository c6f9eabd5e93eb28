package sp.sistemaspalacios.api_timeledger.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LaborProfileDTO {
    private Long id;  // null cuando se usa el perfil por defecto sin guardar
    private String name;
    private int weeklyNormalMinutes;
    private int dailyMaxMinutes;
    private boolean enforceMinBreakRules;
    private int nightWorkMaxMinutes;
    private boolean nightWorkExceptionsNoteEnabled;
    private int overtimeAnnualCapMinutes;
    private double overtimePremium;
    private double extraWorkPremium;
    private String overtimeRoundingMode;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
