package sp.sistemaspalacios.api_timeledger.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WeekSummaryDTO {
    private LocalDate weekStart;
    private LocalDate weekEnd;
    private int workedMinutes;
    private int normalMinutes;
    private int extraWorkMinutes;
    private int overtimeMinutes;
    // Reparto legal: contrato / norma semanal
    private int legalNormalMinutes;
    private int legalExtraWorkMinutes;
    private int legalOvertimeMinutes;
    private List<String> flags;
}
