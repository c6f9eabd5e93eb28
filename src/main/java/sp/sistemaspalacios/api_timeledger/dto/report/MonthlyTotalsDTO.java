package sp.sistemaspalacios.api_timeledger.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonthlyTotalsDTO {
    private int workedMinutes;
    private int planOvertimeMinutes;
    private int legalExtraWorkMinutes;
    private int legalOvertimeMinutes;
    private int incompleteDays;
}
