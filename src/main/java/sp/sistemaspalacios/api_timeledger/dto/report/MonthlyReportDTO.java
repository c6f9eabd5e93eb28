package sp.sistemaspalacios.api_timeledger.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonthlyReportDTO {
    private Long employeeId;
    private int year;
    private int month;
    private List<MonthlyDayDTO> days;
    private MonthlyTotalsDTO totals;
    private List<WeekSummaryDTO> weeklyTotals;
    private int annualOvertimeUsedMinutes;
    private int annualOvertimeRemainingMinutes;
    private boolean annualOvertimeCapExceeded;
    private LaborProfileDTO laborProfile;
}
