package sp.sistemaspalacios.api_timeledger.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DepartmentMonthlySummaryDTO {
    private Long departmentId;
    private String departmentName;
    private Long regionId;
    private int workedMinutes;
    private int overtimeMinutes;
    private int planOvertimeMinutes;
    private int legalExtraWorkMinutes;
    private int legalOvertimeMinutes;
    private int employeeCount;
}
