package sp.sistemaspalacios.api_timeledger.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonthlyDayDTO {
    private LocalDate date;
    private String status;
    private Instant checkIn;
    private Instant checkOut;
    private Double checkInLat;
    private Double checkInLon;
    private Double checkOutLat;
    private Double checkOutLon;
    private int workedMinutes;
    private int planOvertimeMinutes;
    private int legalExtraWorkMinutes;
    private int legalOvertimeMinutes;
    private int missingMinutes;
    private String ruleSource;
    private int appliedPlannedMinutes;
    private int appliedBreakMinutes;
    private int graceMinutes;
    private String leaveType;
    private Long shiftId;
    private String shiftName;
    private List<String> flags;
}
