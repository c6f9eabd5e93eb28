package sp.sistemaspalacios.api_timeledger.service.timeaccounting.day;

import lombok.Builder;
import sp.sistemaspalacios.api_timeledger.entity.leave.LeaveType;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.rule.RuleSource;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Día de un empleado; se recalcula siempre, no se guarda.
 * {@code overtimeMinutes} son minutos sobre lo planificado.
 */
@Builder(toBuilder = true)
public record DayRecord(
        LocalDate date,
        DayStatus status,
        Instant checkIn,
        Instant checkOut,
        Double checkInLat,
        Double checkInLon,
        Double checkOutLat,
        Double checkOutLon,
        int workedMinutes,
        int overtimeMinutes,
        int missingMinutes,
        RuleSource ruleSource,
        int appliedPlannedMinutes,
        int appliedBreakMinutes,
        int graceMinutes,
        LeaveType leaveType,
        Long shiftId,
        String shiftName,
        List<String> flags
) {
    public DayRecord {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }
}
