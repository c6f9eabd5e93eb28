package sp.sistemaspalacios.api_timeledger.service.timeaccounting.week;

import lombok.Builder;

import java.time.LocalDate;
import java.util.List;

/**
 * Semana ISO (lunes a domingo). Los campos {@code legal*} reparten contra contrato y norma legal.
 */
@Builder(toBuilder = true)
public record WeekSummary(
        LocalDate weekStart,
        LocalDate weekEnd,
        int workedMinutes,
        int planOvertimeMinutes,
        int normalMinutes,
        int extraWorkMinutes,
        int overtimeMinutes,
        int legalNormalMinutes,
        int legalExtraWorkMinutes,
        int legalOvertimeMinutes,
        List<String> flags
) {
    public WeekSummary {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public boolean overlaps(LocalDate from, LocalDate to) {
        return !weekEnd.isBefore(from) && !weekStart.isAfter(to);
    }
}
