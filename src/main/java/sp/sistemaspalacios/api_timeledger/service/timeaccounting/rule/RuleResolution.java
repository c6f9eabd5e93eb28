package sp.sistemaspalacios.api_timeledger.service.timeaccounting.rule;

import java.util.List;

/**
 * Valores de regla efectivos de un día.
 *
 * @param plannedMinutesNet objetivo diario ya descontado el descanso
 */
public record RuleResolution(
        RuleSource source,
        int plannedMinutesNet,
        int breakMinutes,
        boolean workday,
        int graceMinutes,
        List<String> extraFlags
) {
    public RuleResolution {
        extraFlags = List.copyOf(extraFlags);
    }
}
