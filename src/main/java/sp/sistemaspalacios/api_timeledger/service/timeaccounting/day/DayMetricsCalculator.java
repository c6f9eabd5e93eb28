package sp.sistemaspalacios.api_timeledger.service.timeaccounting.day;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_timeledger.service.common.TimeService;

import java.time.Instant;

/**
 * Minutos y controles legales de un par entrada/salida.
 * Superar un límite no cambia el estado, solo marca el indicador.
 */
@Service
@RequiredArgsConstructor
public class DayMetricsCalculator {

    private final TimeService timeService;

    /** Descanso mínimo legal: hasta 4h 15 min, hasta 7,5h 30 min, más 60 min. */
    public int legalMinBreakMinutes(int grossMinutes) {
        if (grossMinutes <= 0) return 0;
        if (grossMinutes <= 240) return 15;
        if (grossMinutes <= 450) return 30;
        return 60;
    }

    public DayComputation calculate(Instant firstInUtc,
                                    Instant lastOutUtc,
                                    int plannedMinutesNet,
                                    int breakMinutes,
                                    int dailyMaxMinutes,
                                    int nightWorkMaxMinutes,
                                    boolean enforceMinBreak,
                                    boolean nightShift) {
        if (firstInUtc == null || lastOutUtc == null) {
            return DayComputation.incomplete(breakMinutes);
        }

        int gross = timeService.minutesBetween(firstInUtc, lastOutUtc);
        int legalBreak = enforceMinBreak ? legalMinBreakMinutes(gross) : 0;
        int configuredBreak = Math.max(0, breakMinutes);
        int effectiveBreak = Math.max(configuredBreak, legalBreak);
        boolean minBreakNotMet = enforceMinBreak && configuredBreak < legalBreak && gross > 0;

        int worked = Math.max(0, gross - effectiveBreak);
        int overtime = Math.max(0, worked - Math.max(0, plannedMinutesNet));

        return new DayComputation(
                DayStatus.OK,
                gross,
                worked,
                overtime,
                effectiveBreak,
                legalBreak,
                minBreakNotMet,
                gross > Math.max(0, dailyMaxMinutes),
                nightShift && gross > Math.max(0, nightWorkMaxMinutes)
        );
    }
}
