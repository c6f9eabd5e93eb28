package sp.sistemaspalacios.api_timeledger.service.common;

import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;

@Service
public class TimeService {

    private static final int MINUTES_PER_DAY = 24 * 60;

    /** Convierte LocalTime a minutos desde 00:00. */
    public int toMinutes(LocalTime t) {
        return t.getHour() * 60 + t.getMinute();
    }

    /** Duración de un intervalo de reloj soportando cruce de medianoche. */
    public int wrappedDurationMinutes(LocalTime start, LocalTime end) {
        int diff = toMinutes(end) - toMinutes(start);
        if (diff <= 0) diff += MINUTES_PER_DAY;
        return diff;
    }

    /** Minutos completos entre dos instantes; nunca negativo. */
    public int minutesBetween(Instant from, Instant to) {
        long minutes = Duration.between(from, to).toMinutes();
        if (minutes < 0) return 0;
        return (int) Math.min(minutes, Integer.MAX_VALUE);
    }

    /** Día local de un instante UTC. */
    public LocalDate toLocalDate(Instant tsUtc, ZoneId zone) {
        return tsUtc.atZone(zone).toLocalDate();
    }

    /** Medianoche local de {@code day} en UTC. */
    public Instant startOfDayUtc(LocalDate day, ZoneId zone) {
        return day.atStartOfDay(zone).toInstant();
    }

    public LocalDate isoWeekStart(LocalDate day) {
        return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }
}
