package sp.sistemaspalacios.api_timeledger.service.timeaccounting.day;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_timeledger.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_timeledger.entity.attendance.AttendanceType;
import sp.sistemaspalacios.api_timeledger.service.common.TimeService;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Empareja entrada y salida de cada día local.
 * Una {@link Session} recuerda las salidas ya usadas por el día anterior; se recorre en orden.
 */
@Service
@RequiredArgsConstructor
public class EventPairer {

    static final Comparator<AttendanceEvent> CHRONOLOGICAL = Comparator
            .comparing(AttendanceEvent::getTsUtc)
            .thenComparing(AttendanceEvent::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final TimeService timeService;

    public Session open(Collection<AttendanceEvent> events, ZoneId zone) {
        Map<LocalDate, List<AttendanceEvent>> ins = new HashMap<>();
        Map<LocalDate, List<AttendanceEvent>> outs = new HashMap<>();

        events.stream()
                .filter(Objects::nonNull)
                .filter(e -> e.getTsUtc() != null && e.getType() != null)
                .filter(e -> e.getDeletedAt() == null)
                .sorted(CHRONOLOGICAL)
                .forEach(e -> {
                    LocalDate day = timeService.toLocalDate(e.getTsUtc(), zone);
                    Map<LocalDate, List<AttendanceEvent>> target = e.getType() == AttendanceType.IN ? ins : outs;
                    target.computeIfAbsent(day, d -> new ArrayList<>()).add(e);
                });

        return new Session(ins, outs);
    }

    public static final class Session {

        private final Map<LocalDate, List<AttendanceEvent>> insByDay;
        private final Map<LocalDate, List<AttendanceEvent>> outsByDay;
        private final Set<AttendanceEvent> consumedOuts = Collections.newSetFromMap(new IdentityHashMap<>());

        private Session(Map<LocalDate, List<AttendanceEvent>> insByDay,
                        Map<LocalDate, List<AttendanceEvent>> outsByDay) {
            this.insByDay = insByDay;
            this.outsByDay = outsByDay;
        }

        public EventPair pair(LocalDate day) {
            List<AttendanceEvent> ins = insByDay.getOrDefault(day, List.of());
            List<AttendanceEvent> outs = outsByDay.getOrDefault(day, List.of()).stream()
                    .filter(e -> !consumedOuts.contains(e))
                    .toList();

            AttendanceEvent firstIn = ins.isEmpty() ? null : ins.get(0);
            AttendanceEvent lastOut;
            if (firstIn != null) {
                lastOut = outs.stream()
                        .filter(e -> !e.getTsUtc().isBefore(firstIn.getTsUtc()))
                        .reduce((a, b) -> b)
                        .orElse(null);
            } else {
                lastOut = outs.isEmpty() ? null : outs.get(outs.size() - 1);
            }

            boolean crossMidnight = false;
            if (firstIn != null && lastOut == null) {
                lastOut = takeNextDayCheckout(day.plusDays(1), firstIn);
                crossMidnight = lastOut != null;
            }

            // El último evento del día es una entrada sin salida posterior: turno abierto
            boolean openShift = false;
            List<AttendanceEvent> dayEvents = new ArrayList<>(ins);
            dayEvents.addAll(outs);
            if (!dayEvents.isEmpty()) {
                AttendanceEvent latest = Collections.max(dayEvents, CHRONOLOGICAL);
                openShift = latest.getType() == AttendanceType.IN
                        && (lastOut == null || latest.getTsUtc().isAfter(lastOut.getTsUtc()));
            }

            return new EventPair(firstIn, lastOut, crossMidnight, openShift);
        }

        // Solo cierra el turno una salida anterior a la primera entrada del día siguiente
        private AttendanceEvent takeNextDayCheckout(LocalDate nextDay, AttendanceEvent firstIn) {
            List<AttendanceEvent> nextIns = insByDay.getOrDefault(nextDay, List.of());
            AttendanceEvent nextFirstIn = nextIns.isEmpty() ? null : nextIns.get(0);

            for (AttendanceEvent candidate : outsByDay.getOrDefault(nextDay, List.of())) {
                if (consumedOuts.contains(candidate)) continue;
                if (!candidate.getTsUtc().isAfter(firstIn.getTsUtc())) continue;
                if (nextFirstIn != null && !candidate.getTsUtc().isBefore(nextFirstIn.getTsUtc())) continue;
                consumedOuts.add(candidate);
                return candidate;
            }
            return null;
        }
    }
}
