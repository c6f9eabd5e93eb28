package sp.sistemaspalacios.api_timeledger.service.common;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_timeledger.config.AttendanceProperties;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Zona horaria de asistencia. Se resuelve en cada llamada, sin caché.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceZoneService {

    private final AttendanceProperties properties;

    public ZoneId resolveZone() {
        String raw = properties.getTimezone() == null ? "" : properties.getTimezone().trim();
        if (raw.isEmpty()) {
            return ZoneId.of(AttendanceProperties.DEFAULT_TIMEZONE);
        }
        try {
            return ZoneId.of(raw);
        } catch (DateTimeException e) {
            log.warn("Zona horaria inválida '{}', usando {}", raw, AttendanceProperties.DEFAULT_TIMEZONE);
            return ZoneId.of(AttendanceProperties.DEFAULT_TIMEZONE);
        }
    }
}
