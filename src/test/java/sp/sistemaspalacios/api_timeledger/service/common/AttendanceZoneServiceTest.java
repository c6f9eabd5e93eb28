package sp.sistemaspalacios.api_timeledger.service.common;

import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.api_timeledger.config.AttendanceProperties;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class AttendanceZoneServiceTest {

    @Test
    void usesConfiguredZone() {
        assertThat(zoneFor("America/Bogota")).isEqualTo(ZoneId.of("America/Bogota"));
    }

    @Test
    void blankOrMissingFallsBackToIstanbul() {
        assertThat(zoneFor("  ")).isEqualTo(ZoneId.of("Europe/Istanbul"));
        assertThat(zoneFor(null)).isEqualTo(ZoneId.of("Europe/Istanbul"));
    }

    @Test
    void invalidZoneFallsBackToIstanbul() {
        assertThat(zoneFor("Mars/Olympus")).isEqualTo(ZoneId.of("Europe/Istanbul"));
    }

    @Test
    void picksUpConfigurationChangesOnNextCall() {
        AttendanceProperties properties = new AttendanceProperties();
        AttendanceZoneService service = new AttendanceZoneService(properties);

        assertThat(service.resolveZone()).isEqualTo(ZoneId.of("Europe/Istanbul"));
        properties.setTimezone("UTC");
        assertThat(service.resolveZone()).isEqualTo(ZoneId.of("UTC"));
    }

    private ZoneId zoneFor(String configured) {
        AttendanceProperties properties = new AttendanceProperties();
        properties.setTimezone(configured);
        return new AttendanceZoneService(properties).resolveZone();
    }
}
