package sp.sistemaspalacios.api_timeledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuración de asistencia ({@code attendance.*}).
 */
@ConfigurationProperties(prefix = "attendance")
@Getter
@Setter
public class AttendanceProperties {

    public static final String DEFAULT_TIMEZONE = "Europe/Istanbul";

    /** Zona IANA que decide a qué día pertenece cada marcación. */
    private String timezone = DEFAULT_TIMEZONE;
}
