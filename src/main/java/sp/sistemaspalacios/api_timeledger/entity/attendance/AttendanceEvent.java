package sp.sistemaspalacios.api_timeledger.entity.attendance;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "attendance_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceEvent {

    public static final String FLAG_SHIFT_ID = "SHIFT_ID";
    public static final String FLAG_IS_NIGHT_SHIFT = "IS_NIGHT_SHIFT";
    public static final String FLAG_NIGHT_SHIFT = "NIGHT_SHIFT";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 5)
    private AttendanceType type;

    @Column(name = "ts_utc", nullable = false)
    private Instant tsUtc;

    private Double lat;
    private Double lon;

    // Marcas del dispositivo: "true" o valores como SHIFT_ID
    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "attendance_event_flags", joinColumns = @JoinColumn(name = "event_id"))
    @MapKeyColumn(name = "flag")
    @Column(name = "value")
    private Map<String, String> flags = new HashMap<>();

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private AttendanceEventSource source = AttendanceEventSource.DEVICE;

    @Builder.Default
    @Column(name = "created_by_admin", nullable = false)
    private boolean createdByAdmin = false;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public boolean isFlagSet(String flag) {
        return flags != null && "true".equalsIgnoreCase(flags.get(flag));
    }

    public boolean isManual() {
        return source == AttendanceEventSource.MANUAL || createdByAdmin;
    }

    public boolean isNightShift() {
        return isFlagSet(FLAG_IS_NIGHT_SHIFT) || isFlagSet(FLAG_NIGHT_SHIFT);
    }

    /** Turno declarado en la marcación, si es numérico. */
    public Long declaredShiftId() {
        if (flags == null) return null;
        String raw = flags.get(FLAG_SHIFT_ID);
        if (raw == null || raw.isBlank() || !raw.trim().chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Long.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            // fuera de rango: ningún turno puede tener ese id
            return null;
        }
    }
}
