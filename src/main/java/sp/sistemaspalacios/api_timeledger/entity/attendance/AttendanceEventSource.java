package sp.sistemaspalacios.api_timeledger.entity.attendance;

public enum AttendanceEventSource {
    DEVICE,
    MANUAL
}
