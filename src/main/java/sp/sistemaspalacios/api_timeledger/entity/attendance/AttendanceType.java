package sp.sistemaspalacios.api_timeledger.entity.attendance;

public enum AttendanceType {
    IN,  // entrada
    OUT  // salida
}
