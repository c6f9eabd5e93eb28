package sp.sistemaspalacios.api_timeledger.entity.leave;

public enum LeaveType {
    ANNUAL,
    SICK,
    UNPAID,
    EXCUSE,
    PUBLIC_HOLIDAY
}
