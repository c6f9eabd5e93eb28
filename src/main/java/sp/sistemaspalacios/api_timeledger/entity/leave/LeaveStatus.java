package sp.sistemaspalacios.api_timeledger.entity.leave;

public enum LeaveStatus {
    APPROVED,
    PENDING,
    REJECTED
}
