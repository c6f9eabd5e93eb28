package sp.sistemaspalacios.api_timeledger.entity.labor;

public enum OvertimeRoundingMode {
    OFF,
    ROUND_UP_30MIN
}
