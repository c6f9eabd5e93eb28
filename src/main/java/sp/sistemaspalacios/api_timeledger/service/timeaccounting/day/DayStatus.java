package sp.sistemaspalacios.api_timeledger.service.timeaccounting.day;

public enum DayStatus {
    OK,
    INCOMPLETE,
    LEAVE,
    OFF
}
