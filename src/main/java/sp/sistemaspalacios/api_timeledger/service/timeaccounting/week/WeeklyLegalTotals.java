package sp.sistemaspalacios.api_timeledger.service.timeaccounting.week;

public record WeeklyLegalTotals(int normalMinutes, int extraWorkMinutes, int overtimeMinutes) {
}
