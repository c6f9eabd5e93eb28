package sp.sistemaspalacios.api_timeledger.service.timeaccounting.day;

public record DayComputation(
        DayStatus status,
        int grossMinutes,
        int workedMinutesNet,
        int overtimeMinutes,
        int effectiveBreakMinutes,
        int legalMinBreakMinutes,
        boolean minBreakNotMet,
        boolean dailyMaxExceeded,
        boolean nightWorkExceeded
) {
    static DayComputation incomplete(int breakMinutes) {
        return new DayComputation(DayStatus.INCOMPLETE, 0, 0, 0, Math.max(0, breakMinutes), 0,
                false, false, false);
    }
}
