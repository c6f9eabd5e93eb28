package sp.sistemaspalacios.api_timeledger.service.timeaccounting.day;

import sp.sistemaspalacios.api_timeledger.entity.attendance.AttendanceEvent;

/**
 * Entrada y salida elegidas para un día local. Cualquiera puede faltar.
 */
public record EventPair(
        AttendanceEvent firstIn,
        AttendanceEvent lastOut,
        boolean crossMidnightCheckout,
        boolean openShift
) {
    public boolean isEmpty() {
        return firstIn == null && lastOut == null;
    }
}
