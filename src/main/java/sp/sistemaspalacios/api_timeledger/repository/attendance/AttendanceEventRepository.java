package sp.sistemaspalacios.api_timeledger.repository.attendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.attendance.AttendanceEvent;

import java.time.Instant;
import java.util.List;

@Repository
public interface AttendanceEventRepository extends JpaRepository<AttendanceEvent, Long> {

    // Los eventos de dispositivos desactivados se mantienen
    @Query("SELECT e FROM AttendanceEvent e " +
            "WHERE e.employeeId = :employeeId " +
            "AND e.tsUtc >= :fromUtc " +
            "AND e.tsUtc < :toUtc " +
            "AND e.deletedAt IS NULL " +
            "ORDER BY e.tsUtc ASC, e.id ASC")
    List<AttendanceEvent> findForRange(@Param("employeeId") Long employeeId,
                                       @Param("fromUtc") Instant fromUtc,
                                       @Param("toUtc") Instant toUtc);
}
