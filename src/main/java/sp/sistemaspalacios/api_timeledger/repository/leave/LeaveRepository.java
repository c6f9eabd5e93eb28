package sp.sistemaspalacios.api_timeledger.repository.leave;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.leave.Leave;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface LeaveRepository extends JpaRepository<Leave, Long> {

    @Query("SELECT l FROM Leave l " +
            "WHERE l.employeeId = :employeeId " +
            "AND l.status = sp.sistemaspalacios.api_timeledger.entity.leave.LeaveStatus.APPROVED " +
            "AND l.startDate <= :endDate " +
            "AND l.endDate >= :startDate " +
            "ORDER BY l.startDate ASC, l.id ASC")
    List<Leave> findApprovedInRange(@Param("employeeId") Long employeeId,
                                    @Param("startDate") LocalDate startDate,
                                    @Param("endDate") LocalDate endDate);
}
