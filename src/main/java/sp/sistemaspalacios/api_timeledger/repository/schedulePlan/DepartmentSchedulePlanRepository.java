package sp.sistemaspalacios.api_timeledger.repository.schedulePlan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.schedulePlan.DepartmentSchedulePlan;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface DepartmentSchedulePlanRepository extends JpaRepository<DepartmentSchedulePlan, Long> {

    @Query("SELECT p FROM DepartmentSchedulePlan p " +
            "WHERE p.departmentId = :departmentId " +
            "AND p.active = true " +
            "AND p.startDate <= :endDate " +
            "AND p.endDate >= :startDate " +
            "ORDER BY p.id ASC")
    List<DepartmentSchedulePlan> findActiveInRange(@Param("departmentId") Long departmentId,
                                                   @Param("startDate") LocalDate startDate,
                                                   @Param("endDate") LocalDate endDate);
}
