package sp.sistemaspalacios.api_timeledger.repository.organization;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.organization.Department;

import java.util.List;

@Repository
public interface DepartmentRepository extends JpaRepository<Department, Long> {

    @Query("SELECT d FROM Department d " +
            "WHERE (:departmentId IS NULL OR d.id = :departmentId) " +
            "AND (:regionId IS NULL OR d.regionId = :regionId) " +
            "ORDER BY d.id ASC")
    List<Department> findForSummary(@Param("departmentId") Long departmentId,
                                    @Param("regionId") Long regionId);
}
