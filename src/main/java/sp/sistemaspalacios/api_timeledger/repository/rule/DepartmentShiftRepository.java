package sp.sistemaspalacios.api_timeledger.repository.rule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentShift;

import java.util.List;

@Repository
public interface DepartmentShiftRepository extends JpaRepository<DepartmentShift, Long> {

    /** Incluye turnos inactivos; días pasados pueden referenciarlos. */
    List<DepartmentShift> findByDepartmentIdOrderByIdAsc(Long departmentId);
}
