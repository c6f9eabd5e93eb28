package sp.sistemaspalacios.api_timeledger.repository.rule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentWeekdayShiftAssignment;

import java.util.List;

@Repository
public interface DepartmentWeekdayShiftAssignmentRepository
        extends JpaRepository<DepartmentWeekdayShiftAssignment, Long> {

    List<DepartmentWeekdayShiftAssignment> findByDepartmentIdAndActiveTrueOrderByWeekdayAscSortOrderAscIdAsc(
            Long departmentId);
}
