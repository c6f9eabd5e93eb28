package sp.sistemaspalacios.api_timeledger.repository.organization;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.organization.Employee;

import java.util.List;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, Long> {
    List<Employee> findByDepartmentIdOrderByIdAsc(Long departmentId);

    List<Employee> findByDepartmentIdAndActiveTrueOrderByIdAsc(Long departmentId);
}
