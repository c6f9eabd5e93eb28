package sp.sistemaspalacios.api_timeledger.repository.rule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.rule.DepartmentWeeklyRule;

import java.util.List;

@Repository
public interface DepartmentWeeklyRuleRepository extends JpaRepository<DepartmentWeeklyRule, Long> {
    List<DepartmentWeeklyRule> findByDepartmentId(Long departmentId);
}
