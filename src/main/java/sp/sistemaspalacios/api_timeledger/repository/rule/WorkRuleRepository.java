package sp.sistemaspalacios.api_timeledger.repository.rule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.rule.WorkRule;

import java.util.Optional;

@Repository
public interface WorkRuleRepository extends JpaRepository<WorkRule, Long> {
    Optional<WorkRule> findByDepartmentId(Long departmentId);
}
