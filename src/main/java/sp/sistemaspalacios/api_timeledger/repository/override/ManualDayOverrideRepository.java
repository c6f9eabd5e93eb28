package sp.sistemaspalacios.api_timeledger.repository.override;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.override.ManualDayOverride;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ManualDayOverrideRepository extends JpaRepository<ManualDayOverride, Long> {
    List<ManualDayOverride> findByEmployeeIdAndDayDateBetweenOrderByDayDateAscIdAsc(
            Long employeeId, LocalDate startDate, LocalDate endDate);
}
