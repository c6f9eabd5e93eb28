package sp.sistemaspalacios.api_timeledger.repository.labor;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_timeledger.entity.labor.LaborProfile;

import java.util.Optional;

@Repository
public interface LaborProfileRepository extends JpaRepository<LaborProfile, Long> {
    Optional<LaborProfile> findFirstByOrderByIdAsc();
}
