package sp.sistemaspalacios.api_timeledger.service.labor;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_timeledger.dto.report.LaborProfileDTO;
import sp.sistemaspalacios.api_timeledger.entity.labor.LaborProfile;
import sp.sistemaspalacios.api_timeledger.repository.labor.LaborProfileRepository;

@Service
@RequiredArgsConstructor
public class LaborProfileService {

    private final LaborProfileRepository laborProfileRepository;

    /** Perfil guardado con menor id; si no hay ninguno, el perfil TR_DEFAULT sin persistir. */
    public LaborProfile resolveProfile() {
        return laborProfileRepository.findFirstByOrderByIdAsc()
                .orElseGet(() -> LaborProfile.builder().build());
    }

    public LaborProfileDTO toDTO(LaborProfile profile) {
        return LaborProfileDTO.builder()
                .id(profile.getId())
                .name(profile.getName())
                .weeklyNormalMinutes(profile.getWeeklyNormalMinutes())
                .dailyMaxMinutes(profile.getDailyMaxMinutes())
                .enforceMinBreakRules(profile.isEnforceMinBreakRules())
                .nightWorkMaxMinutes(profile.getNightWorkMaxMinutes())
                .nightWorkExceptionsNoteEnabled(profile.isNightWorkExceptionsNoteEnabled())
                .overtimeAnnualCapMinutes(profile.getOvertimeAnnualCapMinutes())
                .overtimePremium(profile.getOvertimePremium())
                .extraWorkPremium(profile.getExtraWorkPremium())
                .overtimeRoundingMode(profile.getOvertimeRoundingMode() == null
                        ? null : profile.getOvertimeRoundingMode().name())
                .createdAt(profile.getCreatedAt())
                .updatedAt(profile.getUpdatedAt())
                .build();
    }
}
