package sp.sistemaspalacios.api_timeledger.service.labor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sp.sistemaspalacios.api_timeledger.dto.report.LaborProfileDTO;
import sp.sistemaspalacios.api_timeledger.entity.labor.LaborProfile;
import sp.sistemaspalacios.api_timeledger.entity.labor.OvertimeRoundingMode;
import sp.sistemaspalacios.api_timeledger.repository.labor.LaborProfileRepository;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LaborProfileServiceTest {

    @Mock
    LaborProfileRepository laborProfileRepository;

    @InjectMocks
    LaborProfileService laborProfileService;

    @Test
    void defaultProfileWhenNoneStored() {
        when(laborProfileRepository.findFirstByOrderByIdAsc()).thenReturn(Optional.empty());

        LaborProfileDTO dto = laborProfileService.toDTO(laborProfileService.resolveProfile());

        assertThat(dto.getId()).isNull();
        assertThat(dto.getName()).isEqualTo("TR_DEFAULT");
        assertThat(dto.getWeeklyNormalMinutes()).isEqualTo(2700);
        assertThat(dto.getDailyMaxMinutes()).isEqualTo(660);
        assertThat(dto.isEnforceMinBreakRules()).isFalse();
        assertThat(dto.getNightWorkMaxMinutes()).isEqualTo(450);
        assertThat(dto.isNightWorkExceptionsNoteEnabled()).isTrue();
        assertThat(dto.getOvertimeAnnualCapMinutes()).isEqualTo(16200);
        assertThat(dto.getOvertimePremium()).isEqualTo(1.5);
        assertThat(dto.getExtraWorkPremium()).isEqualTo(1.25);
        assertThat(dto.getOvertimeRoundingMode()).isEqualTo("OFF");
    }

    @Test
    void storedProfileWins() {
        LaborProfile stored = LaborProfile.builder()
                .id(4L)
                .name("PLANTA")
                .overtimeRoundingMode(OvertimeRoundingMode.ROUND_UP_30MIN)
                .build();
        when(laborProfileRepository.findFirstByOrderByIdAsc()).thenReturn(Optional.of(stored));

        assertThat(laborProfileService.resolveProfile()).isSameAs(stored);
        assertThat(laborProfileService.toDTO(stored).getOvertimeRoundingMode()).isEqualTo("ROUND_UP_30MIN");
    }
}
