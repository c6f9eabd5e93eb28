package sp.sistemaspalacios.api_timeledger.controller.report;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import sp.sistemaspalacios.api_timeledger.controller.GlobalExceptionHandler;
import sp.sistemaspalacios.api_timeledger.dto.report.DepartmentMonthlySummaryDTO;
import sp.sistemaspalacios.api_timeledger.dto.report.MonthlyDayDTO;
import sp.sistemaspalacios.api_timeledger.dto.report.MonthlyReportDTO;
import sp.sistemaspalacios.api_timeledger.dto.report.MonthlyTotalsDTO;
import sp.sistemaspalacios.api_timeledger.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_timeledger.service.report.MonthlyReportService;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = MonthlyReportController.class)
@AutoConfigureMockMvc(addFilters = false)
class MonthlyReportControllerTest {

    @SpringBootConfiguration
    @Import({MonthlyReportController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @MockBean
    MonthlyReportService monthlyReportService;

    @BeforeEach
    void setup() {
        Mockito.reset(monthlyReportService);
    }

    @Test
    void employeeMonth_returnsReport() throws Exception {
        MonthlyReportDTO report = MonthlyReportDTO.builder()
                .employeeId(7L)
                .year(2024)
                .month(2)
                .days(List.of(MonthlyDayDTO.builder()
                        .date(LocalDate.of(2024, 2, 5))
                        .status("OK")
                        .workedMinutes(600)
                        .flags(List.of("CROSS_MIDNIGHT_CHECKOUT"))
                        .build()))
                .totals(MonthlyTotalsDTO.builder().workedMinutes(600).incompleteDays(0).build())
                .weeklyTotals(List.of())
                .annualOvertimeRemainingMinutes(16200)
                .build();
        when(monthlyReportService.computeEmployeeMonth(7L, 2024, 2)).thenReturn(report);

        mockMvc.perform(get("/api/reports/monthly/employees/7").param("year", "2024").param("month", "2"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.employeeId").value(7))
                .andExpect(jsonPath("$.days[0].date").value("2024-02-05"))
                .andExpect(jsonPath("$.days[0].workedMinutes").value(600))
                .andExpect(jsonPath("$.days[0].flags[0]").value("CROSS_MIDNIGHT_CHECKOUT"))
                .andExpect(jsonPath("$.totals.workedMinutes").value(600))
                .andExpect(jsonPath("$.annualOvertimeRemainingMinutes").value(16200));
    }

    @Test
    void employeeMonth_returns404_whenEmployeeUnknown() throws Exception {
        when(monthlyReportService.computeEmployeeMonth(99L, 2024, 2))
                .thenThrow(new ResourceNotFoundException("Empleado no encontrado con ID: 99"));

        mockMvc.perform(get("/api/reports/monthly/employees/99").param("year", "2024").param("month", "2"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Empleado no encontrado con ID: 99"));
    }

    @Test
    void employeeMonth_returns400_whenMonthInvalid() throws Exception {
        when(monthlyReportService.computeEmployeeMonth(7L, 2024, 13))
                .thenThrow(new IllegalArgumentException("Mes inválido: 13"));

        mockMvc.perform(get("/api/reports/monthly/employees/7").param("year", "2024").param("month", "13"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Mes inválido: 13"));
    }

    @Test
    void employeeMonth_returns400_whenYearMissing() throws Exception {
        mockMvc.perform(get("/api/reports/monthly/employees/7").param("month", "2"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(monthlyReportService);
    }

    @Test
    void departmentSummary_passesFilters() throws Exception {
        when(monthlyReportService.computeDepartmentMonthSummary(null, 3L, 2024, 2, true)).thenReturn(List.of(
                DepartmentMonthlySummaryDTO.builder()
                        .departmentId(1L)
                        .departmentName("Almacén")
                        .regionId(3L)
                        .workedMinutes(1080)
                        .employeeCount(2)
                        .build()));

        mockMvc.perform(get("/api/reports/monthly/departments")
                        .param("year", "2024")
                        .param("month", "2")
                        .param("regionId", "3")
                        .param("includeInactive", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].departmentName").value("Almacén"))
                .andExpect(jsonPath("$[0].employeeCount").value(2));

        verify(monthlyReportService).computeDepartmentMonthSummary(null, 3L, 2024, 2, true);
    }

    @Test
    void departmentSummary_defaultsToActiveEmployees() throws Exception {
        when(monthlyReportService.computeDepartmentMonthSummary(1L, null, 2024, 2, false)).thenReturn(List.of());

        mockMvc.perform(get("/api/reports/monthly/departments")
                        .param("year", "2024")
                        .param("month", "2")
                        .param("departmentId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }
}
