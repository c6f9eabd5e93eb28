package sp.sistemaspalacios.api_timeledger.controller.report;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_timeledger.dto.report.DepartmentMonthlySummaryDTO;
import sp.sistemaspalacios.api_timeledger.dto.report.MonthlyReportDTO;
import sp.sistemaspalacios.api_timeledger.service.report.MonthlyReportService;

import java.util.List;

@RestController
@RequestMapping("/api/reports/monthly")
public class MonthlyReportController {

    @Autowired
    private MonthlyReportService monthlyReportService;

    // Reporte mensual de un empleado
    @GetMapping("/employees/{employeeId}")
    public ResponseEntity<MonthlyReportDTO> getEmployeeMonth(@PathVariable("employeeId") Long employeeId,
                                                             @RequestParam("year") int year,
                                                             @RequestParam("month") int month) {
        return ResponseEntity.ok(monthlyReportService.computeEmployeeMonth(employeeId, year, month));
    }

    // Resumen por departamento, filtrable por departamento y región
    @GetMapping("/departments")
    public ResponseEntity<List<DepartmentMonthlySummaryDTO>> getDepartmentSummary(
            @RequestParam("year") int year,
            @RequestParam("month") int month,
            @RequestParam(value = "departmentId", required = false) Long departmentId,
            @RequestParam(value = "regionId", required = false) Long regionId,
            @RequestParam(value = "includeInactive", defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(monthlyReportService.computeDepartmentMonthSummary(
                departmentId, regionId, year, month, includeInactive));
    }
}
