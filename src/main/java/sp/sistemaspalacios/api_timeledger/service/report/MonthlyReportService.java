package sp.sistemaspalacios.api_timeledger.service.report;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_timeledger.dto.report.DepartmentMonthlySummaryDTO;
import sp.sistemaspalacios.api_timeledger.dto.report.MonthlyDayDTO;
import sp.sistemaspalacios.api_timeledger.dto.report.MonthlyReportDTO;
import sp.sistemaspalacios.api_timeledger.dto.report.MonthlyTotalsDTO;
import sp.sistemaspalacios.api_timeledger.dto.report.WeekSummaryDTO;
import sp.sistemaspalacios.api_timeledger.entity.labor.LaborProfile;
import sp.sistemaspalacios.api_timeledger.entity.organization.Department;
import sp.sistemaspalacios.api_timeledger.entity.organization.Employee;
import sp.sistemaspalacios.api_timeledger.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_timeledger.repository.attendance.AttendanceEventRepository;
import sp.sistemaspalacios.api_timeledger.repository.leave.LeaveRepository;
import sp.sistemaspalacios.api_timeledger.repository.organization.DepartmentRepository;
import sp.sistemaspalacios.api_timeledger.repository.organization.EmployeeRepository;
import sp.sistemaspalacios.api_timeledger.repository.override.ManualDayOverrideRepository;
import sp.sistemaspalacios.api_timeledger.repository.rule.DepartmentShiftRepository;
import sp.sistemaspalacios.api_timeledger.repository.rule.DepartmentWeekdayShiftAssignmentRepository;
import sp.sistemaspalacios.api_timeledger.repository.rule.DepartmentWeeklyRuleRepository;
import sp.sistemaspalacios.api_timeledger.repository.rule.WorkRuleRepository;
import sp.sistemaspalacios.api_timeledger.repository.schedulePlan.DepartmentSchedulePlanRepository;
import sp.sistemaspalacios.api_timeledger.service.common.AttendanceZoneService;
import sp.sistemaspalacios.api_timeledger.service.common.TimeService;
import sp.sistemaspalacios.api_timeledger.service.labor.LaborProfileService;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.day.DayRecord;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.day.DayRecordBuilder;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.day.DayStatus;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.day.TimeAccountingInput;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.week.AnnualOvertimeUsage;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.week.WeekSummary;
import sp.sistemaspalacios.api_timeledger.service.timeaccounting.week.WeeklySummaryAggregator;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Reporte mensual de horas por empleado y resumen por departamento.
 * Se calcula desde el 1 de enero para el tope anual de horas extra; solo se devuelve el mes pedido.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonthlyReportService {

    private final EmployeeRepository employeeRepository;
    private final DepartmentRepository departmentRepository;
    private final WorkRuleRepository workRuleRepository;
    private final DepartmentWeeklyRuleRepository weeklyRuleRepository;
    private final DepartmentShiftRepository shiftRepository;
    private final DepartmentWeekdayShiftAssignmentRepository weekdayShiftAssignmentRepository;
    private final DepartmentSchedulePlanRepository schedulePlanRepository;
    private final ManualDayOverrideRepository manualDayOverrideRepository;
    private final LeaveRepository leaveRepository;
    private final AttendanceEventRepository attendanceEventRepository;
    private final LaborProfileService laborProfileService;
    private final AttendanceZoneService attendanceZoneService;
    private final DayRecordBuilder dayRecordBuilder;
    private final WeeklySummaryAggregator weeklySummaryAggregator;
    private final TimeService timeService;

    @Transactional(readOnly = true)
    public MonthlyReportDTO computeEmployeeMonth(Long employeeId, int year, int month) {
        if (employeeId == null) {
            throw new IllegalArgumentException("employeeId es obligatorio");
        }
        YearMonth period = toPeriod(year, month);
        Employee employee = employeeRepository.findById(employeeId)
                .orElseThrow(() -> new ResourceNotFoundException("Empleado no encontrado con ID: " + employeeId));

        LaborProfile profile = laborProfileService.resolveProfile();
        return computeMonth(employee, period, profile, attendanceZoneService.resolveZone());
    }

    @Transactional(readOnly = true)
    public List<DepartmentMonthlySummaryDTO> computeDepartmentMonthSummary(Long departmentId,
                                                                          Long regionId,
                                                                          int year,
                                                                          int month,
                                                                          boolean includeInactive) {
        YearMonth period = toPeriod(year, month);
        if (departmentId != null && !departmentRepository.existsById(departmentId)) {
            throw new ResourceNotFoundException("Departamento no encontrado con ID: " + departmentId);
        }

        LaborProfile profile = laborProfileService.resolveProfile();
        ZoneId zone = attendanceZoneService.resolveZone();

        List<DepartmentMonthlySummaryDTO> summary = new ArrayList<>();
        for (Department department : departmentRepository.findForSummary(departmentId, regionId)) {
            List<Employee> employees = includeInactive
                    ? employeeRepository.findByDepartmentIdOrderByIdAsc(department.getId())
                    : employeeRepository.findByDepartmentIdAndActiveTrueOrderByIdAsc(department.getId());

            int worked = 0;
            int planOvertime = 0;
            int legalExtraWork = 0;
            int legalOvertime = 0;
            for (Employee employee : employees) {
                MonthlyTotalsDTO totals = computeMonth(employee, period, profile, zone).getTotals();
                worked += totals.getWorkedMinutes();
                planOvertime += totals.getPlanOvertimeMinutes();
                legalExtraWork += totals.getLegalExtraWorkMinutes();
                legalOvertime += totals.getLegalOvertimeMinutes();
            }

            summary.add(DepartmentMonthlySummaryDTO.builder()
                    .departmentId(department.getId())
                    .departmentName(department.getName())
                    .regionId(department.getRegionId())
                    .workedMinutes(worked)
                    .overtimeMinutes(legalOvertime)
                    .planOvertimeMinutes(planOvertime)
                    .legalExtraWorkMinutes(legalExtraWork)
                    .legalOvertimeMinutes(legalOvertime)
                    .employeeCount(employees.size())
                    .build());
        }

        log.info("Resumen mensual {}: {} departamentos (departmentId={}, regionId={})",
                period, summary.size(), departmentId, regionId);
        return summary;
    }

    private MonthlyReportDTO computeMonth(Employee employee, YearMonth period, LaborProfile profile, ZoneId zone) {
        LocalDate monthStart = period.atDay(1);
        LocalDate monthEnd = period.atEndOfMonth();
        LocalDate yearStart = LocalDate.of(period.getYear(), 1, 1);

        List<DayRecord> yearDays = dayRecordBuilder.build(loadInput(employee, yearStart, monthEnd, profile, zone));

        List<WeekSummary> yearWeeks = weeklySummaryAggregator.summarize(
                yearDays,
                employee.getContractWeeklyMinutes(),
                profile.getWeeklyNormalMinutes(),
                profile.getOvertimeRoundingMode());
        AnnualOvertimeUsage usage = weeklySummaryAggregator.markAnnualCap(
                yearWeeks, profile.getOvertimeAnnualCapMinutes());

        List<WeekSummary> monthWeeks = usage.weeks().stream()
                .filter(week -> week.overlaps(monthStart, monthEnd))
                .toList();
        List<DayRecord> monthDays = weeklySummaryAggregator.propagateAnnualCap(
                yearDays.stream()
                        .filter(day -> !day.date().isBefore(monthStart) && !day.date().isAfter(monthEnd))
                        .toList(),
                monthWeeks);

        log.debug("Empleado {} {}: {} días, {} semanas, horas extra anuales {}/{}",
                employee.getId(), period, monthDays.size(), monthWeeks.size(),
                usage.usedMinutes(), usage.capMinutes());

        return MonthlyReportDTO.builder()
                .employeeId(employee.getId())
                .year(period.getYear())
                .month(period.getMonthValue())
                .days(monthDays.stream().map(this::toDayDTO).toList())
                .totals(totals(monthDays))
                .weeklyTotals(monthWeeks.stream().map(this::toWeekDTO).toList())
                .annualOvertimeUsedMinutes(usage.usedMinutes())
                .annualOvertimeRemainingMinutes(usage.remainingMinutes())
                .annualOvertimeCapExceeded(usage.capExceeded())
                .laborProfile(laborProfileService.toDTO(profile))
                .build();
    }

    private TimeAccountingInput loadInput(Employee employee,
                                          LocalDate startDate,
                                          LocalDate endDate,
                                          LaborProfile profile,
                                          ZoneId zone) {
        Long departmentId = employee.getDepartmentId();
        TimeAccountingInput.TimeAccountingInputBuilder input = TimeAccountingInput.builder()
                .employee(employee)
                .laborProfile(profile)
                .zone(zone)
                .startDate(startDate)
                .endDate(endDate)
                .overrides(manualDayOverrideRepository.findByEmployeeIdAndDayDateBetweenOrderByDayDateAscIdAsc(
                        employee.getId(), startDate, endDate))
                .leaves(leaveRepository.findApprovedInRange(employee.getId(), startDate, endDate))
                // Un día extra para cerrar turnos que cruzan la medianoche del último día
                .events(attendanceEventRepository.findForRange(
                        employee.getId(),
                        timeService.startOfDayUtc(startDate, zone),
                        timeService.startOfDayUtc(endDate.plusDays(2), zone)));

        if (departmentId != null) {
            input.workRule(workRuleRepository.findByDepartmentId(departmentId).orElse(null))
                    .weeklyRules(weeklyRuleRepository.findByDepartmentId(departmentId))
                    .shifts(shiftRepository.findByDepartmentIdOrderByIdAsc(departmentId))
                    .weekdayAssignments(weekdayShiftAssignmentRepository
                            .findByDepartmentIdAndActiveTrueOrderByWeekdayAscSortOrderAscIdAsc(departmentId))
                    .plans(schedulePlanRepository.findActiveInRange(departmentId, startDate, endDate));
        }
        return input.build();
    }

    private MonthlyTotalsDTO totals(List<DayRecord> days) {
        int worked = 0;
        int planOvertime = 0;
        int incomplete = 0;
        for (DayRecord day : days) {
            worked += day.workedMinutes();
            planOvertime += Math.max(0, day.overtimeMinutes());
            if (day.status() == DayStatus.INCOMPLETE) incomplete++;
        }
        // Por día el extra legal es 0 y la hora extra legal es la del plan
        return MonthlyTotalsDTO.builder()
                .workedMinutes(worked)
                .planOvertimeMinutes(planOvertime)
                .legalExtraWorkMinutes(0)
                .legalOvertimeMinutes(planOvertime)
                .incompleteDays(incomplete)
                .build();
    }

    private MonthlyDayDTO toDayDTO(DayRecord day) {
        int planOvertime = Math.max(0, day.overtimeMinutes());
        return MonthlyDayDTO.builder()
                .date(day.date())
                .status(day.status().name())
                .checkIn(day.checkIn())
                .checkOut(day.checkOut())
                .checkInLat(day.checkInLat())
                .checkInLon(day.checkInLon())
                .checkOutLat(day.checkOutLat())
                .checkOutLon(day.checkOutLon())
                .workedMinutes(day.workedMinutes())
                .planOvertimeMinutes(planOvertime)
                .legalExtraWorkMinutes(0)
                .legalOvertimeMinutes(planOvertime)
                .missingMinutes(day.missingMinutes())
                .ruleSource(day.ruleSource().name())
                .appliedPlannedMinutes(day.appliedPlannedMinutes())
                .appliedBreakMinutes(day.appliedBreakMinutes())
                .graceMinutes(day.graceMinutes())
                .leaveType(day.leaveType() != null ? day.leaveType().name() : null)
                .shiftId(day.shiftId())
                .shiftName(day.shiftName())
                .flags(day.flags())
                .build();
    }

    private WeekSummaryDTO toWeekDTO(WeekSummary week) {
        return WeekSummaryDTO.builder()
                .weekStart(week.weekStart())
                .weekEnd(week.weekEnd())
                .workedMinutes(week.workedMinutes())
                .normalMinutes(week.normalMinutes())
                .extraWorkMinutes(week.extraWorkMinutes())
                .overtimeMinutes(week.overtimeMinutes())
                .legalNormalMinutes(week.legalNormalMinutes())
                .legalExtraWorkMinutes(week.legalExtraWorkMinutes())
                .legalOvertimeMinutes(week.legalOvertimeMinutes())
                .flags(week.flags())
                .build();
    }

    private YearMonth toPeriod(int year, int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Mes inválido: " + month);
        }
        if (year < 1 || year > 9999) {
            throw new IllegalArgumentException("Año inválido: " + year);
        }
        return YearMonth.of(year, month);
    }
}
