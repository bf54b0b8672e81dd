package com.alyaman.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.alyaman.ledger.config.LedgerProperties;
import com.alyaman.ledger.domain.CostCenter;
import com.alyaman.ledger.domain.Course;
import com.alyaman.ledger.domain.CourseTeacherAssignment;
import com.alyaman.ledger.domain.Teacher;
import com.alyaman.ledger.repository.CostCenterRepository;
import com.alyaman.ledger.repository.CourseRepository;
import com.alyaman.ledger.repository.CourseTeacherAssignmentRepository;
import com.alyaman.ledger.repository.StudentEnrollmentRepository;
import com.alyaman.ledger.repository.TransactionRepository;
import com.alyaman.ledger.service.CostCenterService.CashFlow;
import com.alyaman.ledger.service.CostCenterService.CostCenterReport;
import com.alyaman.ledger.service.CostCenterService.ProfitAndLoss;

@ExtendWith(MockitoExtension.class)
class CostCenterServiceTest {

  private static final LocalDate START = LocalDate.of(2024, 5, 1);
  private static final LocalDate END = LocalDate.of(2024, 5, 31);
  private static final List<String> CASH_CODES = List.of("121", "1120");

  @Mock private CostCenterRepository costCenterRepository;

  @Mock private CourseRepository courseRepository;

  @Mock private CourseTeacherAssignmentRepository assignmentRepository;

  @Mock private StudentEnrollmentRepository enrollmentRepository;

  @Mock private TransactionRepository transactionRepository;

  private CostCenterService costCenterService;

  private CostCenter languages;

  @BeforeEach
  void setUp() {
    costCenterService =
        new CostCenterService(
            costCenterRepository,
            courseRepository,
            assignmentRepository,
            enrollmentRepository,
            transactionRepository,
            new ChartOfAccounts(new LedgerProperties()));

    languages = new CostCenter("LANG", "Languages", CostCenter.CostCenterType.ACADEMIC);
    languages.setId(1L);
  }

  @Test
  void cashFlow_addsNetMovementToOpeningBalance() {
    // Arrange
    when(transactionRepository.sumByCostCenterBefore(languages, true, START)).thenReturn(BigDecimal.ZERO);
    when(transactionRepository.sumByCostCenterBefore(languages, false, START)).thenReturn(BigDecimal.ZERO);
    when(transactionRepository.sumByCostCenterAndAccountCodesAndDateRange(languages, true, CASH_CODES, START, END))
        .thenReturn(new BigDecimal("1800.00"));
    when(transactionRepository.sumByCostCenterAndAccountCodesAndDateRange(languages, false, CASH_CODES, START, END))
        .thenReturn(new BigDecimal("500.00"));

    // Act
    CashFlow cashFlow = costCenterService.cashFlow(languages, START, END);

    // Assert
    assertEquals(0, BigDecimal.ZERO.compareTo(cashFlow.openingBalance()));
    assertEquals(0, new BigDecimal("1800.00").compareTo(cashFlow.cashInflow()));
    assertEquals(0, new BigDecimal("500.00").compareTo(cashFlow.cashOutflow()));
    assertEquals(0, new BigDecimal("1300.00").compareTo(cashFlow.netCashFlow()));
    assertEquals(0, new BigDecimal("1300.00").compareTo(cashFlow.closingBalance()));
  }

  @Test
  void openingBalance_withoutStartDate_isZero() {
    assertEquals(0, BigDecimal.ZERO.compareTo(costCenterService.openingBalance(languages, null)));
    verifyNoInteractions(transactionRepository);
  }

  @Test
  void openingBalance_isDebitsMinusCreditsBeforeStart() {
    // Arrange
    when(transactionRepository.sumByCostCenterBefore(languages, true, START)).thenReturn(new BigDecimal("900.00"));
    when(transactionRepository.sumByCostCenterBefore(languages, false, START)).thenReturn(new BigDecimal("250.00"));

    // Act & Assert
    assertEquals(0, new BigDecimal("650.00").compareTo(costCenterService.openingBalance(languages, START)));
  }

  @Test
  void totalExpenses_withOpenRange_queriesWidestBounds() {
    // Arrange
    when(transactionRepository.sumByCostCenterAndDateRange(
            languages, true, CostCenterService.EARLIEST, CostCenterService.LATEST))
        .thenReturn(new BigDecimal("75.00"));

    // Act & Assert
    assertEquals(0, new BigDecimal("75.00").compareTo(costCenterService.totalExpenses(languages, null, null)));
  }

  @Test
  void teacherSalaries_sumsActiveAssignments() {
    // Arrange
    Course course = new Course("French A1", new BigDecimal("1200.00"), languages);
    Teacher teacher = new Teacher("Nadia Fares", Teacher.SalaryType.HOURLY);
    CourseTeacherAssignment hourly = new CourseTeacherAssignment(course, teacher, START);
    hourly.setHourlyRate(new BigDecimal("40.00"));
    hourly.setTotalHours(20);
    CourseTeacherAssignment monthly = new CourseTeacherAssignment(course, teacher, START.plusDays(3));
    monthly.setMonthlyRate(new BigDecimal("600.00"));
    when(assignmentRepository.findActiveByCostCenterAndStartDateRange(languages, START, END))
        .thenReturn(List.of(hourly, monthly));

    // Act & Assert
    assertEquals(0, new BigDecimal("1400.00").compareTo(costCenterService.teacherSalaries(languages, START, END)));
  }

  @Test
  void profitAndLoss_computesProfitAndBudgetVariance() {
    // Arrange
    languages.setMonthlyBudget(new BigDecimal("2000.00"));
    when(enrollmentRepository.sumTotalAmountByCostCenterAndDateRange(languages, START, END))
        .thenReturn(new BigDecimal("5000.00"));
    when(transactionRepository.sumByCostCenterAndDateRange(languages, true, START, END))
        .thenReturn(new BigDecimal("1500.00"));
    when(assignmentRepository.findActiveByCostCenterAndStartDateRange(languages, START, END))
        .thenReturn(List.of());
    when(courseRepository.countByCostCenterAndActiveTrue(languages)).thenReturn(3L);

    // Act
    ProfitAndLoss pnl = costCenterService.profitAndLoss(languages, START, END);

    // Assert
    assertEquals(0, new BigDecimal("5000.00").compareTo(pnl.totalRevenue()));
    assertEquals(0, new BigDecimal("1500.00").compareTo(pnl.totalExpenses()));
    assertEquals(0, new BigDecimal("1500.00").compareTo(pnl.otherExpenses()));
    assertEquals(0, new BigDecimal("3500.00").compareTo(pnl.profit()));
    assertEquals(0, new BigDecimal("500.00").compareTo(pnl.budgetVariance()));
    assertEquals(3L, pnl.courseCount());
  }

  @Test
  void profitAndLoss_withoutBudget_reportsZeroVariance() {
    // Arrange
    when(enrollmentRepository.sumTotalAmountByCostCenterAndDateRange(languages, START, END))
        .thenReturn(BigDecimal.ZERO);
    when(transactionRepository.sumByCostCenterAndDateRange(languages, true, START, END))
        .thenReturn(new BigDecimal("300.00"));
    when(assignmentRepository.findActiveByCostCenterAndStartDateRange(languages, START, END))
        .thenReturn(List.of());
    when(courseRepository.countByCostCenterAndActiveTrue(languages)).thenReturn(0L);

    // Act
    ProfitAndLoss pnl = costCenterService.profitAndLoss(languages, START, END);

    // Assert
    assertEquals(0, BigDecimal.ZERO.compareTo(pnl.budgetVariance()));
    assertEquals(0, new BigDecimal("-300.00").compareTo(pnl.profit()));
  }

  @Test
  void summaries_coversEveryActiveCostCenter() {
    // Arrange
    CostCenter admin = new CostCenter("ADMIN", "Administration", CostCenter.CostCenterType.ADMINISTRATIVE);
    when(costCenterRepository.findByActiveTrueOrderByCode()).thenReturn(List.of(admin, languages));
    when(enrollmentRepository.sumTotalAmountByCostCenterAndDateRange(any(), any(), any()))
        .thenReturn(new BigDecimal("100.00"));
    when(transactionRepository.sumByCostCenterAndDateRange(any(), anyBoolean(), any(), any()))
        .thenReturn(new BigDecimal("40.00"));
    when(assignmentRepository.findActiveByCostCenterAndStartDateRange(any(), any(), any()))
        .thenReturn(List.of());
    when(transactionRepository.sumByCostCenterBefore(any(), anyBoolean(), any())).thenReturn(BigDecimal.ZERO);
    when(transactionRepository.sumByCostCenterAndAccountCodesAndDateRange(any(), anyBoolean(), any(), any(), any()))
        .thenReturn(BigDecimal.ZERO);

    // Act
    CostCenterReport report = costCenterService.summaries(START, END);

    // Assert
    assertEquals(2, report.profitAndLoss().size());
    assertEquals(2, report.cashFlows().size());
    assertEquals("ADMIN", report.profitAndLoss().get(0).costCenter().getCode());
    assertEquals(0, new BigDecimal("200.00").compareTo(report.totalRevenue()));
    assertEquals(0, new BigDecimal("120.00").compareTo(report.totalProfit()));
  }
}
