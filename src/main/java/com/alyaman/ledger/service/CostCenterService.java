package com.alyaman.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.domain.CostCenter;
import com.alyaman.ledger.domain.CourseTeacherAssignment;
import com.alyaman.ledger.repository.CostCenterRepository;
import com.alyaman.ledger.repository.CourseRepository;
import com.alyaman.ledger.repository.CourseTeacherAssignmentRepository;
import com.alyaman.ledger.repository.StudentEnrollmentRepository;
import com.alyaman.ledger.repository.TransactionRepository;

/**
 * Departmental figures per cost center, read straight from posted transactions, enrollments and
 * teacher assignments on every call.
 *
 * <p>Date bounds are inclusive. A null start or end leaves that side of the range open.
 */
@Service
@Transactional(readOnly = true)
public class CostCenterService {

    private static final Logger log = LoggerFactory.getLogger(CostCenterService.class);

    // Stand-ins for an open range; both fit a SQL DATE column
    static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private final CostCenterRepository costCenterRepository;
    private final CourseRepository courseRepository;
    private final CourseTeacherAssignmentRepository assignmentRepository;
    private final StudentEnrollmentRepository enrollmentRepository;
    private final TransactionRepository transactionRepository;
    private final ChartOfAccounts chartOfAccounts;

    public CostCenterService(CostCenterRepository costCenterRepository,
                             CourseRepository courseRepository,
                             CourseTeacherAssignmentRepository assignmentRepository,
                             StudentEnrollmentRepository enrollmentRepository,
                             TransactionRepository transactionRepository,
                             ChartOfAccounts chartOfAccounts) {
        this.costCenterRepository = costCenterRepository;
        this.courseRepository = courseRepository;
        this.assignmentRepository = assignmentRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.transactionRepository = transactionRepository;
        this.chartOfAccounts = chartOfAccounts;
    }

    // ==================== EXPENSES AND REVENUE ====================

    /**
     * Sum of debit transactions tagged to the cost center.
     */
    public BigDecimal totalExpenses(CostCenter costCenter, LocalDate startDate, LocalDate endDate) {
        return transactionRepository.sumByCostCenterAndDateRange(
            costCenter, true, from(startDate), to(endDate));
    }

    /**
     * Salary owed on the cost center's active teacher assignments that started within the range.
     */
    public BigDecimal teacherSalaries(CostCenter costCenter, LocalDate startDate, LocalDate endDate) {
        return assignmentRepository
            .findActiveByCostCenterAndStartDateRange(costCenter, from(startDate), to(endDate))
            .stream()
            .map(CourseTeacherAssignment::calculateTotalSalary)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Total expenses less teacher salaries. A negative result means recorded expenses do not
     * cover the assigned salaries; it is reported as is.
     */
    public BigDecimal otherExpenses(CostCenter costCenter, LocalDate startDate, LocalDate endDate) {
        BigDecimal other = totalExpenses(costCenter, startDate, endDate)
            .subtract(teacherSalaries(costCenter, startDate, endDate));
        if (other.signum() < 0) {
            log.warn("Cost center {} has negative other expenses ({}) for {} to {}",
                costCenter.getCode(), other, startDate, endDate);
        }
        return other;
    }

    /**
     * Gross enrollment amounts on the cost center's active courses.
     */
    public BigDecimal totalRevenue(CostCenter costCenter, LocalDate startDate, LocalDate endDate) {
        return enrollmentRepository.sumTotalAmountByCostCenterAndDateRange(
            costCenter, from(startDate), to(endDate));
    }

    public long courseCount(CostCenter costCenter) {
        return courseRepository.countByCostCenterAndActiveTrue(costCenter);
    }

    // ==================== CASH FLOW ====================

    public BigDecimal cashInflow(CostCenter costCenter, LocalDate startDate, LocalDate endDate) {
        return transactionRepository.sumByCostCenterAndAccountCodesAndDateRange(
            costCenter, true, chartOfAccounts.cashAccountCodes(), from(startDate), to(endDate));
    }

    public BigDecimal cashOutflow(CostCenter costCenter, LocalDate startDate, LocalDate endDate) {
        return transactionRepository.sumByCostCenterAndAccountCodesAndDateRange(
            costCenter, false, chartOfAccounts.cashAccountCodes(), from(startDate), to(endDate));
    }

    /**
     * Debits minus credits on all of the cost center's transactions before the start date; zero
     * without a start date.
     */
    public BigDecimal openingBalance(CostCenter costCenter, LocalDate startDate) {
        if (startDate == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal debits = transactionRepository.sumByCostCenterBefore(costCenter, true, startDate);
        BigDecimal credits = transactionRepository.sumByCostCenterBefore(costCenter, false, startDate);
        return debits.subtract(credits);
    }

    public BigDecimal closingBalance(CostCenter costCenter, LocalDate startDate, LocalDate endDate) {
        return cashFlow(costCenter, startDate, endDate).closingBalance();
    }

    // ==================== REPORTS ====================

    public ProfitAndLoss profitAndLoss(CostCenter costCenter, LocalDate startDate, LocalDate endDate) {
        BigDecimal revenue = totalRevenue(costCenter, startDate, endDate);
        BigDecimal expenses = totalExpenses(costCenter, startDate, endDate);
        BigDecimal salaries = teacherSalaries(costCenter, startDate, endDate);
        BigDecimal other = expenses.subtract(salaries);
        if (other.signum() < 0) {
            log.warn("Cost center {} has negative other expenses ({}) for {} to {}",
                costCenter.getCode(), other, startDate, endDate);
        }
        BigDecimal monthlyBudget = costCenter.getMonthlyBudget();
        BigDecimal budgetVariance = monthlyBudget != null && monthlyBudget.signum() != 0
            ? monthlyBudget.subtract(expenses)
            : BigDecimal.ZERO;

        return new ProfitAndLoss(
            costCenter,
            startDate,
            endDate,
            revenue,
            expenses,
            salaries,
            other,
            revenue.subtract(expenses),
            budgetVariance,
            courseCount(costCenter)
        );
    }

    public CashFlow cashFlow(CostCenter costCenter, LocalDate startDate, LocalDate endDate) {
        BigDecimal opening = openingBalance(costCenter, startDate);
        BigDecimal inflow = cashInflow(costCenter, startDate, endDate);
        BigDecimal outflow = cashOutflow(costCenter, startDate, endDate);
        BigDecimal net = inflow.subtract(outflow);
        return new CashFlow(costCenter, startDate, endDate, opening, inflow, outflow, net, opening.add(net));
    }

    /**
     * Profit and loss plus cash flow for every active cost center.
     */
    public CostCenterReport summaries(LocalDate startDate, LocalDate endDate) {
        List<ProfitAndLoss> profitAndLoss = new ArrayList<>();
        List<CashFlow> cashFlows = new ArrayList<>();
        for (CostCenter costCenter : costCenterRepository.findByActiveTrueOrderByCode()) {
            profitAndLoss.add(profitAndLoss(costCenter, startDate, endDate));
            cashFlows.add(cashFlow(costCenter, startDate, endDate));
        }
        return new CostCenterReport(startDate, endDate, profitAndLoss, cashFlows);
    }

    private static LocalDate from(LocalDate startDate) {
        return startDate != null ? startDate : EARLIEST;
    }

    private static LocalDate to(LocalDate endDate) {
        return endDate != null ? endDate : LATEST;
    }

    // Report DTOs

    public record ProfitAndLoss(
        CostCenter costCenter,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal totalRevenue,
        BigDecimal totalExpenses,
        BigDecimal teacherSalaries,
        BigDecimal otherExpenses,
        BigDecimal profit,
        BigDecimal budgetVariance,
        long courseCount
    ) {}

    public record CashFlow(
        CostCenter costCenter,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal openingBalance,
        BigDecimal cashInflow,
        BigDecimal cashOutflow,
        BigDecimal netCashFlow,
        BigDecimal closingBalance
    ) {}

    public record CostCenterReport(
        LocalDate startDate,
        LocalDate endDate,
        List<ProfitAndLoss> profitAndLoss,
        List<CashFlow> cashFlows
    ) {
        public BigDecimal totalRevenue() {
            return profitAndLoss.stream().map(ProfitAndLoss::totalRevenue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        }

        public BigDecimal totalExpenses() {
            return profitAndLoss.stream().map(ProfitAndLoss::totalExpenses)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        }

        public BigDecimal totalProfit() {
            return profitAndLoss.stream().map(ProfitAndLoss::profit)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        }
    }
}
