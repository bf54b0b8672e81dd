package com.alyaman.ledger.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.Advance;
import com.alyaman.ledger.domain.Employee;
import com.alyaman.ledger.domain.Teacher;

@Repository
public interface AdvanceRepository extends JpaRepository<Advance, Long> {

  @Query(
      "SELECT a FROM Advance a WHERE a.teacher = :teacher AND a.repaid = false "
          + "AND a.date BETWEEN :startDate AND :endDate ORDER BY a.date, a.id")
  List<Advance> findUnrepaidByTeacherAndDateRange(
      @Param("teacher") Teacher teacher,
      @Param("startDate") LocalDate startDate,
      @Param("endDate") LocalDate endDate);

  List<Advance> findByEmployeeAndRepaidFalseOrderByDateAscIdAsc(Employee employee);
}
