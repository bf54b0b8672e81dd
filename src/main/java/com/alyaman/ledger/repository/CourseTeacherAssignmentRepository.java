package com.alyaman.ledger.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.CostCenter;
import com.alyaman.ledger.domain.CourseTeacherAssignment;

@Repository
public interface CourseTeacherAssignmentRepository
    extends JpaRepository<CourseTeacherAssignment, Long> {

  @Query(
      "SELECT a FROM CourseTeacherAssignment a WHERE a.course.costCenter = :costCenter "
          + "AND a.active = true AND a.course.active = true "
          + "AND a.startDate BETWEEN :startDate AND :endDate")
  List<CourseTeacherAssignment> findActiveByCostCenterAndStartDateRange(
      @Param("costCenter") CostCenter costCenter,
      @Param("startDate") LocalDate startDate,
      @Param("endDate") LocalDate endDate);
}
