package com.alyaman.ledger.repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.CostCenter;
import com.alyaman.ledger.domain.Course;
import com.alyaman.ledger.domain.Student;
import com.alyaman.ledger.domain.StudentEnrollment;

@Repository
public interface StudentEnrollmentRepository extends JpaRepository<StudentEnrollment, Long> {

  Optional<StudentEnrollment> findByStudentAndCourse(Student student, Course course);

  @Query(
      "SELECT COALESCE(SUM(e.totalAmount), 0) FROM StudentEnrollment e "
          + "WHERE e.course.costCenter = :costCenter AND e.course.active = true "
          + "AND e.enrollmentDate BETWEEN :startDate AND :endDate")
  BigDecimal sumTotalAmountByCostCenterAndDateRange(
      @Param("costCenter") CostCenter costCenter,
      @Param("startDate") LocalDate startDate,
      @Param("endDate") LocalDate endDate);
}
