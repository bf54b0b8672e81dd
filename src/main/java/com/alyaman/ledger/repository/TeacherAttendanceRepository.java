package com.alyaman.ledger.repository;

import java.time.LocalDate;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.Teacher;
import com.alyaman.ledger.domain.TeacherAttendance;

@Repository
public interface TeacherAttendanceRepository extends JpaRepository<TeacherAttendance, Long> {

  @Query(
      "SELECT COALESCE(SUM(a.sessionCount), 0) FROM TeacherAttendance a "
          + "WHERE a.teacher = :teacher AND a.present = true "
          + "AND a.attendanceDate BETWEEN :startDate AND :endDate")
  long sumSessions(
      @Param("teacher") Teacher teacher,
      @Param("startDate") LocalDate startDate,
      @Param("endDate") LocalDate endDate);
}
