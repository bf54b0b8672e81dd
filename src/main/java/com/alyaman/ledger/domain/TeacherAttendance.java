package com.alyaman.ledger.domain;

import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/** Sessions taught by a teacher on one day. Only present days count towards salary. */
@Entity
@Table(
    name = "teacher_attendance",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_teacher_attendance_day",
          columnNames = {"teacher_id", "attendance_date"})
    })
public class TeacherAttendance {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "teacher_id", nullable = false)
  private Teacher teacher;

  @NotNull
  @Column(name = "attendance_date", nullable = false)
  private LocalDate attendanceDate;

  @Column(name = "session_count", nullable = false)
  private int sessionCount;

  @Column(nullable = false)
  private boolean present = true;

  public TeacherAttendance() {}

  public TeacherAttendance(Teacher teacher, LocalDate attendanceDate, int sessionCount) {
    this.teacher = teacher;
    this.attendanceDate = attendanceDate;
    this.sessionCount = sessionCount;
  }

  public Long getId() {
    return id;
  }

  public Teacher getTeacher() {
    return teacher;
  }

  public LocalDate getAttendanceDate() {
    return attendanceDate;
  }

  public int getSessionCount() {
    return sessionCount;
  }

  public boolean isPresent() {
    return present;
  }

  public void setPresent(boolean present) {
    this.present = present;
  }
}
