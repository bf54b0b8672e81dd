package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Assigns a teacher to a course with the pay agreed for that course. Used by cost center reports to
 * attribute teacher salaries.
 */
@Entity
@Table(
    name = "course_teacher_assignment",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_course_teacher_start",
          columnNames = {"course_id", "teacher_id", "start_date"})
    })
public class CourseTeacherAssignment {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "course_id", nullable = false)
  private Course course;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "teacher_id", nullable = false)
  private Teacher teacher;

  @NotNull
  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "hourly_rate", precision = 19, scale = 2)
  private BigDecimal hourlyRate;

  @Column(name = "monthly_rate", precision = 19, scale = 2)
  private BigDecimal monthlyRate;

  @Column(name = "total_hours")
  private Integer totalHours;

  @Column(nullable = false)
  private boolean active = true;

  @Size(max = 500)
  @Column(length = 500)
  private String notes;

  public CourseTeacherAssignment() {}

  public CourseTeacherAssignment(Course course, Teacher teacher, LocalDate startDate) {
    this.course = course;
    this.teacher = teacher;
    this.startDate = startDate;
  }

  /**
   * Salary owed for this assignment: hourly rate times total hours when both are set, otherwise
   * the monthly rate, otherwise zero.
   */
  public BigDecimal calculateTotalSalary() {
    if (isPositive(hourlyRate) && totalHours != null && totalHours > 0) {
      return hourlyRate.multiply(BigDecimal.valueOf(totalHours));
    }
    if (isPositive(monthlyRate)) {
      return monthlyRate;
    }
    return BigDecimal.ZERO;
  }

  private static boolean isPositive(BigDecimal value) {
    return value != null && value.signum() > 0;
  }

  public Long getId() {
    return id;
  }

  public Course getCourse() {
    return course;
  }

  public Teacher getTeacher() {
    return teacher;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public void setEndDate(LocalDate endDate) {
    this.endDate = endDate;
  }

  public BigDecimal getHourlyRate() {
    return hourlyRate;
  }

  public void setHourlyRate(BigDecimal hourlyRate) {
    this.hourlyRate = hourlyRate;
  }

  public BigDecimal getMonthlyRate() {
    return monthlyRate;
  }

  public void setMonthlyRate(BigDecimal monthlyRate) {
    this.monthlyRate = monthlyRate;
  }

  public Integer getTotalHours() {
    return totalHours;
  }

  public void setTotalHours(Integer totalHours) {
    this.totalHours = totalHours;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }
}
