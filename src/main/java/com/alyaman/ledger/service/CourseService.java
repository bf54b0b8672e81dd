package com.alyaman.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.domain.CostCenter;
import com.alyaman.ledger.domain.Course;
import com.alyaman.ledger.domain.CourseTeacherAssignment;
import com.alyaman.ledger.domain.Teacher;
import com.alyaman.ledger.domain.User;
import com.alyaman.ledger.repository.CourseRepository;
import com.alyaman.ledger.repository.CourseTeacherAssignmentRepository;

/**
 * Courses and teacher assignments. Creating a course also creates its deferred revenue and
 * revenue accounts.
 */
@Service
@Transactional
public class CourseService {

  private final CourseRepository courseRepository;
  private final CourseTeacherAssignmentRepository assignmentRepository;
  private final AccountService accountService;
  private final AuditService auditService;

  public CourseService(
      CourseRepository courseRepository,
      CourseTeacherAssignmentRepository assignmentRepository,
      AccountService accountService,
      AuditService auditService) {
    this.courseRepository = courseRepository;
    this.assignmentRepository = assignmentRepository;
    this.accountService = accountService;
    this.auditService = auditService;
  }

  public Course createCourse(String name, BigDecimal price, CostCenter costCenter, User actor) {
    Course course = courseRepository.save(new Course(name, price, costCenter));
    accountService.ensureCourseAccounts(course);

    auditService.logEvent(
        actor, "COURSE_CREATED", "Course", course.getId(), "Created course: " + name);
    return course;
  }

  /**
   * Assigns a teacher to a course. Pass an hourly rate with total hours, or a monthly rate.
   */
  public CourseTeacherAssignment assignTeacher(
      Course course,
      Teacher teacher,
      LocalDate startDate,
      BigDecimal hourlyRate,
      Integer totalHours,
      BigDecimal monthlyRate) {
    CourseTeacherAssignment assignment = new CourseTeacherAssignment(course, teacher, startDate);
    assignment.setHourlyRate(hourlyRate);
    assignment.setTotalHours(totalHours);
    assignment.setMonthlyRate(monthlyRate);
    return assignmentRepository.save(assignment);
  }

  @Transactional(readOnly = true)
  public List<Course> findActiveByCostCenter(CostCenter costCenter) {
    return courseRepository.findByCostCenterAndActiveTrue(costCenter);
  }
}
