package com.alyaman.ledger.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.CostCenter;
import com.alyaman.ledger.domain.Course;

@Repository
public interface CourseRepository extends JpaRepository<Course, Long> {

  List<Course> findByCostCenterAndActiveTrue(CostCenter costCenter);

  long countByCostCenterAndActiveTrue(CostCenter costCenter);
}
