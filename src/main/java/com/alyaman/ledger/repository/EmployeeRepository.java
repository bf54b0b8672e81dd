package com.alyaman.ledger.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.Employee;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, Long> {}
