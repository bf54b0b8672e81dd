package com.alyaman.ledger.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.Student;

@Repository
public interface StudentRepository extends JpaRepository<Student, Long> {}
