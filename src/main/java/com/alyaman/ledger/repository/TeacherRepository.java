package com.alyaman.ledger.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.Teacher;

@Repository
public interface TeacherRepository extends JpaRepository<Teacher, Long> {}
