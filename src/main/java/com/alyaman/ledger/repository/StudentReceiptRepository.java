package com.alyaman.ledger.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.StudentReceipt;

@Repository
public interface StudentReceiptRepository extends JpaRepository<StudentReceipt, Long> {}
