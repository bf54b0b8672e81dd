package com.alyaman.ledger.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.SalaryPosting;

@Repository
public interface SalaryPostingRepository extends JpaRepository<SalaryPosting, Long> {

  Optional<SalaryPosting> findByPayeeTypeAndPayeeIdAndPeriodYearAndPeriodMonthAndPurpose(
      SalaryPosting.PayeeType payeeType,
      Long payeeId,
      int periodYear,
      int periodMonth,
      SalaryPosting.Purpose purpose);
}
