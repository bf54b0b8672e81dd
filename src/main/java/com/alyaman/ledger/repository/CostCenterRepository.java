package com.alyaman.ledger.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.CostCenter;

@Repository
public interface CostCenterRepository extends JpaRepository<CostCenter, Long> {

  Optional<CostCenter> findByCode(String code);

  List<CostCenter> findByActiveTrueOrderByCode();
}
