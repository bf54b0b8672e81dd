package com.alyaman.ledger.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LedgerConfig {

  /** Source of "today" for reversals, salary runs and withdrawals. */
  @Bean
  public Clock ledgerClock() {
    return Clock.systemDefaultZone();
  }
}
