package com.alyaman.ledger.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.domain.User;
import com.alyaman.ledger.repository.UserRepository;
import com.alyaman.ledger.service.AccountService;

/**
 * Prepares a fresh database on startup: the system user that owns automated postings and the
 * shared accounts every workflow posts to. Safe to run against an initialized database.
 */
@Component
public class DataInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

  static final String SYSTEM_USERNAME = "system";
  private static final String SYSTEM_DISPLAY_NAME = "System";

  private final UserRepository userRepository;
  private final AccountService accountService;

  public DataInitializer(UserRepository userRepository, AccountService accountService) {
    this.userRepository = userRepository;
    this.accountService = accountService;
  }

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    if (userRepository.findByUsername(SYSTEM_USERNAME).isEmpty()) {
      log.info("Creating system user: {}", SYSTEM_USERNAME);
      userRepository.save(new User(SYSTEM_USERNAME, SYSTEM_DISPLAY_NAME));
    }

    int created = accountService.seedWellKnownAccounts();
    if (created > 0) {
      log.info("Seeded {} shared ledger accounts", created);
    } else {
      log.info("Shared ledger accounts already present");
    }
  }
}
