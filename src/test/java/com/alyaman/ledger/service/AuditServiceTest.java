package com.alyaman.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.alyaman.ledger.domain.AuditEvent;
import com.alyaman.ledger.domain.User;
import com.alyaman.ledger.repository.AuditEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

  @Mock private AuditEventRepository auditEventRepository;

  private AuditService auditService;

  private User actor;

  @BeforeEach
  void setUp() {
    auditService = new AuditService(auditEventRepository, new ObjectMapper());
    actor = new User("accountant", "Accountant");
  }

  @Test
  void logEvent_withDetails_storesThemAsJson() {
    // Arrange
    when(auditEventRepository.save(any(AuditEvent.class))).thenAnswer(inv -> inv.getArgument(0));

    // Act
    AuditEvent event =
        auditService.logEvent(
            actor,
            "ENTRY_POSTED",
            "JournalEntry",
            12L,
            "Posted JE-000012",
            Map.of("amount", new BigDecimal("1800.00")));

    // Assert
    assertEquals("ENTRY_POSTED", event.getEventType());
    assertEquals(actor, event.getActor());
    assertEquals("{\"amount\":1800.00}", event.getDetailsJson());
  }

  @Test
  void logEvent_withoutDetails_leavesJsonEmpty() {
    when(auditEventRepository.save(any(AuditEvent.class))).thenAnswer(inv -> inv.getArgument(0));

    AuditEvent event = auditService.logEvent(actor, "COURSE_CREATED", "Course", 3L, "Created course");

    assertNull(event.getDetailsJson());
  }

  @Test
  void logEvent_whenSummaryTooLong_truncatesTo500Characters() {
    when(auditEventRepository.save(any(AuditEvent.class))).thenAnswer(inv -> inv.getArgument(0));

    AuditEvent event = auditService.logEvent(actor, "NOTE", "Account", 1L, "x".repeat(800));

    assertEquals(500, event.getSummary().length());
    assertTrue(event.getSummary().endsWith("..."));
  }

  @Test
  void findByEntity_returnsEventsInCreationOrder() {
    List<AuditEvent> events = List.of(new AuditEvent(actor, "ACCOUNT_CREATED", "Account", 1L, "Created"));
    when(auditEventRepository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc("Account", 1L))
        .thenReturn(events);

    assertEquals(events, auditService.findByEntity("Account", 1L));
  }
}
