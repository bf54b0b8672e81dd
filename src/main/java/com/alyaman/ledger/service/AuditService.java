package com.alyaman.ledger.service;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.domain.AuditEvent;
import com.alyaman.ledger.domain.User;
import com.alyaman.ledger.repository.AuditEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Records who changed what in the ledger. Events join the caller's transaction. */
@Service
@Transactional
public class AuditService {

  private static final Logger log = LoggerFactory.getLogger(AuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final ObjectMapper objectMapper;

  public AuditService(AuditEventRepository auditEventRepository, ObjectMapper objectMapper) {
    this.auditEventRepository = auditEventRepository;
    this.objectMapper = objectMapper;
  }

  public AuditEvent logEvent(
      User actor, String eventType, String entityType, Long entityId, String summary) {
    return logEvent(actor, eventType, entityType, entityId, summary, null);
  }

  public AuditEvent logEvent(
      User actor,
      String eventType,
      String entityType,
      Long entityId,
      String summary,
      Map<String, Object> details) {
    AuditEvent event = new AuditEvent(actor, eventType, entityType, entityId, truncate(summary));
    if (details != null && !details.isEmpty()) {
      try {
        event.setDetailsJson(objectMapper.writeValueAsString(details));
      } catch (JsonProcessingException e) {
        log.warn("Could not serialize audit details for {} {}: {}", entityType, entityId, e.getMessage());
      }
    }
    return auditEventRepository.save(event);
  }

  @Transactional(readOnly = true)
  public List<AuditEvent> findByEntity(String entityType, Long entityId) {
    return auditEventRepository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc(entityType, entityId);
  }

  private static String truncate(String summary) {
    if (summary == null || summary.length() <= 500) {
      return summary;
    }
    return summary.substring(0, 497) + "...";
  }
}
