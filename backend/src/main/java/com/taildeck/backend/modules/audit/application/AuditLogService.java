package com.taildeck.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

import com.taildeck.backend.modules.audit.domain.AuditLog;
import com.taildeck.backend.modules.audit.infrastructure.persistence.AuditLogRepository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 감사 로그 기록. 항목마다 별도 트랜잭션(REQUIRES_NEW)으로 커밋하며,
 * 기록 실패는 호출자에게 전파하지 않고 ERROR 로그와 실패 카운터로만 남긴다.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    public static final String WRITE_FAILURE_METRIC = "taildeck.audit.write.failures";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final Counter writeFailures;
    private final Clock clock;

    public AuditLogService(
            AuditLogRepository auditLogRepository,
            ObjectMapper objectMapper,
            PlatformTransactionManager transactionManager,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.writeFailures = Counter.builder(WRITE_FAILURE_METRIC)
                .description("Audit log entries that could not be persisted")
                .register(meterRegistry);
        this.clock = clock;
    }

    public AuditWriteResult logAudit(AuditEntry entry) {
        try {
            AuditLog auditLog = new AuditLog(
                    entry.action(),
                    entry.actor().userId(),
                    entry.actor().email(),
                    entry.actor().ip(),
                    entry.resourceType(),
                    entry.resourceId(),
                    toJson(entry.oldValue()),
                    toJson(entry.newValue()),
                    toJson(metadataOrNull(entry.metadata())),
                    OffsetDateTime.now(clock)
            );
            AuditLog saved = transactionTemplate.execute(status -> auditLogRepository.save(auditLog));
            Long id = saved != null ? saved.getId() : null;
            log.debug("Audit entry written: id={} action={} resource={}:{}",
                    id, entry.action(), entry.resourceType(), entry.resourceId());
            return AuditWriteResult.written(id);
        } catch (RuntimeException | JsonProcessingException ex) {
            writeFailures.increment();
            log.error("Failed to write audit entry: action={} resource={}:{} actor={}",
                    entry.action(), entry.resourceType(), entry.resourceId(), entry.actor().userId(), ex);
            return AuditWriteResult.failed();
        }
    }

    private String toJson(Object value) throws JsonProcessingException {
        if (value == null) {
            return null;
        }
        return objectMapper.writeValueAsString(value);
    }

    private static Map<String, Object> metadataOrNull(Map<String, Object> metadata) {
        return metadata == null || metadata.isEmpty() ? null : metadata;
    }
}
