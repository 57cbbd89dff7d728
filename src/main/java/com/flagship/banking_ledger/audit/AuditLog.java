package com.flagship.banking_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only log of every state-changing action, monetary or not.
 *
 * Records are only ever inserted; the table's trigger rejects UPDATE and DELETE.
 * An append joins the caller's transaction, so a rolled-back operation leaves no
 * audit trace.
 */
@Service
@Slf4j
public class AuditLog {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditLog(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public long append(String actor, AuditAction action, AuditEntity entity, Object entityId,
                       Map<String, ?> details) {
        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO audit_log (event_time, actor, action, entity, entity_id, details) " +
            "VALUES (?, ?, ?, ?, ?, CAST(? AS jsonb)) RETURNING audit_id",
            Long.class,
            Timestamp.from(clock.instant().truncatedTo(ChronoUnit.MICROS)),
            actor,
            action.name(),
            entity.name(),
            String.valueOf(entityId),
            toJson(details)
        );
        log.debug("Audit {} {} {} by {}", action, entity, entityId, actor);
        return id;
    }

    public List<AuditRecord> findByEntity(AuditEntity entity, Object entityId) {
        return jdbcTemplate.query(
            "SELECT audit_id, event_time, actor, action, entity, entity_id, details::text AS details " +
            "FROM audit_log WHERE entity = ? AND entity_id = ? ORDER BY audit_id",
            auditRecordRowMapper(),
            entity.name(),
            String.valueOf(entityId)
        );
    }

    /**
     * Builds an ordered details map from key/value pairs. Null values are kept.
     */
    public static Map<String, Object> details(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("details requires key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    private String toJson(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit details", e);
        }
    }

    private RowMapper<AuditRecord> auditRecordRowMapper() {
        return (rs, rowNum) -> new AuditRecord(
            rs.getLong("audit_id"),
            rs.getTimestamp("event_time").toInstant(),
            rs.getString("actor"),
            AuditAction.valueOf(rs.getString("action")),
            AuditEntity.valueOf(rs.getString("entity")),
            rs.getString("entity_id"),
            rs.getString("details")
        );
    }
}
