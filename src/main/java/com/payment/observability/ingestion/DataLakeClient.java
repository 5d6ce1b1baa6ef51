package com.payment.observability.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.observability.core.PayloadValues;
import com.payment.observability.core.RawEventSource;
import com.payment.observability.domain.MerchantDescriptor;
import com.payment.observability.domain.RawIngestionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * {@link RawEventSource} over the {@code raw_payments_ingestion} table of the data lake.
 * Each row holds a JSON payload of the form {@code {"data": {...provider event...}, "merchant": {...},
 * "transactional_id": "..."}}.
 */
@Slf4j
public class DataLakeClient implements RawEventSource {

    private static final String SELECT_UNPROCESSED = """
            SELECT id, payload, created_at
            FROM raw_payments_ingestion
            WHERE is_processed = false
            ORDER BY created_at ASC
            LIMIT :limit
            """;

    private static final String MARK_PROCESSED = """
            UPDATE raw_payments_ingestion
            SET is_processed = true
            WHERE CAST(id AS VARCHAR) IN (:ids)
            """;

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public DataLakeClient(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<RawIngestionRecord> getUnprocessedBatch(int limit) {
        try {
            List<RawIngestionRecord> records = jdbcTemplate.query(SELECT_UNPROCESSED,
                    new MapSqlParameterSource("limit", limit), (rs, rowNum) -> toRecord(rs));
            log.debug("Fetched {} unprocessed raw records (limit={})", records.size(), limit);
            return records;
        } catch (DataAccessException e) {
            throw new DataLakeException("Failed to fetch unprocessed raw records: " + e.getMessage(), e);
        }
    }

    @Override
    public int markProcessed(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        try {
            int updated = jdbcTemplate.update(MARK_PROCESSED, new MapSqlParameterSource("ids", ids));
            log.info("Marked {} raw records as processed (requested={})", updated, ids.size());
            return updated;
        } catch (DataAccessException e) {
            throw new DataLakeException("Failed to mark " + ids.size() + " raw records as processed", e);
        }
    }

    @Override
    public long countRecords(Boolean processed) {
        try {
            Long count;
            if (processed == null) {
                count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM raw_payments_ingestion",
                        Collections.emptyMap(), Long.class);
            } else {
                count = jdbcTemplate.queryForObject(
                        "SELECT COUNT(*) FROM raw_payments_ingestion WHERE is_processed = :processed",
                        new MapSqlParameterSource("processed", processed), Long.class);
            }
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new DataLakeException("Failed to count raw records", e);
        }
    }

    @Override
    public boolean isHealthy() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Collections.emptyMap(), Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Data lake health check failed: {}", e.getMessage());
            return false;
        }
    }

    private RawIngestionRecord toRecord(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        Map<String, Object> payload = parsePayload(id, rs.getString("payload"));
        Map<String, Object> merchant = PayloadValues.map(payload, "merchant");
        Timestamp createdAt = rs.getTimestamp("created_at");
        return RawIngestionRecord.builder()
                .id(id)
                .data(PayloadValues.map(payload, "data"))
                .merchant(merchant == null ? null : MerchantDescriptor.builder()
                        .id(PayloadValues.string(merchant, "id"))
                        .name(PayloadValues.string(merchant, "name"))
                        .country(PayloadValues.string(merchant, "country"))
                        .build())
                .transactionalId(PayloadValues.string(payload, "transactional_id"))
                .createdAt(createdAt != null ? createdAt.toInstant() : null)
                .build();
    }

    private Map<String, Object> parsePayload(String id, String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Raw record {} has a payload that is not valid JSON: {}", id, e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
