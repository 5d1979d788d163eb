package com.componentwatch.monitor.persistence;

import com.componentwatch.monitor.model.Alert;
import com.componentwatch.monitor.model.AlertFilter;
import com.componentwatch.monitor.model.AlertRecord;
import com.componentwatch.monitor.model.AlertStats;
import com.componentwatch.monitor.model.AlertStatus;
import com.componentwatch.monitor.model.RunReport;
import com.componentwatch.monitor.model.StoredRunReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class MonitorJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(MonitorJdbcRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public MonitorJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public int insertAlerts(List<Alert> alerts) {
        if (alerts == null || alerts.isEmpty()) {
            return 0;
        }
        Instant createdAt = Instant.now();
        List<MapSqlParameterSource> paramsList = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            paramsList.add(new MapSqlParameterSource()
                .addValue("alertDate", toTimestamp(alert.date()))
                .addValue("target", alert.target())
                .addValue("pageType", alert.pageType())
                .addValue("component", alert.component())
                .addValue("status", alert.status().name())
                .addValue("message", alert.message())
                .addValue("createdAt", toTimestamp(createdAt)));
        }
        jdbc.batchUpdate(
            """
                INSERT INTO alerts (alert_date, target, page_type, component, status, message, created_at)
                VALUES (:alertDate, :target, :pageType, :component, :status, :message, :createdAt)
                """,
            paramsList.toArray(new MapSqlParameterSource[0])
        );
        return alerts.size();
    }

    public long insertRunReport(RunReport report, Instant savedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("savedAt", toTimestamp(savedAt))
            .addValue("startedAt", toTimestamp(report.startTime()))
            .addValue("finishedAt", toTimestamp(report.endTime()))
            .addValue("executionTime", report.executionTime())
            .addValue("totalTargets", report.totalTargets())
            .addValue("successful", report.successful())
            .addValue("failed", report.failed())
            .addValue("totalAlerts", report.totalAlerts())
            .addValue("reportJson", writeReport(report));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO run_reports (
                    saved_at,
                    started_at,
                    finished_at,
                    execution_time,
                    total_targets,
                    successful,
                    failed,
                    total_alerts,
                    report_json
                )
                VALUES (
                    :savedAt,
                    :startedAt,
                    :finishedAt,
                    :executionTime,
                    :totalTargets,
                    :successful,
                    :failed,
                    :totalAlerts,
                    :reportJson
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public Optional<StoredRunReport> findLatestRunReport() {
        List<StoredRunReport> rows = jdbc.query(
            """
                SELECT id, saved_at, report_json
                FROM run_reports
                ORDER BY saved_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> {
                RunReport report = readReport(rs.getLong("id"), rs.getString("report_json"));
                return report == null
                    ? null
                    : new StoredRunReport(rs.getLong("id"), toInstant(rs.getTimestamp("saved_at")), report);
            }
        );
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    public List<AlertRecord> findAlerts(AlertFilter filter, int offset, int limit) {
        MapSqlParameterSource params = filterParams(filter)
            .addValue("offset", Math.max(0, offset))
            .addValue("limit", Math.max(1, limit));
        String sql =
            """
                SELECT id, alert_date, target, page_type, component, status, message, created_at
                FROM alerts
                """ +
                whereClause(filter) +
                " ORDER BY alert_date DESC, id DESC LIMIT :limit OFFSET :offset";
        return jdbc.query(sql, params, alertRowMapper());
    }

    public long countAlerts(AlertFilter filter) {
        Long total = jdbc.queryForObject(
            "SELECT COUNT(*) FROM alerts" + whereClause(filter),
            filterParams(filter),
            Long.class
        );
        return total == null ? 0L : total;
    }

    public Optional<AlertRecord> findAlertById(long id) {
        List<AlertRecord> rows = jdbc.query(
            """
                SELECT id, alert_date, target, page_type, component, status, message, created_at
                FROM alerts
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            alertRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public AlertStats alertStats() {
        long total = countAlerts(AlertFilter.none());
        return new AlertStats(
            total,
            countGroupedBy("target"),
            countGroupedBy("page_type"),
            countGroupedBy("status")
        );
    }

    public int deleteAllAlerts() {
        return jdbc.update("DELETE FROM alerts", new MapSqlParameterSource());
    }

    private Map<String, Long> countGroupedBy(String column) {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            "SELECT " + column + " AS bucket, COUNT(*) AS total FROM alerts GROUP BY " + column
                + " ORDER BY total DESC, " + column,
            new MapSqlParameterSource(),
            rs -> {
                String bucket = rs.getString("bucket");
                if (bucket != null) {
                    counts.put(bucket, rs.getLong("total"));
                }
            }
        );
        return counts;
    }

    private static String whereClause(AlertFilter filter) {
        if (filter == null) {
            return "";
        }
        List<String> conditions = new ArrayList<>();
        if (filter.target() != null) {
            conditions.add("target = :target");
        }
        if (filter.pageType() != null) {
            conditions.add("page_type = :pageType");
        }
        if (filter.status() != null) {
            conditions.add("status = :status");
        }
        if (filter.from() != null) {
            conditions.add("alert_date >= :from");
        }
        if (filter.to() != null) {
            conditions.add("alert_date < :to");
        }
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private MapSqlParameterSource filterParams(AlertFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (filter == null) {
            return params;
        }
        params.addValue("target", filter.target())
            .addValue("pageType", filter.pageType())
            .addValue("status", filter.status() == null ? null : filter.status().name())
            .addValue("from", toTimestamp(filter.from()))
            .addValue("to", toTimestamp(filter.to()));
        return params;
    }

    private RowMapper<AlertRecord> alertRowMapper() {
        return (rs, rowNum) -> new AlertRecord(
            rs.getLong("id"),
            toInstant(rs.getTimestamp("alert_date")),
            rs.getString("target"),
            rs.getString("page_type"),
            rs.getString("component"),
            parseStatus(rs.getString("status")),
            rs.getString("message"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private String writeReport(RunReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize run report", e);
        }
    }

    private RunReport readReport(long id, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, RunReport.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored run report {} could not be parsed", id, e);
            return null;
        }
    }

    private AlertStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return AlertStatus.valueOf(raw.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Unknown alert status in storage: {}", raw);
            return null;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
