package com.marianbastiurea.parking.infrastructure.jdbc;

import com.marianbastiurea.parking.domain.enums.Ledger;
import com.marianbastiurea.parking.domain.model.AllocationLogEntry;
import com.marianbastiurea.parking.domain.repo.AllocationLogRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class AllocationLogJdbc implements AllocationLogRepo {
    private static final Logger log = LoggerFactory.getLogger(AllocationLogJdbc.class);

    private final NamedParameterJdbcTemplate tpl;

    public AllocationLogJdbc(NamedParameterJdbcTemplate tpl) {
        this.tpl = tpl;
    }

    private static final String INSERT_LOG = """
                INSERT INTO processing_log(ledger, vehicle_id, status, bay, slot, score, reason, logged_at)
                VALUES (:ledger, :vehicleId, :status, :bay, :slot, :score, :reason, :loggedAt)
            """;

    private static final String SELECT_RECENT = """
                SELECT id, ledger, vehicle_id, status, bay, slot, score, reason, logged_at
                  FROM processing_log
                 WHERE ledger = :ledger
                 ORDER BY id DESC
                 FETCH FIRST :limit ROWS ONLY
            """;

    private static final RowMapper<AllocationLogEntry> ROW = (rs, n) -> new AllocationLogEntry(
            rs.getLong("id"),
            Ledger.valueOf(rs.getString("ledger")),
            rs.getString("vehicle_id"),
            rs.getString("status"),
            rs.getObject("bay", Integer.class),
            rs.getObject("slot", Integer.class),
            rs.getObject("score", Double.class),
            rs.getString("reason"),
            rs.getTimestamp("logged_at").toInstant()
    );

    @Override
    public void insert(AllocationLogEntry entry) {
        tpl.update(INSERT_LOG, new MapSqlParameterSource()
                .addValue("ledger", entry.ledger().name())
                .addValue("vehicleId", entry.vehicleId())
                .addValue("status", entry.status())
                .addValue("bay", entry.bay())
                .addValue("slot", entry.slot())
                .addValue("score", entry.score())
                .addValue("reason", entry.reason())
                .addValue("loggedAt", Timestamp.from(entry.loggedAt())));

        if (log.isDebugEnabled()) {
            log.debug("[log.insert] ledger={} vehicle={} status={} bay={} slot={}",
                    entry.ledger(), entry.vehicleId(), entry.status(), entry.bay(), entry.slot());
        }
    }

    @Override
    public List<AllocationLogEntry> findRecent(Ledger ledger, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return tpl.query(SELECT_RECENT, new MapSqlParameterSource()
                .addValue("ledger", ledger.name())
                .addValue("limit", limit), ROW);
    }
}
