package tech.relationsync.record.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.relationsync.model.DomainObjectRef;
import tech.relationsync.model.DomainObjectType;
import tech.relationsync.model.RelationshipSet;
import tech.relationsync.model.SyncRecord;
import tech.relationsync.model.SyncStatus;
import tech.relationsync.record.SyncRecordRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of SyncRecordRepository.
 * The applied tuple set is stored as a JSON array alongside the status code.
 */
@ApplicationScoped
@Typed(JdbcSyncRecordRepository.class)
public class JdbcSyncRecordRepository implements SyncRecordRepository {

    private static final Logger LOG = Logger.getLogger(JdbcSyncRecordRepository.class);

    private static final String TABLE = "relation_sync_record";

    @Inject
    AgroalDataSource dataSource;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public Optional<SyncRecord> find(DomainObjectRef ref) {
        String sql = """
            SELECT object_type, object_id, applied_set, status, last_error, last_synced_at, updated_at
            FROM %s
            WHERE object_type = ? AND object_id = ?
            """.formatted(TABLE);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, ref.type().name());
            stmt.setString(2, ref.id());

            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            LOG.errorf(e, "Failed to load sync record for %s", ref);
            throw new SyncRecordStoreException("Failed to load sync record for " + ref, e);
        }
    }

    @Override
    public List<SyncRecord> findAll() {
        String sql = """
            SELECT object_type, object_id, applied_set, status, last_error, last_synced_at, updated_at
            FROM %s
            ORDER BY object_type, object_id
            """.formatted(TABLE);
        return query(sql, null);
    }

    @Override
    public List<SyncRecord> findByType(DomainObjectType type) {
        String sql = """
            SELECT object_type, object_id, applied_set, status, last_error, last_synced_at, updated_at
            FROM %s
            WHERE object_type = ?
            ORDER BY object_id
            """.formatted(TABLE);
        return query(sql, type.name());
    }

    @Override
    public void save(SyncRecord record) {
        String sql = """
            INSERT INTO %s (object_type, object_id, applied_set, status, last_error, last_synced_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (object_type, object_id) DO UPDATE SET
                applied_set = EXCLUDED.applied_set,
                status = EXCLUDED.status,
                last_error = EXCLUDED.last_error,
                last_synced_at = EXCLUDED.last_synced_at,
                updated_at = EXCLUDED.updated_at
            """.formatted(TABLE);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, record.ref().type().name());
            stmt.setString(2, record.ref().id());
            stmt.setString(3, writeSet(record.lastAppliedSet()));
            stmt.setInt(4, record.status().getCode());
            stmt.setString(5, record.lastError());
            stmt.setTimestamp(6, toTimestamp(record.lastSyncedAt()));
            stmt.setTimestamp(7, toTimestamp(record.updatedAt()));
            stmt.executeUpdate();

        } catch (SQLException e) {
            LOG.errorf(e, "Failed to save sync record for %s", record.ref());
            throw new SyncRecordStoreException("Failed to save sync record for " + record.ref(), e);
        }
    }

    @Override
    public void delete(DomainObjectRef ref) {
        String sql = "DELETE FROM %s WHERE object_type = ? AND object_id = ?".formatted(TABLE);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, ref.type().name());
            stmt.setString(2, ref.id());
            stmt.executeUpdate();

        } catch (SQLException e) {
            LOG.errorf(e, "Failed to delete sync record for %s", ref);
            throw new SyncRecordStoreException("Failed to delete sync record for " + ref, e);
        }
    }

    @Override
    public void createSchema() {
        String sql = """
            CREATE TABLE IF NOT EXISTS %s (
                object_type VARCHAR(32) NOT NULL,
                object_id VARCHAR(255) NOT NULL,
                applied_set TEXT NOT NULL,
                status SMALLINT NOT NULL DEFAULT 0,
                last_error TEXT,
                last_synced_at TIMESTAMP WITH TIME ZONE,
                updated_at TIMESTAMP WITH TIME ZONE NOT NULL,
                PRIMARY KEY (object_type, object_id)
            )
            """.formatted(TABLE);

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_%s_status ON %s (status)".formatted(TABLE, TABLE));
            LOG.infof("Ensured sync record table %s exists", TABLE);
        } catch (SQLException e) {
            LOG.errorf(e, "Failed to create sync record table %s", TABLE);
            throw new SyncRecordStoreException("Failed to create sync record table", e);
        }
    }

    private List<SyncRecord> query(String sql, String param) {
        List<SyncRecord> records = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            if (param != null) {
                stmt.setString(1, param);
            }

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            LOG.errorf(e, "Failed to query sync records");
            throw new SyncRecordStoreException("Failed to query sync records", e);
        }

        return records;
    }

    private SyncRecord mapRow(ResultSet rs) throws SQLException {
        DomainObjectRef ref = new DomainObjectRef(
            DomainObjectType.valueOf(rs.getString("object_type")),
            rs.getString("object_id"));
        return new SyncRecord(
            ref,
            readSet(rs.getString("applied_set"), ref),
            toInstant(rs.getTimestamp("last_synced_at")),
            SyncStatus.fromCode(rs.getInt("status")),
            rs.getString("last_error"),
            toInstant(rs.getTimestamp("updated_at")));
    }

    private String writeSet(RelationshipSet set) {
        try {
            return objectMapper.writeValueAsString(set);
        } catch (JsonProcessingException e) {
            throw new SyncRecordStoreException("Failed to serialize applied set", e);
        }
    }

    private RelationshipSet readSet(String json, DomainObjectRef ref) {
        try {
            return json == null ? RelationshipSet.empty() : objectMapper.readValue(json, RelationshipSet.class);
        } catch (JsonProcessingException e) {
            throw new SyncRecordStoreException("Corrupt applied set for " + ref, e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
