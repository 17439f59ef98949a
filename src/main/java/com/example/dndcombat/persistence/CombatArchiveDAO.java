package com.example.dndcombat.persistence;

import com.example.dndcombat.event.EncounterEvent;
import com.example.dndcombat.event.EncounterEventListener;
import com.example.dndcombat.event.OperationType;
import com.example.dndcombat.model.DamageLogEntry;
import com.example.dndcombat.model.DamageType;
import com.example.dndcombat.model.EncounterSnapshot;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Archives encounters, their damage log and their event stream to H2.
 *
 * Subscribed to the event bus, so writes happen on the dispatcher thread after each commit. All
 * writes are MERGEs keyed by encounter id and sequence, so replaying an event is harmless.
 */
public class CombatArchiveDAO implements EncounterEventListener {
    private static final Logger logger = LoggerFactory.getLogger(CombatArchiveDAO.class);

    private static final String USER = "sa";
    private static final String PASS = "";

    private final String url;

    public CombatArchiveDAO(String url) {
        this.url = url;
        ensureTables();
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(url, USER, PASS);
    }

    private void ensureTables() {
        try (Connection c = connect();
             Statement s = c.createStatement()) {

            s.execute("CREATE TABLE IF NOT EXISTS encounter_archive (" +
                "encounter_id VARCHAR(64) PRIMARY KEY, " +
                "session_id VARCHAR(128), " +
                "status VARCHAR(16) NOT NULL, " +
                "round_no INT NOT NULL, " +
                "version BIGINT NOT NULL, " +
                "participant_count INT NOT NULL, " +
                "updated_at BIGINT NOT NULL" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS damage_log (" +
                "encounter_id VARCHAR(64) NOT NULL, " +
                "id BIGINT NOT NULL, " +
                "participant_id VARCHAR(64) NOT NULL, " +
                "amount INT NOT NULL, " +
                "raw_amount INT NOT NULL, " +
                "damage_type VARCHAR(32) NOT NULL, " +
                "source_participant_id VARCHAR(64), " +
                "source_description VARCHAR(512), " +
                "round_no INT NOT NULL, " +
                "critical BOOLEAN DEFAULT FALSE, " +
                "created_at BIGINT NOT NULL, " +
                "PRIMARY KEY(encounter_id, id)" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS encounter_event (" +
                "encounter_id VARCHAR(64) NOT NULL, " +
                "seq BIGINT NOT NULL, " +
                "event_type VARCHAR(32) NOT NULL, " +
                "round_no INT NOT NULL, " +
                "status VARCHAR(16) NOT NULL, " +
                "created_at BIGINT NOT NULL, " +
                "PRIMARY KEY(encounter_id, seq)" +
            ")");

            s.execute("CREATE INDEX IF NOT EXISTS idx_damage_log_participant ON damage_log(encounter_id, participant_id)");

            logger.info("[CombatArchiveDAO] ensured encounter_archive, damage_log and encounter_event tables at {}", url);

        } catch (SQLException e) {
            throw new RuntimeException("Failed to create combat archive tables", e);
        }
    }

    @Override
    public void onEvent(EncounterEvent event) {
        EncounterSnapshot snap = event.snapshot();
        upsertEncounter(snap);
        if (event.type().touchesHitPoints()) {
            saveDamageLog(snap.damageLog());
        }
        recordEvent(event);
    }

    // ==================== ENCOUNTERS ====================

    public void upsertEncounter(EncounterSnapshot snap) {
        String sql = "MERGE INTO encounter_archive (encounter_id, session_id, status, round_no, version, " +
            "participant_count, updated_at) KEY(encounter_id) VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, snap.encounterId());
            ps.setString(2, snap.sessionId());
            ps.setString(3, snap.status().name());
            ps.setInt(4, snap.round());
            ps.setLong(5, snap.version());
            ps.setInt(6, snap.participants().size());
            ps.setLong(7, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to archive encounter " + snap.encounterId(), e);
        }
    }

    /** Archived status of an encounter, if it was ever archived. */
    public Optional<String> findStatus(String encounterId) {
        String sql = "SELECT status FROM encounter_archive WHERE encounter_id = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, encounterId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(rs.getString("status"));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read archived encounter " + encounterId, e);
        }
    }

    // ==================== DAMAGE LOG ====================

    public void saveDamageLog(List<DamageLogEntry> entries) {
        if (entries.isEmpty()) return;
        String sql = "MERGE INTO damage_log (encounter_id, id, participant_id, amount, raw_amount, damage_type, " +
            "source_participant_id, source_description, round_no, critical, created_at) KEY(encounter_id, id) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            for (DamageLogEntry e : entries) {
                ps.setString(1, e.encounterId());
                ps.setLong(2, e.id());
                ps.setString(3, e.participantId());
                ps.setInt(4, e.amount());
                ps.setInt(5, e.rawAmount());
                ps.setString(6, e.damageType().key);
                if (e.sourceParticipantId() != null) ps.setString(7, e.sourceParticipantId());
                else ps.setNull(7, Types.VARCHAR);
                if (e.sourceDescription() != null) ps.setString(8, e.sourceDescription());
                else ps.setNull(8, Types.VARCHAR);
                ps.setInt(9, e.round());
                ps.setBoolean(10, e.critical());
                ps.setLong(11, e.createdAt());
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException ex) {
            throw new RuntimeException("Failed to archive damage log for encounter " + entries.get(0).encounterId(), ex);
        }
    }

    public List<DamageLogEntry> loadDamageLog(String encounterId) {
        String sql = "SELECT * FROM damage_log WHERE encounter_id = ? ORDER BY id";
        List<DamageLogEntry> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, encounterId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new DamageLogEntry(
                        rs.getLong("id"),
                        rs.getString("encounter_id"),
                        rs.getString("participant_id"),
                        rs.getInt("amount"),
                        rs.getInt("raw_amount"),
                        DamageType.fromKey(rs.getString("damage_type")),
                        rs.getString("source_participant_id"),
                        rs.getString("source_description"),
                        rs.getInt("round_no"),
                        rs.getBoolean("critical"),
                        rs.getLong("created_at")));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load damage log for encounter " + encounterId, e);
        }
        return out;
    }

    // ==================== EVENTS ====================

    public void recordEvent(EncounterEvent event) {
        String sql = "MERGE INTO encounter_event (encounter_id, seq, event_type, round_no, status, created_at) " +
            "KEY(encounter_id, seq) VALUES (?, ?, ?, ?, ?, ?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, event.encounterId());
            ps.setLong(2, event.sequence());
            ps.setString(3, event.type().key);
            ps.setInt(4, event.snapshot().round());
            ps.setString(5, event.snapshot().status().name());
            ps.setLong(6, event.timestamp());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to archive event " + event.type() + " #" + event.sequence(), e);
        }
    }

    /** Archived event types for an encounter, in sequence order. */
    public List<OperationType> loadEventTypes(String encounterId) {
        String sql = "SELECT event_type FROM encounter_event WHERE encounter_id = ? ORDER BY seq";
        List<OperationType> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, encounterId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(OperationType.fromKey(rs.getString("event_type")));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load events for encounter " + encounterId, e);
        }
        return out;
    }
}
