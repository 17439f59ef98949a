package com.example.dndcombat.combat;

import com.example.dndcombat.error.NotFoundException;
import com.example.dndcombat.model.ActiveCondition;
import com.example.dndcombat.model.DamageLogEntry;
import com.example.dndcombat.model.DamageType;
import com.example.dndcombat.model.EncounterSnapshot;
import com.example.dndcombat.model.EncounterStatus;
import com.example.dndcombat.model.Participant;
import com.example.dndcombat.model.ParticipantSnapshot;
import com.example.dndcombat.model.ParticipantStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Working state of one encounter: participants, HP status, conditions, and the audit logs.
 *
 * Not thread-safe. Only the encounter's writer touches an instance; every write operates on a
 * {@link #copy()} that replaces the committed state once the operation succeeds.
 */
public class Encounter {

    /** Unique identifier for this encounter */
    private final String id;

    /** Opaque game-session reference */
    private final String sessionId;

    private EncounterStatus status = EncounterStatus.SETUP;

    /** Current round number (1 once started, 0 during a surprise round) */
    private int round = 1;

    /** Index into {@link #turnOrder()} for whose turn it is */
    private int turnIndex;

    /** Participants keyed by id, in the order they were added */
    private final Map<String, Participant> participants;
    private final Map<String, ParticipantStatus> statuses;

    /** Every condition ever applied, keyed by condition id; inactive ones stay for history */
    private final Map<String, ActiveCondition> conditions;

    private final List<DamageLogEntry> damageLog;
    private final List<String> combatLog;

    private int nextParticipantSeq = 1;
    private int nextConditionSeq = 1;
    private long nextDamageSeq = 1;

    public Encounter(String id, String sessionId) {
        this.id = id;
        this.sessionId = sessionId;
        this.participants = new LinkedHashMap<>();
        this.statuses = new LinkedHashMap<>();
        this.conditions = new LinkedHashMap<>();
        this.damageLog = new ArrayList<>();
        this.combatLog = new ArrayList<>();
    }

    private Encounter(Encounter other) {
        this.id = other.id;
        this.sessionId = other.sessionId;
        this.status = other.status;
        this.round = other.round;
        this.turnIndex = other.turnIndex;
        this.participants = new LinkedHashMap<>();
        for (Participant p : other.participants.values()) {
            participants.put(p.getId(), new Participant(p));
        }
        this.statuses = new LinkedHashMap<>();
        for (ParticipantStatus s : other.statuses.values()) {
            statuses.put(s.getParticipantId(), new ParticipantStatus(s));
        }
        // ActiveCondition and DamageLogEntry are immutable, so shallow copies suffice
        this.conditions = new LinkedHashMap<>(other.conditions);
        this.damageLog = new ArrayList<>(other.damageLog);
        this.combatLog = new ArrayList<>(other.combatLog);
        this.nextParticipantSeq = other.nextParticipantSeq;
        this.nextConditionSeq = other.nextConditionSeq;
        this.nextDamageSeq = other.nextDamageSeq;
    }

    /** Deep copy for a write; the original stays untouched if the write fails. */
    public Encounter copy() {
        return new Encounter(this);
    }

    public String getId() { return id; }
    public String getSessionId() { return sessionId; }

    public EncounterStatus getStatus() { return status; }
    public void setStatus(EncounterStatus status) { this.status = status; }

    public int getRound() { return round; }
    public void setRound(int round) { this.round = round; }

    public int getTurnIndex() { return turnIndex; }
    public void setTurnIndex(int turnIndex) { this.turnIndex = turnIndex; }

    // Participants

    public String nextParticipantId() {
        return "p" + nextParticipantSeq++;
    }

    public void addParticipant(Participant participant, ParticipantStatus status) {
        participants.put(participant.getId(), participant);
        statuses.put(participant.getId(), status);
    }

    public int participantCount() {
        return participants.size();
    }

    /**
     * @throws NotFoundException if the participant is not part of this encounter
     */
    public Participant participant(String participantId) {
        Participant p = participantId == null ? null : participants.get(participantId);
        if (p == null) {
            throw new NotFoundException("Participant", participantId);
        }
        return p;
    }

    public ParticipantStatus status(String participantId) {
        participant(participantId);
        return statuses.get(participantId);
    }

    public boolean hasParticipant(String participantId) {
        return participantId != null && participants.containsKey(participantId);
    }

    /** All participants in insertion order. */
    public List<Participant> participants() {
        return Collections.unmodifiableList(new ArrayList<>(participants.values()));
    }

    public List<Participant> activeParticipants() {
        return participants.values().stream()
            .filter(Participant::isActive)
            .collect(Collectors.toList());
    }

    /** Active participants with an assigned turn position, in turn order. */
    public List<Participant> turnOrder() {
        return participants.values().stream()
            .filter(Participant::isActive)
            .filter(p -> p.getTurnOrder() != null)
            .sorted(Comparator.comparingInt(Participant::getTurnOrder))
            .collect(Collectors.toList());
    }

    /** Whose turn it is, or null before combat starts. */
    public Participant currentParticipant() {
        if (status == EncounterStatus.SETUP) return null;
        List<Participant> order = turnOrder();
        if (order.isEmpty() || turnIndex < 0 || turnIndex >= order.size()) return null;
        return order.get(turnIndex);
    }

    // Conditions

    public String nextConditionId() {
        return "c" + nextConditionSeq++;
    }

    public void putCondition(ActiveCondition condition) {
        conditions.put(condition.getId(), condition);
    }

    /**
     * @throws NotFoundException if no condition with that id was ever applied here
     */
    public ActiveCondition condition(String conditionId) {
        ActiveCondition c = conditionId == null ? null : conditions.get(conditionId);
        if (c == null) {
            throw new NotFoundException("Condition instance", conditionId);
        }
        return c;
    }

    public List<ActiveCondition> activeConditions(String participantId) {
        return conditions.values().stream()
            .filter(ActiveCondition::isActive)
            .filter(c -> c.getParticipantId().equals(participantId))
            .collect(Collectors.toList());
    }

    public List<ActiveCondition> allActiveConditions() {
        return conditions.values().stream()
            .filter(ActiveCondition::isActive)
            .collect(Collectors.toList());
    }

    // Logs

    public DamageLogEntry appendDamage(String participantId, int amount, int rawAmount,
                                       DamageType type,
                                       String sourceParticipantId, String sourceDescription, boolean critical) {
        DamageLogEntry entry = new DamageLogEntry(nextDamageSeq++, id, participantId, amount, rawAmount, type,
            sourceParticipantId, sourceDescription, round, critical, System.currentTimeMillis());
        damageLog.add(entry);
        return entry;
    }

    public List<DamageLogEntry> getDamageLog() {
        return Collections.unmodifiableList(damageLog);
    }

    public void logEvent(String event) {
        combatLog.add(String.format("[R%d] %s", round, event));
    }

    public List<String> getCombatLog() {
        return Collections.unmodifiableList(combatLog);
    }

    // Snapshots

    public EncounterSnapshot snapshot(long version) {
        List<Participant> ordered = new ArrayList<>(participants.values());
        ordered.sort(Comparator
            .comparing((Participant p) -> p.getTurnOrder() == null ? Integer.MAX_VALUE : p.getTurnOrder())
            .thenComparingInt(Participant::getAddOrder));
        List<ParticipantSnapshot> views = new ArrayList<>(ordered.size());
        for (Participant p : ordered) {
            views.add(ParticipantSnapshot.of(p, statuses.get(p.getId()), activeConditions(p.getId())));
        }
        Participant current = currentParticipant();
        return new EncounterSnapshot(id, sessionId, status, round, turnIndex,
            current != null ? current.getId() : null, views, damageLog, combatLog, version);
    }

    @Override
    public String toString() {
        return String.format("Encounter %s [%s] Round %d - %d participants", id, status.getDisplayName(),
            round, participants.size());
    }
}
