package com.example.dndcombat.combat;

import com.example.dndcombat.condition.MechanicalEffects;
import com.example.dndcombat.dice.DiceExpression;
import com.example.dndcombat.error.CombatException;
import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.NotFoundException;
import com.example.dndcombat.event.EncounterEvent;
import com.example.dndcombat.event.EncounterEventBus;
import com.example.dndcombat.event.OperationType;
import com.example.dndcombat.model.Ability;
import com.example.dndcombat.model.ActiveCondition;
import com.example.dndcombat.model.DamageLogEntry;
import com.example.dndcombat.model.DamageType;
import com.example.dndcombat.model.DurationType;
import com.example.dndcombat.model.EncounterSnapshot;
import com.example.dndcombat.model.EncounterStatus;
import com.example.dndcombat.model.Participant;
import com.example.dndcombat.model.ParticipantSnapshot;
import com.example.dndcombat.model.ParticipantStatus;
import com.example.dndcombat.util.SerialExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns one encounter and serializes every write to it.
 *
 * Writes run one at a time on a {@link SerialExecutor}. Each works on a copy of the committed state
 * and replaces it only on success, so a failed operation changes nothing. Readers get the snapshot
 * published by the last successful write and never wait for queued ones.
 */
public class EncounterOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(EncounterOrchestrator.class);

    private final String encounterId;
    private final String sessionId;
    private final long createdSeq;
    private final CombatRules rules;
    private final EncounterEventBus events;
    private final SerialExecutor writer;

    /** Only read and replaced on the writer */
    private Encounter committed;
    private long version;

    private volatile EncounterSnapshot snapshot;
    private volatile boolean faulted;

    private EncounterOrchestrator(Encounter initial, long createdSeq, CombatRules rules,
                                  EncounterEventBus events, Executor workers) {
        this.encounterId = initial.getId();
        this.sessionId = initial.getSessionId();
        this.createdSeq = createdSeq;
        this.rules = rules;
        this.events = events;
        this.writer = new SerialExecutor(workers);
        this.committed = initial;
        this.version = 1;
        this.snapshot = initial.snapshot(version);
    }

    /**
     * Build an encounter in SETUP with its starting participants and publish its creation event.
     */
    public static EncounterOrchestrator create(String encounterId, String sessionId, List<ParticipantSpec> specs,
                                               long createdSeq, CombatRules rules, EncounterEventBus events,
                                               Executor workers) {
        Objects.requireNonNull(encounterId, "encounterId");
        Encounter encounter = new Encounter(encounterId, sessionId);
        encounter.logEvent("Encounter created");
        if (specs != null) {
            for (ParticipantSpec spec : specs) {
                admit(encounter, spec, rules);
            }
        }
        EncounterOrchestrator orchestrator = new EncounterOrchestrator(encounter, createdSeq, rules, events, workers);
        events.publish(new EncounterEvent(encounterId, OperationType.ENCOUNTER_CREATED, orchestrator.version,
            orchestrator.snapshot, null, System.currentTimeMillis()));
        logger.info("[EncounterOrchestrator] Created encounter {} for session {} with {} participants",
            encounterId, sessionId, encounter.participantCount());
        return orchestrator;
    }

    private static Participant admit(Encounter encounter, ParticipantSpec spec, CombatRules rules) {
        Objects.requireNonNull(spec, "participant");
        String id = encounter.nextParticipantId();
        Participant p = new Participant(id, encounter.getId(), spec.identity(), spec.name(),
            spec.initiativeModifier(), spec.stats(), encounter.participantCount());
        int hp = spec.currentHp() != null ? spec.currentHp() : spec.maxHp();
        encounter.addParticipant(p, new ParticipantStatus(id, spec.maxHp(), hp));
        encounter.logEvent(p.getName() + " enters combat!");
        if (spec.initiative() != null) {
            rules.turnOrder().rollInitiative(encounter, id, spec.initiative(), false, false);
        }
        return p;
    }

    // Reads

    public String getId() { return encounterId; }
    public String getSessionId() { return sessionId; }
    long getCreatedSeq() { return createdSeq; }
    public boolean isFaulted() { return faulted; }

    /** The state as of the last committed write. */
    public EncounterSnapshot snapshot() {
        return snapshot;
    }

    public ParticipantSnapshot participant(String participantId) {
        return snapshot.participant(participantId)
            .orElseThrow(() -> new NotFoundException("Participant", participantId));
    }

    /**
     * Damage log, optionally filtered.
     *
     * @param participantId only entries for this participant, or null for all
     * @param round         only entries from this round, or null for all
     */
    public List<DamageLogEntry> damageLog(String participantId, Integer round) {
        EncounterSnapshot snap = snapshot;
        if (participantId != null && snap.participant(participantId).isEmpty()) {
            throw new NotFoundException("Participant", participantId);
        }
        return snap.damageLog().stream()
            .filter(e -> participantId == null || e.participantId().equals(participantId))
            .filter(e -> round == null || e.round() == round)
            .collect(Collectors.toList());
    }

    public List<ActiveCondition> activeConditions(String participantId) {
        return participant(participantId).conditions();
    }

    public MechanicalEffects mechanicalEffects(String participantId) {
        return rules.conditions().effectsOf(participant(participantId).conditions());
    }

    // Setup and lifecycle

    public String addParticipant(ParticipantSpec spec) {
        return mutate(OperationType.PARTICIPANT_ADDED, e -> {
            requireStatus(e, "add participants", EncounterStatus.SETUP);
            return admit(e, spec, rules).getId();
        });
    }

    public InitiativeRoll rollInitiative(String participantId, Integer roll, boolean advantage, boolean disadvantage) {
        return mutate(OperationType.INITIATIVE_ROLLED, e -> {
            requireStatus(e, "roll initiative", EncounterStatus.SETUP, EncounterStatus.PAUSED);
            return rules.turnOrder().rollInitiative(e, participantId, roll, advantage, disadvantage);
        });
    }

    public EncounterSnapshot reorder(String participantId, int newInitiative) {
        return mutateForSnapshot(OperationType.INITIATIVE_REORDERED, e -> {
            requireStatus(e, "reorder initiative", EncounterStatus.SETUP, EncounterStatus.PAUSED);
            rules.turnOrder().reorder(e, participantId, newInitiative);
        });
    }

    public EncounterSnapshot start(boolean surpriseRound) {
        return mutateForSnapshot(OperationType.COMBAT_STARTED, e -> {
            requireStatus(e, "start combat", EncounterStatus.SETUP);
            if (e.activeParticipants().isEmpty()) {
                throw new InvalidStateException("Cannot start an encounter without participants");
            }
            if (!rules.turnOrder().allInitiativesResolved(e)) {
                List<String> missing = e.activeParticipants().stream()
                    .filter(p -> !p.hasInitiative())
                    .map(Participant::getName)
                    .collect(Collectors.toList());
                throw new InvalidStateException("Initiative not rolled for: " + String.join(", ", missing));
            }
            e.setStatus(EncounterStatus.ACTIVE);
            rules.turnOrder().begin(e, surpriseRound);
            Participant first = e.currentParticipant();
            e.logEvent("It is " + first.getName() + "'s turn");
        });
    }

    public EncounterSnapshot pause() {
        return mutateForSnapshot(OperationType.COMBAT_PAUSED, e -> {
            requireStatus(e, "pause", EncounterStatus.ACTIVE);
            e.setStatus(EncounterStatus.PAUSED);
            e.logEvent("Combat paused");
        });
    }

    public EncounterSnapshot resume() {
        return mutateForSnapshot(OperationType.COMBAT_RESUMED, e -> {
            requireStatus(e, "resume", EncounterStatus.PAUSED);
            e.setStatus(EncounterStatus.ACTIVE);
            e.logEvent("Combat resumed");
        });
    }

    public EncounterSnapshot end() {
        return mutateForSnapshot(OperationType.COMBAT_ENDED, e -> {
            requireStatus(e, "end", EncounterStatus.SETUP, EncounterStatus.ACTIVE, EncounterStatus.PAUSED);
            e.setStatus(EncounterStatus.COMPLETED);
            List<String> standing = e.activeParticipants().stream()
                .filter(p -> e.status(p.getId()).isConscious())
                .map(Participant::getName)
                .collect(Collectors.toList());
            e.logEvent(standing.isEmpty() ? "=== COMBAT ENDS - No one left standing ==="
                : "=== COMBAT ENDS - Still standing: " + String.join(", ", standing) + " ===");
        });
    }

    public TurnAdvance nextTurn() {
        return mutate(OperationType.TURN_ADVANCED, e -> {
            requireStatus(e, "advance the turn", EncounterStatus.ACTIVE);
            return rules.turnOrder().nextTurn(e);
        });
    }

    public EncounterSnapshot removeParticipant(String participantId) {
        return mutateForSnapshot(OperationType.PARTICIPANT_REMOVED, e -> {
            requireStatus(e, "remove participants", EncounterStatus.SETUP, EncounterStatus.ACTIVE, EncounterStatus.PAUSED);
            rules.turnOrder().removeParticipant(e, participantId);
        });
    }

    // Attacks and hit points

    public AttackResult attack(AttackRequest request) {
        Objects.requireNonNull(request, "request");
        return mutate(OperationType.ATTACK_RESOLVED, e -> {
            requireStatus(e, "attack", EncounterStatus.ACTIVE);
            checkTurn(e, request.attackerId(), "attack");
            return rules.attacks().resolveAttack(e, request);
        });
    }

    /**
     * Roll the attack and damage with the engine's dice, then resolve it, as one operation.
     */
    public AttackResult rollAndAttack(String attackerId, String targetId, int attackBonus, boolean melee,
                                      DiceExpression damageDice, DamageType damageType) {
        Objects.requireNonNull(damageDice, "damageDice");
        return mutate(OperationType.ATTACK_RESOLVED, e -> {
            requireStatus(e, "attack", EncounterStatus.ACTIVE);
            checkTurn(e, attackerId, "attack");
            AttackRequest request = rules.attackRoller().prepare(e, attackerId, targetId, attackBonus, melee,
                damageDice, damageType);
            return rules.attacks().resolveAttack(e, request);
        });
    }

    public List<AoeTargetResult> aoeAttack(AoeRequest request) {
        Objects.requireNonNull(request, "request");
        return mutate(OperationType.AOE_RESOLVED, e -> {
            requireStatus(e, "attack", EncounterStatus.ACTIVE);
            checkTurn(e, request.casterId(), "area attack");
            return rules.attacks().resolveAoe(e, request);
        });
    }

    public DamageResult applyDamage(String participantId, int amount, DamageType type,
                                    String sourceParticipantId, String sourceDescription, boolean critical) {
        return mutate(OperationType.DAMAGE_APPLIED, e -> {
            requireStatus(e, "apply damage", EncounterStatus.ACTIVE);
            if (sourceParticipantId != null) {
                e.participant(sourceParticipantId);
            }
            return rules.damage().applyDamage(e, participantId, amount, type, sourceParticipantId,
                sourceDescription, critical);
        });
    }

    public HealResult heal(String participantId, int amount, String sourceDescription) {
        return mutate(OperationType.HEALED, e -> {
            requireStatus(e, "heal", EncounterStatus.SETUP, EncounterStatus.ACTIVE);
            return rules.damage().heal(e, participantId, amount, sourceDescription);
        });
    }

    public TempHpResult setTempHp(String participantId, int amount) {
        return mutate(OperationType.TEMP_HP_SET, e -> {
            requireStatus(e, "grant temporary HP", EncounterStatus.SETUP, EncounterStatus.ACTIVE);
            return rules.damage().setTempHp(e, participantId, amount);
        });
    }

    /**
     * @param roll the natural d20, or null to have the engine roll it
     */
    public DeathSaveResult rollDeathSave(String participantId, Integer roll) {
        return mutate(OperationType.DEATH_SAVE_ROLLED, e -> {
            requireStatus(e, "roll a death save", EncounterStatus.ACTIVE);
            int face = roll != null ? roll : rules.dice().d20();
            return rules.damage().rollDeathSave(e, participantId, face);
        });
    }

    // Conditions

    public ConditionApplication applyCondition(String participantId, String conditionName, DurationType durationType,
                                               Integer durationValue, Integer saveDc, Ability saveAbility,
                                               String sourceDescription) {
        return mutate(OperationType.CONDITION_APPLIED, e -> {
            requireStatus(e, "apply conditions", EncounterStatus.SETUP, EncounterStatus.ACTIVE, EncounterStatus.PAUSED);
            return rules.conditions().apply(e, participantId, conditionName, durationType, durationValue,
                saveDc, saveAbility, sourceDescription);
        });
    }

    public ActiveCondition removeCondition(String conditionId) {
        return mutate(OperationType.CONDITION_REMOVED, e -> {
            requireStatus(e, "remove conditions", EncounterStatus.SETUP, EncounterStatus.ACTIVE, EncounterStatus.PAUSED);
            return rules.conditions().remove(e, conditionId);
        });
    }

    public SaveAttempt attemptSave(String conditionId, int saveRollTotal) {
        return mutate(OperationType.SAVE_ATTEMPTED, e -> {
            requireStatus(e, "attempt saves", EncounterStatus.SETUP, EncounterStatus.ACTIVE, EncounterStatus.PAUSED);
            return rules.conditions().attemptSave(e, conditionId, saveRollTotal);
        });
    }

    // Write path

    private record Commit<T>(T result, EncounterSnapshot snapshot) { }

    private <T> T mutate(OperationType type, Function<Encounter, T> operation) {
        return submit(type, operation).result();
    }

    private EncounterSnapshot mutateForSnapshot(OperationType type, Consumer<Encounter> operation) {
        return submit(type, e -> {
            operation.accept(e);
            return null;
        }).snapshot();
    }

    private <T> Commit<T> submit(OperationType type, Function<Encounter, T> operation) {
        CompletableFuture<Commit<T>> future = CompletableFuture.supplyAsync(() -> commit(type, operation), writer);
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw e;
        }
    }

    private <T> Commit<T> commit(OperationType type, Function<Encounter, T> operation) {
        if (faulted) {
            throw new InvalidStateException("Encounter " + encounterId + " is faulted and accepts no further changes");
        }
        Encounter working = committed.copy();
        T result;
        try {
            result = operation.apply(working);
        } catch (CombatException e) {
            logger.debug("[EncounterOrchestrator] {} rejected in encounter {}: {}", type, encounterId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            faulted = true;
            logger.error("[EncounterOrchestrator] Encounter {} faulted during {}", encounterId, type, e);
            throw new InvalidStateException("Encounter " + encounterId + " faulted during " + type.key, e);
        }
        committed = working;
        version++;
        EncounterSnapshot published = working.snapshot(version);
        snapshot = published;
        events.publish(new EncounterEvent(encounterId, type, version, published, result, System.currentTimeMillis()));
        return new Commit<>(result, published);
    }

    private static void requireStatus(Encounter e, String action, EncounterStatus... allowed) {
        for (EncounterStatus s : allowed) {
            if (e.getStatus() == s) return;
        }
        throw new InvalidStateException("Cannot " + action + " while the encounter is "
            + e.getStatus().name().toLowerCase() + " (allowed: " + Arrays.toString(allowed).toLowerCase() + ")");
    }

    private void checkTurn(Encounter e, String actorId, String action) {
        Participant actor = e.participant(actorId);
        Participant current = e.currentParticipant();
        if (current == null || current.getId().equals(actor.getId())) return;
        if (rules.isStrictTurnOrder()) {
            throw new InvalidStateException("It is " + current.getName() + "'s turn, not " + actor.getName() + "'s");
        }
        logger.info("[EncounterOrchestrator] {} acts out of turn ({}) in encounter {}; current is {}",
            actor.getName(), action, encounterId, current.getName());
        e.logEvent(actor.getName() + " acts out of turn (" + action + ")");
    }

    @Override
    public String toString() {
        EncounterSnapshot s = snapshot;
        return "EncounterOrchestrator[" + encounterId + " " + s.status() + " R" + s.round() + " v" + s.version()
            + (faulted ? " FAULTED" : "") + "]";
    }
}
