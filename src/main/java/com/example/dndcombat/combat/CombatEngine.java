package com.example.dndcombat.combat;

import com.example.dndcombat.condition.ConditionDefinition;
import com.example.dndcombat.condition.ConditionsLibrary;
import com.example.dndcombat.condition.MechanicalEffects;
import com.example.dndcombat.config.EngineConfig;
import com.example.dndcombat.dice.DiceExpression;
import com.example.dndcombat.dice.DiceRoller;
import com.example.dndcombat.dice.RandomDiceRoller;
import com.example.dndcombat.error.InvalidStateException;
import com.example.dndcombat.error.NotFoundException;
import com.example.dndcombat.event.EncounterEventBus;
import com.example.dndcombat.event.EncounterEventListener;
import com.example.dndcombat.model.Ability;
import com.example.dndcombat.model.ActiveCondition;
import com.example.dndcombat.model.DamageLogEntry;
import com.example.dndcombat.model.DamageType;
import com.example.dndcombat.model.DurationType;
import com.example.dndcombat.model.EncounterSnapshot;
import com.example.dndcombat.persistence.CombatArchiveDAO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point: holds every encounter of one engine instance, keyed by id, and exposes one
 * synchronous method per combat operation.
 *
 * Encounters share the worker pool and the rule components but no mutable state, so operations on
 * different encounters run in parallel while each encounter sees a single writer.
 */
public class CombatEngine {

    private static final Logger logger = LoggerFactory.getLogger(CombatEngine.class);

    private final EngineConfig config;
    private final ConditionsLibrary library;
    private final CombatRules rules;
    private final EncounterEventBus events;
    private final ExecutorService workers;
    private final Map<String, EncounterOrchestrator> encounters = new ConcurrentHashMap<>();
    private final AtomicLong createdSeq = new AtomicLong();
    private final CombatArchiveDAO archive;

    public CombatEngine(EngineConfig config, ConditionsLibrary library, DiceRoller dice) {
        this.config = config;
        this.library = library;
        this.rules = new CombatRules(library, dice, config);
        this.events = new EncounterEventBus(config.getEventThreadName());
        AtomicInteger threadSeq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "combat-writer-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        if (config.isArchiveEnabled()) {
            this.archive = new CombatArchiveDAO(config.getArchiveUrl());
            events.subscribe(archive);
        } else {
            this.archive = null;
        }
        logger.info("[CombatEngine] Ready with {} conditions, strictTurnOrder={}", library.size(),
            config.isStrictTurnOrder());
    }

    /**
     * Engine configured from {@code /combat-engine.yaml} and system properties, with the bundled
     * conditions and random (or seeded) dice.
     */
    public static CombatEngine create() {
        EngineConfig config = EngineConfig.load();
        DiceRoller dice = config.getDiceSeed() != null
            ? new RandomDiceRoller(config.getDiceSeed())
            : new RandomDiceRoller();
        return new CombatEngine(config, ConditionsLibrary.loadDefault(), dice);
    }

    public EngineConfig getConfig() { return config; }
    public EncounterEventBus events() { return events; }
    public Optional<CombatArchiveDAO> archive() { return Optional.ofNullable(archive); }

    public void subscribe(EncounterEventListener listener) {
        events.subscribe(listener);
    }

    // Encounters

    /**
     * Create an encounter in SETUP. Participants that came with an initiative roll are already
     * placed; the snapshot shows the turn order once everyone has rolled.
     */
    public EncounterSnapshot createEncounter(String sessionId, List<ParticipantSpec> participants) {
        String id = UUID.randomUUID().toString();
        EncounterOrchestrator orchestrator = EncounterOrchestrator.create(id, sessionId, participants,
            createdSeq.incrementAndGet(), rules, events, workers);
        encounters.put(id, orchestrator);
        return orchestrator.snapshot();
    }

    /**
     * @throws NotFoundException if no encounter has that id
     */
    public EncounterOrchestrator encounter(String encounterId) {
        EncounterOrchestrator o = encounterId == null ? null : encounters.get(encounterId);
        if (o == null) {
            throw new NotFoundException("Encounter", encounterId);
        }
        return o;
    }

    /** The most recently created encounter of a session that has not completed. */
    public Optional<EncounterSnapshot> findActiveEncounter(String sessionId) {
        return encounters.values().stream()
            .filter(o -> sessionId != null && sessionId.equals(o.getSessionId()))
            .filter(o -> !o.snapshot().status().isTerminal())
            .max(Comparator.comparingLong(EncounterOrchestrator::getCreatedSeq))
            .map(EncounterOrchestrator::snapshot);
    }

    public int encounterCount() {
        return encounters.size();
    }

    /**
     * Forget a completed encounter.
     */
    public void discard(String encounterId) {
        EncounterOrchestrator o = encounter(encounterId);
        if (!o.snapshot().status().isTerminal() && !o.isFaulted()) {
            throw new InvalidStateException("Encounter " + encounterId + " is still in progress");
        }
        encounters.remove(encounterId);
        logger.info("[CombatEngine] Discarded encounter {}", encounterId);
    }

    public EncounterSnapshot getStatus(String encounterId) {
        return encounter(encounterId).snapshot();
    }

    public String addParticipant(String encounterId, ParticipantSpec spec) {
        return encounter(encounterId).addParticipant(spec);
    }

    // Turn order

    public InitiativeRoll rollInitiative(String encounterId, String participantId, Integer roll,
                                         boolean advantage, boolean disadvantage) {
        return encounter(encounterId).rollInitiative(participantId, roll, advantage, disadvantage);
    }

    public EncounterSnapshot reorder(String encounterId, String participantId, int newInitiative) {
        return encounter(encounterId).reorder(participantId, newInitiative);
    }

    public EncounterSnapshot start(String encounterId) {
        return start(encounterId, false);
    }

    public EncounterSnapshot start(String encounterId, boolean surpriseRound) {
        return encounter(encounterId).start(surpriseRound);
    }

    public EncounterSnapshot pause(String encounterId) {
        return encounter(encounterId).pause();
    }

    public EncounterSnapshot resume(String encounterId) {
        return encounter(encounterId).resume();
    }

    public EncounterSnapshot end(String encounterId) {
        return encounter(encounterId).end();
    }

    public TurnAdvance nextTurn(String encounterId) {
        return encounter(encounterId).nextTurn();
    }

    public EncounterSnapshot removeParticipant(String encounterId, String participantId) {
        return encounter(encounterId).removeParticipant(participantId);
    }

    // Attacks and hit points

    public AttackResult attack(String encounterId, AttackRequest request) {
        return encounter(encounterId).attack(request);
    }

    public AttackResult rollAndAttack(String encounterId, String attackerId, String targetId, int attackBonus,
                                      boolean melee, String damageDice, DamageType damageType) {
        return encounter(encounterId).rollAndAttack(attackerId, targetId, attackBonus, melee,
            DiceExpression.parse(damageDice), damageType);
    }

    public List<AoeTargetResult> aoeAttack(String encounterId, AoeRequest request) {
        return encounter(encounterId).aoeAttack(request);
    }

    public DamageResult applyDamage(String encounterId, String participantId, int amount, DamageType type,
                                    String sourceParticipantId, String sourceDescription, boolean critical) {
        return encounter(encounterId).applyDamage(participantId, amount, type, sourceParticipantId,
            sourceDescription, critical);
    }

    public HealResult heal(String encounterId, String participantId, int amount, String sourceDescription) {
        return encounter(encounterId).heal(participantId, amount, sourceDescription);
    }

    public TempHpResult setTempHp(String encounterId, String participantId, int amount) {
        return encounter(encounterId).setTempHp(participantId, amount);
    }

    public DeathSaveResult rollDeathSave(String encounterId, String participantId, Integer roll) {
        return encounter(encounterId).rollDeathSave(participantId, roll);
    }

    public List<DamageLogEntry> getDamageLog(String encounterId, String participantId, Integer round) {
        return encounter(encounterId).damageLog(participantId, round);
    }

    // Conditions

    public ConditionApplication applyCondition(String encounterId, String participantId, String conditionName,
                                               DurationType durationType, Integer durationValue,
                                               Integer saveDc, Ability saveAbility, String sourceDescription) {
        return encounter(encounterId).applyCondition(participantId, conditionName, durationType, durationValue,
            saveDc, saveAbility, sourceDescription);
    }

    public ActiveCondition removeCondition(String encounterId, String conditionId) {
        return encounter(encounterId).removeCondition(conditionId);
    }

    public SaveAttempt attemptSave(String encounterId, String conditionId, int saveRollTotal) {
        return encounter(encounterId).attemptSave(conditionId, saveRollTotal);
    }

    public List<ActiveCondition> getActiveConditions(String encounterId, String participantId) {
        return encounter(encounterId).activeConditions(participantId);
    }

    public MechanicalEffects getMechanicalEffects(String encounterId, String participantId) {
        return encounter(encounterId).mechanicalEffects(participantId);
    }

    public List<ConditionDefinition> getConditionsLibrary() {
        return library.all();
    }

    public ConditionsLibrary conditionsLibrary() {
        return library;
    }

    public void shutdown() {
        events.shutdown();
        workers.shutdown();
        logger.info("[CombatEngine] Shut down with {} encounters in memory", encounters.size());
    }
}
