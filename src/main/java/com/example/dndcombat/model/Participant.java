package com.example.dndcombat.model;

import java.util.Objects;

/**
 * A combatant inside one encounter. Owned by its encounter; HP lives in {@link ParticipantStatus}.
 */
public class Participant {

    /** Unique identifier for this participant */
    private final String id;

    private final String encounterId;

    /** Character, creature or ad-hoc identity */
    private final IdentityRef identity;

    /** Display name used in logs and narration */
    private final String name;

    private final int initiativeModifier;

    /** Read-only stats from the character/creature subsystem */
    private final CreatureStats stats;

    /** Position in which the participant was added (0-based), last initiative tie-breaker */
    private final int addOrder;

    /** Rolled initiative total, null until rolled */
    private Integer initiative;

    /** Position in the turn order, null until every participant has rolled */
    private Integer turnOrder;

    /** False once removed mid-combat (fled, dismissed) */
    private boolean active = true;

    public Participant(String id, String encounterId, IdentityRef identity, String name,
                       int initiativeModifier, CreatureStats stats, int addOrder) {
        this.id = Objects.requireNonNull(id, "id");
        this.encounterId = encounterId;
        this.identity = Objects.requireNonNull(identity, "identity");
        this.name = name != null && !name.isBlank() ? name : identity.ref();
        this.initiativeModifier = initiativeModifier;
        this.stats = stats != null ? stats : CreatureStats.of(10);
        this.addOrder = addOrder;
    }

    /** Copy constructor used when an encounter state is cloned for a write. */
    public Participant(Participant other) {
        this.id = other.id;
        this.encounterId = other.encounterId;
        this.identity = other.identity;
        this.name = other.name;
        this.initiativeModifier = other.initiativeModifier;
        this.stats = other.stats;
        this.addOrder = other.addOrder;
        this.initiative = other.initiative;
        this.turnOrder = other.turnOrder;
        this.active = other.active;
    }

    public String getId() { return id; }
    public String getEncounterId() { return encounterId; }
    public IdentityRef getIdentity() { return identity; }
    public String getName() { return name; }
    public int getInitiativeModifier() { return initiativeModifier; }
    public CreatureStats getStats() { return stats; }
    public int getAddOrder() { return addOrder; }

    public Integer getInitiative() { return initiative; }
    public void setInitiative(Integer initiative) { this.initiative = initiative; }
    public boolean hasInitiative() { return initiative != null; }

    public Integer getTurnOrder() { return turnOrder; }
    public void setTurnOrder(Integer turnOrder) { this.turnOrder = turnOrder; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    @Override
    public String toString() {
        return "Participant[" + name + " (" + identity + "), init=" + initiative + ", order=" + turnOrder + "]";
    }
}
