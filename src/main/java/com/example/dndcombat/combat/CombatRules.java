package com.example.dndcombat.combat;

import com.example.dndcombat.condition.ConditionsLibrary;
import com.example.dndcombat.config.EngineConfig;
import com.example.dndcombat.dice.DiceRoller;

import java.util.Objects;

/**
 * The stateless rule components, wired once and shared by every encounter of an engine.
 */
public class CombatRules {

    private final DiceRoller dice;
    private final ConditionTracker conditions;
    private final TurnOrderManager turnOrder;
    private final DamageResolver damage;
    private final AttackResolver attacks;
    private final AttackRoller attackRoller;
    private final boolean strictTurnOrder;

    public CombatRules(ConditionsLibrary library, DiceRoller dice, EngineConfig config) {
        Objects.requireNonNull(config, "config");
        this.dice = Objects.requireNonNull(dice, "dice");
        this.conditions = new ConditionTracker(library);
        this.turnOrder = new TurnOrderManager(dice, conditions);
        this.damage = new DamageResolver(conditions, config.isMassiveDamage());
        this.attacks = new AttackResolver(damage);
        this.attackRoller = new AttackRoller(dice, conditions);
        this.strictTurnOrder = config.isStrictTurnOrder();
    }

    public DiceRoller dice() { return dice; }
    public ConditionTracker conditions() { return conditions; }
    public TurnOrderManager turnOrder() { return turnOrder; }
    public DamageResolver damage() { return damage; }
    public AttackResolver attacks() { return attacks; }
    public AttackRoller attackRoller() { return attackRoller; }
    public boolean isStrictTurnOrder() { return strictTurnOrder; }
}
