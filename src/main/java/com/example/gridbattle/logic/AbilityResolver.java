package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.Ability;
import com.example.gridbattle.model.domain.AbilityEffect;
import com.example.gridbattle.model.domain.AbilityType;
import com.example.gridbattle.model.domain.BattleUnit;
import com.example.gridbattle.model.domain.EffectType;
import com.example.gridbattle.model.domain.GridPosition;
import com.example.gridbattle.model.domain.StatusEffectType;
import com.example.gridbattle.model.domain.UnitStats;
import com.example.gridbattle.model.event.AbilityUsedEvent;
import com.example.gridbattle.model.event.AttackEvent;
import com.example.gridbattle.model.event.CriticalHitEvent;
import com.example.gridbattle.model.event.EvadedEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chooses and resolves the single action of a ready unit: heal, move, ability or basic attack.
 */
@Slf4j
public class AbilityResolver {

    public static final String ATTACK_SOURCE = "attack";
    public static final String LIFESTEAL_SOURCE = "lifesteal";

    private final BattleContext context;
    private final TargetingResolver targeting;
    private final StatusEffectProcessor statusProcessor;

    public AbilityResolver(BattleContext context, TargetingResolver targeting, StatusEffectProcessor statusProcessor) {
        this.context = context;
        this.targeting = targeting;
        this.statusProcessor = statusProcessor;
    }

    /**
     * Resolves one action for {@code unit}.
     *
     * @param claimed cells entered by other units earlier in this tick
     * @return the ability that was cast, or {@code null} when the unit moved, attacked or did nothing
     */
    public Ability act(BattleUnit unit, Set<GridPosition> claimed) {
        List<BattleUnit> opponents = context.getOpponents(unit);
        if (opponents.isEmpty()) {
            return null;
        }

        if (anyAllyNeedsHealing(unit)) {
            for (Ability ability : readyAbilities(unit, AbilityType.SUPPORT)) {
                if (ability.hasEffect(EffectType.HEAL) && tryCast(unit, ability)) {
                    return ability;
                }
            }
        }

        BattleUnit nearest = targeting.findNearest(unit.getPosition(), opponents);
        int distance = unit.getPosition().distanceTo(nearest.getPosition());
        if (distance > targeting.effectiveRange(unit)) {
            if (!targeting.stepToward(unit, nearest, claimed)) {
                log.debug("Tick {}: {} is blocked and holds position", context.getTick(), unit.getId());
            }
            return null;
        }

        for (Ability ability : readyAbilities(unit, AbilityType.OFFENSIVE)) {
            if (tryCast(unit, ability)) {
                return ability;
            }
        }

        for (Ability ability : readyAbilities(unit, AbilityType.SUPPORT)) {
            if (!ability.hasEffect(EffectType.HEAL) && !alliesCarryEffectFrom(unit) && tryCast(unit, ability)) {
                return ability;
            }
        }

        basicAttack(unit, nearest);
        return null;
    }

    private List<Ability> readyAbilities(BattleUnit unit, AbilityType type) {
        return unit.getAbilities().stream()
                .filter(a -> a.getType() == type && unit.isAbilityReady(a))
                .collect(Collectors.toList());
    }

    private boolean anyAllyNeedsHealing(BattleUnit unit) {
        double threshold = context.getSettings().getHealThreshold();
        return context.getAllies(unit).stream().anyMatch(a -> a.isDamaged(threshold));
    }

    private boolean alliesCarryEffectFrom(BattleUnit unit) {
        return context.getAllies(unit).stream()
                .flatMap(a -> a.getStatusEffects().stream())
                .anyMatch(e -> e.isActive() && unit.getId().equals(e.getSourceId()));
    }

    /**
     * Casts the ability if at least one of its effects has a valid target. Nothing is applied otherwise.
     */
    boolean tryCast(BattleUnit caster, Ability ability) {
        List<List<BattleUnit>> plan = new ArrayList<>();
        Set<String> affected = new LinkedHashSet<>();
        for (AbilityEffect effect : ability.getEffects()) {
            List<BattleUnit> targets = planTargets(caster, ability, effect);
            plan.add(targets);
            targets.forEach(t -> affected.add(t.getId()));
        }
        if (affected.isEmpty()) {
            return false;
        }

        context.emit(new AbilityUsedEvent(context.getTick(), caster.getId(), ability.getId(), ability.getName(),
                new ArrayList<>(affected)));

        double dealt = 0;
        for (int i = 0; i < ability.getEffects().size(); i++) {
            AbilityEffect effect = ability.getEffects().get(i);
            if (effect.getType() != EffectType.LIFESTEAL) {
                dealt += applyEffect(caster, ability, effect, plan.get(i));
            }
        }
        // Lifesteal needs the damage total of the whole cast
        for (AbilityEffect effect : ability.getEffects()) {
            if (effect.getType() == EffectType.LIFESTEAL && dealt > 0) {
                context.heal(caster, dealt * effect.getValue(), LIFESTEAL_SOURCE);
            }
        }
        return true;
    }

    private List<BattleUnit> planTargets(BattleUnit caster, Ability ability, AbilityEffect effect) {
        switch (effect.getType()) {
            case DAMAGE:
            case STATUS:
                return targeting.resolveOffensiveTargets(caster, ability, effect);
            case HEAL:
                return context.getAllies(caster).stream()
                        .filter(a -> a.getStats().getHp() < a.getStats().getMaxHp())
                        .collect(Collectors.toList());
            case BUFF:
                return context.getAllies(caster);
            case LIFESTEAL:
                return List.of();
            default:
                throw new IllegalStateException("Unhandled effect type " + effect.getType());
        }
    }

    /**
     * @return damage dealt by this effect
     */
    private double applyEffect(BattleUnit caster, Ability ability, AbilityEffect effect, List<BattleUnit> targets) {
        double dealt = 0;
        for (BattleUnit target : targets) {
            if (!target.isAlive()) {
                continue;
            }
            switch (effect.getType()) {
                case DAMAGE:
                    context.damage(target, effect.getValue(), ability.getId(), null);
                    dealt += effect.getValue();
                    context.killIfDead(target, ability.getId());
                    break;
                case STATUS:
                    statusProcessor.apply(target, caster, ability.getId(), effect, effect.getStatusType());
                    break;
                case HEAL:
                    context.heal(target, effect.getValue(), ability.getId());
                    break;
                case BUFF:
                    StatusEffectType buffType = effect.getStatusType() == null
                            ? StatusEffectType.SHIELD : effect.getStatusType();
                    statusProcessor.apply(target, caster, ability.getId(), effect, buffType);
                    break;
                case LIFESTEAL:
                    break;
                default:
                    throw new IllegalStateException("Unhandled effect type " + effect.getType());
            }
        }
        return dealt;
    }

    /**
     * Evasion roll, then crit roll, then defense mitigation.
     */
    void basicAttack(BattleUnit attacker, BattleUnit target) {
        UnitStats a = attacker.getStats();
        UnitStats t = target.getStats();

        double evasion = Math.max(0, Math.min(0.95, t.getEvasion() - (1 - a.getAccuracy())));
        if (context.getRandom().nextDouble() < evasion) {
            context.emit(new EvadedEvent(context.getTick(), attacker.getId(), target.getId()));
            return;
        }

        boolean critical = context.getRandom().nextDouble() < a.getCritChance();
        double baseDamage = a.getDamage() * (critical ? a.getCritDamage() : 1);
        double damage = Math.max(1, baseDamage - t.getDefense() * (1 - a.getPenetration()) * 0.5);

        context.emit(new AttackEvent(context.getTick(), attacker.getId(), target.getId(), critical));
        if (critical) {
            context.emit(new CriticalHitEvent(context.getTick(), attacker.getId(), target.getId()));
        }
        context.damage(target, damage, ATTACK_SOURCE, null);
        if (a.getLifesteal() > 0) {
            context.heal(attacker, damage * a.getLifesteal(), LIFESTEAL_SOURCE);
        }
        context.killIfDead(target, ATTACK_SOURCE);
    }
}
