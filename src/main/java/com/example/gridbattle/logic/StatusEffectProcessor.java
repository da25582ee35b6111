package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.AbilityEffect;
import com.example.gridbattle.model.domain.BattleUnit;
import com.example.gridbattle.model.domain.StatusEffect;
import com.example.gridbattle.model.domain.StatusEffectType;
import com.example.gridbattle.model.domain.UnitStats;
import com.example.gridbattle.model.event.StatusAppliedEvent;
import com.example.gridbattle.model.event.StatusExpiredEvent;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Timed status effects: per-tick damage and regeneration, expiry, and the stat recalculation
 * they trigger.
 */
public class StatusEffectProcessor {

    public static final String DOT_SOURCE = "dot";
    public static final String REGENERATION_SOURCE = "regeneration";

    private final BattleContext context;

    public StatusEffectProcessor(BattleContext context) {
        this.context = context;
    }

    /**
     * Runs once per tick before any unit acts.
     */
    public void processTick() {
        for (BattleUnit unit : context.getLivingUnits()) {
            if (unit.getStatusEffects().isEmpty()) {
                continue;
            }
            if (applyPeriodicEffects(unit)) {
                continue;
            }
            expireEffects(unit);
        }
    }

    /**
     * @return whether the unit died
     */
    private boolean applyPeriodicEffects(BattleUnit unit) {
        for (StatusEffect effect : new ArrayList<>(unit.getStatusEffects())) {
            if (effect.getDamagePerTick() > 0) {
                context.damage(unit, effect.getDamagePerTick(), DOT_SOURCE, effect.getStatusType());
                if (context.killIfDead(unit, effect.getStatusType().getId())) {
                    return true;
                }
            }
            if (effect.getStatusType() == StatusEffectType.REGENERATION && effect.getValue() > 0) {
                context.heal(unit, effect.getValue(), REGENERATION_SOURCE);
            }
        }
        return false;
    }

    private void expireEffects(BattleUnit unit) {
        List<StatusEffect> expired = new ArrayList<>();
        Iterator<StatusEffect> it = unit.getStatusEffects().iterator();
        while (it.hasNext()) {
            StatusEffect effect = it.next();
            effect.setRemainingDuration(effect.getRemainingDuration() - 1);
            if (effect.getRemainingDuration() <= 0) {
                it.remove();
                expired.add(effect);
            }
        }
        for (StatusEffect effect : expired) {
            context.emit(new StatusExpiredEvent(context.getTick(), unit.getId(), effect.getId(),
                    effect.getStatusType()));
        }
        if (!expired.isEmpty()) {
            recalculateStats(unit);
        }
    }

    /**
     * Builds a status instance from an ability effect and attaches it to the target.
     */
    public StatusEffect apply(BattleUnit target, BattleUnit caster, String abilityId, AbilityEffect effect,
            StatusEffectType statusType) {
        int duration = effect.getDurationOrDefault();
        StatusEffect status = StatusEffect.builder()
                .id(context.nextStatusId(statusType, caster.getId()))
                .statusType(statusType)
                .duration(duration)
                .remainingDuration(duration)
                .damagePerTick(effect.getDamagePerTick() == null ? 0 : effect.getDamagePerTick())
                .value(effect.getValue())
                .modifier(effect.getStatModifier())
                .sourceId(caster.getId())
                .sourceAbilityId(abilityId)
                .build();
        target.getStatusEffects().add(status);
        context.emit(new StatusAppliedEvent(context.getTick(), target.getId(), status.getId(), statusType,
                duration, caster.getId()));
        recalculateStats(target);
        return status;
    }

    /**
     * stats := baseStats with the current hp kept, then every active modifier in application order.
     */
    public void recalculateStats(BattleUnit unit) {
        double hp = unit.getStats().getHp();
        UnitStats stats = unit.getBaseStats().copy();
        stats.setHp(hp);
        for (StatusEffect effect : unit.getStatusEffects()) {
            if (!effect.isActive() || effect.getModifier() == null || effect.getModifier().getStat() == null) {
                continue;
            }
            double current = stats.get(effect.getModifier().getStat());
            stats.set(effect.getModifier().getStat(), effect.getModifier().applyTo(current));
        }
        unit.setStats(stats);
        unit.setCooldownRate(stats.getSpeed() / context.getSettings().getCooldownDivisor());
    }
}
