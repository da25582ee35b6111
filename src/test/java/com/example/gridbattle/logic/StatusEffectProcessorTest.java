package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.AbilityEffect;
import com.example.gridbattle.model.domain.BattleUnit;
import com.example.gridbattle.model.domain.EffectType;
import com.example.gridbattle.model.domain.GridPosition;
import com.example.gridbattle.model.domain.Stat;
import com.example.gridbattle.model.domain.StatModifier;
import com.example.gridbattle.model.domain.StatusCategory;
import com.example.gridbattle.model.domain.StatusEffect;
import com.example.gridbattle.model.domain.StatusEffectType;
import com.example.gridbattle.model.domain.UnitStats;
import com.example.gridbattle.model.event.BattleEventType;
import com.example.gridbattle.model.event.DamageEvent;
import com.example.gridbattle.model.event.StatusExpiredEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatusEffectProcessorTest {

    private BattleContext context;
    private StatusEffectProcessor processor;
    private BattleUnit caster;
    private BattleUnit target;

    @BeforeEach
    void setUp() {
        context = new BattleContext(BattleSettings.defaults(), TestUnits.fixedRandom(0.5));
        processor = new StatusEffectProcessor(context);
        caster = TestUnits.place(context, "mage", true, TestUnits.stats(50, 5, 10), new GridPosition(0, 0));
        target = TestUnits.place(context, "orc", false, TestUnits.stats(100, 10, 10), new GridPosition(0, 1));
    }

    @Test
    void testRecalculationIsIdempotentAndKeepsHp() {
        target.getStats().setHp(40);
        processor.apply(target, caster, "haste", effect(EffectType.BUFF, new StatModifier(Stat.SPEED, 50, true), 3),
                StatusEffectType.HASTE);
        UnitStats once = target.getStats().copy();

        processor.recalculateStats(target);
        processor.recalculateStats(target);

        assertEquals(once, target.getStats());
        assertEquals(40, target.getStats().getHp());
        assertEquals(15, target.getStats().getSpeed(), 1e-9);
        assertEquals(1.5, target.getCooldownRate(), 1e-9);
        assertEquals(10, target.getBaseStats().getSpeed());
    }

    @Test
    void testFlatModifierNeverGoesNegative() {
        processor.apply(target, caster, "sunder", effect(EffectType.STATUS,
                new StatModifier(Stat.DAMAGE, -25, false), 3), StatusEffectType.WEAKENED);

        assertEquals(0, target.getStats().getDamage());
    }

    @Test
    void testApplyRecordsSourceAndCategory() {
        StatusEffect status = processor.apply(target, caster, "bash", effect(EffectType.STATUS, null, 2),
                StatusEffectType.STUN);

        assertEquals("mage", status.getSourceId());
        assertEquals("bash", status.getSourceAbilityId());
        assertEquals(2, status.getRemainingDuration());
        assertTrue(target.hasActive(StatusCategory.CONTROL));
        assertEquals(1, context.getLog().ofKind(BattleEventType.STATUS_APPLIED).size());
    }

    @Test
    void testDamageOverTimeKillsAndVacates() {
        target.getStats().setHp(5);
        AbilityEffect poison = effect(EffectType.STATUS, null, 3);
        poison.setDamagePerTick(10.0);
        processor.apply(target, caster, "venom", poison, StatusEffectType.POISON);

        processor.processTick();

        DamageEvent damage = (DamageEvent) context.getLog().ofKind(BattleEventType.DAMAGE).get(0);
        assertEquals(StatusEffectProcessor.DOT_SOURCE, damage.source());
        assertEquals(StatusEffectType.POISON, damage.statusType());
        assertEquals(0, damage.remainingHp());
        assertFalse(target.isAlive());
        assertTrue(target.getStatusEffects().isEmpty());
        assertTrue(context.getGrid().isFree(new GridPosition(0, 1)));
        assertEquals(1, context.getLog().ofKind(BattleEventType.DEATH).size());
        assertTrue(context.getLog().ofKind(BattleEventType.STATUS_EXPIRED).isEmpty());
    }

    @Test
    void testExpiryRestoresStats() {
        processor.apply(target, caster, "hex", effect(EffectType.STATUS, new StatModifier(Stat.DAMAGE, -4, false), 2),
                StatusEffectType.CURSE);
        assertEquals(6, target.getStats().getDamage());

        processor.processTick();
        assertEquals(6, target.getStats().getDamage());
        assertTrue(context.getLog().ofKind(BattleEventType.STATUS_EXPIRED).isEmpty());

        processor.processTick();
        StatusExpiredEvent expired = (StatusExpiredEvent) context.getLog().last();
        assertEquals("orc", expired.unitId());
        assertEquals(StatusEffectType.CURSE, expired.statusType());
        assertEquals(10, target.getStats().getDamage());
        assertTrue(target.getStatusEffects().isEmpty());
    }

    @Test
    void testRegenerationHealsUpToMaxHp() {
        target.getStats().setHp(95);
        AbilityEffect regen = effect(EffectType.BUFF, null, 3);
        regen.setValue(8);
        processor.apply(target, caster, "renew", regen, StatusEffectType.REGENERATION);

        processor.processTick();

        assertEquals(100, target.getStats().getHp());
        assertEquals(1, context.getLog().ofKind(BattleEventType.HEAL).size());
    }

    private static AbilityEffect effect(EffectType type, StatModifier modifier, int duration) {
        return AbilityEffect.builder()
                .type(type)
                .statModifier(modifier)
                .duration(duration)
                .build();
    }
}
