package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.Ability;
import com.example.gridbattle.model.domain.AbilityEffect;
import com.example.gridbattle.model.domain.AbilityType;
import com.example.gridbattle.model.domain.AreaPattern;
import com.example.gridbattle.model.domain.BattleUnit;
import com.example.gridbattle.model.domain.EffectType;
import com.example.gridbattle.model.domain.GridPosition;
import com.example.gridbattle.model.domain.Stat;
import com.example.gridbattle.model.domain.StatModifier;
import com.example.gridbattle.model.domain.StatusEffectType;
import com.example.gridbattle.model.domain.TargetType;
import com.example.gridbattle.model.domain.UnitStats;
import com.example.gridbattle.model.event.AbilityUsedEvent;
import com.example.gridbattle.model.event.AttackEvent;
import com.example.gridbattle.model.event.BattleEvent;
import com.example.gridbattle.model.event.BattleEventType;
import com.example.gridbattle.model.event.DamageEvent;
import com.example.gridbattle.model.event.HealEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AbilityResolverTest {

    @Mock
    private CombatRandom random;

    private BattleContext context;
    private StatusEffectProcessor statusProcessor;
    private AbilityResolver resolver;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(random.nextDouble()).thenReturn(0.5);
        context = new BattleContext(BattleSettings.defaults(), random);
        statusProcessor = new StatusEffectProcessor(context);
        resolver = new AbilityResolver(context, new TargetingResolver(context), statusProcessor);
    }

    @Test
    void testAoeHitsAllNearbyEnemiesAndLifestealsTheSum() {
        Ability whirl = Ability.builder()
                .id("whirl").name("Whirlwind").type(AbilityType.OFFENSIVE).range(1).cooldown(2)
                .effects(List.of(
                        AbilityEffect.builder().type(EffectType.LIFESTEAL).value(0.5).build(),
                        AbilityEffect.builder().type(EffectType.DAMAGE).targetType(TargetType.AOE).radius(1).value(10)
                                .build()))
                .build();
        BattleUnit hero = TestUnits.place(context, "hero", true, TestUnits.stats(100, 5, 10), new GridPosition(3, 3),
                whirl);
        hero.getStats().setHp(50);
        TestUnits.place(context, "e1", false, TestUnits.stats(100, 5, 10), new GridPosition(3, 4));
        TestUnits.place(context, "e2", false, TestUnits.stats(100, 5, 10), new GridPosition(2, 4));
        TestUnits.place(context, "e3", false, TestUnits.stats(100, 5, 10), new GridPosition(4, 5));

        Ability used = resolver.act(hero, new HashSet<>());

        assertSame(whirl, used);
        AbilityUsedEvent cast = (AbilityUsedEvent) context.getLog().ofKind(BattleEventType.ABILITY_USED).get(0);
        assertEquals(List.of("e1", "e2", "e3"), cast.targetIds());
        List<BattleEvent> damage = context.getLog().ofKind(BattleEventType.DAMAGE);
        assertEquals(3, damage.size());
        for (BattleEvent event : damage) {
            assertEquals(10, ((DamageEvent) event).amount());
            assertEquals("whirl", ((DamageEvent) event).source());
        }
        HealEvent heal = (HealEvent) context.getLog().last();
        assertEquals("hero", heal.unitId());
        assertEquals(15, heal.amount(), 1e-9);
        assertEquals(65, hero.getStats().getHp(), 1e-9);
        assertTrue(context.getLog().ofKind(BattleEventType.ATTACK).isEmpty());
        verifyNoInteractions(random);
    }

    @Test
    void testEvadedAttackLeavesTargetUntouched() {
        when(random.nextDouble()).thenReturn(0.1);
        BattleUnit hero = TestUnits.place(context, "hero", true, TestUnits.stats(100, 20, 10), new GridPosition(0, 0));
        UnitStats nimble = TestUnits.stats(30, 5, 10);
        nimble.setEvasion(0.3);
        BattleUnit thief = TestUnits.place(context, "thief", false, nimble, new GridPosition(1, 1));

        assertNull(resolver.act(hero, new HashSet<>()));

        assertEquals(BattleEventType.EVADED, context.getLog().last().kind());
        assertEquals(30, thief.getStats().getHp());
        assertTrue(context.getLog().ofKind(BattleEventType.DAMAGE).isEmpty());
        verify(random, times(1)).nextDouble();
    }

    @Test
    void testAccuracyBelowOneShiftsEffectiveEvasion() {
        when(random.nextDouble()).thenReturn(0.2);
        UnitStats clumsy = TestUnits.stats(100, 20, 10);
        clumsy.setAccuracy(0.8);
        BattleUnit hero = TestUnits.place(context, "hero", true, clumsy, new GridPosition(0, 0));
        UnitStats nimble = TestUnits.stats(300, 5, 10);
        nimble.setEvasion(0.3);
        TestUnits.place(context, "thief", false, nimble, new GridPosition(0, 1));

        // 0.3 - (1 - 0.8) leaves 0.1
        resolver.act(hero, new HashSet<>());
        assertEquals(1, context.getLog().ofKind(BattleEventType.ATTACK).size());

        when(random.nextDouble()).thenReturn(0.05);
        resolver.act(hero, new HashSet<>());
        assertEquals(1, context.getLog().ofKind(BattleEventType.EVADED).size());
    }

    @Test
    void testCriticalAttackAppliesMultiplierDefenseAndLifesteal() {
        when(random.nextDouble()).thenReturn(0.9, 0.1);
        UnitStats attacker = TestUnits.stats(100, 20, 10);
        attacker.setCritChance(0.2);
        attacker.setCritDamage(2);
        attacker.setPenetration(0.5);
        attacker.setLifesteal(0.1);
        BattleUnit hero = TestUnits.place(context, "hero", true, attacker, new GridPosition(0, 0));
        hero.getStats().setHp(50);
        UnitStats armored = TestUnits.stats(100, 5, 10);
        armored.setDefense(20);
        BattleUnit knight = TestUnits.place(context, "knight", false, armored, new GridPosition(0, 1));

        resolver.act(hero, new HashSet<>());

        List<BattleEventType> kinds = context.getLog().getEvents().stream().map(BattleEvent::kind).toList();
        assertEquals(List.of(BattleEventType.ATTACK, BattleEventType.CRITICAL_HIT, BattleEventType.DAMAGE,
                BattleEventType.HEAL), kinds);
        assertTrue(((AttackEvent) context.getLog().getEvents().get(0)).critical());
        // 20 * 2 - 20 * (1 - 0.5) * 0.5
        assertEquals(65, knight.getStats().getHp(), 1e-9);
        assertEquals(53.5, hero.getStats().getHp(), 1e-9);
    }

    @Test
    void testAttackDealsAtLeastOneDamage() {
        BattleUnit hero = TestUnits.place(context, "hero", true, TestUnits.stats(100, 2, 10), new GridPosition(0, 0));
        UnitStats wall = TestUnits.stats(100, 5, 10);
        wall.setDefense(50);
        BattleUnit golem = TestUnits.place(context, "golem", false, wall, new GridPosition(0, 1));

        resolver.act(hero, new HashSet<>());

        assertEquals(99, golem.getStats().getHp(), 1e-9);
    }

    @Test
    void testOutOfRangeUnitMovesInsteadOfAttacking() {
        BattleUnit hero = TestUnits.place(context, "hero", true, TestUnits.stats(100, 20, 10), new GridPosition(0, 0));
        TestUnits.place(context, "orc", false, TestUnits.stats(100, 5, 10), new GridPosition(0, 4));

        assertNull(resolver.act(hero, new HashSet<>()));

        assertEquals(BattleEventType.MOVE, context.getLog().last().kind());
        assertEquals(new GridPosition(0, 1), hero.getPosition());
    }

    @Test
    void testHealerPrefersHealingOverAdvancing() {
        Ability mend = Ability.builder()
                .id("mend").name("Mend").type(AbilityType.SUPPORT).cooldown(3)
                .effects(List.of(AbilityEffect.builder().type(EffectType.HEAL).value(20).build()))
                .build();
        BattleUnit healer = TestUnits.place(context, "healer", true, TestUnits.stats(100, 5, 10),
                new GridPosition(0, 0), mend);
        BattleUnit knight = TestUnits.place(context, "knight", true, TestUnits.stats(100, 5, 10),
                new GridPosition(1, 0));
        knight.getStats().setHp(50);
        TestUnits.place(context, "orc", false, TestUnits.stats(100, 5, 10), new GridPosition(0, 6));

        assertSame(mend, resolver.act(healer, new HashSet<>()));

        assertEquals(70, knight.getStats().getHp());
        assertEquals(new GridPosition(0, 0), healer.getPosition());
        AbilityUsedEvent cast = (AbilityUsedEvent) context.getLog().ofKind(BattleEventType.ABILITY_USED).get(0);
        assertEquals(List.of("knight"), cast.targetIds());
    }

    @Test
    void testAbilityWithoutTargetFallsThroughToAttack() {
        AbilityEffect cleave = AbilityEffect.builder()
                .type(EffectType.DAMAGE).targetType(TargetType.AOE).pattern(AreaPattern.CLEAVE).value(30).build();
        Ability sweep = Ability.builder()
                .id("sweep").name("Sweep").type(AbilityType.OFFENSIVE).range(2).cooldown(2)
                .effects(List.of(cleave))
                .build();
        BattleUnit hero = TestUnits.place(context, "hero", true, TestUnits.stats(100, 5, 10), new GridPosition(0, 0),
                sweep);
        BattleUnit orc = TestUnits.place(context, "orc", false, TestUnits.stats(100, 5, 10), new GridPosition(0, 2));

        assertNull(resolver.act(hero, new HashSet<>()));

        assertTrue(context.getLog().ofKind(BattleEventType.ABILITY_USED).isEmpty());
        assertEquals(95, orc.getStats().getHp());
        assertEquals(0, (int) hero.getAbilityCooldowns().get("sweep"));
    }

    @Test
    void testStatusAbilityUsesDamageTargetSet() {
        Ability frost = Ability.builder()
                .id("frost").name("Frost Nova").type(AbilityType.OFFENSIVE).range(1).cooldown(4)
                .effects(List.of(
                        AbilityEffect.builder().type(EffectType.DAMAGE).targetType(TargetType.AOE).radius(1).value(5)
                                .build(),
                        AbilityEffect.builder().type(EffectType.STATUS).targetType(TargetType.AOE).radius(1)
                                .statusType(StatusEffectType.SLOW).duration(2)
                                .statModifier(new StatModifier(Stat.SPEED, -50, true)).build()))
                .build();
        BattleUnit hero = TestUnits.place(context, "hero", true, TestUnits.stats(100, 5, 10), new GridPosition(3, 3),
                frost);
        BattleUnit e1 = TestUnits.place(context, "e1", false, TestUnits.stats(100, 5, 10), new GridPosition(3, 4));
        BattleUnit e2 = TestUnits.place(context, "e2", false, TestUnits.stats(100, 5, 10), new GridPosition(4, 5));
        BattleUnit far = TestUnits.place(context, "far", false, TestUnits.stats(100, 5, 10), new GridPosition(0, 7));

        resolver.act(hero, new HashSet<>());

        assertEquals(2, context.getLog().ofKind(BattleEventType.STATUS_APPLIED).size());
        assertEquals(5, e1.getStats().getSpeed(), 1e-9);
        assertEquals(5, e2.getStats().getSpeed(), 1e-9);
        assertEquals(10, far.getStats().getSpeed(), 1e-9);
    }

    @Test
    void testBuffDefaultsToShieldOnEveryAlly() {
        Ability rally = Ability.builder()
                .id("rally").name("Rally").type(AbilityType.SUPPORT).cooldown(5)
                .effects(List.of(AbilityEffect.builder().type(EffectType.BUFF)
                        .statModifier(new StatModifier(Stat.DEFENSE, 5, false)).build()))
                .build();
        BattleUnit captain = TestUnits.place(context, "captain", true, TestUnits.stats(100, 5, 10),
                new GridPosition(3, 3), rally);
        BattleUnit squire = TestUnits.place(context, "squire", true, TestUnits.stats(100, 5, 10),
                new GridPosition(7, 0));
        BattleUnit orc = TestUnits.place(context, "orc", false, TestUnits.stats(100, 5, 10), new GridPosition(3, 4));

        assertSame(rally, resolver.act(captain, new HashSet<>()));

        assertEquals(StatusEffectType.SHIELD, captain.getStatusEffects().get(0).getStatusType());
        assertEquals(5, squire.getStats().getDefense());
        assertEquals(100, orc.getStats().getHp());

        // allies still carry the buff, so the next action is an attack
        assertNull(resolver.act(captain, new HashSet<>()));
        assertEquals(95, orc.getStats().getHp());
    }

    @Test
    void testFinishActionArmsTheCastAbility() {
        Ability bolt = Ability.builder().id("bolt").type(AbilityType.OFFENSIVE).cooldown(3)
                .effects(List.of(AbilityEffect.builder().type(EffectType.DAMAGE).value(1).build())).build();
        Ability ward = Ability.builder().id("ward").type(AbilityType.SUPPORT).cooldown(2)
                .effects(List.of(AbilityEffect.builder().type(EffectType.HEAL).value(1).build())).build();
        BattleUnit hero = TestUnits.place(context, "hero", true, TestUnits.stats(100, 5, 10), new GridPosition(0, 0),
                bolt, ward);
        hero.setCooldown(100);
        hero.getAbilityCooldowns().put("ward", 2);
        TickScheduler scheduler = new TickScheduler(context, statusProcessor, resolver, new WaveController(context));

        scheduler.finishAction(hero, bolt);

        assertEquals(0, hero.getCooldown());
        assertEquals(3, (int) hero.getAbilityCooldowns().get("bolt"));
        assertEquals(1, (int) hero.getAbilityCooldowns().get("ward"));
    }
}
