package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.Ability;
import com.example.gridbattle.model.domain.AbilityEffect;
import com.example.gridbattle.model.domain.AbilityType;
import com.example.gridbattle.model.domain.BattleUnit;
import com.example.gridbattle.model.domain.GridPosition;
import com.example.gridbattle.model.event.MoveEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Nearest-target selection, area target sets and single-step movement.
 */
public class TargetingResolver {

    // Right, left, down, up, then the diagonals
    private static final int[][] STEPS = {
            {0, 1}, {0, -1}, {1, 0}, {-1, 0},
            {1, 1}, {1, -1}, {-1, 1}, {-1, -1}
    };

    private final BattleContext context;

    public TargetingResolver(BattleContext context) {
        this.context = context;
    }

    /**
     * Closest candidate by Chebyshev distance; the earliest candidate wins a tie.
     */
    public BattleUnit findNearest(GridPosition origin, List<BattleUnit> candidates) {
        BattleUnit nearest = null;
        int best = Integer.MAX_VALUE;
        for (BattleUnit candidate : candidates) {
            int distance = origin.distanceTo(candidate.getPosition());
            if (distance < best) {
                best = distance;
                nearest = candidate;
            }
        }
        return nearest;
    }

    public BattleUnit findNearestWithin(BattleUnit unit, int range) {
        BattleUnit nearest = findNearest(unit.getPosition(), context.getOpponents(unit));
        if (nearest == null || unit.getPosition().distanceTo(nearest.getPosition()) > range) {
            return null;
        }
        return nearest;
    }

    /**
     * Longest range among ready offensive abilities, melee when there is none.
     */
    public int effectiveRange(BattleUnit unit) {
        int range = 1;
        for (Ability ability : unit.getAbilities()) {
            if (ability.getType() == AbilityType.OFFENSIVE && unit.isAbilityReady(ability)) {
                range = Math.max(range, ability.getRangeOrDefault());
            }
        }
        return range;
    }

    /**
     * Opponents hit by a damage or status effect of {@code ability}. Empty when nothing valid is in range.
     */
    public List<BattleUnit> resolveOffensiveTargets(BattleUnit caster, Ability ability, AbilityEffect effect) {
        switch (effect.getTargetType()) {
            case SELF:
                return List.of(caster);
            case ENEMY: {
                BattleUnit target = findNearestWithin(caster, ability.getRangeOrDefault());
                return target == null ? List.of() : List.of(target);
            }
            case AOE:
                switch (effect.getPattern()) {
                    case CLEAVE:
                        return cleaveTargets(caster);
                    case BLOCK:
                        return blockTargets(caster, ability.getRangeOrDefault());
                    case RADIUS:
                    default:
                        return radiusTargets(caster, ability.getRangeOrDefault(), effect.getRadiusOrDefault());
                }
            default:
                throw new IllegalStateException("Unhandled target type " + effect.getTargetType());
        }
    }

    private List<BattleUnit> radiusTargets(BattleUnit caster, int range, int radius) {
        BattleUnit center = findNearestWithin(caster, range);
        if (center == null) {
            return List.of();
        }
        List<BattleUnit> targets = new ArrayList<>();
        for (BattleUnit opponent : context.getOpponents(caster)) {
            if (opponent.getPosition().distanceTo(center.getPosition()) <= radius) {
                targets.add(opponent);
            }
        }
        return targets;
    }

    private List<BattleUnit> cleaveTargets(BattleUnit caster) {
        BattleUnit primary = findNearestWithin(caster, 1);
        if (primary == null) {
            return List.of();
        }
        List<BattleUnit> targets = new ArrayList<>();
        targets.add(primary);
        for (BattleUnit opponent : context.getOpponents(caster)) {
            if (targets.size() == 3) {
                break;
            }
            if (opponent != primary
                    && opponent.getPosition().distanceTo(primary.getPosition()) == 1
                    && opponent.getPosition().distanceTo(caster.getPosition()) == 1) {
                targets.add(opponent);
            }
        }
        return targets;
    }

    private List<BattleUnit> blockTargets(BattleUnit caster, int range) {
        BattleUnit anchor = findNearestWithin(caster, range);
        if (anchor == null) {
            return List.of();
        }
        // Keep the 2x2 block on the board
        int top = Math.min(anchor.getPosition().row(), context.getGrid().getHeight() - 2);
        int left = Math.min(anchor.getPosition().col(), context.getGrid().getWidth() - 2);
        List<BattleUnit> targets = new ArrayList<>();
        for (BattleUnit opponent : context.getOpponents(caster)) {
            GridPosition pos = opponent.getPosition();
            if (pos.row() >= top && pos.row() <= top + 1 && pos.col() >= left && pos.col() <= left + 1) {
                targets.add(opponent);
            }
        }
        return targets;
    }

    /**
     * One step toward the target. Candidates are scored, the best acceptable free cell not yet claimed
     * this tick wins.
     *
     * @return whether the unit moved
     */
    public boolean stepToward(BattleUnit unit, BattleUnit target, Set<GridPosition> claimed) {
        GridPosition from = unit.getPosition();
        GridPosition goal = target.getPosition();
        int currentDistance = from.distanceTo(goal);
        int towardRow = goal.row() - from.row();
        int towardCol = goal.col() - from.col();

        List<ScoredStep> candidates = new ArrayList<>();
        for (int[] step : STEPS) {
            GridPosition next = from.offset(step[0], step[1]);
            if (!context.getGrid().isFree(next) || claimed.contains(next)) {
                continue;
            }
            int distance = next.distanceTo(goal);
            int alignment = step[0] * towardRow + step[1] * towardCol;
            int score = distance * 100 - (distance < currentDistance ? 50 : 0) - 10 * alignment;
            candidates.add(new ScoredStep(next, distance, score));
        }
        candidates.sort(Comparator.comparingInt(ScoredStep::score));

        for (ScoredStep candidate : candidates) {
            if (candidate.distance() - currentDistance > 1) {
                continue;
            }
            if (context.getGrid().move(unit.getId(), from, candidate.position())) {
                unit.setPosition(candidate.position());
                claimed.add(candidate.position());
                context.emit(new MoveEvent(context.getTick(), unit.getId(), from, candidate.position()));
                return true;
            }
        }
        return false;
    }

    private record ScoredStep(GridPosition position, int distance, int score) {
    }
}
