package com.example.gridbattle.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UnitStats {
    private double hp;
    private double maxHp;
    private double damage;
    private double speed;
    private double defense;
    private double critChance;
    private double critDamage;
    private double evasion;
    private double accuracy;
    // Optional, 0 when the unit has none
    private double penetration;
    private double lifesteal;

    public UnitStats copy() {
        return toBuilder().build();
    }

    public double get(Stat stat) {
        switch (stat) {
            case MAX_HP:
                return maxHp;
            case DAMAGE:
                return damage;
            case SPEED:
                return speed;
            case DEFENSE:
                return defense;
            case CRIT_CHANCE:
                return critChance;
            case CRIT_DAMAGE:
                return critDamage;
            case EVASION:
                return evasion;
            case ACCURACY:
                return accuracy;
            case PENETRATION:
                return penetration;
            case LIFESTEAL:
                return lifesteal;
            default:
                throw new IllegalArgumentException("Unhandled stat " + stat);
        }
    }

    public void set(Stat stat, double value) {
        switch (stat) {
            case MAX_HP:
                maxHp = value;
                break;
            case DAMAGE:
                damage = value;
                break;
            case SPEED:
                speed = value;
                break;
            case DEFENSE:
                defense = value;
                break;
            case CRIT_CHANCE:
                critChance = value;
                break;
            case CRIT_DAMAGE:
                critDamage = value;
                break;
            case EVASION:
                evasion = value;
                break;
            case ACCURACY:
                accuracy = value;
                break;
            case PENETRATION:
                penetration = value;
                break;
            case LIFESTEAL:
                lifesteal = value;
                break;
            default:
                throw new IllegalArgumentException("Unhandled stat " + stat);
        }
    }
}
