package com.example.gridbattle.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named status effects with their fixed category.
 */
public enum StatusEffectType {
    // Control
    STUN("stun", StatusCategory.CONTROL),
    ROOT("root", StatusCategory.CONTROL),
    SILENCE("silence", StatusCategory.CONTROL),
    DISARM("disarm", StatusCategory.CONTROL),
    FEAR("fear", StatusCategory.CONTROL),
    CHARM("charm", StatusCategory.CONTROL),
    SLEEP("sleep", StatusCategory.CONTROL),

    // Damage over time
    POISON("poison", StatusCategory.DOT),
    BURN("burn", StatusCategory.DOT),
    BLEED("bleed", StatusCategory.DOT),

    // Debuffs
    SLOW("slow", StatusCategory.DEBUFF),
    ARMOR_BREAK("armor_break", StatusCategory.DEBUFF),
    WEAKENED("weakened", StatusCategory.DEBUFF),
    VULNERABLE("vulnerable", StatusCategory.DEBUFF),
    DISEASE("disease", StatusCategory.DEBUFF),
    CURSE("curse", StatusCategory.DEBUFF),
    TERROR("terror", StatusCategory.DEBUFF),
    MARKED("marked", StatusCategory.DEBUFF),

    // Buffs
    SHIELD("shield", StatusCategory.BUFF),
    REGENERATION("regeneration", StatusCategory.BUFF),
    ENRAGE("enrage", StatusCategory.BUFF),
    FRENZY("frenzy", StatusCategory.BUFF),
    FORTIFY("fortify", StatusCategory.BUFF),
    HASTE("haste", StatusCategory.BUFF),
    INVISIBILITY("invisibility", StatusCategory.BUFF),
    INCORPOREAL("incorporeal", StatusCategory.BUFF),

    // Everything else
    TAUNT("taunt", StatusCategory.SPECIAL),
    THORNS("thorns", StatusCategory.SPECIAL),
    BURNING_GROUND("burning_ground", StatusCategory.SPECIAL),
    SCORCHED_EARTH("scorched_earth", StatusCategory.SPECIAL),
    PLAGUE_ZONE("plague_zone", StatusCategory.SPECIAL),
    ENTANGLE("entangle", StatusCategory.SPECIAL);

    private final String id;
    private final StatusCategory category;

    StatusEffectType(String id, StatusCategory category) {
        this.id = id;
        this.category = category;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public StatusCategory getCategory() {
        return category;
    }

    @JsonCreator
    public static StatusEffectType fromId(String id) {
        for (StatusEffectType type : values()) {
            if (type.id.equals(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown status type: " + id);
    }
}
