package com.example.gridbattle.model.event;

public record CooldownSnapshot(String unitId, double cooldown, double cooldownRate) {
}
