package com.example.gridbattle.model.domain;

public enum Side {
    HEROES,
    ENEMIES
}
