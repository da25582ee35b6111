package com.example.gridbattle.logic;

import com.example.gridbattle.model.event.BattleEvent;
import com.example.gridbattle.model.event.BattleEventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only record of a battle. Readers only ever see an unmodifiable view.
 */
public class BattleEventLog {

    private final List<BattleEvent> events = new ArrayList<>();
    private final List<BattleEvent> view = Collections.unmodifiableList(events);

    public void append(BattleEvent event) {
        events.add(event);
    }

    public List<BattleEvent> getEvents() {
        return view;
    }

    public BattleEvent last() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public List<BattleEvent> ofKind(BattleEventType kind) {
        return events.stream().filter(e -> e.kind() == kind).collect(Collectors.toList());
    }
}
