package com.saltbet.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic bout source for local runs and demos.
 * The live bout concludes the first time its result is requested; the next
 * call to {@link #getCurrentBout()} then starts a new one.
 */
@Service
@ConditionalOnProperty(
        prefix = "saltbet.match-data",
        name = "mode",
        havingValue = "mock"
)
public class MockMatchDataClient implements MatchDataClient {

    private static final List<Fighter> ROSTER = List.of(
            new Fighter(101, "Iron Lotus", "A", 1420, 1510, 7),
            new Fighter(102, "Copper Mantis", "A", 1385, 1460, 4),
            new Fighter(103, "Gale Warden", "B", 1290, 1330, 3),
            new Fighter(104, "Static Monk", "B", 1255, 1300, 5),
            new Fighter(105, "Ember Shrike", "S", 1610, 1705, 11),
            new Fighter(106, "Quiet Golem", "P", 1090, 1120, 2)
    );

    private final List<ExternalBout> history = new ArrayList<>();
    private long liveBoutId;
    private boolean liveConcluded = true;

    public MockMatchDataClient() {
        for (int i = 0; i < 3; i++) {
            liveBoutId++;
            history.add(concludedBout(liveBoutId));
        }
    }

    @Override
    public synchronized CurrentBout getCurrentBout() {
        if (liveConcluded) {
            liveBoutId++;
            liveConcluded = false;
        }
        return new CurrentBout(blueFor(liveBoutId).id(), redFor(liveBoutId).id(), freshnessFor(liveBoutId));
    }

    @Override
    public synchronized Optional<ExternalBout> getBout(long boutId) {
        if (boutId == liveBoutId && !liveConcluded) {
            history.add(concludedBout(liveBoutId));
            liveConcluded = true;
        }
        return history.stream()
                .filter(bout -> bout.id() == boutId)
                .findFirst();
    }

    @Override
    public synchronized Optional<ExternalBout> getMostRecentBout() {
        if (history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(history.get(history.size() - 1));
    }

    @Override
    public Fighter getFighter(long fighterId) {
        return ROSTER.stream()
                .filter(fighter -> fighter.id() == fighterId)
                .findFirst()
                .orElseGet(() -> new Fighter(fighterId, "Fighter " + fighterId, "U", null, null, null));
    }

    private ExternalBout concludedBout(long boutId) {
        Fighter blue = blueFor(boutId);
        Fighter red = redFor(boutId);
        long winner = boutId % 2 == 0 ? blue.id() : red.id();
        return new ExternalBout(boutId, blue.id(), red.id(), winner, freshnessFor(boutId));
    }

    private Fighter blueFor(long boutId) {
        return ROSTER.get((int) (boutId % ROSTER.size()));
    }

    private Fighter redFor(long boutId) {
        return ROSTER.get((int) ((boutId + 1) % ROSTER.size()));
    }

    private String freshnessFor(long boutId) {
        return "mock" + boutId;
    }
}
