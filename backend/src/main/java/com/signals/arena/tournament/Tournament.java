package com.signals.arena.tournament;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Getter
@Setter
public class Tournament {

    private final long id;
    private final int totalRounds;
    private final Instant createdAt;

    private TournamentPhase phase = TournamentPhase.REGISTRATION;
    private int currentRound;
    private Instant startedAt;
    private Instant completedAt;
    private String cancelReason;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Standing> standings = new LinkedHashMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Map<Integer, List<PlannedRound.Pairing>> pairingsByRound = new TreeMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Map<Integer, String> byesByRound = new TreeMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<Long> pendingMatchIds = new HashSet<>();

    public Tournament(long id, int totalRounds, Instant createdAt) {
        this.id = id;
        this.totalRounds = totalRounds;
        this.createdAt = createdAt;
    }

    public List<String> getPlayers() {
        return List.copyOf(standings.keySet());
    }

    public boolean hasPlayer(String address) {
        return standings.containsKey(address);
    }

    public Standing standingOf(String address) {
        return standings.get(address);
    }

    public List<Standing> getStandings() {
        return List.copyOf(standings.values());
    }

    public Map<Integer, List<PlannedRound.Pairing>> getPairingsByRound() {
        return Collections.unmodifiableMap(pairingsByRound);
    }

    public Map<Integer, String> getByesByRound() {
        return Collections.unmodifiableMap(byesByRound);
    }

    public Set<Long> getPendingMatchIds() {
        return Collections.unmodifiableSet(pendingMatchIds);
    }

    public boolean isRoundSettled() {
        return pendingMatchIds.isEmpty();
    }

    boolean addPlayer(String address) {
        if (standings.containsKey(address)) {
            return false;
        }
        standings.put(address, new Standing(address));
        return true;
    }

    void recordRound(int round, List<PlannedRound.Pairing> pairings, String bye) {
        pairingsByRound.put(round, new ArrayList<>(pairings));
        if (bye != null) {
            byesByRound.put(round, bye);
        }
    }

    void trackMatch(long matchId) {
        pendingMatchIds.add(matchId);
    }

    boolean settleMatch(long matchId) {
        return pendingMatchIds.remove(matchId);
    }

    void clearPendingMatches() {
        pendingMatchIds.clear();
    }

    void recomputeBuchholz() {
        for (Standing standing : standings.values()) {
            int sum = 0;
            for (String opponent : standing.getOpponentsFaced()) {
                Standing other = standings.get(opponent);
                if (other != null) {
                    sum += other.getPoints();
                }
            }
            standing.setBuchholz(sum);
        }
    }
}
