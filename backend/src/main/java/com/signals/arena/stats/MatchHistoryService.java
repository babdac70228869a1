package com.signals.arena.stats;

import com.signals.arena.match.Match;
import com.signals.arena.match.MatchEngine;
import com.signals.arena.match.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-agent statistics and recent match history, fed by match completions.
 * Lives on the arena core thread like the engine it listens to.
 */
@Service
public class MatchHistoryService {

    private static final Logger log = LoggerFactory.getLogger(MatchHistoryService.class);

    static final int HISTORY_LIMIT = 50;

    static final Comparator<AgentStats> LEADERBOARD_ORDER = Comparator
            .comparingInt(AgentStats::getTotalPoints).reversed()
            .thenComparing(Comparator.comparingInt(AgentStats::getMatchesPlayed).reversed())
            .thenComparing(AgentStats::getAddress);

    private final MatchEngine matchEngine;
    private final Map<String, AgentStats> statsByAddress = new HashMap<>();
    private final Map<String, Deque<MatchSummary>> historyByAddress = new HashMap<>();
    private long completedMatches;

    public MatchHistoryService(MatchEngine matchEngine) {
        this.matchEngine = matchEngine;
        matchEngine.onComplete(this::onMatchComplete);
    }

    public Optional<AgentStats> statsFor(String address) {
        return Optional.ofNullable(statsByAddress.get(address));
    }

    /**
     * @return up to {@code limit} summaries, newest first
     */
    public List<MatchSummary> recentMatches(String address, int limit) {
        Deque<MatchSummary> history = historyByAddress.get(address);
        if (history == null) {
            return List.of();
        }
        return history.stream().limit(Math.max(0, limit)).toList();
    }

    public List<AgentStats> leaderboard(int limit) {
        List<AgentStats> ranked = new ArrayList<>(statsByAddress.values());
        ranked.sort(LEADERBOARD_ORDER);
        return ranked.size() > limit ? List.copyOf(ranked.subList(0, Math.max(0, limit))) : ranked;
    }

    public long completedMatches() {
        return completedMatches;
    }

    private void onMatchComplete(long matchId, String addressA, String addressB) {
        Optional<Match> found = matchEngine.findMatch(matchId);
        if (found.isEmpty() || found.get().getResult() == null) {
            log.warn("Completion reported for match {} without a result", matchId);
            return;
        }
        Match match = found.get();
        MatchResult result = match.getResult();
        completedMatches++;

        statsByAddress.computeIfAbsent(addressA, AgentStats::new).record(
                result.revealedChoiceA(), result.forfeitA(), result.pointsA(), match.isTournamentMatch(), match.getCompletedAt());
        statsByAddress.computeIfAbsent(addressB, AgentStats::new).record(
                result.revealedChoiceB(), result.forfeitB(), result.pointsB(), match.isTournamentMatch(), match.getCompletedAt());

        remember(addressA, new MatchSummary(matchId, match.getTournamentId(), addressB,
                result.revealedChoiceA(), result.revealedChoiceB(), result.outcome(),
                result.pointsA(), result.pointsB(), result.forfeitA(), match.getCompletedAt()));
        remember(addressB, new MatchSummary(matchId, match.getTournamentId(), addressA,
                result.revealedChoiceB(), result.revealedChoiceA(), result.outcome(),
                result.pointsB(), result.pointsA(), result.forfeitB(), match.getCompletedAt()));
    }

    private void remember(String address, MatchSummary summary) {
        Deque<MatchSummary> history = historyByAddress.computeIfAbsent(address, key -> new ArrayDeque<>());
        history.addFirst(summary);
        while (history.size() > HISTORY_LIMIT) {
            history.removeLast();
        }
    }
}
