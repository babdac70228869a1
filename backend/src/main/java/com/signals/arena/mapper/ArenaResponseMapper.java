package com.signals.arena.mapper;

import com.signals.arena.betting.BetPayout;
import com.signals.arena.betting.BettingPool;
import com.signals.arena.betting.BettingPoolService;
import com.signals.arena.dto.ArenaAgentResponses;
import com.signals.arena.dto.ArenaMatchResponses;
import com.signals.arena.dto.ArenaStatsResponses;
import com.signals.arena.dto.ArenaTournamentResponses;
import com.signals.arena.match.Match;
import com.signals.arena.match.MatchResult;
import com.signals.arena.queue.QueueEntry;
import com.signals.arena.stats.AgentStats;
import com.signals.arena.stats.MatchSummary;
import com.signals.arena.tournament.PlannedRound;
import com.signals.arena.tournament.Standing;
import com.signals.arena.tournament.Tournament;
import com.signals.arena.ws.ConnectionRegistry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts loop-owned domain objects into immutable response records. Must run on the arena core thread.
 */
@Component
public class ArenaResponseMapper {

    public ArenaMatchResponses.MatchSummary toMatchSummary(Match match) {
        return new ArenaMatchResponses.MatchSummary(
                match.getId(),
                match.getTournamentId(),
                match.getAgentA(),
                match.getAgentB(),
                match.getPhase(),
                match.getPhaseDeadline(),
                match.getCommitHashA() != null,
                match.getCommitHashB() != null,
                match.getCreatedAt()
        );
    }

    public ArenaMatchResponses.MatchDetail toMatchDetail(Match match) {
        return new ArenaMatchResponses.MatchDetail(
                match.getId(),
                match.getTournamentId(),
                match.getAgentA(),
                match.getAgentB(),
                match.getPhase(),
                match.getPhaseDeadline(),
                match.getCommitHashA() != null,
                match.getCommitHashB() != null,
                match.getMessages().stream()
                        .map(message -> new ArenaMatchResponses.MessageLine(message.from(), message.text(), message.sentAt()))
                        .toList(),
                toMatchResultView(match.getResult()),
                match.getSettlementTxRef(),
                match.getCreatedAt(),
                match.getCompletedAt()
        );
    }

    public ArenaMatchResponses.MatchResultView toMatchResultView(MatchResult result) {
        if (result == null) {
            return null;
        }
        return new ArenaMatchResponses.MatchResultView(
                result.outcome(),
                result.revealedChoiceA(),
                result.revealedChoiceB(),
                result.pointsA(),
                result.pointsB(),
                result.forfeitA(),
                result.forfeitB()
        );
    }

    public ArenaMatchResponses.PoolOdds toPoolOdds(BettingPool pool) {
        return new ArenaMatchResponses.PoolOdds(pool.getMatchId(), pool.getState(), pool.totalPool(), pool.odds());
    }

    public ArenaMatchResponses.PoolDetail toPoolDetail(BettingPool pool) {
        List<ArenaMatchResponses.PayoutLine> payouts = new ArrayList<>();
        for (BetPayout payout : pool.getPayouts()) {
            payouts.add(new ArenaMatchResponses.PayoutLine(payout.bettor(), payout.outcome(), payout.stake(), payout.payout()));
        }
        return new ArenaMatchResponses.PoolDetail(
                pool.getMatchId(),
                pool.getState(),
                pool.totalPool(),
                Map.copyOf(pool.getStakes()),
                pool.getBets().size(),
                pool.getWinningOutcome(),
                pool.isRefunded(),
                payouts
        );
    }

    public ArenaTournamentResponses.TournamentSummary toTournamentSummary(Tournament tournament) {
        return new ArenaTournamentResponses.TournamentSummary(
                tournament.getId(),
                tournament.getPhase(),
                tournament.getPlayers().size(),
                tournament.getCurrentRound(),
                tournament.getTotalRounds(),
                tournament.getCreatedAt()
        );
    }

    public ArenaTournamentResponses.TournamentDetail toTournamentDetail(Tournament tournament, List<Standing> ranked) {
        List<ArenaTournamentResponses.RoundView> rounds = new ArrayList<>();
        for (Map.Entry<Integer, List<PlannedRound.Pairing>> entry : tournament.getPairingsByRound().entrySet()) {
            rounds.add(new ArenaTournamentResponses.RoundView(
                    entry.getKey(),
                    entry.getValue().stream()
                            .map(p -> new ArenaTournamentResponses.PairingView(p.matchId(), p.agentA(), p.agentB()))
                            .toList(),
                    tournament.getByesByRound().get(entry.getKey())
            ));
        }
        return new ArenaTournamentResponses.TournamentDetail(
                tournament.getId(),
                tournament.getPhase(),
                tournament.getPlayers(),
                tournament.getCurrentRound(),
                tournament.getTotalRounds(),
                rounds,
                toStandingViews(ranked),
                tournament.getCancelReason(),
                tournament.getCreatedAt(),
                tournament.getStartedAt(),
                tournament.getCompletedAt()
        );
    }

    public List<ArenaTournamentResponses.StandingView> toStandingViews(List<Standing> ranked) {
        List<ArenaTournamentResponses.StandingView> views = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            Standing standing = ranked.get(i);
            views.add(new ArenaTournamentResponses.StandingView(
                    i + 1,
                    standing.getAddress(),
                    standing.getPoints(),
                    standing.getBuchholz(),
                    standing.getMatchesPlayed(),
                    standing.isHadBye()
            ));
        }
        return views;
    }

    public ArenaTournamentResponses.TournamentQueueView toTournamentQueueView(
            List<QueueEntry> entries,
            int capacity,
            int minPlayers,
            Instant registrationDeadline
    ) {
        return new ArenaTournamentResponses.TournamentQueueView(
                entries.size(),
                capacity,
                minPlayers,
                registrationDeadline,
                toQueueEntryViews(entries)
        );
    }

    public List<ArenaTournamentResponses.QueueEntryView> toQueueEntryViews(List<QueueEntry> entries) {
        return entries.stream()
                .map(entry -> new ArenaTournamentResponses.QueueEntryView(entry.address(), entry.joinedAt()))
                .toList();
    }

    public ArenaAgentResponses.AgentStats toAgentStats(String address, AgentStats stats) {
        if (stats == null) {
            return new ArenaAgentResponses.AgentStats(address, 0, 0, 0, 0, 0, 0, null);
        }
        return new ArenaAgentResponses.AgentStats(
                stats.getAddress(),
                stats.getMatchesPlayed(),
                stats.getSplits(),
                stats.getSteals(),
                stats.getForfeits(),
                stats.getTotalPoints(),
                stats.getTournamentMatches(),
                stats.getLastMatchAt()
        );
    }

    public ArenaAgentResponses.AgentMatch toAgentMatch(MatchSummary summary) {
        return new ArenaAgentResponses.AgentMatch(
                summary.matchId(),
                summary.tournamentId(),
                summary.opponent(),
                summary.choice(),
                summary.opponentChoice(),
                summary.outcome(),
                summary.points(),
                summary.opponentPoints(),
                summary.forfeited(),
                summary.completedAt()
        );
    }

    public List<ArenaAgentResponses.LeaderboardEntry> toLeaderboard(List<AgentStats> ranked) {
        List<ArenaAgentResponses.LeaderboardEntry> entries = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            AgentStats stats = ranked.get(i);
            entries.add(new ArenaAgentResponses.LeaderboardEntry(
                    i + 1,
                    stats.getAddress(),
                    stats.getTotalPoints(),
                    stats.getMatchesPlayed(),
                    stats.getSplits(),
                    stats.getSteals(),
                    stats.getForfeits()
            ));
        }
        return entries;
    }

    public ArenaAgentResponses.BettorBet toBettorBet(BettingPoolService.BettorBet bettorBet) {
        return new ArenaAgentResponses.BettorBet(
                bettorBet.bet().matchId(),
                bettorBet.bet().outcome(),
                bettorBet.bet().amount(),
                bettorBet.bet().placedAt(),
                bettorBet.payout(),
                bettorBet.payout() != null
        );
    }

    public ArenaStatsResponses.ConnectionCounts toConnectionCounts(ConnectionRegistry.ConnectionStats stats) {
        return new ArenaStatsResponses.ConnectionCounts(
                stats.total(),
                stats.agents(),
                stats.spectators(),
                stats.bettors(),
                stats.authenticated()
        );
    }
}
