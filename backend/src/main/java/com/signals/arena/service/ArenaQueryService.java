package com.signals.arena.service;

import com.signals.arena.betting.BettingPoolService;
import com.signals.arena.config.LedgerProperties;
import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.WalletAddresses;
import com.signals.arena.dto.ArenaAgentResponses;
import com.signals.arena.dto.ArenaMatchResponses;
import com.signals.arena.dto.ArenaStatsResponses;
import com.signals.arena.dto.ArenaTournamentResponses;
import com.signals.arena.ledger.SettlementSubmitter;
import com.signals.arena.mapper.ArenaResponseMapper;
import com.signals.arena.match.Match;
import com.signals.arena.match.MatchEngine;
import com.signals.arena.queue.MatchmakingQueue;
import com.signals.arena.stats.MatchHistoryService;
import com.signals.arena.tournament.Tournament;
import com.signals.arena.tournament.TournamentManager;
import com.signals.arena.tournament.TournamentQueueManager;
import com.signals.arena.web.ArenaNotFoundException;
import com.signals.arena.web.InvalidAddressException;
import com.signals.arena.ws.ConnectionRegistry;
import com.signals.arena.ws.ConnectionSession;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the REST surface. Every query runs on the arena core thread and returns immutable
 * snapshots, so HTTP threads never touch live state.
 */
@Service
public class ArenaQueryService {

    static final String SERVICE_NAME = "signals-arena";
    static final int MAX_LIMIT = 100;

    private final ArenaEventLoop eventLoop;
    private final ArenaResponseMapper mapper;
    private final ConnectionRegistry connectionRegistry;
    private final MatchEngine matchEngine;
    private final BettingPoolService bettingPoolService;
    private final MatchmakingQueue matchmakingQueue;
    private final TournamentManager tournamentManager;
    private final TournamentQueueManager tournamentQueueManager;
    private final MatchHistoryService matchHistoryService;
    private final SettlementSubmitter settlementSubmitter;
    private final LedgerProperties ledgerProperties;
    private final Instant startedAt;

    public ArenaQueryService(
            ArenaEventLoop eventLoop,
            ArenaResponseMapper mapper,
            ConnectionRegistry connectionRegistry,
            MatchEngine matchEngine,
            BettingPoolService bettingPoolService,
            MatchmakingQueue matchmakingQueue,
            TournamentManager tournamentManager,
            TournamentQueueManager tournamentQueueManager,
            MatchHistoryService matchHistoryService,
            SettlementSubmitter settlementSubmitter,
            LedgerProperties ledgerProperties
    ) {
        this.eventLoop = eventLoop;
        this.mapper = mapper;
        this.connectionRegistry = connectionRegistry;
        this.matchEngine = matchEngine;
        this.bettingPoolService = bettingPoolService;
        this.matchmakingQueue = matchmakingQueue;
        this.tournamentManager = tournamentManager;
        this.tournamentQueueManager = tournamentQueueManager;
        this.matchHistoryService = matchHistoryService;
        this.settlementSubmitter = settlementSubmitter;
        this.ledgerProperties = ledgerProperties;
        this.startedAt = eventLoop.now();
    }

    public ArenaStatsResponses.HealthResponse health() {
        return eventLoop.call(() -> new ArenaStatsResponses.HealthResponse(
                SERVICE_NAME,
                "ok",
                startedAt,
                Duration.between(startedAt, eventLoop.now()).toSeconds(),
                ledgerProperties.getMode(),
                mapper.toConnectionCounts(connectionRegistry.stats())
        ));
    }

    public List<ArenaMatchResponses.MatchSummary> activeMatches() {
        return eventLoop.call(() -> matchEngine.activeMatches().stream().map(mapper::toMatchSummary).toList());
    }

    public ArenaMatchResponses.MatchDetail match(long matchId) {
        return eventLoop.call(() -> mapper.toMatchDetail(requireMatch(matchId)));
    }

    public ArenaMatchResponses.PoolOdds odds(long matchId) {
        return eventLoop.call(() -> bettingPoolService.findPool(matchId)
                .map(mapper::toPoolOdds)
                .orElseThrow(() -> missingPool(matchId)));
    }

    public ArenaMatchResponses.PoolDetail pool(long matchId) {
        return eventLoop.call(() -> bettingPoolService.findPool(matchId)
                .map(mapper::toPoolDetail)
                .orElseThrow(() -> missingPool(matchId)));
    }

    public List<ArenaTournamentResponses.QueueEntryView> queue() {
        return eventLoop.call(() -> mapper.toQueueEntryViews(matchmakingQueue.snapshot()));
    }

    public List<ArenaTournamentResponses.TournamentSummary> activeTournaments() {
        return eventLoop.call(() -> tournamentManager.activeTournaments().stream()
                .map(mapper::toTournamentSummary)
                .toList());
    }

    public ArenaTournamentResponses.TournamentDetail tournament(long tournamentId) {
        return eventLoop.call(() -> {
            Tournament tournament = requireTournament(tournamentId);
            return mapper.toTournamentDetail(tournament, tournamentManager.rankedStandings(tournamentId));
        });
    }

    public List<ArenaTournamentResponses.StandingView> standings(long tournamentId) {
        return eventLoop.call(() -> {
            requireTournament(tournamentId);
            return mapper.toStandingViews(tournamentManager.rankedStandings(tournamentId));
        });
    }

    public ArenaTournamentResponses.TournamentQueueView tournamentQueue() {
        return eventLoop.call(() -> mapper.toTournamentQueueView(
                tournamentQueueManager.snapshot(),
                tournamentQueueManager.capacity(),
                tournamentQueueManager.minPlayers(),
                tournamentQueueManager.getRegistrationDeadline()
        ));
    }

    public ArenaAgentResponses.AgentStatus agentStatus(String rawAddress) {
        String address = normalize(rawAddress);
        return eventLoop.call(() -> {
            Optional<ConnectionSession> session = connectionRegistry.getConnectionByAddress(address);
            Optional<Match> match = matchEngine.activeMatchFor(address);
            Optional<Tournament> tournament = tournamentManager.activeTournamentFor(address);
            return new ArenaAgentResponses.AgentStatus(
                    address,
                    connectionRegistry.isConnected(address),
                    session.map(ConnectionSession::getDisplayName).orElse(null),
                    matchmakingQueue.contains(address),
                    tournamentQueueManager.contains(address),
                    match.map(Match::getId).orElse(null),
                    match.map(Match::getPhase).orElse(null),
                    tournament.map(Tournament::getId).orElse(null)
            );
        });
    }

    public ArenaAgentResponses.AgentStats agentStats(String rawAddress) {
        String address = normalize(rawAddress);
        return eventLoop.call(() -> mapper.toAgentStats(address, matchHistoryService.statsFor(address).orElse(null)));
    }

    public List<ArenaAgentResponses.AgentMatch> agentMatches(String rawAddress) {
        String address = normalize(rawAddress);
        return eventLoop.call(() -> matchHistoryService.recentMatches(address, MAX_LIMIT).stream()
                .map(mapper::toAgentMatch)
                .toList());
    }

    public List<ArenaAgentResponses.BettorBet> bettorBets(String rawAddress) {
        String address = normalize(rawAddress);
        return eventLoop.call(() -> bettingPoolService.betsFor(address).stream()
                .map(mapper::toBettorBet)
                .toList());
    }

    public ArenaStatsResponses.ArenaStats stats() {
        return eventLoop.call(() -> {
            SettlementSubmitter.SubmissionStats submissions = settlementSubmitter.stats();
            return new ArenaStatsResponses.ArenaStats(
                    mapper.toConnectionCounts(connectionRegistry.stats()),
                    matchmakingQueue.size(),
                    tournamentQueueManager.snapshot().size(),
                    matchEngine.activeMatches().size(),
                    tournamentManager.activeTournaments().size(),
                    bettingPoolService.openPoolCount(),
                    matchHistoryService.completedMatches(),
                    submissions.pending(),
                    submissions.confirmed(),
                    submissions.abandoned()
            );
        });
    }

    public List<ArenaAgentResponses.LeaderboardEntry> leaderboard(int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return eventLoop.call(() -> mapper.toLeaderboard(matchHistoryService.leaderboard(bounded)));
    }

    private Match requireMatch(long matchId) {
        return matchEngine.findMatch(matchId).orElseThrow(() -> ArenaNotFoundException.match(matchId));
    }

    private Tournament requireTournament(long tournamentId) {
        return tournamentManager.findTournament(tournamentId)
                .orElseThrow(() -> ArenaNotFoundException.tournament(tournamentId));
    }

    private ArenaNotFoundException missingPool(long matchId) {
        return matchEngine.findMatch(matchId).isPresent()
                ? ArenaNotFoundException.pool(matchId)
                : ArenaNotFoundException.match(matchId);
    }

    private static String normalize(String address) {
        if (!WalletAddresses.isValid(address)) {
            throw new InvalidAddressException(address);
        }
        return WalletAddresses.normalize(address);
    }
}
