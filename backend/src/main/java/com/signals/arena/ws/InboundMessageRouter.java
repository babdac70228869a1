package com.signals.arena.ws;

import com.signals.arena.auth.AuthChallenge;
import com.signals.arena.auth.AuthManager;
import com.signals.arena.auth.AuthenticationException;
import com.signals.arena.betting.Bet;
import com.signals.arena.betting.BettingPool;
import com.signals.arena.betting.BettingPoolService;
import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.ArenaStateException;
import com.signals.arena.match.Choice;
import com.signals.arena.match.MatchEngine;
import com.signals.arena.match.PoolOutcome;
import com.signals.arena.queue.MatchmakingQueue;
import com.signals.arena.tournament.TournamentManager;
import com.signals.arena.tournament.TournamentQueueManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Dispatches decoded client frames to the owning component and turns typed failures into
 * {@code ERROR} or {@code AUTH_FAILED} replies. Runs on the arena core thread.
 */
@Component
public class InboundMessageRouter {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageRouter.class);

    private final ArenaEventLoop eventLoop;
    private final ConnectionRegistry connectionRegistry;
    private final AuthManager authManager;
    private final MatchmakingQueue matchmakingQueue;
    private final TournamentQueueManager tournamentQueueManager;
    private final TournamentManager tournamentManager;
    private final MatchEngine matchEngine;
    private final BettingPoolService bettingPoolService;

    public InboundMessageRouter(
            ArenaEventLoop eventLoop,
            ConnectionRegistry connectionRegistry,
            AuthManager authManager,
            MatchmakingQueue matchmakingQueue,
            TournamentQueueManager tournamentQueueManager,
            TournamentManager tournamentManager,
            MatchEngine matchEngine,
            BettingPoolService bettingPoolService
    ) {
        this.eventLoop = eventLoop;
        this.connectionRegistry = connectionRegistry;
        this.authManager = authManager;
        this.matchmakingQueue = matchmakingQueue;
        this.tournamentQueueManager = tournamentQueueManager;
        this.tournamentManager = tournamentManager;
        this.matchEngine = matchEngine;
        this.bettingPoolService = bettingPoolService;
    }

    public void route(ConnectionSession session, InboundMessage message) {
        String connectionId = session.getConnectionId();
        try {
            dispatch(session, message);
        } catch (ProtocolException ex) {
            log.debug("Protocol error on {}: {}", connectionId, ex.getMessage());
            sendError(connectionId, ex.getCode(), ex.getMessage());
        } catch (ArenaStateException ex) {
            log.debug("Rejected {} from {}: {}", message.type(), connectionId, ex.getMessage());
            sendError(connectionId, ex.getCode(), ex.getMessage());
        } catch (AuthenticationException ex) {
            log.info("Authentication failed on {}: {}", connectionId, ex.getMessage());
            connectionRegistry.send(connectionId, ArenaEventType.AUTH_FAILED, new ArenaEventPayloads.AuthFailed(ex.getMessage()));
        }
    }

    /**
     * Sends a fresh challenge to the connection.
     */
    public void issueChallenge(ConnectionSession session) {
        AuthChallenge challenge = authManager.generateChallenge(session.getConnectionId());
        connectionRegistry.send(session.getConnectionId(), ArenaEventType.AUTH_CHALLENGE, new ArenaEventPayloads.AuthChallenge(
                challenge.challengeId(), challenge.nonce(), challenge.message(), challenge.expiresAt()));
    }

    /**
     * Releases everything a closed agent connection's address held. Matches keep running into their
     * deadlines. Bettor and spectator connections hold no agent state.
     */
    public void disconnect(ConnectionSession session) {
        authManager.discardFor(session);
        String address = session.getAddress();
        if (address == null || session.getRole() != ConnectionRole.AGENT) {
            return;
        }
        matchmakingQueue.removeFromQueue(address);
        tournamentQueueManager.leave(address);
        matchEngine.handleDisconnect(address);
    }

    public void sendError(String connectionId, String code, String message) {
        connectionRegistry.send(connectionId, ArenaEventType.ERROR, new ArenaEventPayloads.Error(code, message));
    }

    private void dispatch(ConnectionSession session, InboundMessage message) {
        switch (message.type()) {
            case AUTH_RESPONSE -> handleAuthResponse(session, message);
            case REQUEST_AUTH -> {
                if (session.getRole() == ConnectionRole.AGENT) {
                    throw ArenaStateException.wrongRole("REQUEST_AUTH");
                }
                issueChallenge(session);
            }
            case JOIN_QUEUE -> {
                String address = requireAgent(session, "JOIN_QUEUE");
                if (tournamentQueueManager.contains(address)) {
                    throw ArenaStateException.alreadyQueuedElsewhere(address, "tournament queue");
                }
                if (tournamentManager.isInActiveTournament(address)) {
                    throw ArenaStateException.inTournament(address);
                }
                matchmakingQueue.addToQueue(address, session.getConnectionId());
            }
            case LEAVE_QUEUE -> matchmakingQueue.removeFromQueue(requireAgent(session, "LEAVE_QUEUE"));
            case MATCH_MESSAGE -> matchEngine.postMessage(
                    requireAgent(session, "MATCH_MESSAGE"),
                    message.requireLong("matchId"),
                    message.requireText("message"));
            case READY -> matchEngine.markReady(requireAgent(session, "READY"), message.requireLong("matchId"));
            case COMMIT_CHOICE -> matchEngine.submitCommitment(
                    requireAgent(session, "COMMIT_CHOICE"),
                    message.requireLong("matchId"),
                    message.requireText("commitHash"));
            case REVEAL_CHOICE -> {
                String address = requireAgent(session, "REVEAL_CHOICE");
                long matchId = message.requireLong("matchId");
                Choice choice = parseChoice(message.requireText("choice"));
                matchEngine.submitReveal(address, matchId, choice, message.requireText("nonce"));
            }
            case JOIN_TOURNAMENT_QUEUE -> tournamentQueueManager.join(
                    requireAgent(session, "JOIN_TOURNAMENT_QUEUE"), session.getConnectionId());
            case LEAVE_TOURNAMENT_QUEUE -> tournamentQueueManager.leave(requireAgent(session, "LEAVE_TOURNAMENT_QUEUE"));
            case PLACE_BET -> handlePlaceBet(session, message);
            case PING -> connectionRegistry.send(session.getConnectionId(), ArenaEventType.PONG,
                    new ArenaEventPayloads.Pong(eventLoop.now().toEpochMilli()));
            case DISCONNECT -> disconnect(session);
        }
    }

    private void handleAuthResponse(ConnectionSession session, InboundMessage message) {
        String challengeId = message.requireText("challengeId");
        String address = message.requireText("address");
        String signature = message.requireText("signature");
        String name = message.optionalText("name");

        String bound = authManager.verify(session.getConnectionId(), challengeId, address, signature, name);
        connectionRegistry.send(session.getConnectionId(), ArenaEventType.AUTH_SUCCESS,
                new ArenaEventPayloads.AuthSuccess(bound, session.getDisplayName(), session.getRole()));
    }

    private void handlePlaceBet(ConnectionSession session, InboundMessage message) {
        if (!session.isAuthenticated()) {
            throw ArenaStateException.notAuthenticated();
        }
        long matchId = message.requireLong("matchId");
        PoolOutcome outcome;
        try {
            outcome = PoolOutcome.parse(message.requireText("outcome"));
        } catch (IllegalArgumentException ex) {
            throw ProtocolException.invalidField("outcome", ex.getMessage());
        }
        BigInteger amount = message.requireAmount("amount");

        String bettor = session.getAddress();
        matchEngine.findMatch(matchId).ifPresent(match -> {
            if (match.isParticipant(bettor)) {
                throw ArenaStateException.ownMatchBet(matchId);
            }
        });

        Bet bet = bettingPoolService.placeBet(matchId, bettor, outcome, amount);
        BigInteger totalPool = bettingPoolService.findPool(matchId)
                .map(BettingPool::totalPool)
                .orElse(bet.amount());
        connectionRegistry.send(session.getConnectionId(), ArenaEventType.BET_PLACED,
                new ArenaEventPayloads.BetPlaced(matchId, outcome, bet.amount(), totalPool));
    }

    private static String requireAgent(ConnectionSession session, String action) {
        if (session.getRole() != ConnectionRole.AGENT) {
            throw ArenaStateException.wrongRole(action);
        }
        if (!session.isAuthenticated()) {
            throw ArenaStateException.notAuthenticated();
        }
        return session.getAddress();
    }

    private static Choice parseChoice(String raw) {
        try {
            return Choice.parse(raw);
        } catch (IllegalArgumentException ex) {
            throw ProtocolException.invalidField("choice", ex.getMessage());
        }
    }
}
