package com.signals.arena.auth;

import com.signals.arena.config.ArenaProperties;
import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.WalletAddresses;
import com.signals.arena.ws.ConnectionRegistry;
import com.signals.arena.ws.ConnectionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;

/**
 * Issues single-use challenges and binds a connection to the wallet that signed one.
 * A challenge is consumed by its first verification attempt whatever the result.
 */
@Service
public class AuthManager {

    private static final Logger log = LoggerFactory.getLogger(AuthManager.class);

    private static final int NONCE_BYTES = 32;

    private final ArenaEventLoop eventLoop;
    private final ConnectionRegistry connectionRegistry;
    private final WalletSignatureVerifier signatureVerifier;
    private final Duration challengeExpiry;
    private final SecureRandom random = new SecureRandom();

    private final Map<String, AuthChallenge> challenges = new HashMap<>();

    public AuthManager(
            ArenaEventLoop eventLoop,
            ConnectionRegistry connectionRegistry,
            WalletSignatureVerifier signatureVerifier,
            ArenaProperties arenaProperties
    ) {
        this.eventLoop = eventLoop;
        this.connectionRegistry = connectionRegistry;
        this.signatureVerifier = signatureVerifier;
        this.challengeExpiry = arenaProperties.getAuth().getChallengeExpiry();
    }

    public AuthChallenge generateChallenge(String connectionId) {
        byte[] nonceBytes = new byte[NONCE_BYTES];
        random.nextBytes(nonceBytes);
        String nonce = "0x" + HexFormat.of().formatHex(nonceBytes);
        Instant expiresAt = eventLoop.now().plus(challengeExpiry);

        AuthChallenge challenge = new AuthChallenge(
                UUID.randomUUID().toString(),
                nonce,
                connectionId,
                challengeMessage(nonce, expiresAt),
                expiresAt
        );

        connectionRegistry.find(connectionId).ifPresent(session -> {
            String previous = session.getPendingChallengeId();
            if (previous != null) {
                challenges.remove(previous);
            }
            session.setPendingChallengeId(challenge.challengeId());
        });
        challenges.put(challenge.challengeId(), challenge);
        return challenge;
    }

    /**
     * @return the normalized address now bound to the connection
     * @throws AuthenticationException if the challenge is unknown, expired, foreign, or the signature
     *                                 does not recover to {@code address}
     */
    public String verify(String connectionId, String challengeId, String address, String signature, String displayName) {
        AuthChallenge challenge = challengeId == null ? null : challenges.remove(challengeId);
        connectionRegistry.find(connectionId).ifPresent(session -> {
            if (challengeId != null && challengeId.equals(session.getPendingChallengeId())) {
                session.setPendingChallengeId(null);
            }
        });

        if (challenge == null) {
            throw new AuthenticationException("Unknown or already used challenge");
        }
        if (!challenge.connectionId().equals(connectionId)) {
            throw new AuthenticationException("Challenge was issued to a different connection");
        }
        if (challenge.isExpired(eventLoop.now())) {
            throw new AuthenticationException("Challenge expired");
        }
        if (!WalletAddresses.isValid(address)) {
            throw new AuthenticationException("Address is not a valid wallet address");
        }
        if (!signatureVerifier.verify(challenge.message(), signature, address)) {
            log.info("Signature verification failed for connection {} claiming {}", connectionId, address);
            throw new AuthenticationException("Signature does not match address");
        }

        String normalized = WalletAddresses.normalize(address);
        String name = displayName == null || displayName.isBlank() ? null : displayName.strip();
        connectionRegistry.bindAddress(connectionId, normalized, name);
        log.info("Connection {} authenticated as {}", connectionId, normalized);
        return normalized;
    }

    public void discardFor(ConnectionSession session) {
        if (session.getPendingChallengeId() != null) {
            challenges.remove(session.getPendingChallengeId());
        }
    }

    /**
     * @return number of expired challenges removed
     */
    public int purgeExpired() {
        Instant now = eventLoop.now();
        int removed = 0;
        Iterator<AuthChallenge> iterator = challenges.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired(now)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    public int pendingChallenges() {
        return challenges.size();
    }

    static String challengeMessage(String nonce, Instant expiresAt) {
        return "Sign this message to authenticate with Signals Arena.\n\n"
                + "Challenge: " + nonce + "\n"
                + "Expires: " + expiresAt;
    }
}
