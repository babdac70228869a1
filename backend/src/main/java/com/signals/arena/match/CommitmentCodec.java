package com.signals.arena.match;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical commitment hash shared with agent clients:
 * {@code keccak256(uint256 matchId ‖ address agent ‖ uint8 choiceCode ‖ bytes32 nonce)}.
 * Binding the agent address stops an opponent from replaying a revealed commitment as its own.
 */
public final class CommitmentCodec {

    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-f]{64}$");
    private static final Pattern HEX_40 = Pattern.compile("^[0-9a-f]{40}$");

    public static final int NONCE_BYTES = 32;
    public static final String SCHEME = "keccak256(uint256 matchId, address agent, uint8 choice, bytes32 nonce)";

    private CommitmentCodec() {
    }

    public static String computeCommitmentHash(long matchId, String agentAddress, Choice choice, byte[] nonce) {
        if (matchId < 0) {
            throw new IllegalArgumentException("matchId must be non-negative");
        }
        if (choice == null) {
            throw new IllegalArgumentException("Choice is required");
        }
        if (nonce == null || nonce.length != NONCE_BYTES) {
            throw new IllegalArgumentException("Nonce must be " + NONCE_BYTES + " bytes");
        }

        byte[] matchIdBytes = leftPad(BigInteger.valueOf(matchId).toByteArray(), 32);
        byte[] addressBytes = decodeAddress(agentAddress);

        byte[] preimage = new byte[matchIdBytes.length + addressBytes.length + 1 + nonce.length];
        int offset = 0;
        System.arraycopy(matchIdBytes, 0, preimage, offset, matchIdBytes.length);
        offset += matchIdBytes.length;
        System.arraycopy(addressBytes, 0, preimage, offset, addressBytes.length);
        offset += addressBytes.length;
        preimage[offset++] = (byte) choice.code();
        System.arraycopy(nonce, 0, preimage, offset, nonce.length);

        Keccak.Digest256 digest = new Keccak.Digest256();
        return "0x" + toHex(digest.digest(preimage));
    }

    public static boolean matches(String commitmentHash, long matchId, String agentAddress, Choice choice, byte[] nonce) {
        return normalizeCommitmentHash(commitmentHash)
                .equals(computeCommitmentHash(matchId, agentAddress, choice, nonce));
    }

    public static String normalizeCommitmentHash(String hash) {
        if (hash == null) {
            throw new IllegalArgumentException("Commitment hash is required");
        }

        String trimmed = hash.trim().toLowerCase(Locale.ROOT);
        String withoutPrefix = trimmed.startsWith("0x") ? trimmed.substring(2) : trimmed;
        if (!HEX_64.matcher(withoutPrefix).matches()) {
            throw new IllegalArgumentException("Commitment hash must be 64 hex characters");
        }
        return "0x" + withoutPrefix;
    }

    public static byte[] decodeNonce(String nonceHex) {
        if (nonceHex == null) {
            throw new IllegalArgumentException("Nonce is required");
        }
        String trimmed = nonceHex.trim().toLowerCase(Locale.ROOT);
        String withoutPrefix = trimmed.startsWith("0x") ? trimmed.substring(2) : trimmed;
        if (!HEX_64.matcher(withoutPrefix).matches()) {
            throw new IllegalArgumentException("Nonce must be 32 bytes of hex");
        }
        return fromHex(withoutPrefix);
    }

    private static byte[] decodeAddress(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Agent address is required");
        }
        String trimmed = address.trim().toLowerCase(Locale.ROOT);
        String withoutPrefix = trimmed.startsWith("0x") ? trimmed.substring(2) : trimmed;
        if (!HEX_40.matcher(withoutPrefix).matches()) {
            throw new IllegalArgumentException("Agent address must be 20 bytes of hex");
        }
        return fromHex(withoutPrefix);
    }

    private static byte[] leftPad(byte[] value, int length) {
        byte[] out = new byte[length];
        int copy = Math.min(value.length, length);
        System.arraycopy(value, value.length - copy, out, length - copy, copy);
        return out;
    }

    private static byte[] fromHex(String hex) {
        byte[] out = new byte[hex.length() / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
        }
        return out;
    }

    static String toHex(byte[] bytes) {
        StringBuilder out = new StringBuilder(bytes.length * 2);
        for (byte value : bytes) {
            out.append(Character.forDigit((value >>> 4) & 0x0f, 16));
            out.append(Character.forDigit(value & 0x0f, 16));
        }
        return out.toString();
    }
}
