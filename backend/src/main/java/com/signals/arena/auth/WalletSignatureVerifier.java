package com.signals.arena.auth;

import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * Recovers the signer of an EIP-191 {@code personal_sign} message and compares it to the claimed address.
 */
@Component
public class WalletSignatureVerifier {

    private static final int SIGNATURE_BYTES = 65;

    public boolean verify(String message, String signatureHex, String expectedAddress) {
        if (message == null || signatureHex == null || expectedAddress == null) {
            return false;
        }

        byte[] signature;
        try {
            signature = Numeric.hexStringToByteArray(signatureHex.trim());
        } catch (RuntimeException ex) {
            return false;
        }
        if (signature.length != SIGNATURE_BYTES) {
            return false;
        }

        byte v = signature[64];
        if (v < 27) {
            v += 27;
        }
        Sign.SignatureData signatureData = new Sign.SignatureData(
                v,
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64)
        );

        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(message.getBytes(StandardCharsets.UTF_8), signatureData);
            String recovered = "0x" + Keys.getAddress(publicKey);
            return recovered.equalsIgnoreCase(expectedAddress.trim());
        } catch (SignatureException | IllegalArgumentException ex) {
            return false;
        }
    }
}
