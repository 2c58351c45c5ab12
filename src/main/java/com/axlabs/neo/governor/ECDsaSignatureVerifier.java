package com.axlabs.neo.governor;

import io.neow3j.crypto.ECKeyPair.ECPublicKey;
import io.neow3j.crypto.Sign;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SignatureException;

/**
 * Recovers signers of secp256r1 signatures created with {@link Sign#signMessage(byte[], io.neow3j.crypto.ECKeyPair)}.
 * The signer is identified by the script hash of its standard (single-sig) account.
 */
public class ECDsaSignatureVerifier implements SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(ECDsaSignatureVerifier.class);

    @Override
    public Hash160 recoverSigner(byte[] digest, Sign.SignatureData signature) {
        if (digest == null || signature == null) {
            return Hash160.ZERO;
        }
        try {
            ECPublicKey publicKey = Sign.signedMessageToKey(digest, signature);
            return Hash160.fromPublicKey(publicKey.getEncoded(true));
        } catch (SignatureException | RuntimeException e) {
            log.debug("Could not recover signer from signature: {}", e.getMessage());
            return Hash160.ZERO;
        }
    }
}
