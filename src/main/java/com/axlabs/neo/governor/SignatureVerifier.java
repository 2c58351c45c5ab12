package com.axlabs.neo.governor;

import io.neow3j.crypto.Sign;
import io.neow3j.types.Hash160;

/**
 * Recovers the signer of a signed digest.
 */
public interface SignatureVerifier {

    /**
     * Recovers the account that signed {@code digest}.
     *
     * @param digest    The signed digest.
     * @param signature The signature.
     * @return the script hash of the signer, or {@link Hash160#ZERO} if no signer can be recovered.
     */
    Hash160 recoverSigner(byte[] digest, Sign.SignatureData signature);

}
