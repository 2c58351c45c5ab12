package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;
import io.neow3j.utils.Numeric;

import java.util.Arrays;
import java.util.Objects;

/**
 * Represents an action of a proposal. Proposals are made up of one or more intents that are executed once the
 * proposal succeeded.
 */
public class Intent {

    /**
     * The contract to be called.
     */
    private final Hash160 target;

    /**
     * The signature of the method to be called, e.g. {@code transfer(address,uint256)}. Empty if the payload already
     * contains the complete call data.
     */
    private final String signature;

    /**
     * The call payload. Opaque to the governor.
     */
    private final byte[] payload;

    public Intent(Hash160 target, String signature, byte[] payload) {
        this.target = target;
        this.signature = signature == null ? "" : signature;
        this.payload = payload == null ? new byte[0] : payload.clone();
    }

    public Hash160 getTarget() {
        return target;
    }

    public String getSignature() {
        return signature;
    }

    public boolean hasSignature() {
        return !signature.isEmpty();
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Intent)) return false;
        Intent intent = (Intent) o;
        return Objects.equals(target, intent.target) &&
                signature.equals(intent.signature) &&
                Arrays.equals(payload, intent.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(target, signature) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Intent{target=" + target + ", signature='" + signature + "', payload=" +
                Numeric.toHexString(payload) + "}";
    }
}
