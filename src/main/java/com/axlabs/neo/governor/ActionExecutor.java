package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Performs the external calls of a succeeded proposal.
 */
public interface ActionExecutor {

    /**
     * Invokes {@code target} with the given call data.
     *
     * @param target   The contract to call.
     * @param callData The call data, i.e., the method selector followed by the payload, or the raw payload if the
     *                 intent had no method signature.
     * @param value    The value attached to the call.
     * @return the data returned by the call.
     * @throws InvocationException if the call failed.
     */
    byte[] invoke(Hash160 target, byte[] callData, BigInteger value) throws InvocationException;

}
