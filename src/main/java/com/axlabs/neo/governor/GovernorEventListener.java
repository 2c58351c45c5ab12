package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.List;

/**
 * Receives the events emitted by a {@link Governor}, e.g., for off-chain indexing. Events are delivered
 * synchronously on the thread performing the operation, after the operation's state change.
 */
public interface GovernorEventListener {

    default void proposalCreated(int id, Hash160 proposer, List<Intent> intents, int startBlock, int endBlock,
            int lifetimeEndBlock, String description) {
    }

    default void voteCast(Hash160 voter, int id, boolean support, BigInteger votes) {
    }

    default void proposalCanceled(int id) {
    }

    default void proposalExecuted(int id) {
    }

    /**
     * Called right before an operation aborts.
     *
     * @param message The reason.
     * @param method  The aborted operation.
     */
    default void error(String message, String method) {
    }

}
