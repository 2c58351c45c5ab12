package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * The source of voting weights, usually a token that keeps checkpoints of its holders' votes.
 */
public interface VotingWeightOracle {

    /**
     * @return the current total supply of the token.
     */
    BigInteger getTotalSupply();

    /**
     * Gets the votes the {@code account} had at the given checkpoint.
     *
     * @param account    The account.
     * @param checkpoint A checkpoint that already passed.
     * @return the account's votes at the checkpoint.
     */
    BigInteger getPriorVotes(Hash160 account, int checkpoint);

}
