package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Holds the for and against tallies of a proposal and the receipt of every voter.
 */
class ProposalVotes {

    /**
     * The votes in support of the proposal.
     */
    BigInteger forVotes;

    /**
     * The votes in opposition to the proposal.
     */
    BigInteger againstVotes;

    /**
     * Holds information about which accounts voted on the proposal.
     */
    final Map<Hash160, Receipt> receipts;

    ProposalVotes() {
        forVotes = BigInteger.ZERO;
        againstVotes = BigInteger.ZERO;
        receipts = new HashMap<>();
    }
}
