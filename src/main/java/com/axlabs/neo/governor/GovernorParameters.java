package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * The immutable configuration of a {@link Governor}. The values are checked against the token's supply when the
 * governor is constructed.
 */
public class GovernorParameters {

    /**
     * The number of checkpoints between the creation of a proposal and the start of its voting period.
     */
    public static final int VOTING_DELAY = 1;

    /**
     * The upper bound for {@link #getProposalMaxOperations()}.
     */
    public static final int MAX_OPERATIONS_LIMIT = 10;

    private final String name;
    private final BigInteger quorumVotes;
    private final BigInteger proposalThreshold;
    private final int proposalMaxOperations;
    private final int votingPeriod;
    private final int proposalLifetime;
    private final Hash160 token;
    private final Hash160 governor;
    private final long networkMagic;

    /**
     * @param name                  The governor's name. Part of the signed ballot domain.
     * @param quorumVotes           The minimum number of for-votes required for a proposal to succeed.
     * @param proposalThreshold     The weight a proposer has to exceed to create a proposal.
     * @param proposalMaxOperations The maximum number of intents per proposal.
     * @param votingPeriod          The number of checkpoints a proposal is open for voting.
     * @param proposalLifetime      The number of checkpoints after the voting start until a proposal expires.
     * @param token                 The script hash of the token that provides the voting weights.
     * @param governor              The script hash identifying this governor in signed ballots.
     * @param networkMagic          The network identifier used in signed ballots.
     */
    public GovernorParameters(String name, BigInteger quorumVotes, BigInteger proposalThreshold,
            int proposalMaxOperations, int votingPeriod, int proposalLifetime, Hash160 token, Hash160 governor,
            long networkMagic) {
        this.name = name;
        this.quorumVotes = quorumVotes;
        this.proposalThreshold = proposalThreshold;
        this.proposalMaxOperations = proposalMaxOperations;
        this.votingPeriod = votingPeriod;
        this.proposalLifetime = proposalLifetime;
        this.token = token;
        this.governor = governor;
        this.networkMagic = networkMagic;
    }

    public String getName() {
        return name;
    }

    public BigInteger getQuorumVotes() {
        return quorumVotes;
    }

    public BigInteger getProposalThreshold() {
        return proposalThreshold;
    }

    public int getProposalMaxOperations() {
        return proposalMaxOperations;
    }

    public int getVotingPeriod() {
        return votingPeriod;
    }

    public int getProposalLifetime() {
        return proposalLifetime;
    }

    public Hash160 getToken() {
        return token;
    }

    public Hash160 getGovernor() {
        return governor;
    }

    public long getNetworkMagic() {
        return networkMagic;
    }

    @Override
    public String toString() {
        return "GovernorParameters{name='" + name + "', quorumVotes=" + quorumVotes + ", proposalThreshold=" +
                proposalThreshold + ", proposalMaxOperations=" + proposalMaxOperations + ", votingPeriod=" +
                votingPeriod + ", proposalLifetime=" + proposalLifetime + ", token=" + token + ", governor=" +
                governor + ", networkMagic=" + networkMagic + "}";
    }
}
