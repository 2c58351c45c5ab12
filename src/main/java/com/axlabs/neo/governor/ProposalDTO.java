package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.List;

/**
 * Used to return all proposal information as one structure in getter methods.
 */
public class ProposalDTO {

    private final int id;
    private final Hash160 proposer;
    private final List<Intent> intents;
    private final int startBlock;
    private final int endBlock;
    private final int lifetimeEndBlock;
    private final BigInteger forVotes;
    private final BigInteger againstVotes;
    private final boolean canceled;
    private final boolean executed;
    private final ProposalState state;

    ProposalDTO(Proposal proposal, ProposalData data, ProposalVotes votes, ProposalState state) {
        id = proposal.id;
        proposer = data.proposer;
        intents = data.intents;
        startBlock = proposal.startBlock;
        endBlock = proposal.endBlock;
        lifetimeEndBlock = proposal.lifetimeEndBlock;
        forVotes = votes.forVotes;
        againstVotes = votes.againstVotes;
        canceled = proposal.canceled;
        executed = proposal.executed;
        this.state = state;
    }

    public int getId() {
        return id;
    }

    public Hash160 getProposer() {
        return proposer;
    }

    public List<Intent> getIntents() {
        return intents;
    }

    public int getStartBlock() {
        return startBlock;
    }

    public int getEndBlock() {
        return endBlock;
    }

    public int getLifetimeEndBlock() {
        return lifetimeEndBlock;
    }

    public BigInteger getForVotes() {
        return forVotes;
    }

    public BigInteger getAgainstVotes() {
        return againstVotes;
    }

    public boolean isCanceled() {
        return canceled;
    }

    public boolean isExecuted() {
        return executed;
    }

    /**
     * @return the state of the proposal at the checkpoint this view was taken.
     */
    public ProposalState getState() {
        return state;
    }
}
