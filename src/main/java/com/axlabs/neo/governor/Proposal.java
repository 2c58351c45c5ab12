package com.axlabs.neo.governor;

/**
 * The lifecycle part of a proposal, i.e., its checkpoints and the flags changed by cancellation and execution.
 * <p>
 * Information that doesn't change after creation lives in {@link ProposalData}, the tallies in
 * {@link ProposalVotes}.
 */
class Proposal {

    /**
     * The proposal's ID. IDs are assigned incrementally, starting at 1.
     */
    final int id;

    /**
     * The checkpoint after which voting starts.
     */
    final int startBlock;

    /**
     * The last checkpoint at which votes are accepted.
     */
    final int endBlock;

    /**
     * The checkpoint at which a succeeded but unexecuted proposal expires.
     */
    final int lifetimeEndBlock;

    boolean canceled;

    boolean executed;

    Proposal(int id, int startBlock, int endBlock, int lifetimeEndBlock) {
        this.id = id;
        this.startBlock = startBlock;
        this.endBlock = endBlock;
        this.lifetimeEndBlock = lifetimeEndBlock;
        canceled = false;
        executed = false;
    }
}
