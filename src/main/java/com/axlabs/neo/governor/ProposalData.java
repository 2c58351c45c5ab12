package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;

import java.util.Collections;
import java.util.List;

/**
 * Proposal information that is set at the time of creation of a proposal and doesn't change after that.
 */
class ProposalData {

    /**
     * The creator of the proposal.
     */
    final Hash160 proposer;

    /**
     * The proposal's intents, executed in order if the proposal succeeds.
     */
    final List<Intent> intents;

    ProposalData(Hash160 proposer, List<Intent> intents) {
        this.proposer = proposer;
        this.intents = Collections.unmodifiableList(intents);
    }
}
