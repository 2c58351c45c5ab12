package com.axlabs.neo.governor;

/**
 * The states a proposal can be in. A proposal's state is never stored but derived from its data and the current
 * checkpoint, see {@link Governor#state(int)}.
 */
public enum ProposalState {

    PENDING,
    ACTIVE,
    CANCELED,
    DEFEATED,
    SUCCEEDED,
    EXPIRED,
    EXECUTED,
    NULL

}
