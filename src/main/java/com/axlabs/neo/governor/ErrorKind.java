package com.axlabs.neo.governor;

/**
 * The kinds of failures a {@link Governor} operation can abort with.
 */
public enum ErrorKind {

    INVALID_CONFIGURATION,
    INSUFFICIENT_WEIGHT,
    MALFORMED_PROPOSAL,
    CONFLICTING_PROPOSAL,
    INVALID_PROPOSAL_ID,
    INVALID_STATE,
    DUPLICATE_VOTE,
    INVALID_SIGNATURE,
    ARITHMETIC_OVERFLOW,
    ARITHMETIC_UNDERFLOW,
    ACTION_EXECUTION_FAILED

}
