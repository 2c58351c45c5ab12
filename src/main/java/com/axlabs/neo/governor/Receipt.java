package com.axlabs.neo.governor;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The record of a voter's ballot on a proposal.
 */
public class Receipt {

    static final Receipt NONE = new Receipt(false, false, BigInteger.ZERO);

    private final boolean hasVoted;
    private final boolean support;
    private final BigInteger votes;

    public Receipt(boolean hasVoted, boolean support, BigInteger votes) {
        this.hasVoted = hasVoted;
        this.support = support;
        this.votes = votes;
    }

    public boolean hasVoted() {
        return hasVoted;
    }

    /**
     * @return true if the voter supports the proposal, false if the voter opposes it or hasn't voted.
     */
    public boolean getSupport() {
        return support;
    }

    /**
     * @return the voting weight the voter had at the proposal's start checkpoint.
     */
    public BigInteger getVotes() {
        return votes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Receipt)) return false;
        Receipt receipt = (Receipt) o;
        return hasVoted == receipt.hasVoted && support == receipt.support && votes.equals(receipt.votes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hasVoted, support, votes);
    }

    @Override
    public String toString() {
        return "Receipt{hasVoted=" + hasVoted + ", support=" + support + ", votes=" + votes + "}";
    }
}
