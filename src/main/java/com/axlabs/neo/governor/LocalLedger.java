package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An in-process ledger that provides voting weights and checkpoints to a {@link Governor}.
 * <p>
 * The ledger keeps a block height that only moves forward via {@link #mineBlocks(int)}. Every change of an account's
 * votes is recorded as a checkpoint at the current height, so that the votes an account had at any past height can
 * be looked up.
 */
public class LocalLedger implements VotingWeightOracle, CheckpointClock {

    private static final Logger log = LoggerFactory.getLogger(LocalLedger.class);

    private final BigInteger totalSupply;
    private final Map<Hash160, List<Checkpoint>> checkpoints = new HashMap<>();
    private int height;

    public LocalLedger(BigInteger totalSupply) {
        this(totalSupply, 1);
    }

    public LocalLedger(BigInteger totalSupply, int startHeight) {
        if (totalSupply.signum() <= 0) throw new IllegalArgumentException("Total supply must be positive");
        if (startHeight < 0) throw new IllegalArgumentException("Start height must not be negative");
        this.totalSupply = totalSupply;
        this.height = startHeight;
    }

    @Override
    public synchronized int getCurrentCheckpoint() {
        return height;
    }

    /**
     * Advances the block height.
     *
     * @param blocks The number of blocks to advance by.
     * @return the new height.
     */
    public synchronized int mineBlocks(int blocks) {
        if (blocks < 0) throw new IllegalArgumentException("Cannot mine a negative number of blocks");
        height = Math.addExact(height, blocks);
        return height;
    }

    @Override
    public BigInteger getTotalSupply() {
        return totalSupply;
    }

    /**
     * Sets the votes of {@code account} as of the current height.
     */
    public synchronized void setVotes(Hash160 account, BigInteger votes) {
        if (votes.signum() < 0) throw new IllegalArgumentException("Votes must not be negative");
        if (votes.compareTo(totalSupply) > 0) throw new IllegalArgumentException("Votes exceed the total supply");
        List<Checkpoint> list = checkpoints.computeIfAbsent(account, k -> new ArrayList<>());
        if (!list.isEmpty() && list.get(list.size() - 1).fromBlock == height) {
            list.set(list.size() - 1, new Checkpoint(height, votes));
        } else {
            list.add(new Checkpoint(height, votes));
        }
        log.debug("Votes of {} set to {} at height {}", account.toAddress(), votes, height);
    }

    /**
     * @return the votes of {@code account} as of the current height.
     */
    public synchronized BigInteger getCurrentVotes(Hash160 account) {
        List<Checkpoint> list = checkpoints.get(account);
        if (list == null || list.isEmpty()) {
            return BigInteger.ZERO;
        }
        return list.get(list.size() - 1).votes;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if the checkpoint is not in the past, i.e., the votes are not yet determined.
     */
    @Override
    public synchronized BigInteger getPriorVotes(Hash160 account, int checkpoint) {
        if (checkpoint >= height) {
            throw new IllegalArgumentException("[LocalLedger.getPriorVotes] Votes at " + checkpoint +
                    " not yet determined");
        }
        List<Checkpoint> list = checkpoints.get(account);
        if (list == null || list.isEmpty() || list.get(0).fromBlock > checkpoint) {
            return BigInteger.ZERO;
        }
        int lower = 0;
        int upper = list.size() - 1;
        while (upper > lower) {
            int center = upper - (upper - lower) / 2;
            Checkpoint cp = list.get(center);
            if (cp.fromBlock == checkpoint) {
                return cp.votes;
            } else if (cp.fromBlock < checkpoint) {
                lower = center;
            } else {
                upper = center - 1;
            }
        }
        return list.get(lower).votes;
    }

    private static class Checkpoint {
        final int fromBlock;
        final BigInteger votes;

        Checkpoint(int fromBlock, BigInteger votes) {
            this.fromBlock = fromBlock;
            this.votes = votes;
        }
    }
}
