package com.axlabs.neo.governor;

/**
 * The monotonic clock the governor measures proposal phases with, e.g., the block height of the underlying chain.
 */
public interface CheckpointClock {

    int getCurrentCheckpoint();

}
