package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The intents of a proposal split into the three parallel lists they were proposed with.
 */
public class ProposalActions {

    private final List<Hash160> targets;
    private final List<String> signatures;
    private final List<byte[]> payloads;

    ProposalActions(List<Intent> intents) {
        List<Hash160> targets = new ArrayList<>();
        List<String> signatures = new ArrayList<>();
        List<byte[]> payloads = new ArrayList<>();
        for (Intent intent : intents) {
            targets.add(intent.getTarget());
            signatures.add(intent.getSignature());
            payloads.add(intent.getPayload());
        }
        this.targets = Collections.unmodifiableList(targets);
        this.signatures = Collections.unmodifiableList(signatures);
        this.payloads = Collections.unmodifiableList(payloads);
    }

    public List<Hash160> getTargets() {
        return targets;
    }

    public List<String> getSignatures() {
        return signatures;
    }

    public List<byte[]> getPayloads() {
        return payloads;
    }
}
