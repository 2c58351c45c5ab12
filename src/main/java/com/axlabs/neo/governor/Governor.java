package com.axlabs.neo.governor;

import io.neow3j.crypto.Hash;
import io.neow3j.crypto.Sign;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

import static com.axlabs.neo.governor.ErrorKind.ACTION_EXECUTION_FAILED;
import static com.axlabs.neo.governor.ErrorKind.ARITHMETIC_OVERFLOW;
import static com.axlabs.neo.governor.ErrorKind.ARITHMETIC_UNDERFLOW;
import static com.axlabs.neo.governor.ErrorKind.CONFLICTING_PROPOSAL;
import static com.axlabs.neo.governor.ErrorKind.DUPLICATE_VOTE;
import static com.axlabs.neo.governor.ErrorKind.INSUFFICIENT_WEIGHT;
import static com.axlabs.neo.governor.ErrorKind.INVALID_CONFIGURATION;
import static com.axlabs.neo.governor.ErrorKind.INVALID_PROPOSAL_ID;
import static com.axlabs.neo.governor.ErrorKind.INVALID_SIGNATURE;
import static com.axlabs.neo.governor.ErrorKind.INVALID_STATE;
import static com.axlabs.neo.governor.ErrorKind.MALFORMED_PROPOSAL;
import static com.axlabs.neo.governor.GovernorParameters.MAX_OPERATIONS_LIMIT;
import static com.axlabs.neo.governor.GovernorParameters.VOTING_DELAY;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The governing engine. Token holders whose votes exceed the proposal threshold create proposals made up of intents,
 * token holders vote on them with the weight they had when voting started, and proposals that reached quorum and a
 * majority are executed by anyone before they expire.
 * <p>
 * All mutating operations are serialized by a single write lock. Queries share a read lock and always see a
 * consistent state.
 */
public class Governor {

    private static final Logger log = LoggerFactory.getLogger(Governor.class);

    static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    static final int SELECTOR_LENGTH = 4;

    private final GovernorParameters params;
    private final VotingWeightOracle oracle;
    private final ActionExecutor executor;
    private final SignatureVerifier verifier;
    private final CheckpointClock clock;
    private final byte[] domainSeparator;

    // Index i holds the proposal with id i + 1.
    private final List<Proposal> proposals = new ArrayList<>();
    private final List<ProposalData> proposalData = new ArrayList<>();
    private final List<ProposalVotes> proposalVotes = new ArrayList<>();
    private final Map<Hash160, Integer> latestProposalIds = new HashMap<>();

    private final List<GovernorEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Creates a governor and checks its parameters against the token's total supply.
     *
     * @param params   The governance parameters.
     * @param oracle   The source of voting weights.
     * @param executor Performs the intents of succeeded proposals.
     * @param verifier Recovers the voters of signed ballots.
     * @param clock    The checkpoint clock.
     * @throws GovernorException with {@link ErrorKind#INVALID_CONFIGURATION} if a parameter is out of bounds.
     */
    public Governor(GovernorParameters params, VotingWeightOracle oracle, ActionExecutor executor,
            SignatureVerifier verifier, CheckpointClock clock) {
        if (params == null || oracle == null || executor == null || verifier == null || clock == null) {
            throw new GovernorException(INVALID_CONFIGURATION, "[Governor] Missing constructor argument");
        }
        throwOnInvalidParameters(params, oracle.getTotalSupply());
        this.params = params;
        this.oracle = oracle;
        this.executor = executor;
        this.verifier = verifier;
        this.clock = clock;
        this.domainSeparator = BallotTypedData.domainSeparator(params.getName(), params.getNetworkMagic(),
                params.getGovernor());
        log.info("Governor '{}' set up with {}", params.getName(), params);
    }

    /**
     * Creates a governor with the parameters found in the properties file read by {@link Config}.
     */
    public static Governor fromConfig(VotingWeightOracle oracle, ActionExecutor executor,
            SignatureVerifier verifier, CheckpointClock clock) {
        return new Governor(Config.getGovernorParameters(), oracle, executor, verifier, clock);
    }

    private static void throwOnInvalidParameters(GovernorParameters params, BigInteger totalSupply) {
        String error = null;
        if (params.getName() == null || params.getName().isEmpty()) {
            error = "Name must not be empty";
        } else if (params.getToken() == null || params.getGovernor() == null) {
            error = "Token and governor hash must be set";
        } else if (params.getQuorumVotes() == null || params.getQuorumVotes().signum() <= 0 ||
                params.getQuorumVotes().compareTo(totalSupply) >= 0) {
            error = "Quorum votes must be positive and below the total supply";
        } else if (params.getProposalThreshold() == null || params.getProposalThreshold().signum() <= 0 ||
                params.getProposalThreshold().compareTo(totalSupply) >= 0) {
            error = "Proposal threshold must be positive and below the total supply";
        } else if (params.getProposalMaxOperations() < 1 ||
                params.getProposalMaxOperations() > MAX_OPERATIONS_LIMIT) {
            error = "Max operations must be between 1 and " + MAX_OPERATIONS_LIMIT;
        } else if (params.getVotingPeriod() <= 0) {
            error = "Voting period must be positive";
        } else if (params.getProposalLifetime() <= params.getVotingPeriod()) {
            error = "Proposal lifetime must be longer than the voting period";
        } else if (params.getNetworkMagic() < 0) {
            error = "Network magic must not be negative";
        }
        if (error != null) {
            throw new GovernorException(INVALID_CONFIGURATION, "[Governor] " + error);
        }
    }

    //region QUERIES

    /**
     * Gets the state of the proposal with {@code id} at the current checkpoint.
     *
     * @param id The proposal id.
     * @return the proposal's state.
     * @throws GovernorException with {@link ErrorKind#INVALID_PROPOSAL_ID} if the proposal doesn't exist.
     */
    public ProposalState state(int id) {
        lock.readLock().lock();
        try {
            abortIfProposalDoesNotExist(id, "state");
            return computeState(id, clock.getCurrentCheckpoint());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets the intents of the proposal with {@code id}.
     *
     * @param id The proposal id.
     * @return the targets, signatures and payloads of the proposal.
     */
    public ProposalActions getActions(int id) {
        lock.readLock().lock();
        try {
            abortIfProposalDoesNotExist(id, "getActions");
            return new ProposalActions(proposalData.get(id - 1).intents);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets the receipt of {@code voter} for the proposal with {@code id}.
     *
     * @param id    The proposal id.
     * @param voter The voter.
     * @return the voter's receipt. If the voter hasn't voted, a receipt with {@code hasVoted} set to false.
     */
    public Receipt getReceipt(int id, Hash160 voter) {
        lock.readLock().lock();
        try {
            abortIfProposalDoesNotExist(id, "getReceipt");
            return proposalVotes.get(id - 1).receipts.getOrDefault(voter, Receipt.NONE);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets all information of the proposal with {@code id}.
     *
     * @param id The proposal's id.
     * @return the proposal.
     */
    public ProposalDTO getProposal(int id) {
        lock.readLock().lock();
        try {
            abortIfProposalDoesNotExist(id, "getProposal");
            return toDTO(id, clock.getCurrentCheckpoint());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets the proposals on the given page.
     *
     * @param page         The page, starting at 0.
     * @param itemsPerPage The number of proposals per page.
     * @return the chosen page, how many pages there are with the given page size and the found proposals on the
     * given page.
     */
    public Paginator.Paginated<ProposalDTO> getProposals(int page, int itemsPerPage) {
        lock.readLock().lock();
        try {
            int[] pagination = Paginator.calcPagination(proposals.size(), page, itemsPerPage);
            int now = clock.getCurrentCheckpoint();
            List<ProposalDTO> list = new ArrayList<>();
            for (int i = pagination[0]; i < pagination[1]; i++) {
                list.add(toDTO(i + 1, now));
            }
            return new Paginator.Paginated<>(page, pagination[2], list);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the number of proposals created on this governor.
     */
    public int getProposalCount() {
        lock.readLock().lock();
        try {
            return proposals.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the id of the most recent proposal of {@code proposer}, or 0 if the account never proposed.
     */
    public int getLatestProposalId(Hash160 proposer) {
        lock.readLock().lock();
        try {
            return latestProposalIds.getOrDefault(proposer, 0);
        } finally {
            lock.readLock().unlock();
        }
    }

    public GovernorParameters getParameters() {
        return params;
    }

    public int getVotingDelay() {
        return VOTING_DELAY;
    }

    /**
     * @return the domain separator voters have to use when signing ballots.
     */
    public byte[] getDomainSeparator() {
        return domainSeparator.clone();
    }

    public void addEventListener(GovernorEventListener listener) {
        listeners.add(listener);
    }

    public void removeEventListener(GovernorEventListener listener) {
        listeners.remove(listener);
    }

    //endregion QUERIES

    //region GOVERNANCE PROCESS METHODS

    /**
     * Creates a proposal from the given intents.
     *
     * @see #propose(Hash160, List, List, List, String)
     */
    public int propose(Hash160 proposer, List<Intent> intents, String description) {
        if (intents == null)
            fireErrorAndAbort(MALFORMED_PROPOSAL, "Missing proposal function information", "propose");
        List<Hash160> targets = new ArrayList<>();
        List<String> signatures = new ArrayList<>();
        List<byte[]> payloads = new ArrayList<>();
        for (Intent intent : intents) {
            targets.add(intent.getTarget());
            signatures.add(intent.getSignature());
            payloads.add(intent.getPayload());
        }
        return propose(proposer, targets, signatures, payloads, description);
    }

    /**
     * Creates a proposal. The lists hold one entry per intent.
     * <p>
     * The proposer's votes at the previous checkpoint have to exceed the proposal threshold, and the proposer must
     * not have another proposal that is pending or active.
     *
     * @param proposer    The account creating the proposal.
     * @param targets     The contracts to call.
     * @param signatures  The method signatures. An empty or null entry means the payload is passed as is.
     * @param payloads    The call payloads.
     * @param description The proposal description. It is only passed on to the event listeners.
     * @return the id of the new proposal.
     */
    public int propose(Hash160 proposer, List<Hash160> targets, List<String> signatures, List<byte[]> payloads,
            String description) {
        lock.writeLock().lock();
        try {
            if (proposer == null) fireErrorAndAbort(MALFORMED_PROPOSAL, "Missing proposer", "propose");
            if (targets == null || signatures == null || payloads == null)
                fireErrorAndAbort(MALFORMED_PROPOSAL, "Missing proposal function information", "propose");

            int now = clock.getCurrentCheckpoint();
            BigInteger proposerVotes = oracle.getPriorVotes(proposer, subtract(now, 1, "propose"));
            if (proposerVotes.compareTo(params.getProposalThreshold()) <= 0)
                fireErrorAndAbort(INSUFFICIENT_WEIGHT, "Proposer votes below proposal threshold", "propose");
            if (targets.size() != signatures.size() || targets.size() != payloads.size())
                fireErrorAndAbort(MALFORMED_PROPOSAL, "Proposal function information arity mismatch", "propose");
            if (targets.isEmpty()) fireErrorAndAbort(MALFORMED_PROPOSAL, "Must provide actions", "propose");
            if (targets.size() > params.getProposalMaxOperations())
                fireErrorAndAbort(MALFORMED_PROPOSAL, "Too many actions", "propose");

            List<Intent> intents = new ArrayList<>();
            for (int i = 0; i < targets.size(); i++) {
                Hash160 target = targets.get(i);
                if (target == null || target.equals(Hash160.ZERO))
                    fireErrorAndAbort(MALFORMED_PROPOSAL, "Invalid intent target at index " + i, "propose");
                intents.add(new Intent(target, signatures.get(i), payloads.get(i)));
            }

            Integer latestId = latestProposalIds.get(proposer);
            if (latestId != null) {
                ProposalState latestState = computeState(latestId, now);
                if (latestState == ProposalState.ACTIVE)
                    fireErrorAndAbort(CONFLICTING_PROPOSAL, "Found an already active proposal", "propose");
                if (latestState == ProposalState.PENDING)
                    fireErrorAndAbort(CONFLICTING_PROPOSAL, "Found an already pending proposal", "propose");
            }

            int startBlock = add(now, VOTING_DELAY, "propose");
            int endBlock = add(startBlock, params.getVotingPeriod(), "propose");
            int lifetimeEndBlock = add(startBlock, params.getProposalLifetime(), "propose");

            int id = proposals.size() + 1;
            proposals.add(new Proposal(id, startBlock, endBlock, lifetimeEndBlock));
            proposalData.add(new ProposalData(proposer, intents));
            proposalVotes.add(new ProposalVotes());
            latestProposalIds.put(proposer, id);

            log.info("Proposal {} created by {} with {} intent(s), voting from {} to {}", id, proposer.toAddress(),
                    intents.size(), startBlock, endBlock);
            List<Intent> stored = proposalData.get(id - 1).intents;
            notifyListeners(l -> l.proposalCreated(id, proposer, stored, startBlock, endBlock, lifetimeEndBlock,
                    description));
            return id;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Casts a vote of {@code voter} on the proposal with {@code id}. The vote's weight is the voter's votes at the
     * proposal's start checkpoint.
     *
     * @param voter   The voting account.
     * @param id      The id of the proposal to vote on.
     * @param support True to vote for the proposal, false to vote against it.
     */
    public void castVote(Hash160 voter, int id, boolean support) {
        lock.writeLock().lock();
        try {
            castVoteInternal(voter, id, support, "castVote");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Casts a vote on behalf of the account that signed the ballot. See {@link BallotTypedData} for how ballots are
     * signed.
     *
     * @param id        The id of the proposal to vote on.
     * @param support   True to vote for the proposal, false to vote against it.
     * @param signature The voter's signature of the ballot.
     * @return the voter recovered from the signature.
     */
    public Hash160 castVoteBySig(int id, boolean support, Sign.SignatureData signature) {
        lock.writeLock().lock();
        try {
            abortIfProposalDoesNotExist(id, "castVoteBySig");
            byte[] digest = BallotTypedData.digest(domainSeparator, id, support);
            Hash160 signatory = verifier.recoverSigner(digest, signature);
            if (signatory == null || signatory.equals(Hash160.ZERO))
                fireErrorAndAbort(INVALID_SIGNATURE, "Invalid signature", "castVoteBySig");
            castVoteInternal(signatory, id, support, "castVoteBySig");
            return signatory;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void castVoteInternal(Hash160 voter, int id, boolean support, String method) {
        abortIfProposalDoesNotExist(id, method);
        if (computeState(id, clock.getCurrentCheckpoint()) != ProposalState.ACTIVE)
            fireErrorAndAbort(INVALID_STATE, "Voting is closed", method);
        ProposalVotes pv = proposalVotes.get(id - 1);
        if (pv.receipts.containsKey(voter)) fireErrorAndAbort(DUPLICATE_VOTE, "Voter already voted", method);

        BigInteger votes = oracle.getPriorVotes(voter, proposals.get(id - 1).startBlock);
        if (support) {
            pv.forVotes = add256(pv.forVotes, votes, method);
        } else {
            pv.againstVotes = add256(pv.againstVotes, votes, method);
        }
        pv.receipts.put(voter, new Receipt(true, support, votes));

        log.debug("{} voted {} on proposal {} with {} votes", voter.toAddress(), support ? "for" : "against", id,
                votes);
        notifyListeners(l -> l.voteCast(voter, id, support, votes));
    }

    /**
     * Cancels the proposal with {@code id}. Anyone can cancel a proposal that wasn't executed, as long as the
     * proposer's votes at the previous checkpoint fell below the proposal threshold.
     *
     * @param id The proposal id.
     */
    public void cancel(int id) {
        lock.writeLock().lock();
        try {
            abortIfProposalDoesNotExist(id, "cancel");
            int now = clock.getCurrentCheckpoint();
            ProposalState state = computeState(id, now);
            if (state == ProposalState.EXECUTED)
                fireErrorAndAbort(INVALID_STATE, "Cannot cancel executed proposal", "cancel");
            if (state == ProposalState.CANCELED)
                fireErrorAndAbort(INVALID_STATE, "Proposal already canceled", "cancel");
            Hash160 proposer = proposalData.get(id - 1).proposer;
            BigInteger proposerVotes = oracle.getPriorVotes(proposer, subtract(now, 1, "cancel"));
            if (proposerVotes.compareTo(params.getProposalThreshold()) >= 0)
                fireErrorAndAbort(INSUFFICIENT_WEIGHT, "Proposer above threshold", "cancel");

            proposals.get(id - 1).canceled = true;
            log.info("Proposal {} canceled", id);
            notifyListeners(l -> l.proposalCanceled(id));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Executes the proposal with {@code id}.
     *
     * @see #execute(int, BigInteger)
     */
    public List<byte[]> execute(int id) {
        return execute(id, BigInteger.ZERO);
    }

    /**
     * Executes the proposal with the given {@code id}. Anyone can execute a succeeded proposal.
     * <p>
     * The proposal is marked as executed before its intents are invoked in order. If an intent fails, execution stops
     * and the proposal stays executed. The intents invoked before the failing one are not reverted, and the proposal
     * cannot be executed again. This differs from an on-chain governor, where the whole transaction reverts and the
     * proposal stays succeeded.
     *
     * @param id    The proposal id.
     * @param value The value attached to the execution. Each intent is invoked with a value of zero.
     * @return the values returned by the proposal's intents.
     */
    public List<byte[]> execute(int id, BigInteger value) {
        lock.writeLock().lock();
        try {
            abortIfProposalDoesNotExist(id, "execute");
            if (computeState(id, clock.getCurrentCheckpoint()) != ProposalState.SUCCEEDED)
                fireErrorAndAbort(INVALID_STATE, "Proposal can only be executed if it is succeeded", "execute");
            if (value != null && value.signum() != 0) {
                log.debug("Ignoring value {} attached to the execution of proposal {}", value, id);
            }

            proposals.get(id - 1).executed = true;
            List<Intent> intents = proposalData.get(id - 1).intents;
            List<byte[]> returnVals = new ArrayList<>();
            for (int i = 0; i < intents.size(); i++) {
                Intent t = intents.get(i);
                try {
                    returnVals.add(executor.invoke(t.getTarget(), buildCallData(t), BigInteger.ZERO));
                } catch (InvocationException e) {
                    log.warn("Intent {} of proposal {} failed: {}", i, id, e.getMessage());
                    fireErrorAndAbort(ACTION_EXECUTION_FAILED, "Transaction execution reverted at intent " + i,
                            "execute", i, e);
                }
            }

            log.info("Proposal {} executed", id);
            notifyListeners(l -> l.proposalExecuted(id));
            return returnVals;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // endregion GOVERNANCE PROCESS METHODS

    /**
     * Builds the call data of an intent: the selector of its signature followed by the payload, or only the payload
     * if the intent has no signature.
     */
    static byte[] buildCallData(Intent intent) {
        byte[] payload = intent.getPayload();
        if (!intent.hasSignature()) {
            return payload;
        }
        return ByteBuffer.allocate(SELECTOR_LENGTH + payload.length)
                .put(selector(intent.getSignature()))
                .put(payload)
                .array();
    }

    /**
     * @return the first four bytes of the SHA-256 hash of the method signature.
     */
    static byte[] selector(String signature) {
        byte[] hash = Hash.sha256(signature.getBytes(UTF_8));
        byte[] selector = new byte[SELECTOR_LENGTH];
        System.arraycopy(hash, 0, selector, 0, SELECTOR_LENGTH);
        return selector;
    }

    // Must be called with the lock held and an existing id.
    private ProposalState computeState(int id, int now) {
        Proposal p = proposals.get(id - 1);
        ProposalVotes v = proposalVotes.get(id - 1);
        BigInteger quorum = params.getQuorumVotes();
        if (p.canceled) {
            return ProposalState.CANCELED;
        } else if (now <= p.startBlock) {
            return ProposalState.PENDING;
        } else if (now <= p.endBlock) {
            return ProposalState.ACTIVE;
        } else if (v.forVotes.compareTo(v.againstVotes) <= 0 || v.forVotes.compareTo(quorum) < 0) {
            return ProposalState.DEFEATED;
        } else if (p.executed) {
            return ProposalState.EXECUTED;
        } else if (now >= p.lifetimeEndBlock) {
            return ProposalState.EXPIRED;
        } else if (v.forVotes.compareTo(v.againstVotes) > 0 && v.forVotes.compareTo(quorum) >= 0) {
            return ProposalState.SUCCEEDED;
        }
        return ProposalState.NULL;
    }

    private ProposalDTO toDTO(int id, int now) {
        return new ProposalDTO(proposals.get(id - 1), proposalData.get(id - 1), proposalVotes.get(id - 1),
                computeState(id, now));
    }

    private void abortIfProposalDoesNotExist(int id, String method) {
        if (id <= 0 || id > proposals.size()) {
            fireErrorAndAbort(INVALID_PROPOSAL_ID, "Proposal doesn't exist", method);
        }
    }

    private BigInteger add256(BigInteger a, BigInteger b, String method) {
        BigInteger c = a.add(b);
        if (b.signum() < 0 || c.compareTo(UINT256_MAX) > 0) {
            fireErrorAndAbort(ARITHMETIC_OVERFLOW, "Addition overflow", method);
        }
        return c;
    }

    private int add(int a, int b, String method) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            fireErrorAndAbort(ARITHMETIC_OVERFLOW, "Checkpoint overflow", method, -1, e);
            return -1;
        }
    }

    private int subtract(int a, int b, String method) {
        if (b > a) fireErrorAndAbort(ARITHMETIC_UNDERFLOW, "Checkpoint underflow", method);
        return a - b;
    }

    // A failing listener must not undo or mask the outcome of the operation that notified it.
    private void notifyListeners(Consumer<GovernorEventListener> event) {
        for (GovernorEventListener l : listeners) {
            try {
                event.accept(l);
            } catch (RuntimeException e) {
                log.warn("Event listener {} failed", l, e);
            }
        }
    }

    private void fireErrorAndAbort(ErrorKind kind, String msg, String method) {
        fireErrorAndAbort(kind, msg, method, -1, null);
    }

    private void fireErrorAndAbort(ErrorKind kind, String msg, String method, int intentIndex, Throwable cause) {
        log.debug("{} aborted: {}", method, msg);
        notifyListeners(l -> l.error(msg, method));
        throw new GovernorException(kind, "[Governor." + method + "] " + msg, intentIndex, cause);
    }

}
