package com.axlabs.neo.governor;

import com.axlabs.neo.governor.util.EventRecorder;
import com.axlabs.neo.governor.util.RecordingActionExecutor;
import io.neow3j.crypto.ECKeyPair;
import io.neow3j.crypto.Sign;
import io.neow3j.types.Hash160;
import io.neow3j.wallet.Account;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.axlabs.neo.governor.util.EventRecorder.VOTE_CAST;
import static com.axlabs.neo.governor.util.TestHelper.ALICE;
import static com.axlabs.neo.governor.util.TestHelper.ALICE_WIF;
import static com.axlabs.neo.governor.util.TestHelper.BOB_WIF;
import static com.axlabs.neo.governor.util.TestHelper.GOVERNOR_HASH;
import static com.axlabs.neo.governor.util.TestHelper.NETWORK_MAGIC;
import static com.axlabs.neo.governor.util.TestHelper.TOTAL_SUPPLY;
import static com.axlabs.neo.governor.util.TestHelper.TARGET_A;
import static com.axlabs.neo.governor.util.TestHelper.createSimpleProposal;
import static com.axlabs.neo.governor.util.TestHelper.defaultParameters;
import static com.axlabs.neo.governor.util.TestHelper.skipToVoting;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CastVoteBySigTest {

    private LocalLedger ledger;
    private EventRecorder events;
    private Governor gov;
    private ECKeyPair voterKeys;
    private Hash160 voter;
    private int id;

    @BeforeEach
    public void setUp() {
        ledger = new LocalLedger(TOTAL_SUPPLY);
        events = new EventRecorder();
        gov = new Governor(defaultParameters(), ledger, new RecordingActionExecutor(), new ECDsaSignatureVerifier(),
                ledger);
        gov.addEventListener(events);

        voterKeys = Account.fromWIF(BOB_WIF).getECKeyPair();
        voter = Hash160.fromPublicKey(voterKeys.getPublicKey().getEncoded(true));
        ledger.setVotes(ALICE, BigInteger.valueOf(50));
        ledger.setVotes(voter, BigInteger.valueOf(150));
        ledger.mineBlocks(1);
        id = createSimpleProposal(gov, ledger, ALICE, "vote_by_sig");
        skipToVoting(ledger);
    }

    @Test
    public void succeed_voting_with_signed_ballot() {
        Sign.SignatureData sig = BallotTypedData.signBallot(voterKeys, gov.getDomainSeparator(), id, true);

        Hash160 signatory = gov.castVoteBySig(id, true, sig);

        assertThat(signatory, is(voter));
        assertThat(gov.getReceipt(id, voter), is(new Receipt(true, true, BigInteger.valueOf(150))));
        assertThat(gov.getProposal(id).getForVotes(), is(BigInteger.valueOf(150)));
        assertThat(events.getEvents(VOTE_CAST), hasSize(1));
        assertThat(events.last().get(0), is(voter));
    }

    @Test
    public void fail_replaying_signed_ballot() {
        Sign.SignatureData sig = BallotTypedData.signBallot(voterKeys, gov.getDomainSeparator(), id, false);
        gov.castVoteBySig(id, false, sig);

        GovernorException e = assertThrows(GovernorException.class, () -> gov.castVoteBySig(id, false, sig));
        assertThat(e.getKind(), is(ErrorKind.DUPLICATE_VOTE));
        assertThat(gov.getProposal(id).getAgainstVotes(), is(BigInteger.valueOf(150)));
    }

    @Test
    public void fail_voting_directly_after_signed_ballot() {
        Sign.SignatureData sig = BallotTypedData.signBallot(voterKeys, gov.getDomainSeparator(), id, true);
        gov.castVoteBySig(id, true, sig);

        GovernorException e = assertThrows(GovernorException.class, () -> gov.castVote(voter, id, false));
        assertThat(e.getKind(), is(ErrorKind.DUPLICATE_VOTE));
    }

    @Test
    public void succeed_attributing_tampered_ballot_to_other_account() {
        // Flipping the support flag changes the digest, so the signature recovers to an unrelated account.
        Sign.SignatureData sig = BallotTypedData.signBallot(voterKeys, gov.getDomainSeparator(), id, true);

        Hash160 signatory = gov.castVoteBySig(id, false, sig);

        assertThat(signatory, is(not(voter)));
        assertThat(gov.getReceipt(id, voter).hasVoted(), is(false));
        assertThat(gov.getReceipt(id, signatory).getVotes(), is(BigInteger.ZERO));
    }

    @Test
    public void succeed_binding_ballot_to_governor_domain() {
        byte[] otherDomain = BallotTypedData.domainSeparator("Test Governor", NETWORK_MAGIC, TARGET_A);
        Sign.SignatureData sig = BallotTypedData.signBallot(voterKeys, otherDomain, id, true);

        Hash160 signatory = gov.castVoteBySig(id, true, sig);

        assertThat(signatory, is(not(voter)));
        assertThat(gov.getProposal(id).getForVotes(), is(BigInteger.ZERO));
    }

    @Test
    public void fail_voting_with_malformed_signature() {
        Sign.SignatureData sig = BallotTypedData.signBallot(voterKeys, gov.getDomainSeparator(), id, true);
        Sign.SignatureData broken = new Sign.SignatureData((byte) 0, sig.getR(), sig.getS());

        GovernorException e = assertThrows(GovernorException.class, () -> gov.castVoteBySig(id, true, broken));
        assertThat(e.getKind(), is(ErrorKind.INVALID_SIGNATURE));
        assertThat(e.getMessage(), endsWith("Invalid signature"));
        assertThat(gov.getProposal(id).getForVotes(), is(BigInteger.ZERO));
    }

    @Test
    public void fail_voting_by_sig_on_non_existent_proposal() {
        Sign.SignatureData sig = BallotTypedData.signBallot(voterKeys, gov.getDomainSeparator(), id, true);

        for (int invalidId : new int[]{-1, 0, id + 1}) {
            GovernorException e = assertThrows(GovernorException.class,
                    () -> gov.castVoteBySig(invalidId, true, sig));
            assertThat(e.getKind(), is(ErrorKind.INVALID_PROPOSAL_ID));
            assertThat(e.getMessage(), endsWith("Proposal doesn't exist"));
            assertThat(events.last().name, is(EventRecorder.ERROR));
            assertThat(events.last().get(1), is("castVoteBySig"));
        }
        assertThat(gov.getReceipt(id, voter).hasVoted(), is(false));
    }

    @Test
    public void fail_voting_without_signature() {
        GovernorException e = assertThrows(GovernorException.class, () -> gov.castVoteBySig(id, true, null));
        assertThat(e.getKind(), is(ErrorKind.INVALID_SIGNATURE));
    }

    @Test
    public void succeed_recovering_signer_of_other_key() {
        ECKeyPair aliceKeys = Account.fromWIF(ALICE_WIF).getECKeyPair();
        byte[] digest = BallotTypedData.digest(gov.getDomainSeparator(), id, true);
        Sign.SignatureData sig = Sign.signMessage(digest, aliceKeys);

        Hash160 recovered = new ECDsaSignatureVerifier().recoverSigner(digest, sig);

        assertThat(recovered, is(Hash160.fromPublicKey(aliceKeys.getPublicKey().getEncoded(true))));
        assertThat(recovered, is(not(GOVERNOR_HASH)));
    }
}
