package com.axlabs.neo.governor;

import io.neow3j.crypto.Hash;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static com.axlabs.neo.governor.util.TestHelper.GOVERNOR_HASH;
import static com.axlabs.neo.governor.util.TestHelper.NETWORK_MAGIC;
import static com.axlabs.neo.governor.util.TestHelper.TARGET_A;
import static io.neow3j.utils.Numeric.hexStringToByteArray;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BallotTypedDataTest {

    @Test
    public void testTypeHashes() {
        assertThat(BallotTypedData.DOMAIN_TYPEHASH, is(Hash.sha256(
                "EIP712Domain(string name,uint256 chainId,address verifyingContract)".getBytes(UTF_8))));
        assertThat(BallotTypedData.BALLOT_TYPEHASH,
                is(Hash.sha256("Ballot(uint256 proposalId,bool support)".getBytes(UTF_8))));
    }

    @Test
    public void testDomainSeparatorDependsOnEveryField() {
        byte[] domain = BallotTypedData.domainSeparator("Test Governor", NETWORK_MAGIC, GOVERNOR_HASH);
        assertThat(domain.length, is(32));
        assertThat(BallotTypedData.domainSeparator("Test Governor", NETWORK_MAGIC, GOVERNOR_HASH), is(domain));
        assertThat(BallotTypedData.domainSeparator("Other Governor", NETWORK_MAGIC, GOVERNOR_HASH), is(not(domain)));
        assertThat(BallotTypedData.domainSeparator("Test Governor", 860833102, GOVERNOR_HASH), is(not(domain)));
        assertThat(BallotTypedData.domainSeparator("Test Governor", NETWORK_MAGIC, TARGET_A), is(not(domain)));
    }

    @Test
    public void testDomainSeparatorLayout() {
        byte[] expected = new byte[128];
        System.arraycopy(BallotTypedData.DOMAIN_TYPEHASH, 0, expected, 0, 32);
        System.arraycopy(Hash.sha256("Test Governor".getBytes(UTF_8)), 0, expected, 32, 32);
        byte[] magic = hexStringToByteArray("4f454e"); // 5195086
        System.arraycopy(magic, 0, expected, 96 - magic.length, magic.length);
        byte[] governor = GOVERNOR_HASH.toArray();
        System.arraycopy(governor, 0, expected, 128 - governor.length, governor.length);

        assertThat(BallotTypedData.domainSeparator("Test Governor", NETWORK_MAGIC, GOVERNOR_HASH),
                is(Hash.sha256(expected)));
    }

    @Test
    public void testDigest() {
        byte[] domain = BallotTypedData.domainSeparator("Test Governor", NETWORK_MAGIC, GOVERNOR_HASH);
        byte[] structHash = BallotTypedData.structHash(7, true);

        byte[] expected = new byte[66];
        expected[0] = 0x19;
        expected[1] = 0x01;
        System.arraycopy(domain, 0, expected, 2, 32);
        System.arraycopy(structHash, 0, expected, 34, 32);
        assertThat(BallotTypedData.digest(domain, 7, true), is(Hash.sha256(expected)));

        assertThat(BallotTypedData.digest(domain, 7, false), is(not(BallotTypedData.digest(domain, 7, true))));
        assertThat(BallotTypedData.digest(domain, 8, true), is(not(BallotTypedData.digest(domain, 7, true))));
    }

    @Test
    public void testWordPadding() {
        byte[] one = BallotTypedData.word(BigInteger.ONE);
        assertThat(one.length, is(32));
        assertThat(one[31], is((byte) 1));
        assertThat(Arrays.copyOf(one, 31), is(new byte[31]));

        // BigInteger adds a sign byte for values with the highest bit set.
        byte[] max = BallotTypedData.word(Governor.UINT256_MAX);
        byte[] ff = new byte[32];
        Arrays.fill(ff, (byte) 0xff);
        assertThat(max, is(ff));

        assertThrows(IllegalArgumentException.class,
                () -> BallotTypedData.word(Governor.UINT256_MAX.add(BigInteger.ONE)));
        assertThrows(IllegalArgumentException.class, () -> BallotTypedData.word(BigInteger.ONE.negate()));
    }
}
