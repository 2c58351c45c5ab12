package com.axlabs.neo.governor;

import io.neow3j.crypto.ECKeyPair;
import io.neow3j.crypto.Hash;
import io.neow3j.crypto.Sign;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Builds the digests signed by voters that cast their vote via {@link Governor#castVoteBySig(int, boolean,
 * Sign.SignatureData)}.
 * <p>
 * The layout follows the typed structured-data scheme: a domain separator over the governor's name, the network
 * magic and the governor's script hash, and a ballot struct over the proposal id and the support flag. Every
 * encoded item is a 32 byte big-endian word. All hashes are SHA-256.
 */
public class BallotTypedData {

    static final byte[] DOMAIN_TYPEHASH =
            Hash.sha256("EIP712Domain(string name,uint256 chainId,address verifyingContract)".getBytes(UTF_8));

    static final byte[] BALLOT_TYPEHASH = Hash.sha256("Ballot(uint256 proposalId,bool support)".getBytes(UTF_8));

    private static final int WORD_SIZE = 32;

    public static byte[] domainSeparator(String name, long networkMagic, Hash160 governor) {
        return Hash.sha256(concat(
                DOMAIN_TYPEHASH,
                Hash.sha256(name.getBytes(UTF_8)),
                word(BigInteger.valueOf(networkMagic)),
                word(governor.toArray())));
    }

    public static byte[] structHash(int proposalId, boolean support) {
        return Hash.sha256(concat(
                BALLOT_TYPEHASH,
                word(BigInteger.valueOf(proposalId)),
                word(support ? BigInteger.ONE : BigInteger.ZERO)));
    }

    /**
     * @return the digest a voter signs to vote on {@code proposalId} with the given {@code support}.
     */
    public static byte[] digest(byte[] domainSeparator, int proposalId, boolean support) {
        return Hash.sha256(concat(new byte[]{0x19, 0x01}, domainSeparator, structHash(proposalId, support)));
    }

    /**
     * Signs a ballot with the voter's key pair.
     *
     * @param keyPair         The voter's key pair.
     * @param domainSeparator The domain separator of the governor, see {@link Governor#getDomainSeparator()}.
     * @param proposalId      The proposal to vote on.
     * @param support         The vote.
     * @return the signature to pass to {@link Governor#castVoteBySig(int, boolean, Sign.SignatureData)}.
     */
    public static Sign.SignatureData signBallot(ECKeyPair keyPair, byte[] domainSeparator, int proposalId,
            boolean support) {
        return Sign.signMessage(digest(domainSeparator, proposalId, support), keyPair);
    }

    static byte[] word(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > WORD_SIZE * 8) {
            throw new IllegalArgumentException("Value doesn't fit into a word: " + value);
        }
        return word(value.toByteArray());
    }

    // Left-pads to a word. A leading sign byte produced by BigInteger is dropped.
    static byte[] word(byte[] bytes) {
        int start = bytes.length > WORD_SIZE ? bytes.length - WORD_SIZE : 0;
        int length = bytes.length - start;
        byte[] word = new byte[WORD_SIZE];
        System.arraycopy(bytes, start, word, WORD_SIZE - length, length);
        return word;
    }

    private static byte[] concat(byte[]... parts) {
        int size = 0;
        for (byte[] part : parts) {
            size += part.length;
        }
        ByteBuffer buffer = ByteBuffer.allocate(size);
        for (byte[] part : parts) {
            buffer.put(part);
        }
        return buffer.array();
    }
}
