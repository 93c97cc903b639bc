package com.flagship.flight_surety.oracle;

import com.flagship.flight_surety.common.AccountId;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * Derives indexes from SHA-256 over rolling entropy, a monotonically advancing nonce
 * and the account identity.
 *
 * The entropy is seeded from {@link SecureRandom} and replaced by each digest, so every
 * index depends on all draws before it.
 */
@Component
public class NonceIndexSource implements IndexSource {

    private final byte[] entropy = new byte[32];
    private long nonce;

    public NonceIndexSource() {
        this(new SecureRandom());
    }

    NonceIndexSource(SecureRandom seed) {
        seed.nextBytes(entropy);
    }

    @Override
    public synchronized int nextIndex(AccountId account, int range) {
        if (range <= 0) {
            throw new IllegalArgumentException("Index range must be positive");
        }
        MessageDigest digest = sha256();
        digest.update(entropy);
        digest.update(ByteBuffer.allocate(Long.BYTES * 2).putLong(nonce++).putLong(System.nanoTime()).array());
        digest.update(account.getValue().getBytes(StandardCharsets.UTF_8));
        byte[] hash = digest.digest();
        System.arraycopy(hash, 0, entropy, 0, entropy.length);
        return (int) Long.remainderUnsigned(ByteBuffer.wrap(hash).getLong(), range);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
