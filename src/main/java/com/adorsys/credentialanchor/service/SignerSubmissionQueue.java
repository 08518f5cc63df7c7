package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.exception.CredentialAnchorException;
import com.adorsys.credentialanchor.exception.SubmissionException;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lets one load-account/submit cycle per signer run at a time within this process, so two
 * requests never build transactions for the same sequence number. When disabled, work runs
 * directly and concurrent writers surface as {@code tx_bad_seq} rejections.
 */
public class SignerSubmissionQueue {

    private static final Logger logger = Logger.getLogger(SignerSubmissionQueue.class);

    /**
     * Ledger work executed while holding the signer's slot.
     */
    @FunctionalInterface
    public interface LedgerWork<T> {
        T run() throws CredentialAnchorException;
    }

    private final boolean enabled;
    private final long waitTimeoutMillis;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * @param enabled     whether submissions are serialized
     * @param waitTimeout how long a caller waits for the signer's slot before giving up
     */
    public SignerSubmissionQueue(boolean enabled, Duration waitTimeout) {
        this.enabled = enabled;
        this.waitTimeoutMillis = waitTimeout.toMillis();
    }

    public <T> T execute(String signerAccountId, LedgerWork<T> work) throws CredentialAnchorException {
        if (!enabled) {
            return work.run();
        }

        ReentrantLock lock = locks.computeIfAbsent(signerAccountId, id -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SubmissionException("Interrupted while waiting to submit for signer " + signerAccountId, e);
        }
        if (!acquired) {
            logger.warnf("Signer %s busy for more than %d ms, %d request(s) waiting",
                    signerAccountId, waitTimeoutMillis, lock.getQueueLength());
            throw new SubmissionException("Timed out waiting to submit for signer " + signerAccountId, 0);
        }

        try {
            logger.debugf("Acquired submission slot for signer %s", signerAccountId);
            return work.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }
}
