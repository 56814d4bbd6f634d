package org.littleshoot.authority.impl;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;

import org.littleshoot.authority.FakeCertificateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;

/**
 * Host to leaf certificate cache. Entries never expire on their own; they go
 * away only when the root changes or the cache is cleared.
 * 
 * Concurrent misses for the same host wait for a single issuance and share
 * its result. Misses for different hosts are issued in parallel.
 */
public class CertificateCache {

    private static final Logger LOG = LoggerFactory
            .getLogger(CertificateCache.class);

    private final LeafCertificateIssuer issuer;

    private final Cache<String, IssuedCertificate> certificates = CacheBuilder
            .newBuilder()
            .concurrencyLevel(16)
            .build();

    public CertificateCache(LeafCertificateIssuer issuer) {
        this.issuer = issuer;
    }

    /**
     * Returns the certificate cached for the host, issuing it under the given
     * root if there is none yet. Hosts are matched exactly.
     * 
     * @throws FakeCertificateException
     *             if issuance fails. Nothing is cached in that case.
     */
    public IssuedCertificate getOrIssue(final String host,
            final KeyMaterial root) {
        IssuedCertificate cached = certificates.getIfPresent(host);
        if (cached != null) {
            LOG.debug("Using cached certificate for {}", host);
            return cached;
        }
        try {
            return certificates.get(host, () -> issuer.issue(root, host));
        } catch (ExecutionException | UncheckedExecutionException
                | ExecutionError e) {
            throw new FakeCertificateException(
                    "Creation dynamic certificate failed for " + host,
                    e.getCause());
        }
    }

    public Optional<IssuedCertificate> lookup(String host) {
        return Optional.ofNullable(certificates.getIfPresent(host));
    }

    public void invalidateAll() {
        certificates.invalidateAll();
        LOG.info("Cleared certificate cache");
    }

    public Set<String> hosts() {
        return ImmutableSet.copyOf(certificates.asMap().keySet());
    }

    public long size() {
        return certificates.size();
    }
}
