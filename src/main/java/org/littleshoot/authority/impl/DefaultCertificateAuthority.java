package org.littleshoot.authority.impl;

import java.io.IOException;
import java.net.InetAddress;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;

import org.apache.commons.lang3.StringUtils;
import org.bouncycastle.operator.OperatorCreationException;
import org.littleshoot.authority.FakeCertificateException;
import org.littleshoot.authority.RootCertificateException;
import org.littleshoot.authority.RootCertificateManager;
import org.littleshoot.authority.TlsContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The certificate authority of an intercepting proxy. It loads (or
 * bootstraps) a root certificate, issues a certificate for every host the
 * proxy impersonates and hands out server {@link SSLContext}s built from
 * them.
 * </p>
 *
 * <p>
 * Create one instance per process and pass it to both the TLS terminating
 * listener, as a {@link TlsContextFactory}, and to whatever handles operator
 * commands, as a {@link RootCertificateManager}.
 * </p>
 *
 * <p>
 * Locking: the root is swapped only while holding the write lock. Issuance
 * holds the read lock, so different hosts are issued in parallel while
 * regeneration and reset wait for in-flight issuance to finish. The write
 * lock also serializes the first load of the root.
 * </p>
 */
public class DefaultCertificateAuthority implements TlsContextFactory,
        RootCertificateManager {

    private static final Logger LOG = LoggerFactory
            .getLogger(DefaultCertificateAuthority.class);

    private static final String SSL_CONTEXT_PROTOCOL = "TLS";

    private static final String LEAF_ALIAS = "leaf";

    /**
     * Protects the in-memory key store entry only, it is never written out.
     */
    private static final char[] LEAF_PASSWORD = "littleproxy".toCharArray();

    private static final String FALLBACK_HOSTNAME = "localhost";

    private final AuthorityConfig config;
    private final KeyMaterialStore store;
    private final RootCertificateGenerator rootGenerator;
    private final CertificateCache cache;
    private final TrustBundleExporter exporter;

    private final ReentrantReadWriteLock rootLock = new ReentrantReadWriteLock();

    /**
     * Non-null exactly when {@link #state} is READY.
     */
    private volatile KeyMaterial keyMaterial;

    private volatile InitializationState state = InitializationState.UNINITIALIZED;

    public DefaultCertificateAuthority(AuthorityConfig config) {
        this(config, new FileKeyMaterialStore(config.dataDir()),
                new LeafCertificateIssuer(config));
    }

    /**
     * With <code>allow_legacy_renegotiation</code> set, build the authority
     * before anything in the JVM performs a TLS handshake. Later, the JDK no
     * longer picks the setting up.
     */
    public DefaultCertificateAuthority(AuthorityConfig config,
            KeyMaterialStore store, LeafCertificateIssuer issuer) {
        this.config = config;
        this.store = store;
        this.rootGenerator = new RootCertificateGenerator(config);
        this.cache = new CertificateCache(issuer);
        this.exporter = new TrustBundleExporter(config.trustBundleAlias());
        if (config.isAllowLegacyRenegotiation()) {
            LegacyRenegotiation.enable();
        }
    }

    @Override
    public void ensureInitialized() throws RootCertificateException {
        initialize();
    }

    /**
     * Returns the active key material, loading it first if needed. Callers
     * arriving while another thread loads block on the write lock and then
     * see its result.
     */
    private KeyMaterial initialize() throws RootCertificateException {
        KeyMaterial current = keyMaterial;
        if (current != null) {
            return current;
        }
        rootLock.writeLock().lock();
        try {
            if (keyMaterial == null) {
                state = InitializationState.INITIALIZING;
                try {
                    keyMaterial = load();
                    state = InitializationState.READY;
                } finally {
                    if (keyMaterial == null) {
                        state = InitializationState.UNINITIALIZED;
                    }
                }
            }
            return keyMaterial;
        } finally {
            rootLock.writeLock().unlock();
        }
    }

    private KeyMaterial load() throws RootCertificateException {
        final MillisecondsDuration duration = new MillisecondsDuration();
        KeyStore.PrivateKeyEntry root = store.loadOrBootstrap();
        KeyPair serverKeyPair;
        try {
            serverKeyPair = CertificateUtils.createKeyPair(config.keySize());
        } catch (GeneralSecurityException e) {
            throw new RootCertificateException(
                    "Could not create the server key pair", e);
        }
        X509Certificate rootCertificate = (X509Certificate) root
                .getCertificate();
        LOG.info("Loaded root certificate authority '{}' in {}ms",
                rootCertificate.getSubjectX500Principal(), duration);
        return new KeyMaterial(rootCertificate, root.getPrivateKey(),
                serverKeyPair);
    }

    /**
     * Returns the certificate for the host, issuing it on first use.
     *
     * @throws FakeCertificateException
     *             if issuance fails
     */
    public IssuedCertificate certificateFor(String host)
            throws RootCertificateException {
        checkHost(host);
        while (true) {
            KeyMaterial root = initialize();
            rootLock.readLock().lock();
            try {
                // the root may have been swapped between initialize() and
                // taking the lock, issue only under the one still active
                if (root == keyMaterial) {
                    return cache.getOrIssue(host, root);
                }
            } finally {
                rootLock.readLock().unlock();
            }
        }
    }

    @Override
    public SSLContext contextFor(String host) throws RootCertificateException {
        checkHost(host);
        while (true) {
            KeyMaterial root = initialize();
            rootLock.readLock().lock();
            try {
                if (root == keyMaterial) {
                    IssuedCertificate leaf = cache.getOrIssue(host, root);
                    return createServerContext(leaf, root.serverKeyPair()
                            .getPrivate());
                }
            } finally {
                rootLock.readLock().unlock();
            }
        }
    }

    @Override
    public SSLEngine serverSslEngine(String host)
            throws RootCertificateException {
        SSLEngine engine = contextFor(host).createSSLEngine();
        engine.setUseClientMode(false);
        return engine;
    }

    private SSLContext createServerContext(IssuedCertificate leaf,
            PrivateKey serverKey) {
        try {
            final KeyStore ks = KeyStore.getInstance(KeyStore
                    .getDefaultType());
            ks.load(null, null);
            ks.setKeyEntry(LEAF_ALIAS, serverKey, LEAF_PASSWORD,
                    new Certificate[] { leaf.certificate() });

            KeyManagerFactory kmf = KeyManagerFactory
                    .getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(ks, LEAF_PASSWORD);

            SSLContext ctx = SSLContext.getInstance(SSL_CONTEXT_PROTOCOL);
            ctx.init(kmf.getKeyManagers(), null, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException | IOException e) {
            throw new FakeCertificateException(
                    "Could not assemble a TLS context for " + leaf.host(), e);
        }
    }

    @Override
    public void regenerate(String hostnameHint)
            throws RootCertificateException {
        final String hint = StringUtils.isBlank(hostnameHint) ? localHostName()
                : hostnameHint.trim();
        rootLock.writeLock().lock();
        try {
            final MillisecondsDuration duration = new MillisecondsDuration();
            X509Certificate certificate;
            KeyPair keyPair;
            try {
                keyPair = CertificateUtils.createKeyPair(config.keySize());
                certificate = rootGenerator.generate(keyPair, hint);
            } catch (GeneralSecurityException | OperatorCreationException
                    | IOException e) {
                throw new RootCertificateException(
                        "Could not generate a new root certificate", e);
            }

            // persist first, the old root stays active if this throws
            store.store(certificate, keyPair.getPrivate());

            cache.invalidateAll();
            keyMaterial = null;
            state = InitializationState.UNINITIALIZED;
            LOG.info("Created root certificate authority '{}' in {}ms",
                    certificate.getSubjectX500Principal(), duration);
        } finally {
            rootLock.writeLock().unlock();
        }
    }

    @Override
    public void resetToDefault() throws RootCertificateException {
        rootLock.writeLock().lock();
        try {
            store.delete();
            cache.invalidateAll();
            keyMaterial = null;
            state = InitializationState.UNINITIALIZED;
            LOG.info("Reset to the default root certificate authority");
        } finally {
            rootLock.writeLock().unlock();
        }
    }

    @Override
    public byte[] exportTrustBundle(char[] password)
            throws RootCertificateException {
        KeyMaterial root = initialize();
        try {
            byte[] bundle = exporter.export(root, password);
            LOG.info("Exported trust bundle for '{}'", root.rootCertificate()
                    .getSubjectX500Principal());
            return bundle;
        } catch (GeneralSecurityException | IOException e) {
            throw new RootCertificateException(
                    "Could not export the trust bundle", e);
        }
    }

    @Override
    public X509Certificate rootCertificate() throws RootCertificateException {
        return initialize().rootCertificate();
    }

    @Override
    public String rootCertificatePem() throws RootCertificateException {
        return Pem.toPem(rootCertificate());
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }

    /**
     * Non-issuing peek into the certificate cache.
     */
    public Optional<IssuedCertificate> lookup(String host) {
        return cache.lookup(host);
    }

    public CertificateCache cache() {
        return cache;
    }

    public InitializationState state() {
        return state;
    }

    public AuthorityConfig config() {
        return config;
    }

    private static void checkHost(String host) {
        if (StringUtils.isBlank(host)) {
            throw new IllegalArgumentException(
                    "Error, 'host' is not allowed to be blank!");
        }
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            LOG.debug("Could not lookup localhost", e);
        } catch (RuntimeException e) {
            LOG.debug("Could not lookup localhost", e);
        }
        return FALLBACK_HOSTNAME;
    }
}
