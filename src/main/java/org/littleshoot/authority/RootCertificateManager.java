package org.littleshoot.authority;

import java.security.cert.X509Certificate;

/**
 * Operator facing commands on the root certificate authority. Implementations
 * serialize these against each other and against certificate issuance.
 */
public interface RootCertificateManager {

    /**
     * Loads the root key material, bootstrapping it from the bundled defaults
     * on first run. Safe to call from many threads; only one of them touches
     * the disk.
     */
    void ensureInitialized() throws RootCertificateException;

    /**
     * Replaces the root with a freshly generated self signed certificate.
     * 
     * @param hostnameHint
     *            added to the common name so the operator can tell roots of
     *            different machines apart. <code>null</code> uses the local
     *            host name.
     * @throws KeyMaterialPersistenceException
     *             if the new files could not be written. The old root stays
     *             active in that case.
     */
    void regenerate(String hostnameHint) throws RootCertificateException;

    /**
     * Deletes the on-disk root so the bundled default is used again.
     * 
     * @throws KeyMaterialNotFoundException
     *             if there is nothing to delete
     */
    void resetToDefault() throws RootCertificateException;

    /**
     * Packages the root private key and certificate into a password protected
     * PKCS#12 bundle for installation on client devices.
     */
    byte[] exportTrustBundle(char[] password) throws RootCertificateException;

    X509Certificate rootCertificate() throws RootCertificateException;

    /**
     * @return the root certificate in PEM form, for display and installation
     *         guidance
     */
    String rootCertificatePem() throws RootCertificateException;

    /**
     * Drops every issued leaf certificate. They are issued again on demand.
     */
    void clearCache();

}
