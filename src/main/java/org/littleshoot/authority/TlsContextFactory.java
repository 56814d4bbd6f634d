package org.littleshoot.authority;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;

/**
 * Source of server side TLS contexts for intercepted hosts. This is what the
 * proxy's socket layer calls for every connection it man-in-the-middles.
 */
public interface TlsContextFactory {

    /**
     * Returns an {@link SSLContext} presenting a certificate for the given
     * host, signed by the current root certificate authority. The certificate
     * is issued on first use and reused afterwards.
     * 
     * @param host
     *            the host name requested by the client, usually taken from
     *            the SNI extension
     * @return a context ready to create server mode engines
     * @throws RootCertificateException
     *             if the root key material could not be loaded
     */
    SSLContext contextFor(String host) throws RootCertificateException;

    /**
     * Convenience for {@link #contextFor(String)} returning an engine already
     * switched to server mode.
     */
    SSLEngine serverSslEngine(String host) throws RootCertificateException;

}
