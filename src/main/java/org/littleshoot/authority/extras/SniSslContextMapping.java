package org.littleshoot.authority.extras;

import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.IdentityCipherSuiteFilter;
import io.netty.handler.ssl.JdkSslContext;
import io.netty.handler.ssl.SniHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.util.Mapping;

import javax.net.ssl.SSLContext;

import org.littleshoot.authority.FakeCertificateException;
import org.littleshoot.authority.RootCertificateException;
import org.littleshoot.authority.TlsContextFactory;
import org.littleshoot.authority.impl.DefaultCertificateAuthority;

/**
 * Maps the host name a client sends in its SNI extension to a Netty
 * {@link SslContext} impersonating that host. Install it in the client facing
 * pipeline with {@link #newSniHandler()}:
 * 
 * <pre>
 * pipeline.addLast(&quot;sni&quot;, new SniSslContextMapping(ca).newSniHandler());
 * </pre>
 */
public class SniSslContextMapping implements Mapping<String, SslContext> {

    private final TlsContextFactory tlsContextFactory;

    private final String defaultHost;

    /**
     * Impersonates the authority's configured <code>default_host</code> for
     * clients that send no server name.
     */
    public SniSslContextMapping(DefaultCertificateAuthority authority) {
        this(authority, authority.config().defaultHost());
    }

    /**
     * @param defaultHost
     *            impersonated when the client sends no server name
     */
    public SniSslContextMapping(TlsContextFactory tlsContextFactory,
            String defaultHost) {
        this.tlsContextFactory = tlsContextFactory;
        this.defaultHost = defaultHost;
    }

    @Override
    public SslContext map(String hostname) {
        String host = hostname != null ? hostname : defaultHost;
        try {
            SSLContext sslContext = tlsContextFactory.contextFor(host);
            return new JdkSslContext(sslContext, false, null,
                    IdentityCipherSuiteFilter.INSTANCE, null, ClientAuth.NONE);
        } catch (RootCertificateException e) {
            throw new FakeCertificateException(
                    "Creation dynamic certificate failed for " + host, e);
        }
    }

    public SniHandler newSniHandler() {
        return new SniHandler(this);
    }
}
