package org.littleshoot.authority.extras;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

import io.netty.handler.ssl.SniHandler;
import io.netty.handler.ssl.SslContext;

import javax.net.ssl.SSLContext;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.littleshoot.authority.FakeCertificateException;
import org.littleshoot.authority.KeyMaterialConfigurationException;
import org.littleshoot.authority.TlsContextFactory;
import org.littleshoot.authority.impl.AuthorityConfig;
import org.littleshoot.authority.impl.DefaultCertificateAuthority;

public class SniSslContextMappingTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private TlsContextFactory factory;

    private SniSslContextMapping mapping;

    @Before
    public void setUp() throws Exception {
        factory = mock(TlsContextFactory.class);
        when(factory.contextFor(anyString())).thenReturn(
                SSLContext.getDefault());
        mapping = new SniSslContextMapping(factory, "localhost");
    }

    @Test
    public void testMapsServerNameToServerContext() throws Exception {
        SslContext context = mapping.map("example.com");

        assertNotNull(context);
        assertTrue(context.isServer());
        verify(factory).contextFor("example.com");
    }

    @Test
    public void testMissingServerNameUsesDefaultHost() throws Exception {
        mapping.map(null);

        verify(factory).contextFor("localhost");
        verifyNoMoreInteractions(factory);
    }

    @Test
    public void testFailureIsReportedAsFakeCertificateException()
            throws Exception {
        when(factory.contextFor("broken.example.com")).thenThrow(
                new KeyMaterialConfigurationException("corrupt root"));

        try {
            mapping.map("broken.example.com");
            fail("Failure was not reported");
        } catch (FakeCertificateException e) {
            assertTrue(e.getMessage().contains("broken.example.com"));
            assertTrue(e.getCause() instanceof KeyMaterialConfigurationException);
        }
    }

    @Test
    public void testAuthorityDefaultHostIsConfigured() throws Exception {
        AuthorityConfig config = AuthorityConfig.builder()
                .withDataDir(tmp.getRoot().toPath())
                .withKeySize(1024)
                .withAllowLegacyRenegotiation(false)
                .withDefaultHost("fallback.example.com")
                .build();
        DefaultCertificateAuthority ca = new DefaultCertificateAuthority(config);

        SslContext context = new SniSslContextMapping(ca).map(null);

        assertTrue(context.isServer());
        assertTrue(ca.lookup("fallback.example.com").isPresent());
        assertEquals(1, ca.cache().size());
    }

    @Test
    public void testCreatesSniHandler() {
        SniHandler handler = mapping.newSniHandler();

        assertNotNull(handler);
        assertNull(handler.hostname());
    }
}
