package org.littleshoot.authority.impl;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.security.Key;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Collections;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TrustBundleExporterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private KeyMaterial root;

    private TrustBundleExporter exporter;

    @Before
    public void setUp() throws Exception {
        KeyStore.PrivateKeyEntry entry = new FileKeyMaterialStore(tmp
                .getRoot().toPath()).loadOrBootstrap();
        root = new KeyMaterial((X509Certificate) entry.getCertificate(),
                entry.getPrivateKey(), CertificateUtils.createKeyPair(1024));
        exporter = new TrustBundleExporter("littleproxy");
    }

    @Test
    public void testBundleHoldsRootUnderAlias() throws Exception {
        byte[] bundle = exporter.export(root, "secret".toCharArray());

        KeyStore ks = KeyStore.getInstance("PKCS12");
        ks.load(new ByteArrayInputStream(bundle), "secret".toCharArray());

        assertEquals(Collections.singletonList("littleproxy"),
                Collections.list(ks.aliases()));
        assertTrue(ks.isKeyEntry("littleproxy"));
        Certificate[] chain = ks.getCertificateChain("littleproxy");
        assertEquals(1, chain.length);
        assertEquals(root.rootCertificate(), chain[0]);
        Key key = ks.getKey("littleproxy", "secret".toCharArray());
        assertEquals(((RSAPublicKey) root.rootCertificate().getPublicKey())
                .getModulus(), ((RSAPrivateCrtKey) key).getModulus());
    }

    @Test
    public void testWrongPasswordIsRejected() throws Exception {
        byte[] bundle = exporter.export(root, "secret".toCharArray());

        KeyStore ks = KeyStore.getInstance("PKCS12");
        try {
            ks.load(new ByteArrayInputStream(bundle), "other".toCharArray());
            fail("Bundle opened with the wrong password");
        } catch (java.io.IOException e) {
            assertThat(e.getMessage(), not(isEmptyOrNullString()));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyPasswordIsRejected() throws Exception {
        exporter.export(root, new char[0]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingPasswordIsRejected() throws Exception {
        exporter.export(root, null);
    }
}
