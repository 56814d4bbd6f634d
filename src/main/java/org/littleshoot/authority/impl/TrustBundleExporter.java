package org.littleshoot.authority.impl;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;

/**
 * Packages the root private key and certificate into a PKCS#12 bundle that
 * client devices can import to trust the proxy.
 */
public class TrustBundleExporter {

    /**
     * The P12 format has to be implemented by every vendor, so the bundle
     * opens with standard tooling.
     */
    private static final String KEY_STORE_TYPE = "PKCS12";

    private final String alias;

    public TrustBundleExporter(String alias) {
        this.alias = alias;
    }

    public byte[] export(KeyMaterial keyMaterial, char[] password)
            throws GeneralSecurityException, IOException {
        if (password == null || password.length == 0) {
            throw new IllegalArgumentException(
                    "Error, a trust bundle needs a password!");
        }
        final KeyStore ks = KeyStore.getInstance(KEY_STORE_TYPE);
        ks.load(null, null);
        ks.setKeyEntry(alias, keyMaterial.rootPrivateKey(), password,
                new Certificate[] { keyMaterial.rootCertificate() });

        ByteArrayOutputStream os = new ByteArrayOutputStream();
        ks.store(os, password);
        return os.toByteArray();
    }

    public String alias() {
        return alias;
    }
}
