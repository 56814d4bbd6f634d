package org.littleshoot.authority.impl;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;

/**
 * Snapshot of the active root: its certificate, its signing key and the
 * server key pair shared by every leaf issued under it. Replaced wholesale,
 * never modified.
 */
public final class KeyMaterial {

    private final X509Certificate rootCertificate;
    private final PrivateKey rootPrivateKey;
    private final KeyPair serverKeyPair;

    public KeyMaterial(X509Certificate rootCertificate,
            PrivateKey rootPrivateKey, KeyPair serverKeyPair) {
        this.rootCertificate = rootCertificate;
        this.rootPrivateKey = rootPrivateKey;
        this.serverKeyPair = serverKeyPair;
    }

    public X509Certificate rootCertificate() {
        return rootCertificate;
    }

    public PrivateKey rootPrivateKey() {
        return rootPrivateKey;
    }

    public KeyPair serverKeyPair() {
        return serverKeyPair;
    }

}
