package org.littleshoot.authority.impl;

import java.math.BigInteger;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;

/**
 * A leaf certificate impersonating one host, as kept in the
 * {@link CertificateCache}.
 */
public final class IssuedCertificate {

    private final String host;
    private final X509Certificate certificate;
    private final byte[] encoded;

    IssuedCertificate(String host, X509Certificate certificate)
            throws CertificateEncodingException {
        this.host = host;
        this.certificate = certificate;
        this.encoded = certificate.getEncoded();
    }

    public String host() {
        return host;
    }

    public X509Certificate certificate() {
        return certificate;
    }

    public BigInteger serialNumber() {
        return certificate.getSerialNumber();
    }

    /**
     * @return the DER encoding, a fresh copy on every call
     */
    public byte[] encoded() {
        return encoded.clone();
    }

    public String toPem() {
        return Pem.toPem(certificate);
    }

    @Override
    public String toString() {
        return "IssuedCertificate [host=" + host + ", serial="
                + serialNumber().toString(16) + ", notAfter="
                + certificate.getNotAfter() + "]";
    }
}
