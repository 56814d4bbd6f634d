package org.littleshoot.authority.impl;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.security.InvalidKeyException;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;

/**
 * Reading and writing of PEM encoded certificates and RSA keys.
 */
final class Pem {

    private static final Provider PROVIDER = new BouncyCastleProvider();

    private Pem() {
    }

    static X509Certificate readCertificate(InputStream in)
            throws CertificateException {
        CertificateFactory certificateFactory = CertificateFactory
                .getInstance("X.509");
        return (X509Certificate) certificateFactory.generateCertificate(in);
    }

    /**
     * Reads an RSA private key, either PKCS#1 ("RSA PRIVATE KEY") or
     * unencrypted PKCS#8 ("PRIVATE KEY").
     */
    static PrivateKey readPrivateKey(Reader reader) throws IOException,
            InvalidKeyException {
        try (PEMParser parser = new PEMParser(reader)) {
            Object obj;
            try {
                obj = parser.readObject();
            } catch (RuntimeException e) {
                // broken base64 or ASN.1 surfaces unchecked from BouncyCastle
                throw new IOException("Malformed PEM data", e);
            }
            if (obj == null) {
                throw new IOException("No PEM object found");
            }
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter()
                    .setProvider(PROVIDER);

            PrivateKeyInfo keyInfo;
            if (obj instanceof PEMKeyPair) {
                keyInfo = ((PEMKeyPair) obj).getPrivateKeyInfo();
            } else if (obj instanceof PrivateKeyInfo) {
                keyInfo = (PrivateKeyInfo) obj;
            } else {
                throw new InvalidKeyException("Unsupported key format: "
                        + obj.getClass().getSimpleName());
            }

            PrivateKey key;
            try {
                key = converter.getPrivateKey(keyInfo);
            } catch (RuntimeException e) {
                throw new InvalidKeyException("Malformed private key", e);
            }
            if (!CertificateUtils.KEY_ALGORITHM.equals(key.getAlgorithm())) {
                throw new InvalidKeyException("Expected an RSA key but got "
                        + key.getAlgorithm());
            }
            return key;
        }
    }

    static String toPem(Object object) {
        StringWriter sw = new StringWriter();
        try {
            write(sw, object);
        } catch (IOException e) {
            // StringWriter does not fail
            throw new IllegalStateException(e);
        }
        return sw.toString();
    }

    /**
     * Writes the object in PEM form. RSA private keys come out as PKCS#1.
     */
    static void write(Writer writer, Object object) throws IOException {
        try (JcaPEMWriter pw = new JcaPEMWriter(writer)) {
            pw.writeObject(object);
            pw.flush();
        }
    }
}
