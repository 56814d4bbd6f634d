package org.littleshoot.authority.impl;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Date;
import java.util.concurrent.TimeUnit;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

/**
 * Helpers shared by root and leaf certificate generation.
 */
final class CertificateUtils {

    static final String PROVIDER = BouncyCastleProvider.PROVIDER_NAME;

    static final String KEY_ALGORITHM = "RSA";

    static final String SIGNATURE_ALGORITHM = "SHA256WithRSAEncryption";

    private static final SecureRandom RANDOM = new SecureRandom();

    static {
        if (Security.getProvider(PROVIDER) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private CertificateUtils() {
    }

    static KeyPair createKeyPair(int keySize) throws NoSuchAlgorithmException {
        final KeyPairGenerator keyGen = KeyPairGenerator
                .getInstance(KEY_ALGORITHM);
        keyGen.initialize(keySize, RANDOM);
        return keyGen.generateKeyPair();
    }

    /**
     * Positive random 64 bit serial. Collisions are not checked.
     */
    static BigInteger randomSerial() {
        BigInteger serial;
        do {
            serial = new BigInteger(64, RANDOM);
        } while (serial.signum() == 0);
        return serial;
    }

    static X500Name subject(AuthorityConfig config, String commonName) {
        X500NameBuilder namebld = new X500NameBuilder(BCStyle.INSTANCE);
        namebld.addRDN(BCStyle.C, config.country());
        namebld.addRDN(BCStyle.ST, config.state());
        namebld.addRDN(BCStyle.L, config.locality());
        namebld.addRDN(BCStyle.O, config.organization());
        namebld.addRDN(BCStyle.OU, config.organizationalUnit());
        namebld.addRDN(BCStyle.CN, commonName);
        return namebld.build();
    }

    static Date daysFrom(Date start, int days) {
        return new Date(start.getTime() + TimeUnit.DAYS.toMillis(days));
    }

    static X509Certificate sign(X509v3CertificateBuilder certGen,
            PrivateKey signingKey, String signatureAlgorithm)
            throws OperatorCreationException, CertificateException {
        final ContentSigner sigGen = new JcaContentSignerBuilder(
                signatureAlgorithm).setProvider(PROVIDER).build(signingKey);
        return new JcaX509CertificateConverter().setProvider(PROVIDER)
                .getCertificate(certGen.build(sigGen));
    }
}
