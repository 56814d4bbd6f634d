package org.littleshoot.authority.impl;

import java.io.IOException;
import java.security.KeyPair;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Date;

import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.OperatorCreationException;

/**
 * Creates self signed root certificates for the proxy's certificate
 * authority.
 */
public class RootCertificateGenerator {

    private final AuthorityConfig config;

    public RootCertificateGenerator(AuthorityConfig config) {
        this.config = config;
    }

    /**
     * @param keyPair
     *            key pair of the new root
     * @param hostnameHint
     *            put in parentheses after the configured common name prefix
     */
    public X509Certificate generate(KeyPair keyPair, String hostnameHint)
            throws OperatorCreationException, CertificateException,
            IOException, NoSuchAlgorithmException {
        final Date startDate = new Date();
        final Date expireDate = CertificateUtils.daysFrom(startDate,
                config.rootValidityDays());

        X500Name name = CertificateUtils.subject(config,
                commonName(hostnameHint));
        X509v3CertificateBuilder certGen = new JcaX509v3CertificateBuilder(
                name, CertificateUtils.randomSerial(), startDate, expireDate,
                name, keyPair.getPublic());

        certGen.addExtension(Extension.subjectKeyIdentifier, false,
                new JcaX509ExtensionUtils()
                        .createSubjectKeyIdentifier(keyPair.getPublic()));
        certGen.addExtension(Extension.basicConstraints, true,
                new BasicConstraints(true));
        certGen.addExtension(Extension.keyUsage, true, new KeyUsage(
                KeyUsage.keyCertSign | KeyUsage.cRLSign));

        ASN1EncodableVector eku = new ASN1EncodableVector();
        eku.add(KeyPurposeId.id_kp_serverAuth);
        eku.add(KeyPurposeId.id_kp_clientAuth);
        certGen.addExtension(Extension.extendedKeyUsage, false,
                new DERSequence(eku));

        return CertificateUtils.sign(certGen, keyPair.getPrivate(),
                CertificateUtils.SIGNATURE_ALGORITHM);
    }

    String commonName(String hostnameHint) {
        return config.rootCommonNamePrefix() + " (" + hostnameHint + ")";
    }
}
