package org.littleshoot.authority.impl;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.cert.X509Certificate;
import java.util.Date;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.net.InetAddresses;

/**
 * Issues the certificate presented to a client in place of the real server's.
 * Every leaf carries the shared server public key and is signed by the root
 * private key with the root's own signature algorithm.
 */
public class LeafCertificateIssuer {

    private static final Logger LOG = LoggerFactory
            .getLogger(LeafCertificateIssuer.class);

    private final AuthorityConfig config;

    public LeafCertificateIssuer(AuthorityConfig config) {
        this.config = config;
    }

    /**
     * Creates a certificate for the given host.
     * 
     * @param root
     *            the active root and the shared server key pair
     * @param host
     *            becomes the subject common name and the single subject
     *            alternative name. IP literals are stamped as IP address
     *            names.
     */
    public IssuedCertificate issue(KeyMaterial root, String host)
            throws GeneralSecurityException, OperatorCreationException,
            IOException {
        final MillisecondsDuration duration = new MillisecondsDuration();
        final X509Certificate caCert = root.rootCertificate();
        final PublicKey pubKey = root.serverKeyPair().getPublic();

        X500Name issuer = new JcaX509CertificateHolder(caCert).getSubject();
        Date notBefore = new Date();
        Date notAfter = CertificateUtils.daysFrom(notBefore,
                config.leafValidityDays());
        X509v3CertificateBuilder certGen = new JcaX509v3CertificateBuilder(
                issuer, CertificateUtils.randomSerial(), notBefore, notAfter,
                CertificateUtils.subject(config, host), pubKey);

        JcaX509ExtensionUtils extensionUtils = new JcaX509ExtensionUtils();
        certGen.addExtension(Extension.subjectKeyIdentifier, false,
                extensionUtils.createSubjectKeyIdentifier(pubKey));
        certGen.addExtension(Extension.authorityKeyIdentifier, false,
                extensionUtils.createAuthorityKeyIdentifier(caCert
                        .getPublicKey()));
        certGen.addExtension(Extension.basicConstraints, false,
                new BasicConstraints(false));
        certGen.addExtension(Extension.subjectAlternativeName, false,
                new GeneralNames(subjectAlternativeName(host)));

        final X509Certificate cert = CertificateUtils.sign(certGen,
                root.rootPrivateKey(), caCert.getSigAlgName());

        // a leaf that does not chain to the root is never handed out
        cert.verify(caCert.getPublicKey());

        LOG.info("Impersonated {} in {}ms", host, duration);
        return new IssuedCertificate(host, cert);
    }

    private static GeneralName subjectAlternativeName(String host) {
        if (InetAddresses.isInetAddress(host)) {
            return new GeneralName(GeneralName.iPAddress, host);
        }
        return new GeneralName(GeneralName.dNSName, host);
    }
}
