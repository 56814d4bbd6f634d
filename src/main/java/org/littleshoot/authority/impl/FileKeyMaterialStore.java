package org.littleshoot.authority.impl;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;

import org.littleshoot.authority.KeyMaterialConfigurationException;
import org.littleshoot.authority.KeyMaterialNotFoundException;
import org.littleshoot.authority.KeyMaterialPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyMaterialStore} keeping the root as two PEM files,
 * <code>ca.crt</code> and <code>ca_key.pem</code>, in the application data
 * directory. On first use both are copied from the default root bundled on
 * the classpath.
 */
public class FileKeyMaterialStore implements KeyMaterialStore {

    private static final Logger LOG = LoggerFactory
            .getLogger(FileKeyMaterialStore.class);

    public static final String CERTIFICATE_FILE = "ca.crt";

    public static final String PRIVATE_KEY_FILE = "ca_key.pem";

    public static final String DEFAULT_CERTIFICATE_RESOURCE = "/certs/ca.crt";

    public static final String DEFAULT_PRIVATE_KEY_RESOURCE = "/certs/ca_key.pem";

    private static final String TEMP_SUFFIX = ".tmp";

    private static final String BACKUP_SUFFIX = ".bak";

    private final Path dataDir;
    private final Path certificateFile;
    private final Path privateKeyFile;
    private final String defaultCertificateResource;
    private final String defaultPrivateKeyResource;

    public FileKeyMaterialStore(Path dataDir) {
        this(dataDir, DEFAULT_CERTIFICATE_RESOURCE,
                DEFAULT_PRIVATE_KEY_RESOURCE);
    }

    public FileKeyMaterialStore(Path dataDir,
            String defaultCertificateResource,
            String defaultPrivateKeyResource) {
        this.dataDir = dataDir;
        this.certificateFile = dataDir.resolve(CERTIFICATE_FILE);
        this.privateKeyFile = dataDir.resolve(PRIVATE_KEY_FILE);
        this.defaultCertificateResource = defaultCertificateResource;
        this.defaultPrivateKeyResource = defaultPrivateKeyResource;
    }

    @Override
    public KeyStore.PrivateKeyEntry loadOrBootstrap()
            throws KeyMaterialConfigurationException {
        boolean hasCertificate = Files.exists(certificateFile);
        boolean hasPrivateKey = Files.exists(privateKeyFile);
        if (!hasCertificate && !hasPrivateKey) {
            bootstrap();
        } else if (!hasCertificate || !hasPrivateKey) {
            throw new KeyMaterialConfigurationException(
                    "Incomplete root key material in " + dataDir + ", found "
                            + (hasCertificate ? certificateFile
                                    : privateKeyFile) + " only");
        }
        return load();
    }

    private void bootstrap() throws KeyMaterialConfigurationException {
        try {
            Files.createDirectories(dataDir);
            copyResource(defaultPrivateKeyResource, privateKeyFile);
            copyResource(defaultCertificateResource, certificateFile);
        } catch (IOException e) {
            throw new KeyMaterialConfigurationException(
                    "Could not copy the default root certificate to "
                            + dataDir, e);
        }
        LOG.info("Installed default root certificate authority in {}",
                dataDir);
    }

    private void copyResource(String resource, Path target)
            throws IOException {
        try (InputStream in = FileKeyMaterialStore.class
                .getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Missing bundled resource " + resource);
            }
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private KeyStore.PrivateKeyEntry load()
            throws KeyMaterialConfigurationException {
        X509Certificate certificate;
        try (InputStream in = Files.newInputStream(certificateFile)) {
            certificate = Pem.readCertificate(in);
        } catch (IOException | GeneralSecurityException e) {
            throw new KeyMaterialConfigurationException(
                    "Could not read root certificate " + certificateFile, e);
        }

        PrivateKey privateKey;
        try (Reader reader = Files.newBufferedReader(privateKeyFile,
                StandardCharsets.US_ASCII)) {
            privateKey = Pem.readPrivateKey(reader);
        } catch (IOException | GeneralSecurityException e) {
            throw new KeyMaterialConfigurationException(
                    "Could not read root private key " + privateKeyFile, e);
        }

        if (!isPair(certificate.getPublicKey(), privateKey)) {
            throw new KeyMaterialConfigurationException("Private key "
                    + privateKeyFile + " does not belong to certificate "
                    + certificateFile);
        }
        try {
            return new KeyStore.PrivateKeyEntry(privateKey,
                    new Certificate[] { certificate });
        } catch (IllegalArgumentException e) {
            throw new KeyMaterialConfigurationException(
                    "Unusable root key material in " + dataDir, e);
        }
    }

    private static boolean isPair(PublicKey publicKey, PrivateKey privateKey) {
        if (publicKey instanceof RSAPublicKey
                && privateKey instanceof RSAPrivateCrtKey) {
            return ((RSAPublicKey) publicKey).getModulus().equals(
                    ((RSAPrivateCrtKey) privateKey).getModulus());
        }
        return publicKey.getAlgorithm().equals(privateKey.getAlgorithm());
    }

    /**
     * Writes both files next to their targets first and only then moves them
     * in place. If a move fails the previous files are restored.
     */
    @Override
    public void store(X509Certificate certificate, PrivateKey privateKey)
            throws KeyMaterialPersistenceException {
        Path tempCertificate = sibling(certificateFile, TEMP_SUFFIX);
        Path tempPrivateKey = sibling(privateKeyFile, TEMP_SUFFIX);
        try {
            Files.createDirectories(dataDir);
            writePem(tempCertificate, certificate);
            writePem(tempPrivateKey, privateKey);
        } catch (IOException e) {
            deleteQuietly(tempCertificate);
            deleteQuietly(tempPrivateKey);
            throw new KeyMaterialPersistenceException(
                    "Could not write root key material to " + dataDir, e);
        }

        Path backupCertificate = sibling(certificateFile, BACKUP_SUFFIX);
        Path backupPrivateKey = sibling(privateKeyFile, BACKUP_SUFFIX);
        try {
            backup(certificateFile, backupCertificate);
            backup(privateKeyFile, backupPrivateKey);
        } catch (IOException e) {
            deleteQuietly(backupCertificate);
            deleteQuietly(backupPrivateKey);
            deleteQuietly(tempCertificate);
            deleteQuietly(tempPrivateKey);
            throw new KeyMaterialPersistenceException(
                    "Could not back up root key material in " + dataDir, e);
        }

        try {
            move(tempPrivateKey, privateKeyFile);
            move(tempCertificate, certificateFile);
        } catch (IOException e) {
            restore(backupCertificate, certificateFile);
            restore(backupPrivateKey, privateKeyFile);
            deleteQuietly(tempCertificate);
            deleteQuietly(tempPrivateKey);
            throw new KeyMaterialPersistenceException(
                    "Could not replace root key material in " + dataDir, e);
        }
        deleteQuietly(backupCertificate);
        deleteQuietly(backupPrivateKey);
        LOG.info("Stored root certificate authority in {}", dataDir);
    }

    @Override
    public void delete() throws KeyMaterialNotFoundException,
            KeyMaterialPersistenceException {
        if (!exists()) {
            throw new KeyMaterialNotFoundException(
                    "No root certificate authority stored in " + dataDir);
        }
        try {
            Files.deleteIfExists(certificateFile);
            Files.deleteIfExists(privateKeyFile);
        } catch (IOException e) {
            throw new KeyMaterialPersistenceException(
                    "Could not delete root key material in " + dataDir, e);
        }
        LOG.info("Deleted root certificate authority in {}", dataDir);
    }

    @Override
    public boolean exists() {
        return Files.exists(certificateFile) || Files.exists(privateKeyFile);
    }

    private static void writePem(Path path, Object object) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path,
                StandardCharsets.US_ASCII)) {
            Pem.write(writer, object);
        }
    }

    private static Path sibling(Path path, String suffix) {
        return path.resolveSibling(path.getFileName() + suffix);
    }

    private static void backup(Path path, Path backup) throws IOException {
        if (Files.exists(path)) {
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
        } else {
            Files.deleteIfExists(backup);
        }
    }

    /**
     * Puts the backup back in place. A missing backup means there was no
     * file before, so whatever is there now goes away.
     */
    private static void restore(Path backup, Path path) {
        try {
            if (Files.exists(backup)) {
                Files.move(backup, path, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            LOG.warn("Could not restore " + path + " from " + backup, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not delete " + path, e);
        }
    }

    @Override
    public String toString() {
        return "FileKeyMaterialStore [" + dataDir + "]";
    }
}
