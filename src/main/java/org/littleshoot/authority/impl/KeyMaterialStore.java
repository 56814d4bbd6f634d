package org.littleshoot.authority.impl;

import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;

import org.littleshoot.authority.KeyMaterialConfigurationException;
import org.littleshoot.authority.KeyMaterialNotFoundException;
import org.littleshoot.authority.KeyMaterialPersistenceException;

/**
 * Persistent home of the root certificate and its private key.
 */
public interface KeyMaterialStore {

    /**
     * Returns the stored root, seeding the store with the bundled default
     * root first if it holds nothing yet.
     * 
     * @return the root private key with a single element chain holding the
     *         root certificate
     */
    KeyStore.PrivateKeyEntry loadOrBootstrap()
            throws KeyMaterialConfigurationException;

    /**
     * Replaces the stored root. Either both certificate and key are replaced
     * or neither is.
     */
    void store(X509Certificate certificate, PrivateKey privateKey)
            throws KeyMaterialPersistenceException;

    /**
     * Removes the stored root so the next {@link #loadOrBootstrap()} falls
     * back to the bundled default.
     */
    void delete() throws KeyMaterialNotFoundException,
            KeyMaterialPersistenceException;

    boolean exists();

}
