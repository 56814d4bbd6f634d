package org.littleshoot.authority;

/**
 * Writing new key material failed. The previously active root is still in
 * place, both on disk and in memory.
 */
public class KeyMaterialPersistenceException extends RootCertificateException {

    private static final long serialVersionUID = 1L;

    public KeyMaterialPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

}
