package org.littleshoot.authority;

/**
 * Thrown when a certificate impersonating a host could not be created. The
 * handshake that asked for it has to fail.
 */
public class FakeCertificateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FakeCertificateException(String message, Throwable cause) {
        super(message, cause);
    }

}
