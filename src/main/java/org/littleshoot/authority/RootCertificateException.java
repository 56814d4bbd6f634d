package org.littleshoot.authority;

/**
 * Base of the failures raised by root certificate authority lifecycle
 * operations. Nothing throwing this is retried automatically; the operator
 * decides how to react.
 */
public class RootCertificateException extends Exception {

    private static final long serialVersionUID = 1L;

    public RootCertificateException(String message) {
        super(message);
    }

    public RootCertificateException(String message, Throwable cause) {
        super(message, cause);
    }

}
