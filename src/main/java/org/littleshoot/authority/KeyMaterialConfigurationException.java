package org.littleshoot.authority;

/**
 * Key material exists on disk but cannot be parsed. The bundled defaults are
 * never used as a silent replacement.
 */
public class KeyMaterialConfigurationException extends RootCertificateException {

    private static final long serialVersionUID = 1L;

    public KeyMaterialConfigurationException(String message) {
        super(message);
    }

    public KeyMaterialConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

}
