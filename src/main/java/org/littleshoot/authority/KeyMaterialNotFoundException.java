package org.littleshoot.authority;

public class KeyMaterialNotFoundException extends RootCertificateException {

    private static final long serialVersionUID = 1L;

    public KeyMaterialNotFoundException(String message) {
        super(message);
    }

}
