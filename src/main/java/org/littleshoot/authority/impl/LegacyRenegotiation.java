package org.littleshoot.authority.impl;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Switches the JDK's TLS implementation to accept unsafe legacy
 * renegotiation, which some intercepted clients still use. JSSE reads these
 * properties once, when its handshake classes load, so this has no effect
 * after the first handshake in the JVM.
 */
final class LegacyRenegotiation {

    private static final Logger LOG = LoggerFactory
            .getLogger(LegacyRenegotiation.class);

    static final String ALLOW_UNSAFE_RENEGOTIATION = "sun.security.ssl.allowUnsafeRenegotiation";

    static final String ALLOW_LEGACY_HELLO_MESSAGES = "sun.security.ssl.allowLegacyHelloMessages";

    private static final AtomicBoolean ENABLED = new AtomicBoolean();

    private LegacyRenegotiation() {
    }

    /**
     * @return true if this call set the properties
     */
    static boolean enable() {
        if (ENABLED.compareAndSet(false, true)) {
            System.setProperty(ALLOW_UNSAFE_RENEGOTIATION, "true");
            System.setProperty(ALLOW_LEGACY_HELLO_MESSAGES, "true");
            LOG.info("Requested legacy TLS renegotiation, effective only if"
                    + " no TLS handshake has happened in this JVM yet");
            return true;
        }
        return false;
    }
}
