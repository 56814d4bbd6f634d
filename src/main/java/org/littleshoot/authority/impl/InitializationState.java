package org.littleshoot.authority.impl;

/**
 * Guards first access to the key material store. Root key material is only
 * defined in {@link #READY}.
 */
public enum InitializationState {
    UNINITIALIZED, INITIALIZING, READY
}
