package io.vaultflow.storage;

/**
 * Base of every failure raised by the vault core. I/O failures are wrapped with the offending
 * path in the message.
 */
public class VaultStoreException extends RuntimeException {
    public VaultStoreException(String message) {
        super(message);
    }

    public VaultStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
