package io.vaultflow.dashboard;

import io.vaultflow.storage.VaultStoreException;

public final class NotDashboardWriterException extends VaultStoreException {
    public NotDashboardWriterException(String role, String writerRole) {
        super("Role '" + role + "' may not rebuild the dashboard; the designated writer is '" + writerRole
                + "'. Submit a delta instead.");
    }
}
