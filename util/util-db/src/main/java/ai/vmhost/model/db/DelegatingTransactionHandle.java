package ai.vmhost.model.db;

import jakarta.annotation.Nullable;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Joins the caller's transaction when there is one, otherwise owns a fresh one.
 */
final class DelegatingTransactionHandle implements TransactionHandle {

    private final TransactionHandle transaction;
    private final boolean acquired;

    DelegatingTransactionHandle(Storage storage, @Nullable TransactionHandle transaction) {
        if (transaction == null) {
            this.transaction = new TransactionHandleImpl(storage);
            acquired = false;
        } else {
            this.transaction = transaction;
            acquired = true;
        }
    }

    @Override
    public synchronized Connection connect() throws SQLException {
        return transaction.connect();
    }

    @Override
    public synchronized void commit() throws SQLException {
        if (!acquired) {
            transaction.commit();
        }
    }

    @Override
    public synchronized void close() throws SQLException {
        if (!acquired) {
            transaction.close();
        }
    }
}
