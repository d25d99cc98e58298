package ai.vmhost.model.db;

import java.sql.Connection;
import java.sql.SQLException;

final class TransactionHandleImpl implements TransactionHandle {

    private final Storage storage;
    private boolean committed = false;
    private Connection con = null;

    TransactionHandleImpl(Storage storage) {
        this.storage = storage;
    }

    @Override
    public synchronized Connection connect() throws SQLException {
        if (con != null) {
            return con;
        }
        con = storage.connect();
        con.setAutoCommit(false);
        return con;
    }

    @Override
    public synchronized void commit() throws SQLException {
        if (con == null) {
            return;
        }
        if (committed) {
            throw new IllegalStateException("Already committed");
        }
        con.commit();
        committed = true;
    }

    @Override
    public synchronized void close() throws SQLException {
        if (con == null || con.isClosed()) {
            return;
        }
        try {
            if (!committed) {
                con.rollback();
            }
            con.setAutoCommit(true);
        } finally {
            con.close();
            con = null;
        }
    }
}
