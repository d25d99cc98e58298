package ai.vmhost.virtualizer.catalog;

import ai.vmhost.model.db.TransactionHandle;
import ai.vmhost.model.db.exceptions.AlreadyExistsException;
import ai.vmhost.virtualizer.model.CatalogEntry;
import jakarta.annotation.Nullable;

import java.sql.SQLException;
import java.util.List;

public interface VirtualizerDao {

    /**
     * Checks and inserts in one transaction.
     *
     * @throws AlreadyExistsException if the name is taken
     */
    void create(CatalogEntry entry, @Nullable TransactionHandle transaction) throws SQLException;

    @Nullable
    CatalogEntry get(String name, @Nullable TransactionHandle transaction) throws SQLException;

    /**
     * @return false if there was nothing to delete
     */
    boolean delete(String name, @Nullable TransactionHandle transaction) throws SQLException;

    /**
     * Ordered by name.
     */
    List<CatalogEntry> list(@Nullable TransactionHandle transaction) throws SQLException;
}
