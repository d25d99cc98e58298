package ai.vmhost.virtualizer.catalog;

import ai.vmhost.model.db.DbHelper;
import ai.vmhost.model.db.Storage;
import ai.vmhost.model.db.TransactionHandle;
import ai.vmhost.model.db.exceptions.AlreadyExistsException;
import ai.vmhost.virtualizer.model.CatalogEntry;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

@Singleton
public class VirtualizerDaoImpl implements VirtualizerDao {
    private static final Logger LOG = LogManager.getLogger(VirtualizerDaoImpl.class);

    private static final String QUERY_EXISTS = """
        SELECT 1
        FROM virtualizers
        WHERE name = ?""";

    private static final String QUERY_INSERT = """
        INSERT INTO virtualizers (name, type, data)
        VALUES (?, ?, ?)""";

    private static final String QUERY_SELECT = """
        SELECT name, type, data
        FROM virtualizers
        WHERE name = ?""";

    private static final String QUERY_SELECT_ALL = """
        SELECT name, type, data
        FROM virtualizers
        ORDER BY name""";

    private static final String QUERY_DELETE = """
        DELETE FROM virtualizers
        WHERE name = ?""";

    private final Storage storage;

    public VirtualizerDaoImpl(CatalogStorage storage) {
        this.storage = storage;
    }

    @Override
    public void create(CatalogEntry entry, @Nullable TransactionHandle transaction) throws SQLException {
        DbHelper.withRetries(LOG, () -> {
            try (var tx = TransactionHandle.getOrCreate(storage, transaction)) {
                var con = tx.connect();
                try (var st = con.prepareStatement(QUERY_EXISTS)) {
                    st.setString(1, entry.name());
                    if (st.executeQuery().next()) {
                        throw alreadyExists(entry.name());
                    }
                }
                try (var st = con.prepareStatement(QUERY_INSERT)) {
                    st.setString(1, entry.name());
                    st.setString(2, entry.type());
                    st.setBytes(3, entry.data());
                    st.executeUpdate();
                } catch (SQLException e) {
                    if (DbHelper.isUniqueViolation(e)) {
                        throw alreadyExists(entry.name());
                    }
                    throw e;
                }
                tx.commit();
            }
        });
    }

    @Override
    @Nullable
    public CatalogEntry get(String name, @Nullable TransactionHandle transaction) throws SQLException {
        return DbHelper.withRetries(LOG, () -> {
            try (var tx = TransactionHandle.getOrCreate(storage, transaction);
                 var st = tx.connect().prepareStatement(QUERY_SELECT))
            {
                st.setString(1, name);
                var rs = st.executeQuery();
                return rs.next() ? read(rs) : null;
            }
        });
    }

    @Override
    public boolean delete(String name, @Nullable TransactionHandle transaction) throws SQLException {
        return DbHelper.withRetries(LOG, () -> {
            try (var tx = TransactionHandle.getOrCreate(storage, transaction)) {
                int deleted;
                try (var st = tx.connect().prepareStatement(QUERY_DELETE)) {
                    st.setString(1, name);
                    deleted = st.executeUpdate();
                }
                tx.commit();
                return deleted > 0;
            }
        });
    }

    @Override
    public List<CatalogEntry> list(@Nullable TransactionHandle transaction) throws SQLException {
        return DbHelper.withRetries(LOG, () -> {
            try (var tx = TransactionHandle.getOrCreate(storage, transaction);
                 var st = tx.connect().prepareStatement(QUERY_SELECT_ALL))
            {
                var rs = st.executeQuery();
                var entries = new ArrayList<CatalogEntry>();
                while (rs.next()) {
                    entries.add(read(rs));
                }
                return entries;
            }
        });
    }

    private static CatalogEntry read(ResultSet rs) throws SQLException {
        return new CatalogEntry(rs.getString("name"), rs.getString("type"), rs.getBytes("data"));
    }

    private static AlreadyExistsException alreadyExists(String name) {
        return new AlreadyExistsException("virtualizer named '%s' already exists".formatted(name));
    }
}
