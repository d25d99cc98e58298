package ai.vmhost.model.db;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.sql.SQLException;

public class StorageImplTest {

    private StorageImpl storage;

    @Before
    public void setUp() {
        var config = new DatabaseConfiguration();
        config.setUrl("jdbc:h2:mem:storage_test;MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        config.setUsername("test");
        config.setPassword("");
        storage = new StorageImpl(config, "classpath:db/test/migrations") {};
    }

    @After
    public void tearDown() throws SQLException {
        if (storage == null) {
            return;
        }
        try (var conn = storage.connect(); var st = conn.createStatement()) {
            st.execute("DELETE FROM items");
        }
        storage.close();
    }

    @Test
    public void uncommittedTransactionIsRolledBack() throws Exception {
        try (var tx = TransactionHandle.create(storage)) {
            insert(tx, "a");
        }
        Assert.assertEquals(0, count());

        try (var tx = TransactionHandle.create(storage)) {
            insert(tx, "a");
            tx.commit();
        }
        Assert.assertEquals(1, count());
    }

    @Test
    public void nestedHandleJoinsOuterTransaction() throws Exception {
        try (var outer = TransactionHandle.create(storage)) {
            try (var inner = TransactionHandle.getOrCreate(storage, outer)) {
                insert(inner, "b");
                inner.commit();
            }
            Assert.assertEquals(0, count());
            outer.commit();
        }
        Assert.assertEquals(1, count());
    }

    @Test
    public void duplicateKeyIsUniqueViolation() throws Exception {
        try (var tx = TransactionHandle.create(storage)) {
            insert(tx, "c");
            tx.commit();
        }
        try (var tx = TransactionHandle.create(storage)) {
            insert(tx, "c");
            Assert.fail();
        } catch (SQLException e) {
            Assert.assertTrue(DbHelper.isUniqueViolation(e));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingUrl() {
        new StorageImpl(new DatabaseConfiguration(), "classpath:db/test/migrations") {};
    }

    private static void insert(TransactionHandle tx, String id) throws SQLException {
        try (var st = tx.connect().prepareStatement("INSERT INTO items (id, payload) VALUES (?, ?)")) {
            st.setString(1, id);
            st.setString(2, "payload-" + id);
            st.executeUpdate();
        }
    }

    private int count() throws SQLException {
        try (var conn = storage.connect();
             var rs = conn.createStatement().executeQuery("SELECT count(*) FROM items"))
        {
            rs.next();
            return rs.getInt(1);
        }
    }
}
