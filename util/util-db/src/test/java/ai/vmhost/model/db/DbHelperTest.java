package ai.vmhost.model.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Assert;
import org.junit.Test;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

public class DbHelperTest {
    private static final Logger LOG = LogManager.getLogger(DbHelperTest.class);

    @Test
    public void retriesSerializationFailures() throws Exception {
        var calls = new AtomicInteger(0);

        var result = DbHelper.withRetries(new DbHelper.DefaultRetryPolicy(3, 1, 1), LOG, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new SQLException("could not serialize access", "40001");
            }
            return "done";
        });

        Assert.assertEquals("done", result);
        Assert.assertEquals(3, calls.get());
    }

    @Test
    public void givesUpAfterLimit() {
        var calls = new AtomicInteger(0);
        try {
            DbHelper.withRetries(new DbHelper.DefaultRetryPolicy(2, 1, 1), LOG, () -> {
                calls.incrementAndGet();
                throw new SQLException("connection refused", "08001");
            });
            Assert.fail();
        } catch (SQLException e) {
            Assert.assertTrue(e instanceof DbHelper.RetryCountExceededException);
            Assert.assertEquals(3, calls.get());
        }
    }

    @Test
    public void nonRetryableErrorIsRethrown() {
        var calls = new AtomicInteger(0);
        try {
            DbHelper.withRetries(LOG, () -> {
                calls.incrementAndGet();
                throw new SQLException("duplicate key", "23505");
            });
            Assert.fail();
        } catch (SQLException e) {
            Assert.assertTrue(DbHelper.isUniqueViolation(e));
            Assert.assertEquals(1, calls.get());
        }
    }
}
