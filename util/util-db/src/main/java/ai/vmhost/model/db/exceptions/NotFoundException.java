package ai.vmhost.model.db.exceptions;

import java.sql.SQLException;

public class NotFoundException extends SQLException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
