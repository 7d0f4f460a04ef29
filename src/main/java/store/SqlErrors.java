package store;

import java.sql.SQLException;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

public final class SqlErrors {

    private SqlErrors() {
    }

    /**
     * 是否为约束冲突（UNIQUE、PRIMARY KEY等）。扩展错误码的低8位是基础错误码。
     */
    public static boolean isConstraintViolation(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLiteException) {
                int code = ((SQLiteException) t).getResultCode().code & 0xff;
                return code == SQLiteErrorCode.SQLITE_CONSTRAINT.code;
            }
        }
        return e.getErrorCode() == SQLiteErrorCode.SQLITE_CONSTRAINT.code;
    }
}
