package store;

import java.sql.Connection;
import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import util.PasswordUtil;

/**
 * 示例用户，--reset-db 启动时写入
 */
public final class SampleData {
    private static final Logger log = LoggerFactory.getLogger(SampleData.class);

    // name, email, password
    static final String[][] SAMPLE_USERS = {
        {"John Doe", "john@example.com", "password123"},
        {"Jane Smith", "jane@example.com", "secret456"},
        {"Bob Johnson", "bob@example.com", "qwerty789"},
        {"Diana Prince", "diana@example.com", "securepass"},
        {"Eve Adams", "eve@example.com", "evepassword"}
    };

    private SampleData() {
    }

    public static int seed(Database database, UserRepository repository, PasswordUtil passwordUtil) throws SQLException {
        try (Connection c = database.open()) {
            c.setAutoCommit(false);
            try {
                for (String[] user : SAMPLE_USERS) {
                    repository.insert(c, user[0], user[1], passwordUtil.hashPassword(user[2]));
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        }
        log.info("已写入 {} 个示例用户", SAMPLE_USERS.length);
        return SAMPLE_USERS.length;
    }
}
