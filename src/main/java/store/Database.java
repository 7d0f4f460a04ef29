package store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.Function;

/**
 * SQLite数据库文件。每个请求通过open()获取自己的连接，用完即关，不在请求之间共享。
 */
public class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private static final String CREATE_USERS_TABLE =
        "CREATE TABLE IF NOT EXISTS users ("
            + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " name TEXT NOT NULL,"
            + " email TEXT NOT NULL UNIQUE,"
            + " password_hash TEXT NOT NULL"
            + ")";

    // SQLite的LIKE和lower()只处理ASCII，名字匹配改用这个函数做Unicode大小写折叠
    static final String FOLD_CASE_FUNCTION = "fold_case";

    private final Path file;
    private final String url;

    public Database(Path file) {
        this.file = file;
        this.url = "jdbc:sqlite:" + file.toAbsolutePath();
    }

    /**
     * 打开一个新连接，调用方负责关闭（try-with-resources）
     */
    public Connection open() throws SQLException {
        ensureParentDir();
        Connection c = DriverManager.getConnection(url);
        try (Statement st = c.createStatement()) {
            st.execute("PRAGMA foreign_keys=ON;");
            st.execute("PRAGMA busy_timeout=5000;");
            Function.create(c, FOLD_CASE_FUNCTION, new FoldCase());
        } catch (SQLException e) {
            c.close();
            throw e;
        }
        return c;
    }

    /**
     * 表不存在时创建
     */
    public void initSchema() throws SQLException {
        try (Connection c = open(); Statement st = c.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL;");
            st.executeUpdate(CREATE_USERS_TABLE);
        }
        log.info("数据库表结构已就绪: {}", file.toAbsolutePath());
    }

    /**
     * 删除数据库文件（包括WAL文件）并重建表结构
     */
    public void recreate() throws IOException, SQLException {
        for (String suffix : new String[] {"", "-wal", "-shm"}) {
            Path p = Path.of(file.toString() + suffix);
            if (Files.deleteIfExists(p)) {
                log.info("已删除数据库文件: {}", p);
            }
        }
        initSchema();
    }

    private void ensureParentDir() throws SQLException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SQLException("Failed to create database directory: " + parent, e);
        }
    }

    static String foldCase(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static final class FoldCase extends Function {
        @Override
        protected void xFunc() throws SQLException {
            if (args() != 1) {
                throw new SQLException(FOLD_CASE_FUNCTION + " expects 1 argument, got " + args());
            }
            result(foldCase(value_text(0)));
        }
    }
}
