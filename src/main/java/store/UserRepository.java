package store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import service.User;

/**
 * users表的SQL操作。所有语句都参数化，连接由调用方提供并负责关闭。
 */
public class UserRepository {

    public List<User> findAll(Connection c) throws SQLException {
        String sql = "SELECT id, name, email FROM users ORDER BY id";
        try (PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            return mapPublic(rs);
        }
    }

    public Optional<User> findById(Connection c, long id) throws SQLException {
        String sql = "SELECT id, name, email FROM users WHERE id = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new User(rs.getLong("id"), rs.getString("name"), rs.getString("email")));
            }
        }
    }

    // 登录用，包含password_hash
    public Optional<User> findCredentialsByEmail(Connection c, String email) throws SQLException {
        String sql = "SELECT id, name, email, password_hash FROM users WHERE email = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, email);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new User(
                    rs.getLong("id"),
                    rs.getString("name"),
                    rs.getString("email"),
                    rs.getString("password_hash")
                ));
            }
        }
    }

    public boolean existsById(Connection c, long id) throws SQLException {
        String sql = "SELECT 1 FROM users WHERE id = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * 邮箱是否已被其他用户占用（排除excludeId自己）
     */
    public boolean isEmailTakenByOther(Connection c, String email, long excludeId) throws SQLException {
        String sql = "SELECT 1 FROM users WHERE email = ? AND id <> ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, email);
            ps.setLong(2, excludeId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * @return 数据库分配的id
     */
    public long insert(Connection c, String name, String email, String passwordHash) throws SQLException {
        String sql = "INSERT INTO users (name, email, password_hash) VALUES (?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, name);
            ps.setString(2, email);
            ps.setString(3, passwordHash);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("INSERT into users returned no generated id");
                }
                return keys.getLong(1);
            }
        }
    }

    /**
     * 只更新非null的字段，name和email都为null时不执行任何语句
     * @return 受影响的行数
     */
    public int update(Connection c, long id, String name, String email) throws SQLException {
        List<String> assignments = new ArrayList<>();
        List<String> params = new ArrayList<>();
        if (name != null) {
            assignments.add("name = ?");
            params.add(name);
        }
        if (email != null) {
            assignments.add("email = ?");
            params.add(email);
        }
        if (assignments.isEmpty()) {
            return 0;
        }

        String sql = "UPDATE users SET " + String.join(", ", assignments) + " WHERE id = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            for (String param : params) {
                ps.setString(i++, param);
            }
            ps.setLong(i, id);
            return ps.executeUpdate();
        }
    }

    public int deleteById(Connection c, long id) throws SQLException {
        String sql = "DELETE FROM users WHERE id = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            return ps.executeUpdate();
        }
    }

    /**
     * 按名字做不区分大小写的子串匹配（Unicode大小写折叠），查询按字面匹配，%和_不是通配符
     */
    public List<User> searchByName(Connection c, String query) throws SQLException {
        String sql = "SELECT id, name, email FROM users WHERE instr("
            + Database.FOLD_CASE_FUNCTION + "(name), ?) > 0 ORDER BY id";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, Database.foldCase(query));
            try (ResultSet rs = ps.executeQuery()) {
                return mapPublic(rs);
            }
        }
    }

    private static List<User> mapPublic(ResultSet rs) throws SQLException {
        List<User> users = new ArrayList<>();
        while (rs.next()) {
            users.add(new User(rs.getLong("id"), rs.getString("name"), rs.getString("email")));
        }
        return users;
    }
}
