package service;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import store.SqlErrors;
import store.UserRepository;
import util.PasswordUtil;

/**
 * 用户相关的数据库操作和密码处理。调用方传入当前请求的连接。
 */
public class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    public enum UpdateOutcome { UPDATED, NOT_FOUND }

    private final UserRepository repository;
    private final PasswordUtil passwordUtil;
    // 邮箱不存在时也做一次哈希校验，使两种失败的耗时接近
    private final String dummyHash;

    public UserService(UserRepository repository, PasswordUtil passwordUtil) {
        this.repository = repository;
        this.passwordUtil = passwordUtil;
        this.dummyHash = passwordUtil.hashPassword("dummy-password-for-timing");
    }

    public List<User> listUsers(Connection c) throws SQLException {
        return repository.findAll(c);
    }

    public Optional<User> getUser(Connection c, long id) throws SQLException {
        return repository.findById(c, id);
    }

    public boolean userExists(Connection c, long id) throws SQLException {
        return repository.existsById(c, id);
    }

    public List<User> searchByName(Connection c, String query) throws SQLException {
        return repository.searchByName(c, query);
    }

    /**
     * 创建用户，密码在写入前哈希
     * @return 新用户的id
     * @throws DuplicateEmailException 违反唯一约束时
     */
    public long createUser(Connection c, String name, String email, String password) throws SQLException {
        String passwordHash = passwordUtil.hashPassword(password);
        try {
            long id = repository.insert(c, name, email, passwordHash);
            log.info("User created: {}, ID: {}", email, id);
            return id;
        } catch (SQLException e) {
            if (SqlErrors.isConstraintViolation(e)) {
                throw new DuplicateEmailException(email, e);
            }
            throw e;
        }
    }

    /**
     * 更新name和/或email（为null的字段不变）。与自己当前的邮箱相同不算冲突。
     * @throws DuplicateEmailException 邮箱属于其他用户时
     */
    public UpdateOutcome updateUser(Connection c, long id, String name, String email) throws SQLException {
        if (!userExists(c, id)) {
            return UpdateOutcome.NOT_FOUND;
        }
        if (email != null && repository.isEmailTakenByOther(c, email, id)) {
            throw new DuplicateEmailException(email);
        }
        try {
            int rows = repository.update(c, id, name, email);
            if (rows == 0) {
                // 检查和更新之间被其他请求删除
                return UpdateOutcome.NOT_FOUND;
            }
        } catch (SQLException e) {
            if (SqlErrors.isConstraintViolation(e)) {
                throw new DuplicateEmailException(email, e);
            }
            throw e;
        }
        log.info("User {} updated.", id);
        return UpdateOutcome.UPDATED;
    }

    public boolean deleteUser(Connection c, long id) throws SQLException {
        boolean deleted = repository.deleteById(c, id) > 0;
        if (deleted) {
            log.info("User {} deleted.", id);
        }
        return deleted;
    }

    /**
     * 校验邮箱和密码
     * @return 成功时返回用户id；邮箱不存在或密码错误都返回empty
     */
    public Optional<Long> authenticate(Connection c, String email, String password) throws SQLException {
        Optional<User> user = repository.findCredentialsByEmail(c, email);
        if (user.isEmpty()) {
            passwordUtil.checkPassword(password, dummyHash);
            return Optional.empty();
        }
        if (!passwordUtil.checkPassword(password, user.get().getPasswordHash())) {
            return Optional.empty();
        }
        return Optional.of(user.get().getId());
    }
}
