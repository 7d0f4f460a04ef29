package util;

import org.mindrot.jbcrypt.BCrypt;

/**
 * 密码哈希工具，基于BCrypt。每次哈希使用随机盐，盐和代价参数嵌入在结果中。
 */
public class PasswordUtil {
    public static final int DEFAULT_LOG_ROUNDS = 12;

    private final int logRounds;

    public PasswordUtil() {
        this(DEFAULT_LOG_ROUNDS);
    }

    public PasswordUtil(int logRounds) {
        if (logRounds < 4 || logRounds > 31) {
            throw new IllegalArgumentException("BCrypt log rounds must be between 4 and 31: " + logRounds);
        }
        this.logRounds = logRounds;
    }

    public String hashPassword(String plainTextPassword) { // 对密码进行哈希加密
        return BCrypt.hashpw(plainTextPassword, BCrypt.gensalt(logRounds));
    }

    /**
     * 检查密码是否匹配。checkpw内部做常量时间比较。
     * 哈希值格式错误时返回false而不是抛出异常。
     */
    public boolean checkPassword(String plainTextPassword, String hashedPassword) {
        if (plainTextPassword == null || hashedPassword == null) {
            return false;
        }
        try {
            return BCrypt.checkpw(plainTextPassword, hashedPassword);
        } catch (IllegalArgumentException | StringIndexOutOfBoundsException e) {
            return false;
        }
    }

    public int getLogRounds() {
        return logRounds;
    }
}
