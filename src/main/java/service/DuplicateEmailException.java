package service;

// 邮箱已被占用（由数据库唯一约束或更新前的检查触发）
public class DuplicateEmailException extends RuntimeException {
    public DuplicateEmailException(String email) {
        super("Email already in use: " + email);
    }

    public DuplicateEmailException(String email, Throwable cause) {
        super("Email already in use: " + email, cause);
    }
}
