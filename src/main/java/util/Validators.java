package util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 请求参数校验。所有方法都是纯函数，不抛异常，返回值由处理器决定如何响应。
 */
public final class Validators {
    public static final int MIN_PASSWORD_LENGTH = 8;

    private static final Pattern EMAIL_PATTERN =
        Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private Validators() {
    }

    // 验证邮箱格式 local@domain.tld
    public static boolean validateEmail(String email) {
        return email != null && EMAIL_PATTERN.matcher(email).matches();
    }

    // 验证密码长度，按码点计数
    public static boolean validatePasswordStrength(String password) {
        return password != null && password.codePointCount(0, password.length()) >= MIN_PASSWORD_LENGTH;
    }

    /**
     * 返回缺失的字段名（不存在、为null或为空字符串），保持names的顺序。
     */
    public static Set<String> validateRequiredFields(Map<String, String> payload, Collection<String> names) {
        Set<String> missing = new LinkedHashSet<>();
        for (String name : names) {
            String value = payload == null ? null : payload.get(name);
            if (value == null || value.isEmpty()) {
                missing.add(name);
            }
        }
        return missing;
    }
}
