package handlers;

/**
 * 处理器流水线中的提前退出。抛出后由异常映射器直接生成错误响应，
 * 不会重试也不会回到之前的阶段。
 */
public class ApiError extends RuntimeException {
    private final ErrorKind kind;
    private final String category;

    public ApiError(ErrorKind kind, String category, String message) {
        this(kind, category, message, null);
    }

    public ApiError(ErrorKind kind, String category, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.category = category;
    }

    public static ApiError validation(String category, String message) {
        return new ApiError(ErrorKind.VALIDATION, category, message);
    }

    public static ApiError malformedBody() {
        return new ApiError(ErrorKind.MALFORMED_REQUEST, "Invalid JSON", "Request body must be valid JSON.");
    }

    public static ApiError userNotFound() {
        return new ApiError(ErrorKind.NOT_FOUND, null, "User not found");
    }

    public static ApiError routeNotFound() {
        return new ApiError(ErrorKind.ROUTE_NOT_FOUND, "Not Found", "Endpoint not found.");
    }

    public static ApiError methodNotAllowed() {
        return new ApiError(ErrorKind.METHOD_NOT_ALLOWED, "Method Not Allowed", "Method not allowed for this endpoint.");
    }

    public static ApiError conflict(String message) {
        return new ApiError(ErrorKind.CONFLICT, "Conflict", message);
    }

    // 登录失败只返回一条通用信息，不区分邮箱不存在还是密码错误
    public static ApiError invalidCredentials() {
        return new ApiError(ErrorKind.AUTH, "Unauthorized", "Invalid email or password.");
    }

    public static ApiError store(String message, Throwable cause) {
        return new ApiError(ErrorKind.STORE, "Database Error", message, cause);
    }

    // 未预期的异常，cause只写日志，不返回给客户端
    public static ApiError internal(Throwable cause) {
        return new ApiError(ErrorKind.INTERNAL, "Internal Server Error", "Something went wrong on the server.", cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getStatus() {
        return kind.getStatus();
    }

    // 可能为null：记录不存在时响应体只有message
    public String getCategory() {
        return category;
    }
}
