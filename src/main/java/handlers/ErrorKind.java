package handlers;

// 失败类型与HTTP状态码的固定映射
public enum ErrorKind {
    VALIDATION(400),
    MALFORMED_REQUEST(400),
    AUTH(401),
    NOT_FOUND(404),
    ROUTE_NOT_FOUND(404),
    METHOD_NOT_ALLOWED(405),
    CONFLICT(409),
    STORE(500),
    INTERNAL(500);

    private final int status;

    ErrorKind(int status) {
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
