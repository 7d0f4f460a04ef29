package app;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import handlers.ApiError;
import handlers.ErrorKind;
import handlers.RequestStage;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpResponseException;

/**
 * 把各类失败转换为固定的状态码和JSON响应体 {"error": ..., "message": ...}。
 * 用户不存在时只返回 {"message": "User not found"}，与旧客户端保持兼容。
 */
public final class ErrorMapper {
    private static final Logger log = LoggerFactory.getLogger(ErrorMapper.class);

    private ErrorMapper() {
    }

    public static void register(Javalin app) {
        app.exception(ApiError.class, ErrorMapper::handleApiError);
        app.exception(HttpResponseException.class, ErrorMapper::handleHttpResponse);
        app.exception(Exception.class, ErrorMapper::handleUnexpected);
    }

    static Map<String, Object> toBody(ApiError e) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (e.getCategory() != null) {
            body.put("error", e.getCategory());
        }
        if (e.getKind() == ErrorKind.AUTH) {
            body.put("status", "failed");
        }
        body.put("message", e.getMessage());
        return body;
    }

    private static void handleApiError(ApiError e, Context ctx) {
        RequestStage failedAt = RequestStage.current(ctx);
        if (e.getKind() != ErrorKind.STORE) {
            // STORE类错误在路由表里已经带堆栈记录过
            log.info("{} {} -> {} at stage {}: {}", ctx.method(), ctx.path(), e.getStatus(), failedAt, e.getMessage());
        }
        respond(ctx, e);
    }

    // Javalin自身的异常：路由不存在、方法不允许等
    private static void handleHttpResponse(HttpResponseException e, Context ctx) {
        int status = e.getStatus();
        log.info("{} {} -> {}", ctx.method(), ctx.path(), status);
        if (status == ErrorKind.ROUTE_NOT_FOUND.getStatus()) {
            respond(ctx, ApiError.routeNotFound());
        } else if (status == ErrorKind.METHOD_NOT_ALLOWED.getStatus()) {
            respond(ctx, ApiError.methodNotAllowed());
        } else {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", status == 400 ? "Bad Request" : "Error");
            body.put("message", e.getMessage());
            respond(ctx, status, body);
        }
    }

    private static void handleUnexpected(Exception e, Context ctx) {
        log.error("Unhandled error on {} {} at stage {}", ctx.method(), ctx.path(), RequestStage.current(ctx), e);
        respond(ctx, ApiError.internal(e));
    }

    private static void respond(Context ctx, ApiError e) {
        respond(ctx, e.getStatus(), toBody(e));
    }

    private static void respond(Context ctx, int status, Map<String, Object> body) {
        ctx.status(status).json(body);
        RequestStage.advance(ctx, RequestStage.RESPONDED);
    }
}
