package app;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import handlers.ApiError;
import handlers.RequestStage;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import store.Database;

/**
 * 显式路由表：(方法, 路径) → 处理器。
 * 需要数据库的路由在进入处理器前打开连接，无论成功还是失败都在请求结束时关闭。
 * 路径中的 {id} 在这里转换为long，非数字id视为路由不存在（404）。
 */
public class RouteTable {
    private static final Logger log = LoggerFactory.getLogger(RouteTable.class);

    public static final String ID_PARAM = "id";
    private static final Pattern ID_PATTERN = Pattern.compile("\\d{1,19}");

    @FunctionalInterface
    public interface StoreHandler {
        void handle(Context ctx, Connection conn) throws SQLException;
    }

    @FunctionalInterface
    public interface UserIdHandler {
        void handle(Context ctx, Connection conn, long userId) throws SQLException;
    }

    public static class Route {
        private final HandlerType method;
        private final String path;
        private final Handler handler;

        Route(HandlerType method, String path, Handler handler) {
            this.method = method;
            this.path = path;
            this.handler = handler;
        }

        public HandlerType getMethod() { return method; }
        public String getPath() { return path; }
        public Handler getHandler() { return handler; }
    }

    private final Database database;
    private final List<Route> routes = new ArrayList<>();

    public RouteTable(Database database) {
        this.database = database;
    }

    // 不访问数据库的路由
    public RouteTable add(HandlerType method, String path, Handler handler) {
        routes.add(new Route(method, path, handler));
        return this;
    }

    /**
     * 访问数据库的路由。SQLException在这里记录日志并转换为500，客户端只看到failureMessage。
     */
    public RouteTable addStoreRoute(HandlerType method, String path, String failureMessage, StoreHandler handler) {
        routes.add(new Route(method, path, ctx -> runScoped(ctx, failureMessage, handler)));
        return this;
    }

    /**
     * 带 {id} 路径参数的访问数据库的路由
     */
    public RouteTable addUserRoute(HandlerType method, String path, String failureMessage, UserIdHandler handler) {
        if (!path.contains("{" + ID_PARAM + "}")) {
            throw new IllegalArgumentException("Route path has no {" + ID_PARAM + "} parameter: " + path);
        }
        routes.add(new Route(method, path, ctx -> {
            long userId = parseUserId(ctx.pathParam(ID_PARAM));
            runScoped(ctx, failureMessage, (c, conn) -> handler.handle(c, conn, userId));
        }));
        return this;
    }

    public List<Route> getRoutes() {
        return Collections.unmodifiableList(routes);
    }

    public void registerOn(Javalin app) {
        for (Route route : routes) {
            app.addHandler(route.getMethod(), route.getPath(), route.getHandler());
        }
    }

    /**
     * 只接受非负整数，其他都当作路由不存在
     */
    static long parseUserId(String raw) {
        if (raw == null || !ID_PATTERN.matcher(raw).matches()) {
            throw ApiError.routeNotFound();
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            // 超出long范围
            throw ApiError.routeNotFound();
        }
    }

    private void runScoped(Context ctx, String failureMessage, StoreHandler handler) {
        try (Connection conn = database.open()) {
            handler.handle(ctx, conn);
        } catch (SQLException e) {
            log.error("Database error on {} {} at stage {}: {}",
                ctx.method(), ctx.path(), RequestStage.current(ctx), e.getMessage(), e);
            throw ApiError.store(failureMessage, e);
        }
    }
}
