package app;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.UUID;

import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.google.gson.Gson;

import config.ServerConfig;
import handlers.RequestStage;
import handlers.UserHandler;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import service.UserService;
import store.Database;
import store.SampleData;
import store.UserRepository;
import util.GsonJsonMapper;
import util.PasswordUtil;

public class Application {
    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static final String REQUEST_ID = "requestId";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    public static void main(String[] args) throws Exception {
        // 加载配置文件
        String configPath = System.getProperty("config.path", "config/server-config.properties");
        ServerConfig.loadPropertiesConfig(configPath);

        int port = ServerConfig.getInt(ServerConfig.PORT, 5000);
        String host = ServerConfig.getString(ServerConfig.ADDRESS, "0.0.0.0");
        int maxThreads = ServerConfig.getInt(ServerConfig.MAX_THREADS, 200);
        boolean httpLogEnabled = ServerConfig.getBoolean(ServerConfig.HTTP_LOG_ENABLED, true);
        String databasePath = ServerConfig.getString(ServerConfig.DATABASE_PATH, "users.db");
        int bcryptRounds = ServerConfig.getInt(ServerConfig.BCRYPT_ROUNDS, PasswordUtil.DEFAULT_LOG_ROUNDS);

        Database database = new Database(Path.of(databasePath));
        PasswordUtil passwordUtil = new PasswordUtil(bcryptRounds);

        // --reset-db：删除旧数据库并写入示例用户
        if (Arrays.asList(args).contains("--reset-db")) {
            database.recreate();
            SampleData.seed(database, new UserRepository(), passwordUtil);
        } else {
            database.initSchema();
        }

        Javalin app = createApp(database, passwordUtil, httpLogEnabled, maxThreads).start(host, port);
        Runtime.getRuntime().addShutdownHook(new Thread(app::stop));
        log.info("User Management System API listening on {}:{}", host, app.port());
    }

    /**
     * 创建但不启动应用，测试中用 start(0) 在随机端口启动
     */
    public static Javalin createApp(Database database, PasswordUtil passwordUtil, boolean httpLogEnabled, int maxThreads) {
        UserService userService = new UserService(new UserRepository(), passwordUtil);
        UserHandler userHandler = new UserHandler(userService);

        Javalin app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jsonMapper(new GsonJsonMapper(new Gson()));
            // 路径存在但方法不对时返回405而不是404
            config.prefer405over404 = true;

            // 如果启用HTTP日志，每个请求记录一行
            if (httpLogEnabled) {
                config.requestLogger((ctx, executionTimeMs) -> log.info("{} {} -> {} ({} ms) [{}]",
                    ctx.method(), ctx.path(), ctx.status(), Math.round(executionTimeMs), ctx.attribute(REQUEST_ID)));
            }

            // 设置最大线程数
            config.server(() -> new Server(new QueuedThreadPool(maxThreads)));
        });

        app.before(ctx -> {
            // 为每个请求生成唯一 ID
            String requestId = UUID.randomUUID().toString();
            ctx.attribute(REQUEST_ID, requestId);
            ctx.header(REQUEST_ID_HEADER, requestId);
            MDC.put(REQUEST_ID, requestId);
            RequestStage.advance(ctx, RequestStage.RECEIVED);
        });

        app.after(ctx -> MDC.remove(REQUEST_ID));

        ErrorMapper.register(app);
        buildRoutes(database, userHandler).registerOn(app);
        return app;
    }

    static RouteTable buildRoutes(Database database, UserHandler userHandler) {
        return new RouteTable(database)
            // 健康检查
            .add(HandlerType.GET, "/", userHandler::health)
            // 用户列表与创建
            .addStoreRoute(HandlerType.GET, "/users", "Failed to retrieve users.", userHandler::listUsers)
            .addStoreRoute(HandlerType.POST, "/users", "Failed to create user.", userHandler::createUser)
            // 单个用户
            .addUserRoute(HandlerType.GET, "/user/{id}", "Failed to retrieve user.", userHandler::getUser)
            .addUserRoute(HandlerType.PUT, "/user/{id}", "Failed to update user.", userHandler::updateUser)
            .addUserRoute(HandlerType.DELETE, "/user/{id}", "Failed to delete user.", userHandler::deleteUser)
            // 搜索与登录
            .addStoreRoute(HandlerType.GET, "/search", "Failed to search users.", userHandler::searchUsers)
            .addStoreRoute(HandlerType.POST, "/login", "An error occurred during login.", userHandler::login);
    }
}
