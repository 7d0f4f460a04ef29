package handlers;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.http.Context;
import service.DuplicateEmailException;
import service.User;
import service.UserService;
import util.Validators;

/**
 * 用户相关接口。每个方法都是 解析 → 校验 → 查询 → 响应 的线性流程，
 * 失败时抛出ApiError直接结束请求。
 */
public class UserHandler {
    private static final Logger log = LoggerFactory.getLogger(UserHandler.class);

    public static final String HEALTH_MESSAGE = "User Management System API is running!";

    private static final List<String> CREATE_FIELDS = Arrays.asList("name", "email", "password");
    private static final List<String> LOGIN_FIELDS = Arrays.asList("email", "password");

    private final UserService userService;

    public UserHandler(UserService userService) {
        this.userService = userService;
    }

    // 健康检查API
    public void health(Context ctx) {
        respond(ctx, 200, Collections.singletonMap("message", HEALTH_MESSAGE));
    }

    // 获取所有用户API
    public void listUsers(Context ctx, Connection conn) throws SQLException {
        RequestStage.advance(ctx, RequestStage.VALIDATED);
        List<User> users = userService.listUsers(conn);
        RequestStage.advance(ctx, RequestStage.STORE_QUERIED);

        respond(ctx, 200, Collections.singletonMap("users", toViews(users)));
    }

    // 通过ID获取用户API
    public void getUser(Context ctx, Connection conn, long userId) throws SQLException {
        RequestStage.advance(ctx, RequestStage.VALIDATED);
        Optional<User> user = userService.getUser(conn, userId);
        RequestStage.advance(ctx, RequestStage.STORE_QUERIED);

        if (user.isEmpty()) {
            throw ApiError.userNotFound();
        }
        respond(ctx, 200, Collections.singletonMap("user", user.get().toPublicView()));
    }

    // 创建用户API
    public void createUser(Context ctx, Connection conn) throws SQLException {
        Map<String, String> body = JsonBody.parseObject(ctx.body());
        RequestStage.advance(ctx, RequestStage.PARSED);

        Set<String> missing = Validators.validateRequiredFields(body, CREATE_FIELDS);
        if (!missing.isEmpty()) {
            log.debug("Create user rejected, missing fields: {}", missing);
            throw ApiError.validation("Missing Data", "Name, email, and password are required.");
        }
        String name = body.get("name");
        String email = body.get("email");
        String password = body.get("password");
        if (!Validators.validateEmail(email)) {
            throw invalidEmail();
        }
        if (!Validators.validatePasswordStrength(password)) {
            throw ApiError.validation("Weak Password",
                "Password must be at least " + Validators.MIN_PASSWORD_LENGTH + " characters long.");
        }
        RequestStage.advance(ctx, RequestStage.VALIDATED);

        long id;
        try {
            id = userService.createUser(conn, name, email, password);
        } catch (DuplicateEmailException e) {
            log.warn("Attempted to create user with existing email: {}", email);
            throw ApiError.conflict("User with this email already exists.");
        }
        RequestStage.advance(ctx, RequestStage.STORE_QUERIED);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "User created successfully!");
        response.put("id", id);
        respond(ctx, 201, response);
    }

    // 更新用户API，只允许修改name和email
    public void updateUser(Context ctx, Connection conn, long userId) throws SQLException {
        Map<String, String> body = JsonBody.parseObject(ctx.body());
        RequestStage.advance(ctx, RequestStage.PARSED);

        String name = emptyToNull(body.get("name"));
        String email = emptyToNull(body.get("email"));
        if (name == null && email == null) {
            throw ApiError.validation("No Data", "At least 'name' or 'email' must be provided for update.");
        }
        // 先确认用户存在，再校验邮箱格式
        if (!userService.userExists(conn, userId)) {
            RequestStage.advance(ctx, RequestStage.STORE_QUERIED);
            throw ApiError.userNotFound();
        }
        if (email != null && !Validators.validateEmail(email)) {
            throw invalidEmail();
        }
        RequestStage.advance(ctx, RequestStage.VALIDATED);

        UserService.UpdateOutcome outcome;
        try {
            outcome = userService.updateUser(conn, userId, name, email);
        } catch (DuplicateEmailException e) {
            log.warn("Attempted to update user {} with existing email: {}", userId, email);
            throw ApiError.conflict("Email already in use by another user.");
        }
        RequestStage.advance(ctx, RequestStage.STORE_QUERIED);

        if (outcome == UserService.UpdateOutcome.NOT_FOUND) {
            throw ApiError.userNotFound();
        }
        respond(ctx, 200, Collections.singletonMap("message", "User updated successfully!"));
    }

    // 删除用户API，成功时返回204且没有响应体
    public void deleteUser(Context ctx, Connection conn, long userId) throws SQLException {
        RequestStage.advance(ctx, RequestStage.VALIDATED);
        boolean deleted = userService.deleteUser(conn, userId);
        RequestStage.advance(ctx, RequestStage.STORE_QUERIED);

        if (!deleted) {
            throw ApiError.userNotFound();
        }
        ctx.status(204);
        RequestStage.advance(ctx, RequestStage.RESPONDED);
    }

    // 按名字搜索用户API，没有结果时返回空列表
    public void searchUsers(Context ctx, Connection conn) throws SQLException {
        String query = ctx.queryParam("name");
        RequestStage.advance(ctx, RequestStage.PARSED);
        if (query == null || query.isEmpty()) {
            throw ApiError.validation("Missing Parameter", "Please provide a 'name' query parameter to search.");
        }
        RequestStage.advance(ctx, RequestStage.VALIDATED);

        List<User> users = userService.searchByName(conn, query);
        RequestStage.advance(ctx, RequestStage.STORE_QUERIED);
        log.info("Search for '{}' returned {} results.", query, users.size());

        respond(ctx, 200, Collections.singletonMap("users", toViews(users)));
    }

    // 用户登录API
    public void login(Context ctx, Connection conn) throws SQLException {
        Map<String, String> body = JsonBody.parseObject(ctx.body());
        RequestStage.advance(ctx, RequestStage.PARSED);

        if (!Validators.validateRequiredFields(body, LOGIN_FIELDS).isEmpty()) {
            throw ApiError.validation("Missing Credentials", "Email and password are required.");
        }
        String email = body.get("email");
        RequestStage.advance(ctx, RequestStage.VALIDATED);

        Optional<Long> userId = userService.authenticate(conn, email, body.get("password"));
        RequestStage.advance(ctx, RequestStage.STORE_QUERIED);

        if (userId.isEmpty()) {
            log.warn("Failed login attempt for email: {}", email);
            throw ApiError.invalidCredentials();
        }
        log.info("Login successful for user ID: {}", userId.get());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Login successful!");
        response.put("user_id", userId.get());
        respond(ctx, 200, response);
    }

    private static ApiError invalidEmail() {
        return ApiError.validation("Invalid Email", "Please provide a valid email address.");
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static List<Map<String, Object>> toViews(List<User> users) {
        List<Map<String, Object>> views = new ArrayList<>(users.size());
        for (User user : users) {
            views.add(user.toPublicView());
        }
        return views;
    }

    private static void respond(Context ctx, int status, Object body) {
        ctx.status(status).json(body);
        RequestStage.advance(ctx, RequestStage.RESPONDED);
    }
}
