package app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import handlers.ApiError;
import handlers.ErrorKind;
import handlers.UserHandler;
import io.javalin.http.HandlerType;
import service.UserService;
import store.Database;
import store.UserRepository;
import util.PasswordUtil;

class RouteTableTest {

    @Test
    void parsesNonNegativeIntegerIds() {
        assertThat(RouteTable.parseUserId("42")).isEqualTo(42L);
        assertThat(RouteTable.parseUserId("0")).isZero();
        assertThat(RouteTable.parseUserId("9223372036854775807")).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void nonNumericIdsAreRouteNotFound() {
        for (String raw : new String[] {"abc", "-1", "1.5", "", " 1", "9223372036854775808", "99999999999999999999"}) {
            assertThatThrownBy(() -> RouteTable.parseUserId(raw))
                .as("id %s", raw)
                .isInstanceOfSatisfying(ApiError.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.ROUTE_NOT_FOUND);
                    assertThat(e.getStatus()).isEqualTo(404);
                });
        }
    }

    @Test
    void userRoutesMustDeclareTheIdParameter() {
        RouteTable table = new RouteTable(new Database(Path.of("unused.db")));

        assertThatThrownBy(() -> table.addUserRoute(HandlerType.GET, "/user/{name}", "x", (ctx, conn, id) -> { }))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void applicationRegistersTheFullRouteTable() {
        Database database = new Database(Path.of("unused.db"));
        UserHandler handler = new UserHandler(new UserService(new UserRepository(), new PasswordUtil(4)));

        List<RouteTable.Route> routes = Application.buildRoutes(database, handler).getRoutes();

        assertThat(routes).extracting(r -> r.getMethod() + " " + r.getPath()).containsExactly(
            "GET /",
            "GET /users",
            "POST /users",
            "GET /user/{id}",
            "PUT /user/{id}",
            "DELETE /user/{id}",
            "GET /search",
            "POST /login");
    }
}
