package service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import store.Database;
import store.UserRepository;
import util.PasswordUtil;

class UserServiceTest {
    @TempDir
    Path dir;

    private final UserRepository repository = new UserRepository();
    private final UserService userService = new UserService(repository, new PasswordUtil(4));
    private Connection conn;

    @BeforeEach
    void setUp() throws SQLException {
        Database database = new Database(dir.resolve("users.db"));
        database.initSchema();
        conn = database.open();
    }

    @AfterEach
    void tearDown() throws SQLException {
        conn.close();
    }

    @Test
    void createStoresAHashNotThePassword() throws SQLException {
        long id = userService.createUser(conn, "Alice", "a@x.com", "longenough1");

        User stored = repository.findCredentialsByEmail(conn, "a@x.com").orElseThrow();
        assertThat(stored.getId()).isEqualTo(id);
        assertThat(stored.getPasswordHash()).startsWith("$2a$").isNotEqualTo("longenough1");
    }

    @Test
    void duplicateCreateRaisesDuplicateEmail() throws SQLException {
        userService.createUser(conn, "Alice", "a@x.com", "longenough1");

        assertThatThrownBy(() -> userService.createUser(conn, "Alice Again", "a@x.com", "longenough2"))
            .isInstanceOf(DuplicateEmailException.class);
        assertThat(userService.listUsers(conn)).hasSize(1);
    }

    @Test
    void updateWithOwnEmailSucceeds() throws SQLException {
        long id = userService.createUser(conn, "Alice", "a@x.com", "longenough1");

        assertThat(userService.updateUser(conn, id, null, "a@x.com")).isEqualTo(UserService.UpdateOutcome.UPDATED);
        assertThat(userService.updateUser(conn, id, "Alicia", "a@x.com")).isEqualTo(UserService.UpdateOutcome.UPDATED);
        assertThat(userService.getUser(conn, id).orElseThrow().getName()).isEqualTo("Alicia");
    }

    @Test
    void updateWithAnotherUsersEmailConflicts() throws SQLException {
        userService.createUser(conn, "Alice", "a@x.com", "longenough1");
        long bob = userService.createUser(conn, "Bob", "b@x.com", "longenough1");

        assertThatThrownBy(() -> userService.updateUser(conn, bob, null, "a@x.com"))
            .isInstanceOf(DuplicateEmailException.class);
        assertThat(userService.getUser(conn, bob).orElseThrow().getEmail()).isEqualTo("b@x.com");
    }

    @Test
    void updateOfMissingUserIsNotFound() throws SQLException {
        assertThat(userService.updateUser(conn, 999, "Ghost", null)).isEqualTo(UserService.UpdateOutcome.NOT_FOUND);
    }

    @Test
    void authenticateDoesNotDistinguishFailureCauses() throws SQLException {
        long id = userService.createUser(conn, "Alice", "a@x.com", "longenough1");

        assertThat(userService.authenticate(conn, "a@x.com", "longenough1")).contains(id);
        assertThat(userService.authenticate(conn, "a@x.com", "wrongpassword")).isEmpty();
        assertThat(userService.authenticate(conn, "nobody@x.com", "longenough1")).isEmpty();
    }

    @Test
    void deleteIsIdempotentlyFalseForMissingRows() throws SQLException {
        long id = userService.createUser(conn, "Alice", "a@x.com", "longenough1");

        assertThat(userService.deleteUser(conn, id)).isTrue();
        assertThat(userService.deleteUser(conn, id)).isFalse();
        assertThat(userService.deleteUser(conn, id)).isFalse();
    }
}
