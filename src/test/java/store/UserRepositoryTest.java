package store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import service.User;

class UserRepositoryTest {
    @TempDir
    Path dir;

    private final UserRepository repository = new UserRepository();
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
    void insertAssignsIncreasingIdsAndFindAllKeepsIdOrder() throws SQLException {
        long first = repository.insert(conn, "John Doe", "john@example.com", "h1");
        long second = repository.insert(conn, "Jane Smith", "jane@example.com", "h2");

        assertThat(second).isGreaterThan(first);
        List<User> users = repository.findAll(conn);
        assertThat(users).extracting(User::getId).containsExactly(first, second);
        assertThat(users).extracting(User::getPasswordHash).containsOnlyNulls();
    }

    @Test
    void findByIdDoesNotLoadTheHash() throws SQLException {
        long id = repository.insert(conn, "Alice", "a@x.com", "secret-hash");

        Optional<User> user = repository.findById(conn, id);
        assertThat(user).isPresent();
        assertThat(user.get().getName()).isEqualTo("Alice");
        assertThat(user.get().getEmail()).isEqualTo("a@x.com");
        assertThat(user.get().getPasswordHash()).isNull();
        assertThat(repository.findById(conn, id + 100)).isEmpty();
    }

    @Test
    void credentialsLookupReturnsTheHash() throws SQLException {
        long id = repository.insert(conn, "Alice", "a@x.com", "secret-hash");

        User user = repository.findCredentialsByEmail(conn, "a@x.com").orElseThrow();
        assertThat(user.getId()).isEqualTo(id);
        assertThat(user.getPasswordHash()).isEqualTo("secret-hash");
        // 邮箱区分大小写
        assertThat(repository.findCredentialsByEmail(conn, "A@X.COM")).isEmpty();
    }

    @Test
    void duplicateEmailIsAConstraintViolation() throws SQLException {
        repository.insert(conn, "Alice", "a@x.com", "h1");

        assertThatThrownBy(() -> repository.insert(conn, "Other", "a@x.com", "h2"))
            .isInstanceOfSatisfying(SQLException.class, e -> assertThat(SqlErrors.isConstraintViolation(e)).isTrue());
        assertThat(repository.findAll(conn)).hasSize(1);
    }

    @Test
    void emailTakenCheckExcludesOwnRow() throws SQLException {
        long alice = repository.insert(conn, "Alice", "a@x.com", "h1");
        long bob = repository.insert(conn, "Bob", "b@x.com", "h2");

        assertThat(repository.isEmailTakenByOther(conn, "a@x.com", alice)).isFalse();
        assertThat(repository.isEmailTakenByOther(conn, "a@x.com", bob)).isTrue();
        assertThat(repository.isEmailTakenByOther(conn, "c@x.com", bob)).isFalse();
    }

    @Test
    void updateChangesOnlyProvidedFields() throws SQLException {
        long id = repository.insert(conn, "Alice", "a@x.com", "h1");

        assertThat(repository.update(conn, id, "Alicia", null)).isEqualTo(1);
        assertThat(repository.findById(conn, id).orElseThrow().getEmail()).isEqualTo("a@x.com");

        assertThat(repository.update(conn, id, null, "alicia@x.com")).isEqualTo(1);
        User user = repository.findById(conn, id).orElseThrow();
        assertThat(user.getName()).isEqualTo("Alicia");
        assertThat(user.getEmail()).isEqualTo("alicia@x.com");

        assertThat(repository.update(conn, id, null, null)).isZero();
        assertThat(repository.update(conn, id + 1, "Nobody", null)).isZero();
    }

    @Test
    void deleteReportsAffectedRows() throws SQLException {
        long id = repository.insert(conn, "Alice", "a@x.com", "h1");

        assertThat(repository.existsById(conn, id)).isTrue();
        assertThat(repository.deleteById(conn, id)).isEqualTo(1);
        assertThat(repository.deleteById(conn, id)).isZero();
        assertThat(repository.existsById(conn, id)).isFalse();
    }

    @Test
    void searchIsCaseInsensitiveSubstringMatch() throws SQLException {
        long john = repository.insert(conn, "John Doe", "john@example.com", "h");
        repository.insert(conn, "Jane Smith", "jane@example.com", "h");
        long bob = repository.insert(conn, "Bob Johnson", "bob@example.com", "h");

        assertThat(repository.searchByName(conn, "joh")).extracting(User::getId).containsExactly(john, bob);
        assertThat(repository.searchByName(conn, "DOE")).extracting(User::getId).containsExactly(john);
        assertThat(repository.searchByName(conn, "hn d")).extracting(User::getId).containsExactly(john);
        assertThat(repository.searchByName(conn, "zzz")).isEmpty();
    }

    @Test
    void searchTreatsWildcardsLiterally() throws SQLException {
        repository.insert(conn, "John Doe", "john@example.com", "h");
        long percent = repository.insert(conn, "100% Real", "real@example.com", "h");

        assertThat(repository.searchByName(conn, "%")).extracting(User::getId).containsExactly(percent);
        assertThat(repository.searchByName(conn, "_")).isEmpty();
        assertThat(repository.searchByName(conn, "\\")).isEmpty();
    }

    @Test
    void searchFoldsNonAsciiCase() throws SQLException {
        long emile = repository.insert(conn, "Émile Zola", "emile@example.com", "h");
        long sophie = repository.insert(conn, "SOPHIE MÜLLER", "sophie@example.com", "h");
        repository.insert(conn, "Emile Plain", "plain@example.com", "h");

        assertThat(repository.searchByName(conn, "émile")).extracting(User::getId).containsExactly(emile);
        assertThat(repository.searchByName(conn, "ÉMILE")).extracting(User::getId).containsExactly(emile);
        assertThat(repository.searchByName(conn, "müller")).extracting(User::getId).containsExactly(sophie);
    }
}
