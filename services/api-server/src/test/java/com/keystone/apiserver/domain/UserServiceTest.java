package com.keystone.apiserver.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.observability.RequestContext;
import com.keystone.observability.RequestContextHolder;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("UserService")
class UserServiceTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final InMemoryUserRepository repository = new InMemoryUserRepository();
    private final UserService service = new UserService(repository, executor);

    private static final UserDetails JOHN = new UserDetails("John", "Doe", "john@example.com");

    @AfterEach
    void cleanup() {
        executor.shutdownNow();
        RequestContextHolder.clear();
    }

    @Test
    @DisplayName("creates, reads, updates and deletes a user")
    void crudRoundTrip() {
        User created = service.createUser(JOHN).join();
        assertThat(service.findUser(created.id()).join()).contains(created);

        var renamed = new UserDetails("Johnny", "Doe", "john@example.com");
        Optional<User> updated = service.updateUser(created.id(), renamed).join();
        assertThat(updated).hasValueSatisfying(user -> assertThat(user.firstName()).isEqualTo("Johnny"));

        assertThat(service.deleteUser(created.id()).join()).isTrue();
        assertThat(service.listUsers().join()).isEmpty();
    }

    @Test
    @DisplayName("reports misses as empty results")
    void misses() {
        assertThat(service.findUser(99).join()).isEmpty();
        assertThat(service.updateUser(99, JOHN).join()).isEmpty();
        assertThat(service.deleteUser(99).join()).isFalse();
    }

    @Test
    @DisplayName("lists users in id order")
    void listsInOrder() {
        service.createUser(JOHN).join();
        service.createUser(new UserDetails("Jane", "Roe", "jane@example.com")).join();

        List<User> users = service.listUsers().join();

        assertThat(users).extracting(User::firstName).containsExactly("John", "Jane");
    }

    @Test
    @DisplayName("runs repository calls with the caller's request id in the MDC")
    void propagatesRequestContext() {
        RequestContextHolder.set(RequestContext.of("req-42"));
        UserRepository probing = new InMemoryUserRepository() {
            @Override
            public List<User> findAll() {
                return List.of(new User(1, MDC.get(RequestContext.MDC_REQUEST_ID), "", "", null, null));
            }
        };

        List<User> users = new UserService(probing, executor).listUsers().join();

        assertThat(users.get(0).firstName()).isEqualTo("req-42");
    }

    @Test
    @DisplayName("surfaces repository failures through the future")
    void repositoryFailure() {
        UserRepository failing = new InMemoryUserRepository() {
            @Override
            public User insert(UserDetails details) {
                throw new IllegalStateException("duplicate email");
            }
        };

        assertThat(new UserService(failing, executor).createUser(JOHN))
                .failsWithin(Duration.ofSeconds(5))
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("requires a repository and an executor")
    void requiresCollaborators() {
        assertThatThrownBy(() -> new UserService(null, executor))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UserService(repository, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
