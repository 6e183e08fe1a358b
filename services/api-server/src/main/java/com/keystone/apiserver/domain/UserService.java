package com.keystone.apiserver.domain;

import com.keystone.observability.RequestContextHolder;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Asynchronous facade over {@link UserRepository}.
 *
 * <p>Every call runs on the data-store executor with the caller's request context attached, so log
 * lines written by the repository carry the request id.
 */
public class UserService {

    private final UserRepository repository;
    private final Executor executor;

    public UserService(UserRepository repository, Executor executor) {
        if (repository == null || executor == null) {
            throw new IllegalArgumentException("repository and executor are required");
        }
        this.repository = repository;
        this.executor = executor;
    }

    public CompletableFuture<List<User>> listUsers() {
        return async(repository::findAll);
    }

    public CompletableFuture<Optional<User>> findUser(long id) {
        return async(() -> repository.findById(id));
    }

    public CompletableFuture<User> createUser(UserDetails details) {
        return async(() -> repository.insert(details));
    }

    public CompletableFuture<Optional<User>> updateUser(long id, UserDetails details) {
        return async(() -> repository.update(id, details));
    }

    public CompletableFuture<Boolean> deleteUser(long id) {
        return async(() -> repository.delete(id));
    }

    private <T> CompletableFuture<T> async(Supplier<T> work) {
        return CompletableFuture.supplyAsync(RequestContextHolder.propagate(work), executor);
    }
}
