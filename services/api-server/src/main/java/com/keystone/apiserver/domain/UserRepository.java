package com.keystone.apiserver.domain;

import java.util.List;
import java.util.Optional;

/**
 * Port for user persistence. Implementations are blocking; {@link UserService} moves the calls off
 * the request thread.
 */
public interface UserRepository {

    List<User> findAll();

    Optional<User> findById(long id);

    User insert(UserDetails details);

    /** Returns the updated user, or empty if no user has {@code id}. */
    Optional<User> update(long id, UserDetails details);

    /** Returns whether a user was deleted. */
    boolean delete(long id);
}
