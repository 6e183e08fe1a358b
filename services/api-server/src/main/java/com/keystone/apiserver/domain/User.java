package com.keystone.apiserver.domain;

import java.time.Instant;

/**
 * A stored user.
 *
 * @param id generated identifier
 * @param firstName given name
 * @param lastName family name
 * @param email unique email address
 * @param createdAt when the row was inserted
 * @param updatedAt when the row was last written
 */
public record User(
        long id,
        String firstName,
        String lastName,
        String email,
        Instant createdAt,
        Instant updatedAt) {}
