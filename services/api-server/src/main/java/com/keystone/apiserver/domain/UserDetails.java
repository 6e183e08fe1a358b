package com.keystone.apiserver.domain;

/**
 * The writable fields of a {@link User}, as sent on create and update.
 */
public record UserDetails(String firstName, String lastName, String email) {}
