/**
 * Domain layer: the {@link com.keystone.apiserver.domain.User} model, its persistence port and the
 * service the API calls.
 *
 * <p>Nothing here depends on Spring, the servlet API or JDBC. Adapters live under
 * {@code infrastructure}; wiring lives under {@code config}.
 */
package com.keystone.apiserver.domain;
