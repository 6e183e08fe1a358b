/**
 * Cross-cutting observability support for Keystone services.
 *
 * <ul>
 *   <li>{@link com.keystone.observability.RequestContext} and
 *       {@link com.keystone.observability.RequestContextHolder} carry the request id into SLF4J
 *       MDC, across executor handoffs included
 *   <li>{@link com.keystone.observability.DispatchMetrics} counts router outcomes in Micrometer
 * </ul>
 */
package com.keystone.observability;
