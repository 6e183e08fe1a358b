/**
 * Servlet-side adapters: the request-id filter, the Spring MVC bridge into the router and the
 * error mapping.
 */
package com.keystone.apiserver.infrastructure.web;
