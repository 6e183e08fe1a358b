/**
 * Request routing: {@link com.keystone.apiserver.routing.Router} maps {@code (method, path)} to a
 * {@link com.keystone.apiserver.routing.RouteHandler} and answers unmatched requests with a
 * structured 404.
 *
 * <p>This package has no servlet or Spring MVC dependency. The web layer adapts HTTP requests to
 * {@link com.keystone.apiserver.routing.Router#dispatch(String, String, java.util.Map, String)}.
 */
package com.keystone.apiserver.routing;
