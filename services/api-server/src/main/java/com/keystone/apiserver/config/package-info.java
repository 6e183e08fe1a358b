/**
 * Spring wiring for the API server: bound properties, the router, the startup sequence and the
 * domain services.
 */
package com.keystone.apiserver.config;
