/**
 * HTTP API: route registrars and the handlers they mount on the router.
 */
package com.keystone.apiserver.api;
