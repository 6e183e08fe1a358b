/** JDBC adapters for the domain repositories. */
package com.keystone.apiserver.infrastructure.persistence;
