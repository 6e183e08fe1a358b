package com.keystone.apiserver.config;

import com.keystone.apiserver.domain.UserRepository;
import com.keystone.apiserver.domain.UserService;
import com.keystone.database.config.DatabaseConfiguration;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Domain services. The domain package stays free of Spring annotations, so they are wired here. */
@Configuration(proxyBeanMethods = false)
public class ServiceConfig {

    @Bean
    public UserService userService(
            UserRepository userRepository,
            @Qualifier(DatabaseConfiguration.DATA_STORE_EXECUTOR_BEAN) Executor dataStoreExecutor) {
        return new UserService(userRepository, dataStoreExecutor);
    }
}
