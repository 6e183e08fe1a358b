package com.keystone.apiserver.config;

import com.keystone.apiserver.routing.RouteRegistrar;
import com.keystone.apiserver.routing.Router;
import com.keystone.observability.DispatchMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the application {@link Router} from every {@link RouteRegistrar} bean, in bean order,
 * and seals it before the context finishes refreshing.
 */
@Configuration(proxyBeanMethods = false)
public class RoutingConfig {

    @Bean
    public DispatchMetrics dispatchMetrics(MeterRegistry meterRegistry) {
        return new DispatchMetrics(meterRegistry);
    }

    @Bean
    public Router router(List<RouteRegistrar> registrars, DispatchMetrics dispatchMetrics) {
        Router router = new Router(dispatchMetrics);
        registrars.forEach(registrar -> registrar.registerRoutes(router));
        router.seal();
        return router;
    }
}
