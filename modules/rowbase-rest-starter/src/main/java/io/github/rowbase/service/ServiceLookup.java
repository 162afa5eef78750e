package io.github.rowbase.service;

import io.github.rowbase.annotation.RowbaseService;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Resolves database specific implementations by the service name of their
 * {@link RowbaseService} annotation.
 *
 * <p>Example usage:</p>
 * <pre>
 * {@code
 * SqlDialect dialect = serviceLookup.forBean(SqlDialect.class, "postgres");
 * }
 * </pre>
 *
 * @see RowbaseService
 */
@Service
public class ServiceLookup {

    private final ApplicationContext applicationContext;

    public ServiceLookup(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    /**
     * Finds the bean of the given type whose {@link RowbaseService#serviceName()} matches.
     *
     * @throws NoSuchBeanDefinitionException if no bean of the type carries the service name
     */
    public <T> T forBean(Class<T> serviceClass, String serviceName) {
        Map<String, T> beans = applicationContext.getBeansOfType(serviceClass);

        return beans.entrySet().stream()
                .filter(entry -> getAnnotatedServiceName(entry.getKey()).equals(serviceName))
                .findFirst()
                .map(Map.Entry::getValue)
                .orElseThrow(() -> new NoSuchBeanDefinitionException(serviceClass.getSimpleName(), serviceName));
    }

    private String getAnnotatedServiceName(String beanName) {
        RowbaseService rowbaseService = applicationContext.findAnnotationOnBean(beanName, RowbaseService.class);
        return rowbaseService == null ? "" : rowbaseService.serviceName();
    }
}
