package io.github.rowbase.annotation;

import org.springframework.stereotype.Service;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a database specific implementation of a Rowbase service interface.
 *
 * <p>Meta-annotated with Spring's {@code @Service}, so annotated classes are picked up by
 * component scanning. The {@link #serviceName()} is the key {@link io.github.rowbase.service.ServiceLookup}
 * uses to pick the implementation matching the configured database type.</p>
 *
 * <p>Example usage:</p>
 * <pre>
 * {@code
 * @RowbaseService(serviceName = SupportedDatabaseConstant.POSTGRES)
 * public class PostgresDialect extends AbstractJdbcDialect {
 *     // PostgreSQL quoting, literals and table description
 * }
 * }
 * </pre>
 *
 * @see org.springframework.stereotype.Service
 */
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Service
public @interface RowbaseService {
    String serviceName();
}
