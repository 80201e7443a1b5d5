package com.enterprise.cte.resolver.adapter;

import com.enterprise.cte.compose.SqlRecomposer;
import com.enterprise.cte.resolver.port.CteDependencyResolver;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * Spring wiring for the CTE resolver.
 *
 * <p>Provides an {@link SqlRecomposer} and a {@link CteDependencyResolver} bean.
 * Import this configuration or let component scanning pick it up:
 * <pre>{@code
 * @Import(CteResolverConfig.class)
 * @Configuration
 * public class WorkspaceConfig { ... }
 * }</pre>
 *
 * <p>{@code cte.recompose.indent} sets the number of spaces nested CTE bodies
 * are indented by (default 4, see {@code cte-resolver.properties}).
 */
@Configuration
@PropertySource(value = "classpath:cte-resolver.properties", ignoreResourceNotFound = true)
public class CteResolverConfig {

    @Bean
    public SqlRecomposer sqlRecomposer(
            @Value("${cte.recompose.indent:" + SqlRecomposer.DEFAULT_INDENT + "}") int indentWidth) {
        return SqlRecomposer.withIndent(indentWidth);
    }

    @Bean
    public CteDependencyResolver cteDependencyResolver(SqlRecomposer sqlRecomposer) {
        return new DefaultCteDependencyResolver(sqlRecomposer);
    }
}
