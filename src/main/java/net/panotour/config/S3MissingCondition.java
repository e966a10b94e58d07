package net.panotour.config;

import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Inverse of {@link S3EnvironmentCondition}; enables the inline data-URI fallback.
 */
public class S3MissingCondition implements Condition {

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return !S3EnvironmentCondition.isConfigured(context.getEnvironment());
    }
}
