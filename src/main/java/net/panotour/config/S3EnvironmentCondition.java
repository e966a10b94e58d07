/**
 * Spring {@link org.springframework.context.annotation.Condition} that gates the persistent
 * panorama storage on the presence of the S3 credential set.
 */
package net.panotour.config;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;

public class S3EnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(S3EnvironmentCondition.class);
    private static final AtomicBoolean messageLogged = new AtomicBoolean(false);
    private static final String STATUS_MISSING = "MISSING";
    private static final String STATUS_SET = "SET";

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return isConfigured(context.getEnvironment());
    }

    /**
     * Whether access key, secret and bucket are all present in the environment.
     */
    public static boolean isConfigured(Environment environment) {
        String accessKeyId = firstNonBlank(environment, "s3.access-key-id", "S3_ACCESS_KEY_ID");
        String secretAccessKey = firstNonBlank(environment, "s3.secret-access-key", "S3_SECRET_ACCESS_KEY");
        String bucket = firstNonBlank(environment, "s3.bucket-name", "S3_BUCKET");

        boolean hasRequiredVars = hasText(accessKeyId)
            && hasText(secretAccessKey)
            && hasText(bucket);

        // Only log the message once to avoid spam during startup
        if (messageLogged.compareAndSet(false, true)) {
            if (hasRequiredVars) {
                logger.info("S3 environment variables detected - panoramas are stored in bucket {}", bucket);
            } else {
                logger.warn("S3 environment variables missing - panoramas are returned as inline data URIs");
                logger.warn("Current status: S3_ACCESS_KEY_ID={}, S3_SECRET_ACCESS_KEY={}, S3_BUCKET={}",
                    (hasText(accessKeyId) ? STATUS_SET : STATUS_MISSING),
                    (hasText(secretAccessKey) ? STATUS_SET : STATUS_MISSING),
                    (hasText(bucket) ? STATUS_SET : STATUS_MISSING));
            }
        }

        return hasRequiredVars;
    }

    private static String firstNonBlank(Environment environment, String... keys) {
        for (String key : keys) {
            String value = environment.getProperty(key);
            if (hasText(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
