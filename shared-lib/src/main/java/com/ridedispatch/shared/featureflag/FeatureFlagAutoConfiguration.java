package com.ridedispatch.shared.featureflag;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Registers FeatureFlagService for every service that has shared-lib and Redis
 * on the classpath. Scope defaults to the application name.
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@ConditionalOnClass(StringRedisTemplate.class)
public class FeatureFlagAutoConfiguration {

    @Bean
    @ConditionalOnBean(StringRedisTemplate.class)
    @ConditionalOnMissingBean
    public FeatureFlagService featureFlagService(
            StringRedisTemplate redisTemplate,
            @Value("${feature-flags.scope:${spring.application.name:default}}") String scope) {
        return new FeatureFlagService(redisTemplate, scope);
    }
}
