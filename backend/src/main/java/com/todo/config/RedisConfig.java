package com.todo.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for rate-limit counters.
 *
 * Counters are plain integers under string keys with a TTL equal to their
 * window, so a template with String serializers on both sides is all that is
 * needed. Lettuce is the client connector.
 *
 * Key layout:
 * - {@code rate:login:{email}|{ip}} failed-login attempts (1 minute window)
 * - {@code rate:forgot:{email}} password-reset requests (1 hour window)
 *
 * @see com.todo.service.RateLimitService
 */
@Configuration
@Slf4j
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(redisHost);
        config.setPort(redisPort);

        log.info("Configuring Redis connection factory: host={}, port={}", redisHost, redisPort);

        return new LettuceConnectionFactory(config);
    }

    /**
     * Template for counter operations, with String serialization for keys and values.
     *
     * @param redisConnectionFactory the Redis connection factory
     * @return configured RedisTemplate for string operations
     */
    @Bean
    public RedisTemplate<String, String> redisStringTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, String> template = new RedisTemplate<>();
        template.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setValueSerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);
        template.setHashValueSerializer(stringSerializer);

        template.afterPropertiesSet();

        log.debug("RedisTemplate configured for String operations");
        return template;
    }
}
