package com.myorg.fanout.engine.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.fanout.engine.FanoutEngineProperties;
import com.myorg.fanout.engine.transport.LiveTransport;
import com.myorg.fanout.engine.transport.RedisLiveTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

/**
 * Live transport over Redis pub/sub.
 *
 * <p>Kept apart from {@link FanoutEngineAutoConfiguration} so applications without Redis on the
 * classpath still get the engine (with no live transport).
 */
@Slf4j
@AutoConfiguration(before = FanoutEngineAutoConfiguration.class)
@EnableConfigurationProperties(FanoutEngineProperties.class)
@ConditionalOnClass(RedisConnectionFactory.class)
@ConditionalOnProperty(prefix = "fanout.engine.transport.redis", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FanoutEngineRedisAutoConfiguration {

    /**
     * No RedisConnectionFactory from the app (or Spring Boot): build a standalone Lettuce one from
     * spring.data.redis.*.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(LettuceConnectionFactory.class)
    @ConditionalOnMissingBean(RedisConnectionFactory.class)
    static class EnsureRedisConnectionFactoryConfig {

        @Bean
        public RedisConnectionFactory redisConnectionFactory(Environment env) {
            String host = env.getProperty("spring.data.redis.host", "localhost");
            int port = Integer.parseInt(env.getProperty("spring.data.redis.port", "6379"));
            int db = Integer.parseInt(env.getProperty("spring.data.redis.database", "0"));
            String username = env.getProperty("spring.data.redis.username");
            String password = env.getProperty("spring.data.redis.password");

            log.warn("No RedisConnectionFactory bean found; creating LettuceConnectionFactory using spring.data.redis.* (standalone)");

            RedisStandaloneConfiguration cfg = new RedisStandaloneConfiguration(host, port);
            cfg.setDatabase(db);
            if (StringUtils.hasText(username)) {
                cfg.setUsername(username);
            }
            if (StringUtils.hasText(password)) {
                cfg.setPassword(RedisPassword.of(password));
            }
            return new LettuceConnectionFactory(cfg);
        }
    }

    @Bean
    @ConditionalOnMissingBean(StringRedisTemplate.class)
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
        return new StringRedisTemplate(cf);
    }

    @Bean
    @ConditionalOnMissingBean(LiveTransport.class)
    public LiveTransport redisLiveTransport(StringRedisTemplate redis,
                                           ObjectProvider<ObjectMapper> mapper,
                                           FanoutEngineProperties props) {
        String channel = props.getTransport().getRedis().getChannel();
        log.info("Live transport: Redis pub/sub channel={}", channel);
        return new RedisLiveTransport(redis, mapper.getIfAvailable(ObjectMapper::new), channel);
    }
}
