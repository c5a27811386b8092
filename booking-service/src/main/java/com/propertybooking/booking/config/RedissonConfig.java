package com.propertybooking.booking.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redis connection for the distributed lock strategy. Not created with the default
 * pessimistic strategy, so the service runs without Redis.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "booking.lock.strategy", havingValue = "distributed")
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(@Value("${booking.redis.address:redis://localhost:6379}") String address) {
        Config config = new Config();
        config.useSingleServer().setAddress(address);
        log.info("Connecting Redisson to {}", address);
        return Redisson.create(config);
    }
}
