package com.bikeredlights.ride.config;

import com.bikeredlights.ride.service.RideSummary;
import com.bikeredlights.ride.service.motion.LocationFix;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * redis 프로필 전용 RedisTemplate (키: 문자열, 값: JSON).
 * 인덱스 set 은 자동 구성되는 StringRedisTemplate 을 사용한다.
 */
@Configuration
@Profile("redis")
public class RedisConfig {

    @Bean
    RedisTemplate<String, LocationFix> fixRedisTemplate(RedisConnectionFactory cf, ObjectMapper om) {
        return jsonTemplate(cf, new Jackson2JsonRedisSerializer<>(om, LocationFix.class));
    }

    @Bean
    RedisTemplate<String, RideSummary> summaryRedisTemplate(RedisConnectionFactory cf, ObjectMapper om) {
        return jsonTemplate(cf, new Jackson2JsonRedisSerializer<>(om, RideSummary.class));
    }

    private static <T> RedisTemplate<String, T> jsonTemplate(RedisConnectionFactory cf,
                                                             Jackson2JsonRedisSerializer<T> valueSerializer) {
        RedisTemplate<String, T> t = new RedisTemplate<>();
        t.setConnectionFactory(cf);
        t.setKeySerializer(new StringRedisSerializer());
        t.setValueSerializer(valueSerializer);
        t.afterPropertiesSet();
        return t;
    }
}
