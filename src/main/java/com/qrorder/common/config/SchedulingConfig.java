package com.qrorder.common.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import javax.sql.DataSource;

/**
 * 스케줄링 + ShedLock 설정
 *
 * <p>락은 세션 DB의 {@code shedlock} 테이블에 저장된다 (schema.sql).
 * {@code usingDbTime()}: 인스턴스 시계가 아니라 DB 시각으로 락 만료를 판단.</p>
 *
 * <h3>★ JDBC LockProvider</h3>
 * <p>이 서비스에는 Redis가 없으므로 세션 DB 자체를 락 저장소로 쓴다.
 * 동작(한 주기 한 인스턴스)은 Redis 기반 LockProvider와 같다.</p>
 *
 * <p>{@code self-order.scheduling.enabled=false}로 끌 수 있다 (테스트 기본값).</p>
 */
@Configuration
@EnableScheduling
@EnableSchedulerLock(defaultLockAtMostFor = "10m")
@ConditionalOnProperty(prefix = "self-order.scheduling", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    @Bean
    public LockProvider lockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(
                JdbcTemplateLockProvider.Configuration.builder()
                        .withJdbcTemplate(new JdbcTemplate(dataSource))
                        .usingDbTime()
                        .build());
    }
}
