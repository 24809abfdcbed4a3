package com.musicinsights.playlistmerge.bootstrap;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시점에 canonical store의 Flyway 마이그레이션을 실행하는 Runner입니다.
 *
 * <p>다른 Runner(명령 실행)보다 먼저 실행되도록 가장 높은 우선순위를 가집니다.</p>
 *
 * <p>주요 설정값:
 * {@code spring.datasource.*}, {@code spring.flyway.locations},
 * {@code spring.flyway.baseline-on-migrate}, {@code spring.flyway.baseline-version}</p>
 */
@Component
public class FlywayRunner implements ApplicationRunner, Ordered {

    private static final Logger log = LoggerFactory.getLogger(FlywayRunner.class);

    private final Environment env;

    public FlywayRunner(Environment env) {
        this.env = env;
    }

    @Override
    public void run(ApplicationArguments args) {
        String url = env.getProperty("spring.datasource.url");
        String user = env.getProperty("spring.datasource.username");
        String pass = env.getProperty("spring.datasource.password");

        Flyway flyway = Flyway.configure()
                .dataSource(url, user, pass)
                .locations(env.getProperty("spring.flyway.locations", "classpath:db/migration"))
                .baselineOnMigrate(Boolean.parseBoolean(
                        env.getProperty("spring.flyway.baseline-on-migrate", "false")
                ))
                .baselineVersion(env.getProperty("spring.flyway.baseline-version", "0"))
                .load();

        int applied = flyway.migrate().migrationsExecuted;
        log.debug("Flyway applied {} migration(s) to {}", applied, url);
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }
}
