package com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * canonical store(H2/R2DBC)의 Reactive 트랜잭션 설정입니다.
 * <p>
 * 소스 단위 full refresh(delete + insert)를 하나의 트랜잭션으로 묶기 위해
 * {@link TransactionalOperator}를 등록합니다.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public ReactiveTransactionManager reactiveTransactionManager(ConnectionFactory cf) {
        return new R2dbcTransactionManager(cf);
    }

    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager tm) {
        return TransactionalOperator.create(tm);
    }
}
