package com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc;

import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * R2DBC 배치 SQL 공통 베이스 클래스입니다.
 * <p>
 * 대량 입력을 chunk 단위로 나누어 순차 실행하고 rowsUpdated를 합산합니다.
 * 다중 행 VALUES 절 생성, null-safe 바인딩, UTC 시각 변환 헬퍼를 함께 제공합니다.
 */
public abstract class BatchSqlSupport {

    /** R2DBC SQL 실행을 위한 DatabaseClient */
    protected final DatabaseClient db;

    protected BatchSqlSupport(DatabaseClient db) {
        this.db = db;
    }

    /**
     * 아이템 목록을 chunk 단위로 분할하여 순차(concat) 실행하고 결과를 합산합니다.
     *
     * @param items  처리할 전체 아이템 목록
     * @param chunk  한 번에 처리할 chunk 크기
     * @param onceFn chunk 단위 실행 함수(rowsUpdated 반환)
     * @param <T>    아이템 타입
     * @return rowsUpdated 합계
     */
    protected <T> Mono<Long> chunkedSum(
            List<T> items,
            int chunk,
            Function<List<T>, Mono<Long>> onceFn
    ) {
        if (items == null || items.isEmpty()) return Mono.just(0L);
        return Flux.fromIterable(items)
                .buffer(chunk)
                .concatMap(onceFn)
                .reduce(0L, Long::sum);
    }

    /**
     * 행 번호를 붙인 named parameter 튜플을 {@code rows}개 만들어 콤마로 잇습니다.
     * <p>
     * 예: {@code values(List.of("a", "b"), 2)} → {@code (:a0, :b0), (:a1, :b1)}
     *
     * @param params 한 행의 파라미터 이름(접두어)
     * @param rows   행 수
     * @return VALUES 뒤에 붙일 SQL 조각
     */
    protected static String values(List<String> params, int rows) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            if (i > 0) sb.append(",\n");
            final int row = i;
            sb.append(params.stream()
                    .map(p -> ":" + p + row)
                    .collect(Collectors.joining(", ", "(", ")")));
        }
        return sb.toString();
    }

    /**
     * 값이 null이면 {@code bindNull}, 아니면 {@code bind}를 수행합니다.
     *
     * @param spec  바인딩 대상 spec
     * @param name  파라미터 이름
     * @param value 바인딩할 값(Nullable)
     * @param type  null 바인딩 시 사용할 타입
     * @param <V>   값 타입
     * @return 바인딩이 적용된 spec
     */
    protected <V> DatabaseClient.GenericExecuteSpec bindOrNull(
            DatabaseClient.GenericExecuteSpec spec, String name, V value, Class<V> type
    ) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }

    /** Instant → UTC 기준 LocalDateTime(TIMESTAMP 컬럼 저장용) */
    protected static LocalDateTime toUtc(Instant at) {
        return at == null ? null : LocalDateTime.ofInstant(at, ZoneOffset.UTC);
    }

    /** UTC 기준 LocalDateTime → Instant */
    protected static Instant fromUtc(LocalDateTime at) {
        return at == null ? null : at.toInstant(ZoneOffset.UTC);
    }
}
