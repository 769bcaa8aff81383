package com.ryuqq.sortedfeed.adapter.redis;

/**
 * Redis 연결 설정 (불변 record).
 *
 * <p>연결 관리는 이 모듈의 관심사가 아니므로, 운영 환경에서는 외부에서 구성한
 * {@code JedisPool}을 직접 주입하는 것을 권장합니다. 이 record는 단독 실행과 테스트용입니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>host: 호스트 (기본 localhost)</li>
 *   <li>port: 포트 (기본 6379)</li>
 *   <li>timeoutMs: 연결/읽기 타임아웃 (기본 2000ms)</li>
 *   <li>database: DB 번호 (기본 0)</li>
 *   <li>password: 비밀번호 (기본 null, 인증 없음)</li>
 * </ul>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 * @param host 호스트 (null 또는 빈 문자열 불가)
 * @param port 포트 (1 ~ 65535)
 * @param timeoutMs 타임아웃 (밀리초, 양수)
 * @param database DB 번호 (0 이상)
 * @param password 비밀번호 (null 허용)
 */
public record RedisConnectionConfig(
    String host,
    int port,
    int timeoutMs,
    int database,
    String password
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: localhost:6379, timeoutMs=2000, database=0, password=null</p>
     */
    public RedisConnectionConfig() {
        this("localhost", 6379, 2000, 0, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RedisConnectionConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException(
                "port must be between 1 and 65535 (current: " + port + ")"
            );
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
        if (database < 0) {
            throw new IllegalArgumentException(
                "database must be non-negative (current: " + database + ")"
            );
        }
    }

    /**
     * host, port만 변경한 새 인스턴스 생성.
     */
    public RedisConnectionConfig withEndpoint(String host, int port) {
        return new RedisConnectionConfig(host, port, timeoutMs, database, password);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public RedisConnectionConfig withTimeoutMs(int timeoutMs) {
        return new RedisConnectionConfig(host, port, timeoutMs, database, password);
    }

    /**
     * database만 변경한 새 인스턴스 생성.
     */
    public RedisConnectionConfig withDatabase(int database) {
        return new RedisConnectionConfig(host, port, timeoutMs, database, password);
    }

    /**
     * password만 변경한 새 인스턴스 생성.
     */
    public RedisConnectionConfig withPassword(String password) {
        return new RedisConnectionConfig(host, port, timeoutMs, database, password);
    }

    @Override
    public String toString() {
        return "RedisConnectionConfig{" + host + ":" + port + "/" + database
            + ", timeoutMs=" + timeoutMs + ", password=" + (password == null ? "none" : "***") + '}';
    }
}
