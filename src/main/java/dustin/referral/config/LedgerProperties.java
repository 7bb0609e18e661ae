package dustin.referral.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import lombok.Data;

/**
 * 원장 설정
 * Ledger Configuration
 * 
 * 역할:
 * - 직렬화 트랜잭션 재시도 정책 (횟수, 백오프)
 * - 저장소 충돌 신호(SQLState) 목록
 * - Kafka 토픽 이름 및 리스너 자동 시작 여부
 * 
 * 설정 방법:
 * - application.yml의 ledger.* 에서 설정
 * - 환경변수로 오버라이드 가능
 * 
 * 주의:
 * - 커미션 비율은 여기서 설정하지 않음 (CommissionRates 상수, 런타임 변경 불가)
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Transaction transaction = new Transaction();

    private Kafka kafka = new Kafka();

    @Data
    public static class Transaction {

        /**
         * 최대 시도 횟수 (첫 시도 포함)
         * Max attempts including the first one
         */
        private int maxAttempts = 3;

        /**
         * 첫 재시도 대기 시간 (ms)
         */
        private long initialBackoffMs = 10;

        /**
         * 백오프 배수 (10ms → 20ms → 40ms)
         */
        private double backoffMultiplier = 2.0;

        private long maxBackoffMs = 1000;

        /**
         * 직렬화 충돌로 간주할 SQLState 목록
         * PostgreSQL: 40001 (serialization_failure), 40P01 (deadlock_detected)
         */
        private List<String> conflictSqlStates = new ArrayList<>(List.of("40001", "40P01"));
    }

    @Data
    public static class Kafka {

        private String tradeSubmittedTopic = "trade-submitted";

        private String tradeProcessedTopic = "trade-commission-processed";

        private String earningsClaimedTopic = "earnings-claimed";

        /**
         * 리스너 컨테이너 자동 시작 여부 (테스트에서는 false)
         */
        private boolean listenerAutoStartup = true;

        /**
         * 원장 이벤트 발행 여부 (테스트에서는 false)
         */
        private boolean publishEnabled = true;
    }
}
