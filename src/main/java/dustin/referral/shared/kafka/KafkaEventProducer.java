package dustin.referral.shared.kafka;

import java.util.concurrent.CompletableFuture;

import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.referral.config.LedgerProperties;
import dustin.referral.shared.kafka.model.EarningsClaimedEvent;
import dustin.referral.shared.kafka.model.TradeCommissionProcessedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 이벤트 발행자
 * Kafka Event Producer
 * 
 * 역할:
 * - 원장 이벤트(분배 완료, 수익 청구)를 Kafka로 발행
 * - 비동기 처리 (논블로킹)
 * 
 * 주의사항:
 * - 반드시 트랜잭션 커밋 후에 호출 (롤백된 상태가 외부로 나가지 않도록)
 * - 실패해도 원장에는 영향 없음 (로깅만)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaEventProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerProperties ledgerProperties;

    /**
     * 분배 완료 이벤트 발행 (key = 거래 ID)
     */
    public void publishTradeProcessed(TradeCommissionProcessedEvent event) {
        publish(ledgerProperties.getKafka().getTradeProcessedTopic(), String.valueOf(event.getTradeId()), event);
    }

    /**
     * 수익 청구 이벤트 발행 (key = 사용자 ID)
     */
    public void publishEarningsClaimed(EarningsClaimedEvent event) {
        publish(ledgerProperties.getKafka().getEarningsClaimedTopic(), String.valueOf(event.getUserId()), event);
    }

    private void publish(String topic, String key, Object event) {
        if (!ledgerProperties.getKafka().isPublishEnabled()) {
            log.debug("[KafkaEventProducer] 발행 비활성화, 건너뜀: topic={}, key={}", topic, key);
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("[KafkaEventProducer] 이벤트 직렬화 실패: topic={}, key={}", topic, key, e);
            return;
        }

        CompletableFuture.runAsync(() -> kafkaTemplate.send(topic, key, payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("[KafkaEventProducer] 이벤트 발행 실패: topic={}, key={}, error={}",
                                topic, key, ex.getMessage());
                    }
                }))
                .exceptionally(ex -> {
                    log.error("[KafkaEventProducer] 이벤트 발행 중 예외 발생: topic={}, key={}, error={}",
                            topic, key, ex.getMessage());
                    return null;
                });
    }
}
