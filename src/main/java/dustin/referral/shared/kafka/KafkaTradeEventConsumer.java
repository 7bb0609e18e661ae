package dustin.referral.shared.kafka;

import java.math.BigDecimal;

import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.referral.domains.trade.model.dto.TradeProcessingResponse;
import dustin.referral.domains.trade.service.TradeProcessingService;
import dustin.referral.shared.decimal.DecimalMath;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import dustin.referral.shared.kafka.model.TradeSubmittedEvent;
import dustin.referral.shared.model.TokenType;
import lombok.extern.slf4j.Slf4j;

/**
 * 거래 제출 이벤트 Consumer
 * Trade Submitted Event Consumer
 * 
 * 역할:
 * - 거래 서비스가 발행한 trade-submitted 토픽 메시지 수신
 * - 거래 기록 및 수수료 분배 (TradeProcessingService)
 * 
 * 처리 과정:
 * 1. JSON 파싱 (JSON → TradeSubmittedEvent)
 * 2. 금액/토큰 종류 검증
 * 3. fee_tier가 있으면 명시 등급, 없으면 사용자 저장 등급으로 처리
 * 
 * 실패 처리:
 * - 파싱 실패, 비즈니스 거부 (INVALID_INPUT, NOT_FOUND 등): 로그 후 건너뜀 (재전달해도 결과가 같음)
 * - TRANSACTION_FAILED: 예외 전파 → 컨테이너가 재전달
 */
@Slf4j
@Component
public class KafkaTradeEventConsumer {

    private final TradeProcessingService tradeProcessingService;
    private final ObjectMapper objectMapper;

    public KafkaTradeEventConsumer(TradeProcessingService tradeProcessingService) {
        this.tradeProcessingService = tradeProcessingService;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 거래 제출 이벤트 수신 및 처리
     * 
     * @param message Kafka 메시지 (JSON 문자열)
     */
    @KafkaListener(
            topics = "${ledger.kafka.trade-submitted-topic:trade-submitted}",
            groupId = "${spring.kafka.consumer.group-id:referral-ledger-group}"
    )
    public void consumeTradeSubmitted(String message) {
        TradeSubmittedEvent event;
        try {
            event = objectMapper.readValue(message, TradeSubmittedEvent.class);
        } catch (JsonProcessingException e) {
            log.error("[KafkaTradeEventConsumer] JSON 파싱 실패, 건너뜀: message={}", message, e);
            return;
        }

        try {
            if (event.getUserId() == null) {
                throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "user_id is required");
            }
            BigDecimal volume = DecimalMath.parse(event.getVolume());
            TokenType tokenType = TokenType.fromCode(event.getTokenType());

            TradeProcessingResponse response;
            if (event.getFeeTier() == null || event.getFeeTier().isBlank()) {
                response = tradeProcessingService.recordTrade(event.getUserId(), volume, tokenType);
            } else {
                response = tradeProcessingService.simulateTrade(
                        event.getUserId(), volume, DecimalMath.parse(event.getFeeTier()), tokenType);
            }
            log.debug("[KafkaTradeEventConsumer] 거래 처리 완료: tradeId={}, userId={}",
                    response.getTradeId(), response.getUserId());
        } catch (LedgerException e) {
            if (e.getErrorCode() == LedgerErrorCode.TRANSACTION_FAILED) {
                log.error("[KafkaTradeEventConsumer] 트랜잭션 실패, 재전달 대기: message={}", message, e);
                throw e;
            }
            log.warn("[KafkaTradeEventConsumer] 거래 거부, 건너뜀: code={}, reason={}, message={}",
                    e.getErrorCode(), e.getMessage(), message);
        }
    }
}
