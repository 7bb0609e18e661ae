package dustin.referral.shared.kafka;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.referral.domains.trade.model.dto.TradeProcessingResponse;
import dustin.referral.domains.trade.service.TradeProcessingService;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import dustin.referral.shared.model.TokenType;

/**
 * 거래 제출 이벤트 Consumer 테스트
 * Kafka Trade Submitted Event Consumer Test
 * 
 * 테스트 항목:
 * 1. fee_tier 유무에 따른 처리 경로 선택
 * 2. 잘못된 메시지는 건너뜀
 * 3. TRANSACTION_FAILED만 전파 (재전달 대상)
 */
class KafkaTradeEventConsumerTest {

    private TradeProcessingService tradeProcessingService;
    private KafkaTradeEventConsumer consumer;

    @BeforeEach
    void setUp() {
        tradeProcessingService = mock(TradeProcessingService.class);
        consumer = new KafkaTradeEventConsumer(tradeProcessingService);
        TradeProcessingResponse response = TradeProcessingResponse.builder().tradeId(1L).userId(7L).build();
        when(tradeProcessingService.recordTrade(anyLong(), any(), any())).thenReturn(response);
        when(tradeProcessingService.simulateTrade(anyLong(), any(), any(), any())).thenReturn(response);
    }

    @Test
    @DisplayName("fee_tier 없음: 사용자 저장 등급으로 기록")
    void testRecordTradeWithStoredTier() {
        consumer.consumeTradeSubmitted(
                "{\"user_id\": 7, \"volume\": \"1000\", \"token_type\": \"USDC-SOLANA\", \"extra\": true}");

        verify(tradeProcessingService).recordTrade(eq(7L),
                argThat(volume -> volume.compareTo(new BigDecimal("1000")) == 0), eq(TokenType.USDC_SOLANA));
        verify(tradeProcessingService, never()).simulateTrade(anyLong(), any(), any(), any());
    }

    @Test
    @DisplayName("fee_tier 있음: 명시 등급으로 기록")
    void testSimulateTradeWithExplicitTier() {
        consumer.consumeTradeSubmitted(
                "{\"user_id\": 7, \"volume\": \"500.5\", \"token_type\": \"USDC-ARBITRUM\", \"fee_tier\": \"0.02\"}");

        verify(tradeProcessingService).simulateTrade(eq(7L),
                argThat(volume -> volume.compareTo(new BigDecimal("500.5")) == 0),
                argThat(tier -> tier.compareTo(new BigDecimal("0.02")) == 0),
                eq(TokenType.USDC_ARBITRUM));
    }

    @Test
    @DisplayName("JSON 파싱 실패, 잘못된 필드는 건너뜀")
    void testSkipsMalformedMessages() {
        assertThatCode(() -> consumer.consumeTradeSubmitted("not-json")).doesNotThrowAnyException();
        assertThatCode(() -> consumer.consumeTradeSubmitted(
                "{\"volume\": \"1\", \"token_type\": \"USDC-SOLANA\"}")).doesNotThrowAnyException();
        assertThatCode(() -> consumer.consumeTradeSubmitted(
                "{\"user_id\": 7, \"volume\": \"-1\", \"token_type\": \"USDC-SOLANA\"}")).doesNotThrowAnyException();
        assertThatCode(() -> consumer.consumeTradeSubmitted(
                "{\"user_id\": 7, \"volume\": \"1\", \"token_type\": \"BTC\"}")).doesNotThrowAnyException();

        verifyNoInteractions(tradeProcessingService);
    }

    @Test
    @DisplayName("비즈니스 거부는 로그 후 건너뜀")
    void testSkipsBusinessRejection() {
        when(tradeProcessingService.recordTrade(anyLong(), any(), any()))
                .thenThrow(new LedgerException(LedgerErrorCode.NOT_FOUND, "User not found: 7"));

        assertThatCode(() -> consumer.consumeTradeSubmitted(
                "{\"user_id\": 7, \"volume\": \"1\", \"token_type\": \"USDC-SOLANA\"}")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("TRANSACTION_FAILED는 전파하여 재전달")
    void testPropagatesTransactionFailure() {
        when(tradeProcessingService.recordTrade(anyLong(), any(), any()))
                .thenThrow(new LedgerException(LedgerErrorCode.TRANSACTION_FAILED, "retries exhausted"));

        assertThatThrownBy(() -> consumer.consumeTradeSubmitted(
                "{\"user_id\": 7, \"volume\": \"1\", \"token_type\": \"USDC-SOLANA\"}"))
                .isInstanceOf(LedgerException.class)
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.TRANSACTION_FAILED);
    }
}
