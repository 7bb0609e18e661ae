package dustin.referral.domains.claim.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;

import dustin.referral.domains.claim.model.dto.SingleClaimResponse;
import dustin.referral.domains.commission.model.entity.Cashback;
import dustin.referral.domains.commission.model.entity.Commission;
import dustin.referral.domains.commission.repository.CashbackRepository;
import dustin.referral.domains.commission.repository.CommissionRepository;
import dustin.referral.domains.user.repository.UserRepository;
import dustin.referral.shared.kafka.KafkaEventProducer;
import dustin.referral.shared.model.TokenType;
import dustin.referral.shared.transaction.SerializableTransactionExecutor;

/**
 * 청구 이벤트 발행 테스트
 * Claim Event Publishing Test
 *
 * 테스트 항목:
 * 1. 전체 청구 / 단건 청구 모두 성공 시 earnings-claimed 발행
 * 2. 이미 청구된 항목, 청구할 항목 없음은 발행하지 않음
 */
class ClaimServiceEventTest {

    private static final Long USER = 7L;

    private CommissionRepository commissionRepository;
    private CashbackRepository cashbackRepository;
    private KafkaEventProducer eventProducer;
    private ClaimService claimService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        UserRepository userRepository = mock(UserRepository.class);
        commissionRepository = mock(CommissionRepository.class);
        cashbackRepository = mock(CashbackRepository.class);
        eventProducer = mock(KafkaEventProducer.class);
        SerializableTransactionExecutor transactionExecutor = mock(SerializableTransactionExecutor.class);
        when(transactionExecutor.execute(any())).thenAnswer(invocation ->
                ((TransactionCallback<Object>) invocation.getArgument(0)).doInTransaction(mock(TransactionStatus.class)));
        when(userRepository.existsById(USER)).thenReturn(true);

        claimService = new ClaimService(userRepository, commissionRepository, cashbackRepository,
                transactionExecutor, eventProducer);
    }

    @Test
    @DisplayName("커미션 단건 청구 성공: 커미션 금액으로 이벤트 발행")
    void testSingleCommissionClaimPublishes() {
        when(commissionRepository.findById(15L)).thenReturn(Optional.of(commission(15L, "3")));
        when(commissionRepository.markClaimed(eq(15L), any())).thenReturn(1);

        SingleClaimResponse response = claimService.claimCommission(USER, 15L);

        assertThat(response.isClaimed()).isTrue();
        assertThat(response.getTokenType()).isEqualTo(TokenType.USDC_ARBITRUM);
        verify(eventProducer).publishEarningsClaimed(argThat(event -> event.getUserId().equals(USER)
                && event.getTokenType().equals("USDC-ARBITRUM")
                && new BigDecimal(event.getCommissionTotal()).compareTo(new BigDecimal("3")) == 0
                && new BigDecimal(event.getCashbackTotal()).signum() == 0
                && new BigDecimal(event.getTotal()).compareTo(new BigDecimal("3")) == 0));
    }

    @Test
    @DisplayName("캐시백 단건 청구 성공: 캐시백 금액으로 이벤트 발행")
    void testSingleCashbackClaimPublishes() {
        when(cashbackRepository.findById(21L)).thenReturn(Optional.of(cashback(21L, "1.5")));
        when(cashbackRepository.markClaimed(eq(21L), any())).thenReturn(1);

        claimService.claimCashback(USER, 21L);

        verify(eventProducer).publishEarningsClaimed(argThat(event -> event.getTokenType().equals("USDC-ARBITRUM")
                && new BigDecimal(event.getCommissionTotal()).signum() == 0
                && new BigDecimal(event.getCashbackTotal()).compareTo(new BigDecimal("1.5")) == 0));
    }

    @Test
    @DisplayName("이미 청구된 단건은 이벤트 없음")
    void testAlreadyClaimedDoesNotPublish() {
        when(commissionRepository.findById(15L)).thenReturn(Optional.of(commission(15L, "3")));
        when(commissionRepository.markClaimed(eq(15L), any())).thenReturn(0);
        when(cashbackRepository.findById(21L)).thenReturn(Optional.of(cashback(21L, "1.5")));
        when(cashbackRepository.markClaimed(eq(21L), any())).thenReturn(0);

        SingleClaimResponse commission = claimService.claimCommission(USER, 15L);
        SingleClaimResponse cashback = claimService.claimCashback(USER, 21L);

        assertThat(commission.isClaimed()).isFalse();
        assertThat(cashback.isClaimed()).isFalse();
        verify(eventProducer, never()).publishEarningsClaimed(any());
    }

    @Test
    @DisplayName("전체 청구: 청구한 항목이 있을 때만 이벤트 발행")
    void testBulkClaimPublishesOnlyWhenSomethingClaimed() {
        when(commissionRepository.findByUserIdAndTokenTypeAndClaimedFalseOrderByIdAsc(USER, TokenType.USDC_ARBITRUM))
                .thenReturn(List.of());
        when(cashbackRepository.findByUserIdAndTokenTypeAndClaimedFalseOrderByIdAsc(USER, TokenType.USDC_ARBITRUM))
                .thenReturn(List.of());

        claimService.claim(USER, TokenType.USDC_ARBITRUM);
        verify(eventProducer, never()).publishEarningsClaimed(any());

        when(commissionRepository.findByUserIdAndTokenTypeAndClaimedFalseOrderByIdAsc(USER, TokenType.USDC_ARBITRUM))
                .thenReturn(List.of(commission(15L, "3")));
        when(commissionRepository.markClaimed(eq(15L), any())).thenReturn(1);

        claimService.claim(USER, TokenType.USDC_ARBITRUM);
        verify(eventProducer).publishEarningsClaimed(argThat(event ->
                new BigDecimal(event.getTotal()).compareTo(new BigDecimal("3")) == 0));
    }

    private Commission commission(Long id, String amount) {
        return Commission.builder()
                .id(id)
                .userId(USER)
                .tradeId(1L)
                .amount(new BigDecimal(amount).setScale(18))
                .level(1)
                .tokenType(TokenType.USDC_ARBITRUM)
                .build();
    }

    private Cashback cashback(Long id, String amount) {
        return Cashback.builder()
                .id(id)
                .userId(USER)
                .tradeId(1L)
                .amount(new BigDecimal(amount).setScale(18))
                .tokenType(TokenType.USDC_ARBITRUM)
                .build();
    }
}
