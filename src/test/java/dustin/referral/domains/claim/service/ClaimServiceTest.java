package dustin.referral.domains.claim.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import dustin.referral.domains.claim.model.dto.ClaimResponse;
import dustin.referral.domains.claim.model.dto.ClaimableBalanceResponse;
import dustin.referral.domains.claim.model.dto.SingleClaimResponse;
import dustin.referral.domains.commission.model.entity.Cashback;
import dustin.referral.domains.commission.model.entity.Commission;
import dustin.referral.domains.trade.model.dto.TradeProcessingResponse;
import dustin.referral.domains.trade.service.TradeProcessingService;
import dustin.referral.domains.user.model.entity.User;
import dustin.referral.shared.decimal.DecimalMath;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import dustin.referral.shared.model.TokenType;
import dustin.referral.support.LedgerIntegrationSupport;

/**
 * 수익 청구 통합 테스트
 * Claim Engine Integration Test
 * 
 * 테스트 항목:
 * 1. 토큰별 전체 청구, 두 번째 청구는 0
 * 2. 단건 청구: 소유자 검증, 이미 청구된 항목
 * 3. 청구 가능 잔액
 * 4. 동시 청구 시 각 행은 한 번만 합산
 */
class ClaimServiceTest extends LedgerIntegrationSupport {

    @Autowired
    private ClaimService claimService;

    @Autowired
    private TradeProcessingService tradeProcessingService;

    private User referrer;
    private User trader;

    @BeforeEach
    void setUp() {
        referrer = createUser("referrer");
        trader = createUser("trader", "0.0100");
        refer(trader, referrer);
    }

    @Test
    @DisplayName("토큰별 청구: 커미션 합계 반환, 두 번째 청구는 0")
    void testClaimAllForToken() {
        trade("1000", TokenType.USDC_SOLANA);
        trade("500", TokenType.USDC_SOLANA);
        trade("1000", TokenType.USDC_ARBITRUM);

        ClaimResponse first = claimService.claim(referrer.getId(), TokenType.USDC_SOLANA);

        assertThat(first.getClaimedCommissionTotal()).isEqualByComparingTo("4.5");
        assertThat(first.getClaimedCommissionCount()).isEqualTo(2);
        assertThat(first.getClaimedCashbackCount()).isZero();
        assertThat(first.getClaimedTotal()).isEqualByComparingTo("4.5");

        ClaimResponse second = claimService.claim(referrer.getId(), TokenType.USDC_SOLANA);
        assertThat(second.getClaimedTotal()).isEqualByComparingTo("0");
        assertThat(second.getClaimedCommissionCount()).isZero();

        List<Commission> arbitrum = commissionRepository
                .findByUserIdAndTokenTypeAndClaimedFalseOrderByIdAsc(referrer.getId(), TokenType.USDC_ARBITRUM);
        assertThat(arbitrum).hasSize(1);
        assertThat(commissionRepository.findByUserIdAndTokenTypeOrderByIdAsc(referrer.getId(), TokenType.USDC_SOLANA))
                .allSatisfy(c -> {
                    assertThat(c.isClaimed()).isTrue();
                    assertThat(c.getClaimedAt()).isNotNull();
                });
    }

    @Test
    @DisplayName("거래자는 캐시백을 청구")
    void testTraderClaimsCashback() {
        trade("1000", TokenType.USDC_SOLANA);

        ClaimResponse response = claimService.claim(trader.getId(), TokenType.USDC_SOLANA);

        assertThat(response.getClaimedCashbackTotal()).isEqualByComparingTo("1");
        assertThat(response.getClaimedCashbackCount()).isEqualTo(1);
        assertThat(response.getClaimedCommissionTotal()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("없는 사용자는 NOT_FOUND, 토큰 누락은 INVALID_INPUT")
    void testClaimRejections() {
        assertThatThrownBy(() -> claimService.claim(Long.MAX_VALUE, TokenType.USDC_SOLANA))
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.NOT_FOUND);
        assertThatThrownBy(() -> claimService.claim(referrer.getId(), null))
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("단건 청구: 다른 사용자는 NOT_OWNER, 재청구는 claimed=false / 0")
    void testSingleClaims() {
        TradeProcessingResponse response = trade("1000", TokenType.USDC_SOLANA);
        Commission commission = commissionRepository.findByTradeIdOrderByLevelAsc(response.getTradeId()).get(0);
        Cashback cashback = cashbackRepository.findByTradeId(response.getTradeId()).orElseThrow();

        assertThatThrownBy(() -> claimService.claimCommission(trader.getId(), commission.getId()))
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.NOT_OWNER);
        assertThatThrownBy(() -> claimService.claimCashback(referrer.getId(), cashback.getId()))
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.NOT_OWNER);
        assertThatThrownBy(() -> claimService.claimCommission(referrer.getId(), Long.MAX_VALUE))
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.NOT_FOUND);

        SingleClaimResponse claimed = claimService.claimCommission(referrer.getId(), commission.getId());
        assertThat(claimed.isClaimed()).isTrue();
        assertThat(claimed.getAmount()).isEqualByComparingTo("3");

        SingleClaimResponse again = claimService.claimCommission(referrer.getId(), commission.getId());
        assertThat(again.isClaimed()).isFalse();
        assertThat(again.getAmount()).isEqualByComparingTo("0");

        SingleClaimResponse cashbackClaim = claimService.claimCashback(trader.getId(), cashback.getId());
        assertThat(cashbackClaim.isClaimed()).isTrue();
        assertThat(cashbackClaim.getAmount()).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("청구 가능 잔액: 토큰별 미청구 합계")
    void testClaimableBalance() {
        trade("1000", TokenType.USDC_SOLANA);
        trade("2000", TokenType.USDC_ARBITRUM);

        ClaimableBalanceResponse before = claimService.getClaimableBalance(referrer.getId());
        assertThat(balanceOf(before, TokenType.USDC_SOLANA).getCommissions()).isEqualByComparingTo("3");
        assertThat(balanceOf(before, TokenType.USDC_ARBITRUM).getCommissions()).isEqualByComparingTo("6");
        assertThat(balanceOf(before, TokenType.USDC_ARBITRUM).getTotal()).isEqualByComparingTo("6");

        claimService.claim(referrer.getId(), TokenType.USDC_SOLANA);

        ClaimableBalanceResponse after = claimService.getClaimableBalance(referrer.getId());
        assertThat(balanceOf(after, TokenType.USDC_SOLANA).getTotal()).isEqualByComparingTo("0");
        assertThat(balanceOf(after, TokenType.USDC_ARBITRUM).getTotal()).isEqualByComparingTo("6");

        ClaimableBalanceResponse traderBalance = claimService.getClaimableBalance(trader.getId());
        assertThat(balanceOf(traderBalance, TokenType.USDC_SOLANA).getCashback()).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("동시 청구: 모든 행이 정확히 한 번만 합산")
    void testConcurrentClaimsCountEachRowOnce() throws Exception {
        for (int i = 0; i < 5; i++) {
            trade("1000", TokenType.USDC_SOLANA);
        }

        int threads = 2;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ClaimResponse>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        return claimService.claim(referrer.getId(), TokenType.USDC_SOLANA);
                    } catch (LedgerException e) {
                        assertThat(e.getErrorCode()).isEqualTo(LedgerErrorCode.TRANSACTION_FAILED);
                        return null;
                    }
                }));
            }
            start.countDown();

            BigDecimal total = DecimalMath.ZERO;
            int rows = 0;
            for (Future<ClaimResponse> result : results) {
                ClaimResponse response = result.get(30, TimeUnit.SECONDS);
                if (response != null) {
                    total = DecimalMath.add(total, response.getClaimedTotal());
                    rows += response.getClaimedCommissionCount();
                }
            }
            assertThat(total).isEqualByComparingTo("15");
            assertThat(rows).isEqualTo(5);
        } finally {
            pool.shutdownNow();
        }

        assertThat(commissionRepository
                .findByUserIdAndTokenTypeAndClaimedFalseOrderByIdAsc(referrer.getId(), TokenType.USDC_SOLANA))
                .isEmpty();
    }

    private TradeProcessingResponse trade(String volume, TokenType tokenType) {
        return tradeProcessingService.recordTrade(trader.getId(), new BigDecimal(volume), tokenType);
    }

    private ClaimableBalanceResponse.TokenBalance balanceOf(ClaimableBalanceResponse response, TokenType tokenType) {
        return response.getBalances().stream()
                .filter(balance -> balance.getTokenType() == tokenType)
                .findFirst()
                .orElseThrow();
    }
}
