package dustin.referral.domains.earnings.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import dustin.referral.domains.claim.service.ClaimService;
import dustin.referral.domains.earnings.model.dto.EarningsAmounts;
import dustin.referral.domains.earnings.model.dto.EarningsHistoryItem;
import dustin.referral.domains.earnings.model.dto.EarningsResponse;
import dustin.referral.domains.earnings.model.dto.EarningsType;
import dustin.referral.domains.trade.model.dto.TradeProcessingResponse;
import dustin.referral.domains.trade.service.TradeProcessingService;
import dustin.referral.domains.user.model.entity.User;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.model.TokenType;
import dustin.referral.shared.model.dto.PageResponse;
import dustin.referral.support.LedgerIntegrationSupport;

/**
 * 수익 조회 통합 테스트
 * Earnings Service Integration Test
 */
class EarningsServiceTest extends LedgerIntegrationSupport {

    @Autowired
    private EarningsService earningsService;

    @Autowired
    private TradeProcessingService tradeProcessingService;

    @Autowired
    private ClaimService claimService;

    private User grandReferrer;
    private User referrer;
    private User trader;

    @BeforeEach
    void setUp() {
        grandReferrer = createUser("grand");
        referrer = createUser("referrer");
        trader = createUser("trader", "0.0100");
        refer(referrer, grandReferrer);
        refer(trader, referrer);
    }

    @Test
    @DisplayName("요약: 단계별 / 토큰별 커미션과 청구 상태")
    void testEarningsSummary() {
        trade("1000", TokenType.USDC_SOLANA);
        trade("2000", TokenType.USDC_ARBITRUM);
        claimService.claim(referrer.getId(), TokenType.USDC_SOLANA);

        EarningsResponse earnings = earningsService.getEarnings(referrer.getId(), null);

        EarningsAmounts summary = earnings.getCommissions().getSummary();
        assertThat(summary.getTotal()).isEqualByComparingTo("9");
        assertThat(summary.getClaimed()).isEqualByComparingTo("3");
        assertThat(summary.getUnclaimed()).isEqualByComparingTo("6");
        assertThat(earnings.getCommissions().getLevel1()).isEqualByComparingTo("9");
        assertThat(earnings.getCommissions().getLevel2()).isEqualByComparingTo("0");
        assertThat(earnings.getCommissions().getByToken()).hasSize(2);
        assertThat(earnings.getCashback().getSummary().getTotal()).isEqualByComparingTo("0");

        EarningsResponse grand = earningsService.getEarnings(grandReferrer.getId(), null);
        assertThat(grand.getCommissions().getLevel2()).isEqualByComparingTo("0.9");
        assertThat(grand.getCommissions().getLevel1()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("토큰 필터와 캐시백 요약")
    void testEarningsFilteredByToken() {
        trade("1000", TokenType.USDC_SOLANA);
        trade("2000", TokenType.USDC_ARBITRUM);

        EarningsResponse referrerSolana = earningsService.getEarnings(referrer.getId(), TokenType.USDC_SOLANA);
        assertThat(referrerSolana.getCommissions().getSummary().getTotal()).isEqualByComparingTo("3");
        assertThat(referrerSolana.getCommissions().getByToken())
                .extracting(EarningsAmounts::getTokenType)
                .containsExactly(TokenType.USDC_SOLANA);

        EarningsResponse traderEarnings = earningsService.getEarnings(trader.getId(), null);
        assertThat(traderEarnings.getCashback().getSummary().getTotal()).isEqualByComparingTo("3");
        assertThat(traderEarnings.getCashback().getSummary().getUnclaimed()).isEqualByComparingTo("3");
        assertThat(traderEarnings.getCommissions().getSummary().getTotal()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("내역: 최신순, 페이지 단위, 종류 필터")
    void testEarningsHistory() {
        TradeProcessingResponse first = trade("1000", TokenType.USDC_SOLANA);
        TradeProcessingResponse second = trade("500", TokenType.USDC_SOLANA);
        TradeProcessingResponse third = trade("100", TokenType.USDC_ARBITRUM);

        PageResponse<EarningsHistoryItem> page = earningsService.getEarningsHistory(
                referrer.getId(), null, EarningsType.ALL, 0, 2);

        assertThat(page.getTotalElements()).isEqualTo(3);
        assertThat(page.getTotalPages()).isEqualTo(2);
        assertThat(page.isHasMore()).isTrue();
        assertThat(page.getContent()).extracting(EarningsHistoryItem::getTradeId)
                .containsExactly(third.getTradeId(), second.getTradeId());
        assertThat(page.getContent().get(0).getType()).isEqualTo(EarningsType.COMMISSION);
        assertThat(page.getContent().get(0).getLevel()).isEqualTo(1);

        PageResponse<EarningsHistoryItem> last = earningsService.getEarningsHistory(
                referrer.getId(), null, null, 1, 2);
        assertThat(last.getContent()).extracting(EarningsHistoryItem::getTradeId)
                .containsExactly(first.getTradeId());
        assertThat(last.isLast()).isTrue();

        PageResponse<EarningsHistoryItem> cashbackOnly = earningsService.getEarningsHistory(
                trader.getId(), TokenType.USDC_SOLANA, EarningsType.CASHBACK, 0, 50);
        assertThat(cashbackOnly.getContent()).hasSize(2)
                .allSatisfy(item -> {
                    assertThat(item.getType()).isEqualTo(EarningsType.CASHBACK);
                    assertThat(item.getLevel()).isNull();
                });

        PageResponse<EarningsHistoryItem> commissionsOnly = earningsService.getEarningsHistory(
                trader.getId(), null, EarningsType.COMMISSION, 0, 50);
        assertThat(commissionsOnly.getContent()).isEmpty();
        assertThat(commissionsOnly.getTotalElements()).isZero();
    }

    @Test
    @DisplayName("페이지 크기 범위 밖이면 INVALID_INPUT")
    void testHistoryPageValidation() {
        assertThatThrownBy(() -> earningsService.getEarningsHistory(referrer.getId(), null, null, 0, 0))
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.INVALID_INPUT);
        assertThatThrownBy(() -> earningsService.getEarningsHistory(referrer.getId(), null, null, 0, 101))
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.INVALID_INPUT);
        assertThatThrownBy(() -> earningsService.getEarningsHistory(referrer.getId(), null, null, -1, 10))
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.INVALID_INPUT);
        assertThatThrownBy(() -> EarningsType.fromValue("bonus"))
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.INVALID_INPUT);
    }

    private TradeProcessingResponse trade(String volume, TokenType tokenType) {
        return tradeProcessingService.recordTrade(trader.getId(), new BigDecimal(volume), tokenType);
    }
}
