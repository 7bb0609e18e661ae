package dustin.referral.domains.commission.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.referral.domains.commission.model.dto.CommissionBreakdown;
import dustin.referral.domains.commission.model.dto.LevelCommission;
import dustin.referral.domains.referral.model.dto.UplineMember;
import dustin.referral.shared.decimal.DecimalMath;
import dustin.referral.shared.model.TokenType;

/**
 * 커미션 계산기 테스트
 * Commission Calculator Test
 * 
 * 테스트 항목:
 * 1. 3단계 체인 전체 분배
 * 2. 추천인 없음 / 1명일 때 트레저리 귀속
 * 3. 절사가 발생하는 금액에서도 합계 항등식 유지
 */
class CommissionCalculatorTest {

    private static final Long TRADER = 100L;

    private final CommissionCalculator calculator = new CommissionCalculator();
    private final CommissionBreakdownValidator validator = new CommissionBreakdownValidator();

    private final List<UplineMember> fullChain = List.of(
            UplineMember.builder().userId(11L).level(1).build(),
            UplineMember.builder().userId(12L).level(2).build(),
            UplineMember.builder().userId(13L).level(3).build());

    @Test
    @DisplayName("수수료 10, 3단계 체인: 3.00 / 0.30 / 0.20, 캐시백 1.00, 트레저리 5.50")
    void fullChainDistribution() {
        CommissionBreakdown breakdown = calculator.calculate(TRADER, new BigDecimal("10"),
                TokenType.USDC_SOLANA, fullChain);

        assertThat(breakdown.getCommissions()).hasSize(3);
        assertLevel(breakdown.getCommissions().get(0), 11L, 1, "3.00");
        assertLevel(breakdown.getCommissions().get(1), 12L, 2, "0.30");
        assertLevel(breakdown.getCommissions().get(2), 13L, 3, "0.20");
        assertThat(breakdown.getCashback()).isEqualByComparingTo("1.00");
        assertThat(breakdown.getTreasury()).isEqualByComparingTo("5.50");
        assertThat(breakdown.getAbsorbed()).isEqualByComparingTo("0");
        assertThat(breakdown.getTraderId()).isEqualTo(TRADER);
        assertThat(validator.isValid(TRADER, new BigDecimal("10"), TokenType.USDC_SOLANA, fullChain, breakdown)).isTrue();
    }

    @Test
    @DisplayName("추천인 없음: 캐시백 10, 트레저리 90")
    void noUpline() {
        CommissionBreakdown breakdown = calculator.calculate(TRADER, new BigDecimal("100"),
                TokenType.USDC_ARBITRUM, Collections.emptyList());

        assertThat(breakdown.getCommissions()).isEmpty();
        assertThat(breakdown.getCashback()).isEqualByComparingTo("10");
        assertThat(breakdown.getTreasury()).isEqualByComparingTo("90");
        assertThat(breakdown.getBaseTreasury()).isEqualByComparingTo("55");
        assertThat(breakdown.getAbsorbed()).isEqualByComparingTo("35");
    }

    @Test
    @DisplayName("추천인 1명: 1단계 30, 캐시백 10, 트레저리 60")
    void singleReferrer() {
        List<UplineMember> upline = List.of(UplineMember.builder().userId(11L).level(1).build());

        CommissionBreakdown breakdown = calculator.calculate(TRADER, new BigDecimal("100"),
                TokenType.USDC_SOLANA, upline);

        assertThat(breakdown.getCommissions()).hasSize(1);
        assertLevel(breakdown.getCommissions().get(0), 11L, 1, "30");
        assertThat(breakdown.getCashback()).isEqualByComparingTo("10");
        assertThat(breakdown.getTreasury()).isEqualByComparingTo("60");
        assertThat(breakdown.getAbsorbed()).isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("수수료 33.33: 절사된 몫과 나머지 트레저리")
    void unevenFeeKeepsSumIdentity() {
        BigDecimal fee = new BigDecimal("33.33");

        CommissionBreakdown breakdown = calculator.calculate(TRADER, fee, TokenType.USDC_SOLANA, fullChain);

        assertLevel(breakdown.getCommissions().get(0), 11L, 1, "9.999");
        assertLevel(breakdown.getCommissions().get(1), 12L, 2, "0.9999");
        assertLevel(breakdown.getCommissions().get(2), 13L, 3, "0.6666");
        assertThat(breakdown.getCashback()).isEqualByComparingTo("3.333");
        assertThat(breakdown.getTreasury()).isEqualByComparingTo("18.3315");
        assertThat(sumOf(breakdown)).isEqualByComparingTo(fee);
    }

    @Test
    @DisplayName("최소 단위 수수료는 전부 트레저리로")
    void smallestFeeGoesToTreasury() {
        BigDecimal fee = new BigDecimal("0.000000000000000001");

        CommissionBreakdown breakdown = calculator.calculate(TRADER, fee, TokenType.USDC_SOLANA, fullChain);

        assertThat(breakdown.getCashback()).isEqualByComparingTo("0");
        assertThat(breakdown.getCommissions()).allSatisfy(c -> assertThat(c.getAmount()).isEqualByComparingTo("0"));
        assertThat(breakdown.getTreasury()).isEqualByComparingTo(fee);
        assertThat(validator.isValid(TRADER, fee, TokenType.USDC_SOLANA, fullChain, breakdown)).isTrue();
    }

    @Test
    @DisplayName("수수료 0: 모든 몫이 0")
    void zeroFee() {
        CommissionBreakdown breakdown = calculator.calculate(TRADER, BigDecimal.ZERO, TokenType.USDC_SOLANA, fullChain);

        assertThat(breakdown.getTreasury()).isEqualByComparingTo("0");
        assertThat(breakdown.getCashback()).isEqualByComparingTo("0");
        assertThat(breakdown.getCommissions()).hasSize(3);
    }

    @Test
    @DisplayName("임의 금액에서도 합계 항등식이 정확히 성립")
    void sumIdentityAcrossAmounts() {
        String[] fees = {"0.000000000000000007", "1", "0.3333", "123456.789012345678901", "9999999999.999999999999999999"};
        for (String value : fees) {
            BigDecimal fee = DecimalMath.normalize(new BigDecimal(value));
            for (int depth = 0; depth <= 3; depth++) {
                List<UplineMember> upline = fullChain.subList(0, depth);
                CommissionBreakdown breakdown = calculator.calculate(TRADER, fee, TokenType.USDC_ARBITRUM, upline);

                assertThat(sumOf(breakdown)).as("fee=%s depth=%d", value, depth).isEqualByComparingTo(fee);
                assertThat(validator.isValid(TRADER, fee, TokenType.USDC_ARBITRUM, upline, breakdown)).isTrue();
            }
        }
    }

    private BigDecimal sumOf(CommissionBreakdown breakdown) {
        BigDecimal total = DecimalMath.add(breakdown.getCashback(), breakdown.getTreasury());
        for (LevelCommission commission : breakdown.getCommissions()) {
            total = DecimalMath.add(total, commission.getAmount());
        }
        return total;
    }

    private void assertLevel(LevelCommission commission, Long beneficiaryId, int level, String amount) {
        assertThat(commission.getBeneficiaryId()).isEqualTo(beneficiaryId);
        assertThat(commission.getLevel()).isEqualTo(level);
        assertThat(commission.getAmount()).isEqualByComparingTo(amount);
    }
}
