package dustin.referral.domains.commission.model;

import java.math.BigDecimal;

/**
 * 커미션 분배 비율 (불변 상수)
 * Commission Distribution Rates
 * 
 * 분배 구조 (수수료 100% 기준):
 * - 캐시백 (거래자 본인): 10%
 * - 1단계 추천인: 30%
 * - 2단계 추천인: 3%
 * - 3단계 추천인: 2%
 * - 트레저리 (기본): 55%
 * 
 * 추천인이 없는 단계의 몫은 트레저리로 귀속됩니다.
 * 
 * 다섯 비율의 합은 정확히 1이어야 하며, 클래스 로딩 시 한 번 검증합니다.
 * 런타임에 변경할 수 없습니다.
 */
public final class CommissionRates {

    public static final BigDecimal CASHBACK = new BigDecimal("0.10");
    public static final BigDecimal LEVEL_1 = new BigDecimal("0.30");
    public static final BigDecimal LEVEL_2 = new BigDecimal("0.03");
    public static final BigDecimal LEVEL_3 = new BigDecimal("0.02");
    public static final BigDecimal TREASURY = new BigDecimal("0.55");

    static {
        BigDecimal total = CASHBACK.add(LEVEL_1).add(LEVEL_2).add(LEVEL_3).add(TREASURY);
        if (total.compareTo(BigDecimal.ONE) != 0) {
            throw new IllegalStateException("Commission rates must sum to 1, got " + total.toPlainString());
        }
    }

    private CommissionRates() {
    }

    /**
     * 단계별 커미션 비율
     * 
     * @param level 1, 2, 3
     * @throws IllegalArgumentException 범위 밖의 단계
     */
    public static BigDecimal rateForLevel(int level) {
        switch (level) {
            case 1:
                return LEVEL_1;
            case 2:
                return LEVEL_2;
            case 3:
                return LEVEL_3;
            default:
                throw new IllegalArgumentException("Unsupported commission level: " + level);
        }
    }

    /**
     * 전체 비율 합계 (항상 1)
     */
    public static BigDecimal total() {
        return CASHBACK.add(LEVEL_1).add(LEVEL_2).add(LEVEL_3).add(TREASURY);
    }
}
