package dustin.referral.domains.earnings.model.dto;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import dustin.referral.shared.decimal.DecimalMath;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수익 요약 DTO
 * Earnings Summary Response DTO
 * 
 * 구조:
 * - commissions: 합계/청구/미청구 + 단계별 + 토큰별
 * - cashback: 합계/청구/미청구 + 토큰별
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "수익 요약")
public class EarningsResponse {

    private CommissionEarnings commissions;

    private CashbackEarnings cashback;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CommissionEarnings {

        private EarningsAmounts summary;

        @Builder.Default
        private BigDecimal level1 = DecimalMath.ZERO;

        @Builder.Default
        private BigDecimal level2 = DecimalMath.ZERO;

        @Builder.Default
        private BigDecimal level3 = DecimalMath.ZERO;

        @Builder.Default
        private List<EarningsAmounts> byToken = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CashbackEarnings {

        private EarningsAmounts summary;

        @Builder.Default
        private List<EarningsAmounts> byToken = new ArrayList<>();
    }
}
