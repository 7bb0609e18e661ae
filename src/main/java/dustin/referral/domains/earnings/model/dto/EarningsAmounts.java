package dustin.referral.domains.earnings.model.dto;

import java.math.BigDecimal;

import dustin.referral.shared.decimal.DecimalMath;
import dustin.referral.shared.model.TokenType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 합계 / 청구 / 미청구 금액
 * Total, claimed and unclaimed amounts
 * 
 * tokenType은 토큰별 집계 항목에서만 채워짐
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EarningsAmounts {

    @Schema(description = "토큰 종류 (토큰별 집계에서만)", example = "USDC-ARBITRUM")
    private TokenType tokenType;

    @Builder.Default
    private BigDecimal total = DecimalMath.ZERO;

    @Builder.Default
    private BigDecimal claimed = DecimalMath.ZERO;

    @Builder.Default
    private BigDecimal unclaimed = DecimalMath.ZERO;

    /**
     * 금액 한 건 누적
     */
    public void accumulate(BigDecimal amount, boolean isClaimed) {
        total = DecimalMath.add(total, amount);
        if (isClaimed) {
            claimed = DecimalMath.add(claimed, amount);
        } else {
            unclaimed = DecimalMath.add(unclaimed, amount);
        }
    }
}
