package dustin.referral.domains.commission.model.dto;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import dustin.referral.shared.model.TokenType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수수료 분배 결과
 * Commission Breakdown
 * 
 * 항등식: Σ commissions.amount + cashback + treasury = feeAmount (정확히 일치)
 * 
 * treasury = baseTreasury + absorbed + 절사 잔여분
 * - baseTreasury: 수수료 × 55%
 * - absorbed: 추천인이 없는 단계의 몫 합계
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "수수료 분배 결과")
public class CommissionBreakdown {

    @Schema(description = "분배 대상 수수료", example = "10.000000000000000000")
    private BigDecimal feeAmount;

    @Schema(description = "토큰 종류", example = "USDC-ARBITRUM")
    private TokenType tokenType;

    /**
     * 거래자 본인 (캐시백 수령인)
     */
    @Schema(description = "거래자 사용자 ID", example = "7")
    private Long traderId;

    @Builder.Default
    @Schema(description = "단계별 커미션 (추천인이 있는 단계만)")
    private List<LevelCommission> commissions = new ArrayList<>();

    @Schema(description = "캐시백", example = "1.000000000000000000")
    private BigDecimal cashback;

    @Schema(description = "트레저리 귀속 금액", example = "5.500000000000000000")
    private BigDecimal treasury;

    @Schema(description = "트레저리 기본 몫 (55%)", example = "5.500000000000000000")
    private BigDecimal baseTreasury;

    @Schema(description = "추천인이 없는 단계에서 귀속된 몫", example = "0.000000000000000000")
    private BigDecimal absorbed;
}
