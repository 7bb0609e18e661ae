package dustin.referral.domains.claim.model.dto;

import java.math.BigDecimal;

import dustin.referral.shared.model.TokenType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수익 청구 결과 DTO
 * Claim Response DTO
 * 
 * 청구할 항목이 없으면 모든 합계가 0 (오류 아님)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "청구 결과")
public class ClaimResponse {

    @Schema(description = "토큰 종류", example = "USDC-ARBITRUM")
    private TokenType tokenType;

    @Schema(description = "청구된 커미션 합계", example = "3.300000000000000000")
    private BigDecimal claimedCommissionTotal;

    @Schema(description = "청구된 캐시백 합계", example = "1.000000000000000000")
    private BigDecimal claimedCashbackTotal;

    @Schema(description = "청구 합계", example = "4.300000000000000000")
    private BigDecimal claimedTotal;

    @Schema(description = "청구된 커미션 건수", example = "2")
    private int claimedCommissionCount;

    @Schema(description = "청구된 캐시백 건수", example = "1")
    private int claimedCashbackCount;
}
