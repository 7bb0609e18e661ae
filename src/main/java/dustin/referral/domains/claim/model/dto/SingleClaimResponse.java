package dustin.referral.domains.claim.model.dto;

import java.math.BigDecimal;

import dustin.referral.shared.model.TokenType;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 단건 청구 결과 DTO
 * Single Claim Response DTO
 * 
 * 이미 청구된 항목이면 claimed = false, amount = 0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "단건 청구 결과")
public class SingleClaimResponse {

    @Schema(description = "커미션 또는 캐시백 ID", example = "15")
    private Long id;

    @Schema(description = "토큰 종류", example = "USDC-SOLANA")
    private TokenType tokenType;

    @Schema(description = "이번 요청으로 청구된 금액", example = "3.000000000000000000")
    private BigDecimal amount;

    @Schema(description = "이번 요청이 청구에 성공했는지 여부", example = "true")
    private boolean claimed;
}
