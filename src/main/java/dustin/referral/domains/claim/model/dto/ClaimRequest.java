package dustin.referral.domains.claim.model.dto;

import dustin.referral.shared.model.TokenType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수익 청구 요청 DTO
 * Claim Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "토큰 종류별 전체 청구 요청")
public class ClaimRequest {

    @NotNull
    @Schema(description = "토큰 종류", example = "USDC-ARBITRUM", required = true)
    private TokenType tokenType;
}
