package dustin.referral.domains.claim.model.dto;

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
 * 청구 가능 잔액 DTO
 * Claimable Balance Response DTO
 * 
 * 지원하는 모든 토큰 종류에 대해 한 항목씩 (잔액 0 포함)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "토큰 종류별 청구 가능 잔액")
public class ClaimableBalanceResponse {

    @Builder.Default
    private List<TokenBalance> balances = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TokenBalance {

        @Schema(description = "토큰 종류", example = "USDC-SOLANA")
        private TokenType tokenType;

        @Schema(description = "미청구 커미션", example = "0.300000000000000000")
        private BigDecimal commissions;

        @Schema(description = "미청구 캐시백", example = "1.000000000000000000")
        private BigDecimal cashback;

        @Schema(description = "합계", example = "1.300000000000000000")
        private BigDecimal total;
    }
}
