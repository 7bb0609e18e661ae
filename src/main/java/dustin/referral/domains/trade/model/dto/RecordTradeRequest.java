package dustin.referral.domains.trade.model.dto;

import dustin.referral.shared.model.TokenType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 거래 기록 요청 DTO
 * Record Trade Request DTO
 * 
 * 거래자는 인증 토큰의 사용자, 수수료 등급은 사용자에게 저장된 값을 사용
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "거래 기록 요청")
public class RecordTradeRequest {

    /**
     * 거래량 (정밀도 보존을 위해 문자열)
     */
    @NotBlank
    @Schema(description = "거래량", example = "1000", required = true)
    private String volume;

    @NotNull
    @Schema(description = "토큰 종류", example = "USDC-ARBITRUM", required = true)
    private TokenType tokenType;
}
