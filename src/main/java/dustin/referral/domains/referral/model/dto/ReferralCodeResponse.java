package dustin.referral.domains.referral.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 추천 코드 발급 응답 DTO
 * Referral Code Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "추천 코드 발급 결과")
public class ReferralCodeResponse {

    @Schema(description = "추천 코드", example = "3F9A0C1B")
    private String code;

    /**
     * 이미 발급된 코드를 반환한 경우 true
     */
    @Schema(description = "기존 코드 반환 여부", example = "false")
    private boolean alreadyExists;
}
