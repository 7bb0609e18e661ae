package dustin.referral.domains.referral.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 추천 코드 검증 응답 DTO
 * Referral Code Validation Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "추천 코드 검증 결과")
public class ReferralCodeValidationResponse {

    @Schema(description = "사용 가능 여부", example = "true")
    private boolean valid;

    @Schema(description = "사용 불가 사유", example = "Referral code is at maximum depth")
    private String error;

    @Schema(description = "추천인 사용자 ID", example = "42")
    private Long referrerId;
}
