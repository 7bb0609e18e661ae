package dustin.referral.domains.referral.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 추천인 등록 요청 DTO
 * Register Referral Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "추천인 등록 요청")
public class RegisterReferralRequest {

    @NotBlank
    @Size(min = 1, max = 20)
    @Schema(description = "추천인의 추천 코드 (대소문자 무관)", example = "3f9a0c1b", required = true)
    private String referralCode;
}
