package dustin.referral.domains.referral.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상위 추천인 체인의 한 단계
 * One member of a trader's upline chain
 * 
 * level 1 = 직접 추천인, 거리가 멀어질수록 증가 (최대 3)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UplineMember {

    private Long userId;

    private int level;
}
