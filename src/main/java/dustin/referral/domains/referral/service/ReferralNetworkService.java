package dustin.referral.domains.referral.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.referral.domains.referral.model.dto.ReferralNetworkResponse;
import dustin.referral.domains.user.repository.UserRepository;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import lombok.RequiredArgsConstructor;

/**
 * 추천 네트워크 조회 서비스
 * Referral Network Service
 * 
 * 직접 추천 목록 + 1~3단계 하위 추천 수 (읽기 전용)
 */
@Service
@RequiredArgsConstructor
public class ReferralNetworkService {

    private final UserRepository userRepository;
    private final ReferralGraphService referralGraphService;

    @Transactional(readOnly = true)
    public ReferralNetworkResponse getNetwork(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new LedgerException(LedgerErrorCode.NOT_FOUND, "User not found: " + userId);
        }

        List<ReferralNetworkResponse.DirectReferral> direct = userRepository
                .findByReferrerIdOrderByCreatedAtAsc(userId).stream()
                .map(user -> ReferralNetworkResponse.DirectReferral.builder()
                        .userId(user.getId())
                        .email(user.getEmail())
                        .depth(user.getReferralDepth())
                        .joinedAt(user.getCreatedAt())
                        .build())
                .collect(Collectors.toList());

        List<List<Long>> levels = referralGraphService.getDownlineByLevel(userId);
        int level1 = levels.get(0).size();
        int level2 = levels.get(1).size();
        int level3 = levels.get(2).size();

        return ReferralNetworkResponse.builder()
                .direct(direct)
                .level1Count(level1)
                .level2Count(level2)
                .level3Count(level3)
                .totalNetwork(level1 + level2 + level3)
                .build();
    }
}
