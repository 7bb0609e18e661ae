package dustin.referral.domains.referral.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.referral.domains.referral.model.dto.UplineMember;
import dustin.referral.domains.user.model.entity.User;
import dustin.referral.domains.user.repository.UserRepository;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 추천 그래프 조회 서비스
 * Referral Graph Accessor
 * 
 * 역할:
 * - 사용자의 상위 추천인 체인 조회 (최대 3단계)
 * - 하위 추천 트리 단계별 조회 (네트워크 통계)
 * - 하위 추천 방향 도달 가능 여부 조회 (순환 참조 방지용)
 * 
 * 탐색 방식:
 * - 재귀 쿼리 대신 방문 집합을 가진 반복 탐색
 * - 깊이 제한으로 데이터가 손상되어도 반드시 종료
 * - 가까운 단계부터 순서대로 반환 (level 1, 2, 3)
 * 
 * 트랜잭션:
 * - 호출자의 트랜잭션에 참여 (거래 처리/등록 트랜잭션 안에서 일관된 스냅샷 조회)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferralGraphService {

    /**
     * 커미션 지급 최대 단계 / 최대 추천 깊이
     */
    public static final int MAX_LEVELS = 3;

    private final UserRepository userRepository;

    /**
     * 상위 추천인 체인 조회 (기본 3단계)
     */
    @Transactional(readOnly = true)
    public List<UplineMember> getUplineChain(Long userId) {
        return getUplineChain(userId, MAX_LEVELS);
    }

    /**
     * 상위 추천인 체인 조회
     * Get upline chain
     * 
     * 처리 과정:
     * 1. 사용자 조회 (없으면 NOT_FOUND)
     * 2. referrer_id를 따라 위로 이동하며 (userId, level) 수집
     * 3. 루트(referrer_id = NULL) 또는 maxLevels 도달 시 종료
     * 
     * 예시:
     * - trader → level1 → level2 → level3 → root
     * - 결과: [(level1, 1), (level2, 2), (level3, 3)] (root는 4단계라 제외)
     * 
     * @param userId 거래자 ID
     * @param maxLevels 최대 단계 (1~3)
     * @return 가까운 단계부터 정렬된 체인 (추천인이 없으면 빈 목록)
     */
    @Transactional(readOnly = true)
    public List<UplineMember> getUplineChain(Long userId, int maxLevels) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_FOUND, "User not found: " + userId));

        int limit = Math.min(Math.max(maxLevels, 0), MAX_LEVELS);
        if (limit == 0 || user.getReferrerId() == null) {
            return Collections.emptyList();
        }

        List<UplineMember> chain = new ArrayList<>(limit);
        Set<Long> visited = new HashSet<>();
        visited.add(userId);

        Long nextId = user.getReferrerId();
        int level = 1;
        while (nextId != null && level <= limit) {
            if (!visited.add(nextId)) {
                // 순환 데이터: 이미 방문한 사용자에서 중단
                log.warn("[ReferralGraphService] 추천 그래프 순환 감지: userId={}, repeatedId={}", userId, nextId);
                break;
            }
            Optional<User> referrer = userRepository.findById(nextId);
            if (referrer.isEmpty()) {
                log.warn("[ReferralGraphService] 존재하지 않는 추천인 참조: userId={}, referrerId={}", userId, nextId);
                break;
            }
            chain.add(UplineMember.builder().userId(nextId).level(level).build());
            nextId = referrer.get().getReferrerId();
            level++;
        }
        return chain;
    }

    /**
     * 하위 추천 트리를 단계별로 조회 (최대 3단계)
     * Downline grouped by level
     * 
     * @param userId 기준 사용자
     * @return index 0 = 1단계(직접 추천), 1 = 2단계, 2 = 3단계
     */
    @Transactional(readOnly = true)
    public List<List<Long>> getDownlineByLevel(Long userId) {
        List<List<Long>> levels = new ArrayList<>(MAX_LEVELS);
        Set<Long> visited = new HashSet<>();
        visited.add(userId);
        List<Long> frontier = List.of(userId);

        for (int level = 1; level <= MAX_LEVELS; level++) {
            List<Long> next = new ArrayList<>();
            if (!frontier.isEmpty()) {
                for (Long childId : userRepository.findIdsByReferrerIdIn(frontier)) {
                    if (visited.add(childId)) {
                        next.add(childId);
                    }
                }
            }
            levels.add(next);
            frontier = next;
        }
        return levels;
    }

    /**
     * candidateId가 userId의 하위 추천 트리(자기 자신 포함)에 있는지 확인
     * Is candidate reachable from user by following referrer edges downward?
     * 
     * 너비 우선 탐색: 한 단계씩 "referrer_id IN (현재 단계)" 조회
     * 
     * @param userId 기준 사용자
     * @param candidateId 확인할 사용자 (등록하려는 추천인)
     * @return 하위 트리에 있으면 true
     */
    @Transactional(readOnly = true)
    public boolean isInDownline(Long userId, Long candidateId) {
        if (userId.equals(candidateId)) {
            return true;
        }
        Set<Long> visited = new HashSet<>();
        visited.add(userId);
        List<Long> frontier = List.of(userId);

        while (!frontier.isEmpty()) {
            List<Long> next = new ArrayList<>();
            for (Long childId : userRepository.findIdsByReferrerIdIn(frontier)) {
                if (childId.equals(candidateId)) {
                    return true;
                }
                if (visited.add(childId)) {
                    next.add(childId);
                }
            }
            frontier = next;
        }
        return false;
    }
}
