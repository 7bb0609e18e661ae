package dustin.referral.domains.user.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.referral.domains.user.model.entity.User;

/**
 * 사용자 리포지토리
 * User Repository
 * 
 * 역할:
 * - 추천 그래프 조회 (추천인 방향 / 하위 추천 방향)
 * - 추천인, 추천 코드의 조건부 갱신 (이미 설정된 경우 0건 갱신)
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByReferralCode(String referralCode);

    /**
     * 직접 추천한 사용자 수
     */
    long countByReferrerId(Long referrerId);

    /**
     * 직접 추천한 사용자 목록 (가입 순)
     */
    List<User> findByReferrerIdOrderByCreatedAtAsc(Long referrerId);

    /**
     * 주어진 사용자들이 직접 추천한 사용자 ID 목록 (하위 방향 한 단계)
     * 
     * @param referrerIds 추천인 ID 목록
     * @return 하위 사용자 ID 목록
     */
    @Query("SELECT u.id FROM User u WHERE u.referrerId IN :referrerIds")
    List<Long> findIdsByReferrerIdIn(@Param("referrerIds") Collection<Long> referrerIds);

    /**
     * 추천인 조건부 설정 (추천인이 없을 때만)
     * Conditionally attach a referrer
     * 
     * @return 갱신된 행 수 (0이면 이미 추천인이 있음)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE User u
        SET u.referrerId = :referrerId, u.referralDepth = :depth, u.updatedAt = :now
        WHERE u.id = :userId AND u.referrerId IS NULL
        """)
    int attachReferrer(
        @Param("userId") Long userId,
        @Param("referrerId") Long referrerId,
        @Param("depth") int depth,
        @Param("now") LocalDateTime now
    );

    /**
     * 하위 추천 사용자들의 깊이 재설정 (추천인 등록 시 하위 트리 전체를 함께 이동)
     *
     * @param userIds 같은 단계의 하위 사용자 ID 목록
     * @param depth 새 깊이
     * @return 갱신된 행 수
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE User u
        SET u.referralDepth = :depth, u.updatedAt = :now
        WHERE u.id IN :userIds
        """)
    int updateReferralDepth(
        @Param("userIds") Collection<Long> userIds,
        @Param("depth") int depth,
        @Param("now") LocalDateTime now
    );

    /**
     * 추천 코드 조건부 설정 (코드가 없을 때만, 유니크 제약으로 중복 방지)
     * 
     * @return 갱신된 행 수 (0이면 이미 코드가 있음)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE User u
        SET u.referralCode = :code, u.updatedAt = :now
        WHERE u.id = :userId AND u.referralCode IS NULL
        """)
    int assignReferralCode(
        @Param("userId") Long userId,
        @Param("code") String code,
        @Param("now") LocalDateTime now
    );
}
