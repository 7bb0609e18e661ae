package dustin.referral.domains.user.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 사용자 엔티티
 * User Entity
 * 
 * 역할:
 * - 추천 관계(referrer_id)와 추천 깊이, 수수료 등급을 보관
 * - 계정/인증 정보는 외부 인증 서비스가 관리 (여기서는 식별자와 이메일만)
 * 
 * 추천 그래프 불변식:
 * - 각 사용자는 최대 한 명의 추천인을 가짐 (포레스트 구조, 순환 없음)
 * - referral_depth = 0 (루트) 또는 추천인 깊이 + 1, 최대 3
 * - 추천인은 한 번만 설정 가능 (등록 시점에 검증)
 */
@Entity
@Table(name = "users",
       indexes = {
           @Index(name = "idx_users_referrer_id", columnList = "referrer_id"),
           @Index(name = "idx_users_referral_code", columnList = "referral_code", unique = true)
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    /**
     * 추천 코드 (발급 전에는 NULL, 발급 후 변경 불가)
     * 예: "A1B2C3D4"
     */
    @Column(name = "referral_code", length = 20)
    private String referralCode;

    /**
     * 추천인 사용자 ID (루트 사용자는 NULL)
     */
    @Column(name = "referrer_id")
    private Long referrerId;

    /**
     * 추천 깊이 (0 = 루트, 최대 3)
     */
    @Column(name = "referral_depth", nullable = false)
    @Builder.Default
    private Integer referralDepth = 0;

    /**
     * 수수료 등급 (예: 0.0100 = 1%)
     * 거래 수수료 = 거래량 × 수수료 등급
     */
    @Column(name = "fee_tier", nullable = false, precision = 5, scale = 4)
    @Builder.Default
    private BigDecimal feeTier = new BigDecimal("0.0100");

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
