package dustin.referral.domains.trade.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import dustin.referral.domains.user.model.entity.User;
import dustin.referral.shared.model.TokenType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 거래 엔티티
 * Trade Entity
 * 
 * 역할:
 * - 수수료가 발생한 거래 한 건
 * - 커미션/캐시백/트레저리 원장 행의 소유자 (거래 삭제 시 함께 삭제)
 * 
 * 생명주기:
 * 1. 생성: processed_for_commissions = false (pending)
 * 2. 분배 완료: processed_for_commissions = true (한 번만, 원장 행 생성과 같은 트랜잭션)
 * 3. 처리 후에는 변경하지 않음
 * 
 * 수수료 계산:
 * - fee_amount = volume × fee_tier
 * - 예: 1000 × 0.0100 = 10
 */
@Entity
@Table(name = "trades",
       indexes = {
           @Index(name = "idx_trades_user_id", columnList = "user_id"),
           @Index(name = "idx_trades_created_at", columnList = "created_at")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 거래자 사용자 ID
     */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * 소유 관계 (FK, 사용자 삭제 시 거래도 삭제)
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", insertable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    /**
     * 거래량
     */
    @Column(name = "volume", nullable = false, precision = 28, scale = 18)
    private BigDecimal volume;

    /**
     * 수수료 금액 (분배 대상)
     */
    @Column(name = "fee_amount", nullable = false, precision = 28, scale = 18)
    private BigDecimal feeAmount;

    /**
     * 거래 시점의 수수료 등급 스냅샷
     */
    @Column(name = "fee_tier", nullable = false, precision = 5, scale = 4)
    private BigDecimal feeTier;

    @Column(name = "token_type", nullable = false, length = 32)
    private TokenType tokenType;

    @Column(name = "processed_for_commissions", nullable = false)
    @Builder.Default
    private boolean processedForCommissions = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
