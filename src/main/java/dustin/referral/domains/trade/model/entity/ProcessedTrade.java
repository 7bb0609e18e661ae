package dustin.referral.domains.trade.model.entity;

import java.time.LocalDateTime;

import org.springframework.data.domain.Persistable;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 처리 완료 마커 (멱등성 키)
 * Processed Trade Marker
 * 
 * - PK = 거래 ID, 존재하면 해당 거래의 원장 행이 모두 기록되었음을 의미
 * - 거래 처리와 같은 트랜잭션에서 생성
 * - 항상 INSERT로 저장 (merge 금지), PK 충돌 시 ALREADY_PROCESSED
 */
@Entity
@Table(name = "processed_trades")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedTrade implements Persistable<Long> {

    @Id
    @Column(name = "trade_id", nullable = false)
    private Long tradeId;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private LocalDateTime processedAt;

    @Transient
    @Builder.Default
    private boolean newMarker = true;

    @Override
    public Long getId() {
        return tradeId;
    }

    @Override
    public boolean isNew() {
        return newMarker;
    }

    @PrePersist
    protected void onCreate() {
        if (processedAt == null) {
            processedAt = LocalDateTime.now();
        }
    }

    @PostPersist
    @PostLoad
    protected void markNotNew() {
        newMarker = false;
    }
}
