package dustin.referral.support;

import java.math.BigDecimal;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import dustin.referral.domains.commission.repository.CashbackRepository;
import dustin.referral.domains.commission.repository.CommissionRepository;
import dustin.referral.domains.commission.repository.TreasuryAllocationRepository;
import dustin.referral.domains.referral.service.ReferralRegistrationService;
import dustin.referral.domains.trade.repository.ProcessedTradeRepository;
import dustin.referral.domains.trade.repository.TradeRepository;
import dustin.referral.domains.user.model.entity.User;
import dustin.referral.domains.user.repository.UserRepository;

/**
 * 통합 테스트 공통 설정
 * Integration test base
 * 
 * - H2 (PostgreSQL 모드) + test 프로파일
 * - Kafka 리스너 자동 시작 / 이벤트 발행 비활성화
 * - 각 테스트 전에 원장 데이터 전체 삭제 (자식 테이블부터)
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class LedgerIntegrationSupport {

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    protected TradeRepository tradeRepository;

    @Autowired
    protected ProcessedTradeRepository processedTradeRepository;

    @Autowired
    protected CommissionRepository commissionRepository;

    @Autowired
    protected CashbackRepository cashbackRepository;

    @Autowired
    protected TreasuryAllocationRepository treasuryAllocationRepository;

    @Autowired
    protected ReferralRegistrationService referralRegistrationService;

    private int emailSequence;

    @BeforeEach
    void cleanLedger() {
        processedTradeRepository.deleteAllInBatch();
        commissionRepository.deleteAllInBatch();
        cashbackRepository.deleteAllInBatch();
        treasuryAllocationRepository.deleteAllInBatch();
        tradeRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
    }

    protected User createUser(String name) {
        emailSequence++;
        return userRepository.save(User.builder()
                .email(name + "-" + emailSequence + "@test.com")
                .build());
    }

    protected User createUser(String name, String feeTier) {
        emailSequence++;
        return userRepository.save(User.builder()
                .email(name + "-" + emailSequence + "@test.com")
                .feeTier(new BigDecimal(feeTier))
                .build());
    }

    /**
     * 추천 관계 설정 (referrer ← user)
     */
    protected void refer(User user, User referrer) {
        referralRegistrationService.setReferrer(user.getId(), referrer.getId());
    }

    protected User reload(User user) {
        return userRepository.findById(user.getId()).orElseThrow();
    }
}
