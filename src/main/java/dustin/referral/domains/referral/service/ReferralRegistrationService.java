package dustin.referral.domains.referral.service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.referral.domains.referral.model.dto.MyReferralCodeResponse;
import dustin.referral.domains.referral.model.dto.ReferralCodeResponse;
import dustin.referral.domains.referral.model.dto.ReferralCodeValidationResponse;
import dustin.referral.domains.referral.model.dto.RegisterReferralResponse;
import dustin.referral.domains.user.model.entity.User;
import dustin.referral.domains.user.repository.UserRepository;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import dustin.referral.shared.transaction.SerializableTransactionExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 추천 등록 서비스
 * Referral Registration Service
 * 
 * 역할:
 * - 추천 코드 발급 / 조회 / 검증
 * - 추천인 등록 (추천 그래프에 간선 추가)
 * 
 * 등록 검증 순서 (모두 쓰기 전에 검사):
 * 1. NOT_FOUND: 사용자 없음
 * 2. ALREADY_REFERRED: 이미 추천인이 있음
 * 3. INVALID_INPUT: 코드 형식 오류
 * 4. NOT_FOUND: 코드에 해당하는 추천인 없음
 * 5. SELF_REFERRAL: 본인 코드
 * 6. MAX_DEPTH_EXCEEDED: 추천인의 깊이가 이미 3
 * 7. CIRCULAR_REFERENCE: 추천인이 내 하위 트리에 있음 (코드 보유 여부와 관계없이 항상 검사)
 * 8. MAX_DEPTH_EXCEEDED: 추천인 깊이 + 1 + 내 하위 트리 높이가 3 초과
 * 
 * 하위 트리 이동:
 * - 이미 하위 추천이 있는 사용자가 등록하면 하위 사용자들의 깊이도 같은 트랜잭션에서 갱신
 * 
 * 동시성:
 * - 검사와 쓰기를 SERIALIZABLE 트랜잭션 하나에서 실행
 * - 쓰기는 조건부 UPDATE (referrer_id IS NULL), 0건이면 ALREADY_REFERRED
 * - 코드 발급은 조건부 UPDATE + 유니크 인덱스, 충돌 시 새 코드로 재시도
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferralRegistrationService {

    /**
     * 코드 충돌 시 최대 발급 시도 횟수
     */
    static final int MAX_CODE_ATTEMPTS = 10;

    private static final String SHARE_PATH = "/register?ref=";

    private final UserRepository userRepository;
    private final ReferralGraphService referralGraphService;
    private final ReferralCodeGenerator codeGenerator;
    private final SerializableTransactionExecutor transactionExecutor;

    /**
     * 추천 코드 발급 (멱등)
     * Generate referral code
     * 
     * - 이미 코드가 있으면 그대로 반환 (alreadyExists = true)
     * - 없으면 8자리 코드를 발급, 다른 사용자와 충돌하면 새 코드로 재시도
     * 
     * @throws LedgerException NOT_FOUND, TRANSACTION_FAILED (충돌 재시도 소진)
     */
    public ReferralCodeResponse generateCode(Long userId) {
        for (int attempt = 1; attempt <= MAX_CODE_ATTEMPTS; attempt++) {
            try {
                ReferralCodeResponse response = transactionExecutor.execute(status -> assignCode(userId));
                if (!response.isAlreadyExists()) {
                    log.info("[ReferralRegistrationService] 추천 코드 발급: userId={}, code={}",
                            userId, response.getCode());
                }
                return response;
            } catch (DataIntegrityViolationException e) {
                log.warn("[ReferralRegistrationService] 추천 코드 충돌, 재발급: userId={}, attempt={}/{}",
                        userId, attempt, MAX_CODE_ATTEMPTS);
            }
        }
        throw new LedgerException(LedgerErrorCode.TRANSACTION_FAILED,
                "Could not allocate a unique referral code after " + MAX_CODE_ATTEMPTS + " attempts");
    }

    private ReferralCodeResponse assignCode(Long userId) {
        User user = findUser(userId);
        if (user.getReferralCode() != null) {
            return ReferralCodeResponse.builder().code(user.getReferralCode()).alreadyExists(true).build();
        }

        String code = codeGenerator.generate();
        int updated = userRepository.assignReferralCode(userId, code, LocalDateTime.now());
        if (updated == 0) {
            // 동시 요청이 먼저 발급함
            return ReferralCodeResponse.builder().code(findUser(userId).getReferralCode()).alreadyExists(true).build();
        }
        return ReferralCodeResponse.builder().code(code).alreadyExists(false).build();
    }

    /**
     * 내 추천 코드 조회
     * 
     * @return 코드 (미발급 시 null), 직접 추천 수, 공유 경로
     */
    @Transactional(readOnly = true)
    public MyReferralCodeResponse getMyCode(Long userId) {
        User user = findUser(userId);
        String code = user.getReferralCode();
        return MyReferralCodeResponse.builder()
                .code(code)
                .referralCount(userRepository.countByReferrerId(userId))
                .shareUrl(code == null ? null : SHARE_PATH + code)
                .build();
    }

    /**
     * 추천 코드 검증 (예외 없이 결과로 반환)
     * Validate a referral code before registration
     */
    @Transactional(readOnly = true)
    public ReferralCodeValidationResponse validateCode(String rawCode) {
        String code = codeGenerator.normalize(rawCode);
        if (!codeGenerator.isValidFormat(code)) {
            return invalid("Invalid referral code format");
        }
        Optional<User> referrer = userRepository.findByReferralCode(code);
        if (referrer.isEmpty()) {
            return invalid("Referral code not found");
        }
        if (referrer.get().getReferralDepth() >= ReferralGraphService.MAX_LEVELS) {
            return invalid("Referral code is at maximum depth");
        }
        return ReferralCodeValidationResponse.builder()
                .valid(true)
                .referrerId(referrer.get().getId())
                .build();
    }

    /**
     * 추천 코드로 추천인 등록
     * Register a referrer by code
     * 
     * @param userId 등록하는 사용자
     * @param rawCode 추천인의 코드 (대소문자 무관, 앞뒤 공백 허용)
     * @throws LedgerException NOT_FOUND, ALREADY_REFERRED, INVALID_INPUT, SELF_REFERRAL,
     *                         MAX_DEPTH_EXCEEDED, CIRCULAR_REFERENCE, TRANSACTION_FAILED
     */
    public RegisterReferralResponse register(Long userId, String rawCode) {
        RegisterReferralResponse response = transactionExecutor.execute(status -> {
            User user = findUser(userId);
            requireNoReferrer(user);

            String code = codeGenerator.normalize(rawCode);
            if (!codeGenerator.isValidFormat(code)) {
                throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "Invalid referral code format");
            }
            User referrer = userRepository.findByReferralCode(code)
                    .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_FOUND,
                            "Referral code not found: " + code));
            return attach(user, referrer);
        });

        log.info("[ReferralRegistrationService] 추천인 등록: userId={}, referrerId={}, depth={}",
                response.getUserId(), response.getReferrerId(), response.getReferralDepth());
        return response;
    }

    /**
     * 추천인 ID로 직접 등록 (register와 동일한 검증)
     * Attach a referrer by id
     */
    public RegisterReferralResponse setReferrer(Long userId, Long referrerId) {
        RegisterReferralResponse response = transactionExecutor.execute(status -> {
            User user = findUser(userId);
            requireNoReferrer(user);

            if (referrerId == null) {
                throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "Referrer id is required");
            }
            User referrer = userRepository.findById(referrerId)
                    .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_FOUND,
                            "Referrer not found: " + referrerId));
            return attach(user, referrer);
        });

        log.info("[ReferralRegistrationService] 추천인 설정: userId={}, referrerId={}, depth={}",
                response.getUserId(), response.getReferrerId(), response.getReferralDepth());
        return response;
    }

    private RegisterReferralResponse attach(User user, User referrer) {
        if (referrer.getId().equals(user.getId())) {
            throw new LedgerException(LedgerErrorCode.SELF_REFERRAL, "Cannot use your own referral code");
        }
        if (referrer.getReferralDepth() >= ReferralGraphService.MAX_LEVELS) {
            throw new LedgerException(LedgerErrorCode.MAX_DEPTH_EXCEEDED,
                    "Referrer is already at maximum depth " + ReferralGraphService.MAX_LEVELS);
        }
        if (referralGraphService.isInDownline(user.getId(), referrer.getId())) {
            throw new LedgerException(LedgerErrorCode.CIRCULAR_REFERENCE,
                    "Referrer " + referrer.getId() + " is in the downline of user " + user.getId());
        }

        int depth = referrer.getReferralDepth() + 1;
        List<List<Long>> downline = referralGraphService.getDownlineByLevel(user.getId());
        int height = heightOf(downline);
        if (depth + height > ReferralGraphService.MAX_LEVELS) {
            throw new LedgerException(LedgerErrorCode.MAX_DEPTH_EXCEEDED,
                    "Referral chain would exceed depth " + ReferralGraphService.MAX_LEVELS
                            + " (referrer depth " + referrer.getReferralDepth() + ", downline height " + height + ")");
        }

        LocalDateTime now = LocalDateTime.now();
        int updated = userRepository.attachReferrer(user.getId(), referrer.getId(), depth, now);
        if (updated == 0) {
            throw new LedgerException(LedgerErrorCode.ALREADY_REFERRED, "User already has a referrer");
        }
        for (int level = 1; level <= height; level++) {
            userRepository.updateReferralDepth(downline.get(level - 1), depth + level, now);
        }
        return RegisterReferralResponse.builder()
                .userId(user.getId())
                .referrerId(referrer.getId())
                .referralDepth(depth)
                .build();
    }

    /**
     * 하위 트리 높이 (비어 있지 않은 마지막 단계)
     */
    private int heightOf(List<List<Long>> downline) {
        int height = 0;
        for (int level = 1; level <= downline.size(); level++) {
            if (!downline.get(level - 1).isEmpty()) {
                height = level;
            }
        }
        return height;
    }

    private void requireNoReferrer(User user) {
        if (user.getReferrerId() != null) {
            throw new LedgerException(LedgerErrorCode.ALREADY_REFERRED, "User already has a referrer");
        }
    }

    private User findUser(Long userId) {
        if (userId == null) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "User id is required");
        }
        return userRepository.findById(userId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_FOUND, "User not found: " + userId));
    }

    private ReferralCodeValidationResponse invalid(String error) {
        return ReferralCodeValidationResponse.builder().valid(false).error(error).build();
    }
}
