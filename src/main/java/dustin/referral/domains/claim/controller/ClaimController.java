package dustin.referral.domains.claim.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.referral.domains.claim.model.dto.ClaimRequest;
import dustin.referral.domains.claim.model.dto.ClaimResponse;
import dustin.referral.domains.claim.model.dto.ClaimableBalanceResponse;
import dustin.referral.domains.claim.model.dto.SingleClaimResponse;
import dustin.referral.domains.claim.service.ClaimService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

import lombok.RequiredArgsConstructor;

/**
 * 수익 청구 컨트롤러
 * Claim Controller
 * 
 * API 엔드포인트:
 * - POST /api/referral/claims - 토큰 종류별 전체 청구
 * - POST /api/referral/claims/commissions/{id} - 커미션 단건 청구
 * - POST /api/referral/claims/cashback/{id} - 캐시백 단건 청구
 * - GET /api/referral/claimable - 청구 가능 잔액
 */
@RestController
@RequestMapping("/api/referral")
@RequiredArgsConstructor
@Tag(name = "Claims", description = "커미션/캐시백 청구 API")
public class ClaimController {

    private final ClaimService claimService;

    @Operation(
            summary = "전체 청구",
            description = "지정한 토큰 종류의 미청구 커미션과 캐시백을 모두 청구합니다. 청구할 항목이 없으면 0을 반환합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "청구 완료",
                    content = @Content(schema = @Schema(implementation = ClaimResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "잘못된 토큰 종류"),
            @ApiResponse(responseCode = "401", description = "인증 실패"),
            @ApiResponse(responseCode = "503", description = "트랜잭션 재시도 소진")
    })
    @PostMapping("/claims")
    public ResponseEntity<ClaimResponse> claim(
            @Valid @RequestBody ClaimRequest request,
            HttpServletRequest httpRequest
    ) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(claimService.claim(userId, request.getTokenType()));
    }

    @Operation(
            summary = "커미션 단건 청구",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "처리 완료 (이미 청구된 경우 claimed=false)"),
            @ApiResponse(responseCode = "403", description = "본인 커미션이 아님"),
            @ApiResponse(responseCode = "404", description = "커미션 없음")
    })
    @PostMapping("/claims/commissions/{commissionId}")
    public ResponseEntity<SingleClaimResponse> claimCommission(
            @PathVariable Long commissionId,
            HttpServletRequest httpRequest
    ) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(claimService.claimCommission(userId, commissionId));
    }

    @Operation(
            summary = "캐시백 단건 청구",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @PostMapping("/claims/cashback/{cashbackId}")
    public ResponseEntity<SingleClaimResponse> claimCashback(
            @PathVariable Long cashbackId,
            HttpServletRequest httpRequest
    ) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(claimService.claimCashback(userId, cashbackId));
    }

    @Operation(
            summary = "청구 가능 잔액",
            description = "토큰 종류별 미청구 커미션, 캐시백, 합계를 조회합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @GetMapping("/claimable")
    public ResponseEntity<ClaimableBalanceResponse> getClaimableBalance(HttpServletRequest httpRequest) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(claimService.getClaimableBalance(userId));
    }
}
