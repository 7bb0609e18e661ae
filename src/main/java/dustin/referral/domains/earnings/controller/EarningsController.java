package dustin.referral.domains.earnings.controller;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.referral.domains.earnings.model.dto.EarningsHistoryItem;
import dustin.referral.domains.earnings.model.dto.EarningsResponse;
import dustin.referral.domains.earnings.model.dto.EarningsType;
import dustin.referral.domains.earnings.service.EarningsService;
import dustin.referral.shared.model.TokenType;
import dustin.referral.shared.model.dto.PageResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

import lombok.RequiredArgsConstructor;

/**
 * 수익 조회 컨트롤러
 * Earnings Controller
 * 
 * API 엔드포인트:
 * - GET /api/referral/earnings?tokenType= - 수익 요약
 * - GET /api/referral/earnings/history?tokenType=&type=&page=&size= - 수익 내역
 */
@RestController
@RequestMapping("/api/referral/earnings")
@RequiredArgsConstructor
@Tag(name = "Earnings", description = "커미션/캐시백 수익 조회 API")
public class EarningsController {

    private final EarningsService earningsService;

    @Operation(
            summary = "수익 요약",
            description = "커미션(단계별, 토큰별)과 캐시백(토큰별)의 합계, 청구, 미청구 금액을 조회합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @GetMapping
    public ResponseEntity<EarningsResponse> getEarnings(
            @Parameter(description = "토큰 종류 (예: USDC-ARBITRUM), 생략 시 전체")
            @RequestParam(value = "tokenType", required = false) String tokenType,
            HttpServletRequest httpRequest
    ) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(earningsService.getEarnings(userId, parseTokenType(tokenType)));
    }

    @Operation(
            summary = "수익 내역",
            description = "커미션과 캐시백 내역을 최신순으로 조회합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @GetMapping("/history")
    public ResponseEntity<PageResponse<EarningsHistoryItem>> getEarningsHistory(
            @RequestParam(value = "tokenType", required = false) String tokenType,
            @Parameter(description = "all | commission | cashback")
            @RequestParam(value = "type", required = false) String type,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size,
            HttpServletRequest httpRequest
    ) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(earningsService.getEarningsHistory(
                userId, parseTokenType(tokenType), EarningsType.fromValue(type), page, size));
    }

    private TokenType parseTokenType(String tokenType) {
        return tokenType == null || tokenType.isBlank() ? null : TokenType.fromCode(tokenType);
    }
}
