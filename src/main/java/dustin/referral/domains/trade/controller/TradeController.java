package dustin.referral.domains.trade.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.referral.domains.trade.model.dto.RecordTradeRequest;
import dustin.referral.domains.trade.model.dto.TradeProcessingResponse;
import dustin.referral.domains.trade.service.TradeProcessingService;
import dustin.referral.shared.decimal.DecimalMath;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

import lombok.RequiredArgsConstructor;

/**
 * 거래 기록 컨트롤러
 * Trade Controller
 * 
 * API 엔드포인트:
 * - POST /api/referral/trades - 거래 기록 및 수수료 분배 (사용자 저장 수수료 등급)
 */
@RestController
@RequestMapping("/api/referral/trades")
@RequiredArgsConstructor
@Tag(name = "Trades", description = "거래 기록 및 수수료 분배 API")
public class TradeController {

    private final TradeProcessingService tradeProcessingService;

    /**
     * 거래 기록
     * Record Trade
     * 
     * 응답:
     * - 201: 거래 기록 및 분배 완료
     * - 400: 잘못된 거래량 / 토큰 종류
     * - 404: 사용자 없음
     * - 503: 재시도 소진 (다시 요청 가능)
     */
    @Operation(
            summary = "거래 기록",
            description = "거래를 기록하고 수수료를 캐시백, 상위 추천인 커미션, 트레저리로 분배합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "거래 기록 성공",
                    content = @Content(schema = @Schema(implementation = TradeProcessingResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "잘못된 요청"),
            @ApiResponse(responseCode = "401", description = "인증 실패"),
            @ApiResponse(responseCode = "404", description = "사용자 없음"),
            @ApiResponse(responseCode = "503", description = "트랜잭션 재시도 소진")
    })
    @PostMapping
    public ResponseEntity<TradeProcessingResponse> recordTrade(
            @Valid @RequestBody RecordTradeRequest request,
            HttpServletRequest httpRequest
    ) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        TradeProcessingResponse response = tradeProcessingService.recordTrade(
                userId, DecimalMath.parse(request.getVolume()), request.getTokenType());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
