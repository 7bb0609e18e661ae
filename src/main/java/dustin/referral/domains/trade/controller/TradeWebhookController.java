package dustin.referral.domains.trade.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.referral.domains.trade.model.dto.SimulateTradeRequest;
import dustin.referral.domains.trade.model.dto.TradeProcessingResponse;
import dustin.referral.domains.trade.service.TradeProcessingService;
import dustin.referral.shared.decimal.DecimalMath;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

import lombok.RequiredArgsConstructor;

/**
 * 거래 웹훅 컨트롤러
 * Trade Webhook Controller
 * 
 * 수수료 등급을 요청에 명시하는 거래 입력 경로 (시뮬레이션, 외부 연동)
 * 
 * API 엔드포인트:
 * - POST /api/webhook/trade
 */
@RestController
@RequestMapping("/api/webhook")
@RequiredArgsConstructor
@Tag(name = "Webhook", description = "거래 웹훅 API")
public class TradeWebhookController {

    private final TradeProcessingService tradeProcessingService;

    @Operation(
            summary = "거래 웹훅",
            description = "명시된 수수료 등급으로 거래를 기록하고 수수료를 분배합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @PostMapping("/trade")
    public ResponseEntity<TradeProcessingResponse> trade(
            @Valid @RequestBody SimulateTradeRequest request,
            HttpServletRequest httpRequest
    ) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        TradeProcessingResponse response = tradeProcessingService.simulateTrade(
                userId,
                DecimalMath.parse(request.getVolume()),
                DecimalMath.parse(request.getFeeTier()),
                request.getTokenType());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
