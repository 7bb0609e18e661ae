package dustin.referral.domains.referral.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.referral.domains.referral.model.dto.MyReferralCodeResponse;
import dustin.referral.domains.referral.model.dto.ReferralCodeResponse;
import dustin.referral.domains.referral.model.dto.ReferralCodeValidationResponse;
import dustin.referral.domains.referral.model.dto.ReferralNetworkResponse;
import dustin.referral.domains.referral.model.dto.RegisterReferralRequest;
import dustin.referral.domains.referral.model.dto.RegisterReferralResponse;
import dustin.referral.domains.referral.service.ReferralNetworkService;
import dustin.referral.domains.referral.service.ReferralRegistrationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

import lombok.RequiredArgsConstructor;

/**
 * 추천 컨트롤러
 * Referral Controller
 * 
 * 인증:
 * - 코드 검증(GET /code/validate)을 제외한 모든 엔드포인트는 JWT 토큰 필요
 * - JWT 필터가 Request Attribute에 저장한 userId 사용
 * 
 * API 엔드포인트:
 * - POST /api/referral/code - 추천 코드 발급 (멱등)
 * - GET /api/referral/code - 내 추천 코드 조회
 * - GET /api/referral/code/validate?code= - 추천 코드 검증 (공개)
 * - POST /api/referral/register - 추천인 등록
 * - GET /api/referral/network - 내 추천 네트워크
 */
@RestController
@RequestMapping("/api/referral")
@RequiredArgsConstructor
@Tag(name = "Referral", description = "추천 코드 및 추천인 등록 API")
public class ReferralController {

    private final ReferralRegistrationService registrationService;
    private final ReferralNetworkService networkService;

    @Operation(
            summary = "추천 코드 발급",
            description = "추천 코드를 발급합니다. 이미 발급된 경우 기존 코드를 반환합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "발급 또는 기존 코드 반환",
                    content = @Content(schema = @Schema(implementation = ReferralCodeResponse.class))
            ),
            @ApiResponse(responseCode = "401", description = "인증 실패"),
            @ApiResponse(responseCode = "404", description = "사용자 없음")
    })
    @PostMapping("/code")
    public ResponseEntity<ReferralCodeResponse> generateCode(HttpServletRequest httpRequest) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(registrationService.generateCode(userId));
    }

    @Operation(
            summary = "내 추천 코드 조회",
            description = "내 추천 코드, 직접 추천 수, 공유 경로를 조회합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @GetMapping("/code")
    public ResponseEntity<MyReferralCodeResponse> getMyCode(HttpServletRequest httpRequest) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(registrationService.getMyCode(userId));
    }

    /**
     * 추천 코드 검증 (인증 불필요)
     * 가입 화면에서 코드 입력 즉시 사용 가능 여부를 확인
     */
    @Operation(
            summary = "추천 코드 검증",
            description = "추천 코드의 형식, 존재 여부, 최대 깊이 도달 여부를 확인합니다."
    )
    @GetMapping("/code/validate")
    public ResponseEntity<ReferralCodeValidationResponse> validateCode(@RequestParam("code") String code) {
        return ResponseEntity.ok(registrationService.validateCode(code));
    }

    /**
     * 추천인 등록
     * 
     * 응답:
     * - 200: 등록 성공
     * - 400: 형식 오류 / 본인 코드 / 최대 깊이
     * - 404: 코드 없음
     * - 409: 이미 추천인이 있음 / 순환 참조
     */
    @Operation(
            summary = "추천인 등록",
            description = "추천 코드로 추천인을 등록합니다. 추천인은 한 번만 설정할 수 있습니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "등록 성공",
                    content = @Content(schema = @Schema(implementation = RegisterReferralResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "형식 오류, 본인 코드, 최대 깊이 초과"),
            @ApiResponse(responseCode = "401", description = "인증 실패"),
            @ApiResponse(responseCode = "404", description = "추천 코드 없음"),
            @ApiResponse(responseCode = "409", description = "이미 추천인이 있음 또는 순환 참조")
    })
    @PostMapping("/register")
    public ResponseEntity<RegisterReferralResponse> register(
            @Valid @RequestBody RegisterReferralRequest request,
            HttpServletRequest httpRequest
    ) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(registrationService.register(userId, request.getReferralCode()));
    }

    @Operation(
            summary = "내 추천 네트워크",
            description = "직접 추천 목록과 1~3단계 하위 추천 수를 조회합니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @GetMapping("/network")
    public ResponseEntity<ReferralNetworkResponse> getNetwork(HttpServletRequest httpRequest) {
        Long userId = (Long) httpRequest.getAttribute("userId");

        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(networkService.getNetwork(userId));
    }
}
