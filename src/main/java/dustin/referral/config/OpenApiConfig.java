package dustin.referral.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;

/**
 * OpenAPI 설정
 * OpenAPI Configuration
 * 
 * - 컨트롤러의 @SecurityRequirement(name = "BearerAuth")가 참조하는 JWT 스킴 등록
 */
@Configuration
public class OpenApiConfig {

    public static final String BEARER_AUTH = "BearerAuth";

    @Bean
    public OpenAPI referralLedgerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Referral Ledger API")
                        .description("다단계 추천 커미션 원장 API - 추천 코드, 거래 수수료 분배, 커미션/캐시백 청구")
                        .version("0.0.1"))
                .components(new Components()
                        .addSecuritySchemes(BEARER_AUTH, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }
}
