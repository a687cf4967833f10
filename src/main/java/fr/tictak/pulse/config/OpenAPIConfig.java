package fr.tictak.pulse.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenAPIConfig {

    private static final String BEARER = "BearerAuth";

    @Bean
    public OpenAPI pulseOpenAPI(@Value("${spring.application.name:pulse}") String applicationName) {
        return new OpenAPI()
                .info(new Info()
                        .title("API de Notifications " + applicationName)
                        .version("1.0.0")
                        .description("Notifications en temps réel, préférences par type, règles, sources externes, "
                                + "tendances de réponse et résumés périodiques."))
                .components(new Components().addSecuritySchemes(BEARER, new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")
                        .description("Jeton d'accès émis par le service d'authentification")))
                .addSecurityItem(new SecurityRequirement().addList(BEARER));
    }

    @Bean
    public GroupedOpenApi inboxApi() {
        return GroupedOpenApi.builder()
                .group("inbox")
                .pathsToMatch("/api/notifications/**", "/api/notification-preferences/**")
                .build();
    }

    @Bean
    public GroupedOpenApi automationApi() {
        return GroupedOpenApi.builder()
                .group("automation")
                .pathsToMatch("/api/notification-rules/**", "/api/notification-sources/**",
                        "/api/notification-patterns/**", "/api/notification-digests/**")
                .build();
    }
}
