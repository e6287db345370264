package com.stride.backend.config;

import com.stride.backend.dto.ApiError;
import io.swagger.v3.core.converter.ModelConverters;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@Configuration
public class OpenApiConfig {

    static final String BEARER = "bearerAuth";
    static final String AUTHENTICATION_FAILED = "AuthenticationFailed";

    @Bean
    public OpenAPI strideOpenApi(@Value("${stride.api.version:1.0}") String version) {
        SecurityScheme bearerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")
                .description("Access token from /api/auth/login or /api/auth/refresh. Refresh tokens are rejected here.");

        Components components = new Components().addSecuritySchemes(BEARER, bearerScheme);
        Map<String, Schema> errorSchemas = ModelConverters.getInstance().read(ApiError.class);
        errorSchemas.forEach(components::addSchemas);
        components.addResponses(AUTHENTICATION_FAILED, new ApiResponse()
                .description("Missing, invalid, expired or revoked token, or bad credentials")
                .content(new Content().addMediaType(org.springframework.http.MediaType.APPLICATION_JSON_VALUE,
                        new MediaType().schema(new Schema<>().$ref("#/components/schemas/ApiError")))));

        return new OpenAPI()
                .info(new Info()
                        .title("Stride API")
                        .description("Accounts, tokens, audit log and security counters")
                        .version(version))
                .components(components)
                .addTagsItem(new Tag().name("auth").description("Registration, login and token lifecycle"))
                .addTagsItem(new Tag().name("audit").description("Audit event queries and statistics (admin)"))
                .addTagsItem(new Tag().name("security").description("Security counters (admin)"))
                .addSecurityItem(new SecurityRequirement().addList(BEARER));
    }
}
