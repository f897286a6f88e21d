package uk.gegc.assessment.shared.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature surface.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public OpenAPI assessmentEngineOpenApi() {
        return new OpenAPI().info(new Info()
                .title("Assessment Engine API")
                .description("Timed attempts, automatic scoring and manual grading")
                .version("v1"));
    }

    @Bean
    public GroupedOpenApi attemptsGroup() {
        return GroupedOpenApi.builder()
                .group("attempts")
                .displayName("Attempts")
                .pathsToMatch("/api/v1/attempts/**")
                .build();
    }

    @Bean
    public GroupedOpenApi gradingGroup() {
        return GroupedOpenApi.builder()
                .group("grading")
                .displayName("Grading & Re-grading")
                .pathsToMatch("/api/v1/grading/**")
                .build();
    }
}
