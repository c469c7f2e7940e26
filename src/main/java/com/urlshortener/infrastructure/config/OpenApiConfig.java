package com.urlshortener.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(AppProperties appProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title("URL Shortener API")
                        .version("1.0")
                        .description("Creates short codes and resolves them back to the original URL. "
                                + "Short links are served under " + appProperties.getShortUrl().getBaseUrl()));
    }

    @Bean
    public OperationCustomizer addRequestIdHeader() {
        return (operation, handlerMethod) -> {
            Parameter requestId = new Parameter()
                    .in("header")
                    .name("X-Request-Id")
                    .required(false)
                    .description("Correlation id echoed back in the response and in error bodies")
                    .schema(new StringSchema());
            operation.addParametersItem(requestId);
            return operation;
        };
    }
}
