package com.clapgrow.dispatch.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI dispatchApiOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Message Dispatch API")
                        .description("Outbound message dispatch over pluggable transports (Kafka, Amazon SQS, RabbitMQ). " +
                                "Supports single sends, retry with exponential backoff, dead-letter hand-off, " +
                                "batch sends and runtime provider switching.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("ClapGrow")
                                .email("support@clapgrow.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server().url("http://localhost:" + serverPort).description("Local Development Server")
                ));
    }
}
