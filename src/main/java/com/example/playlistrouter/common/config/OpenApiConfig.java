package com.example.playlistrouter.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI playlistRouterOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Playlist Router API")
                        .description("Base/child playlist management and Spotify sync. "
                                + "Every request identifies its user with the X-User-Id header.")
                        .version("v1")
                        .contact(new Contact().name("playlist-router")));
    }
}
