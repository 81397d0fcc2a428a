package com.example.playlistrouter;

import com.example.playlistrouter.common.config.AppSpotifyProperties;
import com.example.playlistrouter.common.config.AppSyncProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@MapperScan("com.example.playlistrouter.infrastructure.persistence.mapper")
@EnableConfigurationProperties({
        AppSpotifyProperties.class,
        AppSyncProperties.class
})
public class PlaylistRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlaylistRouterApplication.class, args);
    }
}
