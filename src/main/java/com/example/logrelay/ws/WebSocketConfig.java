package com.example.logrelay.ws;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final LogStreamingWebSocketHandler logStreamingWebSocketHandler;

    public WebSocketConfig(LogStreamingWebSocketHandler logStreamingWebSocketHandler) {
        this.logStreamingWebSocketHandler = logStreamingWebSocketHandler;
    }

    /**
     * Client frames are small; outgoing log lines can carry large messages.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(512 * 1024);
        container.setMaxBinaryMessageBufferSize(64 * 1024);
        return container;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // no auth: put a gateway in front of it
        registry.addHandler(logStreamingWebSocketHandler, "/ws/log-streaming")
                .setAllowedOriginPatterns("*");
    }
}
