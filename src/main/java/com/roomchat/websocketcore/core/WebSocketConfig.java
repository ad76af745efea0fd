package com.roomchat.websocketcore.core;

import com.roomchat.config.ChatRoomProperties;
import com.roomchat.room.core.RoomRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

	/* 컨테이너 수준 프레임 상한. 인바운드 16KB 제한은 방 엔진이 strike 로 처리하므로 그보다 넉넉하게 둔다. */
	private static final int CONTAINER_MAX_MESSAGE_BUFFER_SIZE = 32 * 1024;

	RoomRegistry roomRegistry;
	ChatRoomProperties chatRoomProperties;

	public WebSocketConfig(
			RoomRegistry roomRegistry,
			ChatRoomProperties chatRoomProperties) {

		this.roomRegistry = roomRegistry;
		this.chatRoomProperties = chatRoomProperties;
	}
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatTextWebSocketHandler(), "/chat")
                .addInterceptors(chatHandShakeIntercepter())
                .setAllowedOrigins("*");
    }
    @Bean
    public WebSocketHandler chatTextWebSocketHandler() {
        return new ChatTextWebSocketHandler(roomRegistry, chatRoomProperties);
    }
    @Bean
    public HandshakeInterceptor chatHandShakeIntercepter() {
        return new ChatHandShakeIntercepter(roomRegistry);
    }
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(CONTAINER_MAX_MESSAGE_BUFFER_SIZE);
        container.setMaxBinaryMessageBufferSize(CONTAINER_MAX_MESSAGE_BUFFER_SIZE);
        return container;
    }
}
