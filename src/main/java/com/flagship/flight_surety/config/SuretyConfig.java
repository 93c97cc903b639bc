package com.flagship.flight_surety.config;

import com.flagship.flight_surety.access.AccessControl;
import com.flagship.flight_surety.common.AccountId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the HTTP gateway identity and, when configured, authorizes it once with
 * {@link AccessControl} on behalf of the owner.
 */
@Configuration
@Slf4j
public class SuretyConfig {

    @Bean
    public GatewayIdentity gatewayIdentity(SuretyProperties properties, AccessControl accessControl) {
        AccountId gatewayId = AccountId.of(properties.getGateway().getId());
        if (properties.getGateway().isAutoAuthorize() && !accessControl.isAuthorized(gatewayId)) {
            accessControl.authorize(properties.ownerId(), gatewayId);
            log.info("Authorized gateway {} on behalf of owner {}", gatewayId, properties.ownerId());
        }
        return new GatewayIdentity(gatewayId);
    }
}
