package com.kvmcloud.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kvmcloud.common.time.ExecutorBrokerScheduler;
import com.kvmcloud.gateway.auth.IdentityService;
import com.kvmcloud.gateway.bridge.SessionBridge;
import com.kvmcloud.gateway.device.DeviceConnectionManager;
import com.kvmcloud.gateway.directory.DeviceDirectory;
import com.kvmcloud.gateway.exchange.ExchangeAdmission;
import com.kvmcloud.gateway.registry.DeviceConnectionRegistry;
import com.kvmcloud.gateway.registry.SessionLock;
import com.kvmcloud.gateway.relay.ClientPairingRelay;
import com.kvmcloud.gateway.signaling.IceServers;
import com.kvmcloud.gateway.signaling.SignalingCodec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Spring configuration for the signaling broker beans.
 * {@link IdentityService} and {@link DeviceDirectory} are supplied by the
 * hosting application.
 */
@Configuration
public class GatewayBeanConfig {

    @Value("${kvmcloud.signaling.ice-servers:" + IceServers.DEFAULT_SERVERS + "}")
    private String iceServers;
    @Value("${kvmcloud.signaling.liveness-interval:10s}")
    private Duration livenessInterval;
    @Value("${kvmcloud.signaling.exchange-timeout:15s}")
    private Duration exchangeTimeout;
    @Value("${kvmcloud.signaling.scheduler-threads:2}")
    private int schedulerThreads;

    @Bean
    public Clock brokerClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public ExecutorBrokerScheduler brokerScheduler() {
        return new ExecutorBrokerScheduler("kvm-broker", schedulerThreads);
    }

    @Bean
    public DeviceConnectionRegistry deviceConnectionRegistry() {
        return new DeviceConnectionRegistry();
    }

    @Bean
    public SessionLock sessionLock(Clock brokerClock) {
        return new SessionLock(brokerClock);
    }

    @Bean
    public IceServers iceServers() {
        return IceServers.parse(iceServers);
    }

    @Bean
    public SignalingCodec signalingCodec(ObjectMapper objectMapper) {
        return new SignalingCodec(objectMapper);
    }

    @Bean
    public ExchangeAdmission exchangeAdmission(DeviceConnectionRegistry registry, SessionLock sessionLock,
            IdentityService identityService) {
        return new ExchangeAdmission(registry, sessionLock, identityService);
    }

    @Bean(destroyMethod = "close")
    public DeviceConnectionManager deviceConnectionManager(DeviceConnectionRegistry registry,
            SessionLock sessionLock, IdentityService identityService, DeviceDirectory deviceDirectory,
            ExecutorBrokerScheduler brokerScheduler, Clock brokerClock) {
        return new DeviceConnectionManager(registry, sessionLock, identityService, deviceDirectory,
                brokerScheduler, livenessInterval, brokerClock);
    }

    @Bean
    public ClientPairingRelay clientPairingRelay(ExchangeAdmission exchangeAdmission, IceServers iceServers,
            SignalingCodec signalingCodec) {
        return new ClientPairingRelay(exchangeAdmission, iceServers, signalingCodec);
    }

    @Bean
    public SessionBridge sessionBridge(ExchangeAdmission exchangeAdmission, IceServers iceServers,
            ExecutorBrokerScheduler brokerScheduler, SignalingCodec signalingCodec) {
        return new SessionBridge(exchangeAdmission, iceServers, brokerScheduler, exchangeTimeout, signalingCodec);
    }
}
