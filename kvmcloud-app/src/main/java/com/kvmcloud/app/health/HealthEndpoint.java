package com.kvmcloud.app.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kvmcloud.gateway.registry.DeviceConnectionRegistry;
import com.kvmcloud.gateway.registry.SessionLease;
import com.kvmcloud.gateway.registry.SessionLock;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Clock;

/**
 * Liveness endpoint for container health checks and load balancer checks.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper = new ObjectMapper();
    private final DeviceConnectionRegistry registry;
    private final SessionLock sessionLock;
    private final Clock clock;

    public HealthEndpoint(DeviceConnectionRegistry registry, SessionLock sessionLock, Clock brokerClock) {
        this.registry = registry;
        this.sessionLock = sessionLock;
        this.clock = brokerClock;
    }

    @GetMapping("/healthz")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("ready", true);
        node.put("time", clock.instant().toString());
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        var broker = node.putObject("broker");
        broker.put("connectedDevices", registry.size());
        broker.put("inFlightExchanges", sessionLock.size());
        var exchanges = broker.putArray("exchanges");
        for (SessionLease lease : sessionLock.activeLeases()) {
            exchanges.addObject()
                    .put("device", lease.getDeviceId())
                    .put("holder", lease.getHolder())
                    .put("since", lease.getAcquiredAt().toString())
                    .put("heldMs", sessionLock.heldFor(lease).toMillis());
        }
        return node;
    }
}
